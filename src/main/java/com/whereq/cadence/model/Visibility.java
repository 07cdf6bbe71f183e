package com.whereq.cadence.model;

/**
 * Visibility requested when uploading to the publish target
 */
public enum Visibility {
    PRIVATE,
    PUBLIC
}
