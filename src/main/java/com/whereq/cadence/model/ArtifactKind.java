package com.whereq.cadence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Artifact format produced by the content generation service.
 */
public enum ArtifactKind {
    /**
     * Vertical short-form artifact, one per content segment
     */
    SHORT,

    /**
     * Single long-form artifact for the whole content
     */
    LONG;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ArtifactKind fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "short" -> SHORT;
            case "long", "regular" -> LONG;
            default -> throw new IllegalArgumentException("Unknown artifact kind: " + value);
        };
    }
}
