package com.whereq.cadence.model;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits source content into the segments that become individual short artifacts.
 */
public final class ContentSegments {

    private ContentSegments() {
    }

    public static List<String> split(String content, String marker) {
        List<String> segments = new ArrayList<>();
        if (content == null) {
            return segments;
        }
        for (String segment : content.split(Pattern.quote(marker))) {
            if (!segment.isBlank()) {
                segments.add(segment.strip());
            }
        }
        return segments;
    }

    /**
     * Number of artifacts a job is expected to produce
     */
    public static int estimate(String content, String marker, ArtifactKind kind) {
        if (kind == ArtifactKind.LONG) {
            return 1;
        }
        return Math.max(1, split(content, marker).size());
    }
}
