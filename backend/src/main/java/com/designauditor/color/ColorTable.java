package com.designauditor.color;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consolidated colors keyed by canonical hex, ordered by usage count descending.
 */
public record ColorTable(Map<String, ColorCluster> clusters, int observationCount, int malformedCount) {
    public ColorTable {
        clusters = Collections.unmodifiableMap(new LinkedHashMap<>(clusters));
    }

    public static ColorTable empty() {
        return new ColorTable(Map.of(), 0, 0);
    }

    public int uniqueColorCount() {
        return clusters.size();
    }
}
