package com.designauditor.color;

import java.util.List;
import java.util.Map;

public record ColorSummary(
    int totalColors,
    Map<ColorUsage, List<String>> byUsage,
    Map<ColorUsage, Integer> usageCounts,
    List<String> neutrals,
    List<String> outliers,
    List<ColorFamily> families,
    int observationCount,
    int malformedCount
) {
}
