package com.designauditor.crawl.model;

import java.util.List;

/**
 * Effective options of one job after request values were merged with configured defaults.
 */
public record AnalysisOptions(
    int maxPages,
    long delayBetweenPagesMs,
    List<Integer> timeoutScheduleMs,
    AnalysisMode mode
) {
    public AnalysisOptions {
        timeoutScheduleMs = List.copyOf(timeoutScheduleMs);
    }
}
