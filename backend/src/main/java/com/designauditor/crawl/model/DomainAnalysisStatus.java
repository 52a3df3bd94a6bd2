package com.designauditor.crawl.model;

import java.time.Instant;

public record DomainAnalysisStatus(
    String jobId,
    String domain,
    DomainAnalysisJobStatus status,
    int completed,
    int failed,
    int total,
    int totalInSitemap,
    int percent,
    String currentUrl,
    String notice,
    Instant startedAt,
    Instant finishedAt,
    Instant cancelledAt
) {
}
