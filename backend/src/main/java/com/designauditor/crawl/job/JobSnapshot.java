package com.designauditor.crawl.job;

import com.designauditor.crawl.merge.AggregateResult;
import com.designauditor.crawl.model.AnalysisOptions;
import com.designauditor.crawl.model.DomainAnalysisJobStatus;
import com.designauditor.crawl.model.FailedPage;

import java.time.Instant;
import java.util.List;

/**
 * Serializable copy of a job, written to the progress store after every page.
 */
public record JobSnapshot(
    String jobId,
    String domain,
    AnalysisOptions options,
    List<String> explicitUrls,
    DomainAnalysisJobStatus status,
    List<String> urls,
    List<String> processedUrls,
    int completed,
    List<FailedPage> failedPages,
    int totalInSitemap,
    String notice,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    Instant cancelledAt,
    AggregateResult result
) {
}
