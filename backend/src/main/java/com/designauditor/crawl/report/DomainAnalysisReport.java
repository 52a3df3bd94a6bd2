package com.designauditor.crawl.report;

import com.designauditor.color.ColorConsistencyReport;
import com.designauditor.color.ColorSummary;
import com.designauditor.color.ColorTable;
import com.designauditor.crawl.merge.AggregateResult;
import com.designauditor.crawl.model.AnalysisCounts;
import com.designauditor.crawl.model.DomainAnalysisJobStatus;
import com.designauditor.crawl.model.FailedPage;

import java.time.Instant;
import java.util.List;

public record DomainAnalysisReport(
    String jobId,
    String domain,
    DomainAnalysisJobStatus status,
    String notice,
    AnalysisCounts counts,
    List<String> analyzedPages,
    List<FailedPage> failedPages,
    boolean mobileOnlyData,
    boolean hasMobileData,
    ColorTable colorTable,
    ColorSummary colorSummary,
    ColorConsistencyReport colorConsistency,
    AggregateResult result,
    Instant startedAt,
    Instant finishedAt
) {
}
