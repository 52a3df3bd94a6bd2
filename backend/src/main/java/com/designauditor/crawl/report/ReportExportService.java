package com.designauditor.crawl.report;

import com.designauditor.color.ColorCluster;
import com.designauditor.color.ColorConsistencyReport;
import com.designauditor.color.ColorConsistencyScorer;
import com.designauditor.color.ColorConsolidationEngine;
import com.designauditor.color.ColorObservation;
import com.designauditor.color.ColorSummary;
import com.designauditor.color.ColorTable;
import com.designauditor.color.ColorUsage;
import com.designauditor.crawl.job.DomainAnalysisJob;
import com.designauditor.crawl.merge.AggregateResult;
import com.designauditor.crawl.merge.ResultMerger;
import com.designauditor.crawl.model.DomainAnalysisStatus;
import com.designauditor.crawl.model.FailedPage;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class ReportExportService {
    private static final String[] COLOR_HEADERS = {
        "canonical_hex", "count", "used_as", "merged_hexes", "pages", "sample_selector"
    };
    private static final String[] FAILED_PAGE_HEADERS = {
        "url", "reason_code", "reason", "attempted_timeouts_ms", "failed_at"
    };

    private final ColorConsolidationEngine colorEngine;
    private final ColorConsistencyScorer consistencyScorer;
    private final ResultMerger merger;

    public ReportExportService(
        ColorConsolidationEngine colorEngine,
        ColorConsistencyScorer consistencyScorer,
        ResultMerger merger
    ) {
        this.colorEngine = colorEngine;
        this.consistencyScorer = consistencyScorer;
        this.merger = merger;
    }

    public DomainAnalysisReport buildReport(DomainAnalysisJob job) {
        DomainAnalysisStatus status = job.toStatus();
        AggregateResult result = job.result();
        ColorTable table = colorEngine.consolidate(result.getColorObservations());
        ColorSummary summary = colorEngine.deriveSummary(table);
        ColorConsistencyReport consistency = consistencyScorer.score(summary, result.getContrastFailures().size());
        return new DomainAnalysisReport(
            job.jobId(),
            job.domain(),
            status.status(),
            status.notice(),
            merger.counts(result),
            List.copyOf(result.getPagesAnalyzed()),
            job.failedPages(),
            merger.isMobileOnlyData(result),
            merger.hasMobileData(result),
            table,
            summary,
            consistency,
            result,
            status.startedAt(),
            status.finishedAt()
        );
    }

    public String colorTableCsv(ColorTable table) {
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT.builder().setHeader(COLOR_HEADERS).build())) {
            for (ColorCluster cluster : table.clusters().values()) {
                printer.printRecord(
                    cluster.canonicalHex(),
                    cluster.count(),
                    cluster.usages().stream().map(ColorUsage::label).collect(Collectors.joining(";")),
                    String.join(";", cluster.mergedHexes()),
                    cluster.instances().stream().map(ColorObservation::pageUrl).distinct().count(),
                    cluster.instances().isEmpty() ? "" : cluster.instances().get(0).selector()
                );
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write color table CSV", e);
        }
        return out.toString();
    }

    public String failedPagesCsv(List<FailedPage> failedPages) {
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT.builder().setHeader(FAILED_PAGE_HEADERS).build())) {
            for (FailedPage page : failedPages) {
                printer.printRecord(
                    page.url(),
                    page.reasonCode(),
                    page.reason(),
                    page.attemptedTimeouts().stream().map(String::valueOf).collect(Collectors.joining(";")),
                    page.timestamp()
                );
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write failed pages CSV", e);
        }
        return out.toString();
    }
}
