package com.designauditor.crawl.report;

import com.designauditor.color.ColorConsistencyScorer;
import com.designauditor.color.ColorConsolidationEngine;
import com.designauditor.color.ColorObservation;
import com.designauditor.color.ColorTable;
import com.designauditor.color.ColorUsage;
import com.designauditor.config.AuditorProperties;
import com.designauditor.crawl.job.DomainAnalysisJob;
import com.designauditor.crawl.merge.ResultMerger;
import com.designauditor.crawl.model.AnalysisMode;
import com.designauditor.crawl.model.AnalysisOptions;
import com.designauditor.crawl.model.ContrastIssue;
import com.designauditor.crawl.model.DomainAnalysisJobStatus;
import com.designauditor.crawl.model.ExtractionRecord;
import com.designauditor.crawl.model.FailedPage;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReportExportServiceTest {
    private final Clock clock = Clock.fixed(Instant.parse("2026-05-01T12:00:00Z"), ZoneOffset.UTC);
    private final ColorConsolidationEngine engine = new ColorConsolidationEngine(new AuditorProperties());
    private final ReportExportService service =
        new ReportExportService(engine, new ColorConsistencyScorer(), new ResultMerger());

    @Test
    void reportCombinesTableSummaryAndScore() {
        DomainAnalysisJob job = job();
        String home = "https://shop.test/";
        job.recordSuccess(home, ExtractionRecord.desktop(
            home,
            Map.of(),
            List.of(
                observation("#101010", home, "H1"),
                observation("#101011", home, "P"),
                observation("#ff0000", home, "BUTTON")
            ),
            List.of(new ContrastIssue(home, "main", "-", "p.faint", "#aaaaaa", "#ffffff", 2.32, 4.5, false, "Faint"))
        ), new ResultMerger());
        job.finish(job.completionStatus(), null);

        DomainAnalysisReport report = service.buildReport(job);

        assertThat(report.status()).isEqualTo(DomainAnalysisJobStatus.SUCCEEDED);
        assertThat(report.analyzedPages()).containsExactly(home);
        assertThat(report.counts().colorObservations()).isEqualTo(3);
        assertThat(report.counts().contrastFailures()).isEqualTo(1);
        assertThat(report.colorTable().clusters()).containsOnlyKeys("#101010", "#ff0000");
        assertThat(report.colorSummary().totalColors()).isEqualTo(2);
        assertThat(report.colorConsistency().contrastFailures()).isEqualTo(1);
        assertThat(report.colorConsistency().score()).isEqualTo(10.0);
        assertThat(report.mobileOnlyData()).isFalse();
        assertThat(report.hasMobileData()).isFalse();
    }

    @Test
    void colorCsvQuotesValuesThatNeedIt() {
        String page = "https://shop.test/a";
        ColorTable table = engine.consolidate(List.of(
            new ColorObservation("#000000", ColorUsage.TEXT, page, "P", "div > p, span", "x"),
            new ColorObservation("#000000", ColorUsage.BORDER, page, "P", "div > p, span", "x")
        ));

        String csv = service.colorTableCsv(table);

        assertThat(csv.split("\r\n")).containsExactly(
            "canonical_hex,count,used_as,merged_hexes,pages,sample_selector",
            "#000000,2,text;border,,1,\"div > p, span\""
        );
    }

    @Test
    void failedPagesCsvHasOneRowPerPage() {
        List<FailedPage> failed = List.of(
            new FailedPage("https://shop.test/x", "HTTP 404", "HTTP_404", List.of(15000L), clock.instant()),
            new FailedPage("https://shop.test/y", "Page did not finish loading", "SESSION_TIMEOUT",
                List.of(15000L, 20000L, 25000L), clock.instant())
        );

        String[] lines = service.failedPagesCsv(failed).split("\r\n");

        assertThat(lines).hasSize(3);
        assertThat(lines[0]).isEqualTo("url,reason_code,reason,attempted_timeouts_ms,failed_at");
        assertThat(lines[1]).isEqualTo("https://shop.test/x,HTTP_404,HTTP 404,15000,2026-05-01T12:00:00Z");
        assertThat(lines[2]).contains("15000;20000;25000");
    }

    @Test
    void emptyTableProducesHeaderOnly() {
        assertThat(service.colorTableCsv(ColorTable.empty()))
            .isEqualTo("canonical_hex,count,used_as,merged_hexes,pages,sample_selector\r\n");
    }

    private DomainAnalysisJob job() {
        DomainAnalysisJob job = new DomainAnalysisJob(
            "r1",
            "shop.test",
            new AnalysisOptions(5, 0, List.of(15000, 20000, 25000), AnalysisMode.DESKTOP_ONLY),
            List.of(),
            clock
        );
        job.markRunning();
        job.setDiscovered(List.of("https://shop.test/"), 1, null);
        return job;
    }

    private static ColorObservation observation(String hex, String page, String tag) {
        return new ColorObservation(hex, ColorUsage.TEXT, page, tag, tag.toLowerCase(), "sample");
    }
}
