package com.designauditor.crawl.service;

import com.designauditor.color.ColorConsistencyScorer;
import com.designauditor.color.ColorConsolidationEngine;
import com.designauditor.color.ColorObservation;
import com.designauditor.color.ColorUsage;
import com.designauditor.config.AuditorProperties;
import com.designauditor.crawl.job.DomainAnalysisJob;
import com.designauditor.crawl.job.DomainAnalysisJobRegistry;
import com.designauditor.crawl.merge.ResultMerger;
import com.designauditor.crawl.model.AnalysisMode;
import com.designauditor.crawl.model.AnalysisOptions;
import com.designauditor.crawl.model.DomainAnalysisJobStatus;
import com.designauditor.crawl.model.DomainAnalysisRequest;
import com.designauditor.crawl.model.DomainAnalysisStatus;
import com.designauditor.crawl.model.ExtractionRecord;
import com.designauditor.crawl.model.FailedPage;
import com.designauditor.crawl.persistence.JobProgressRecorder;
import com.designauditor.crawl.report.DomainAnalysisReport;
import com.designauditor.crawl.report.ReportExportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DomainAnalysisServiceTest {
    private final MutableClock clock = new MutableClock();
    private final DomainAnalysisJobRegistry registry = new DomainAnalysisJobRegistry();
    private final CrawlOrchestratorService orchestrator = Mockito.mock(CrawlOrchestratorService.class);
    private final JobProgressRecorder recorder = Mockito.mock(JobProgressRecorder.class);
    private final ExecutorService executor = Mockito.mock(ExecutorService.class);
    private final AuditorProperties properties = new AuditorProperties();
    private final ResultMerger merger = new ResultMerger();
    private DomainAnalysisService service;

    @BeforeEach
    void setUp() {
        ReportExportService reports = new ReportExportService(
            new ColorConsolidationEngine(properties),
            new ColorConsistencyScorer(),
            merger
        );
        service = new DomainAnalysisService(registry, orchestrator, recorder, reports, properties, executor, clock);
    }

    @Test
    void startRegistersPendingJobAndSubmitsIt() {
        String jobId = service.startDomainAnalysis(request("https://Example.com/"));

        DomainAnalysisStatus status = service.getStatus(jobId);
        assertThat(status.domain()).isEqualTo("example.com");
        assertThat(status.status()).isEqualTo(DomainAnalysisJobStatus.PENDING);
        verify(recorder).record(registry.require(jobId));
        verify(executor).submit(any(Runnable.class));
    }

    @Test
    void secondStartForAnActiveDomainIsRejected() {
        service.startDomainAnalysis(request("example.com"));

        assertThatThrownBy(() -> service.startDomainAnalysis(request("EXAMPLE.com")))
            .isInstanceOf(ActiveAnalysisJobException.class);
        service.startDomainAnalysis(request("other.org"));
        assertThat(service.listJobs()).hasSize(2);
    }

    @Test
    void finishedDomainCanBeAnalyzedAgain() {
        String first = service.startDomainAnalysis(request("example.com"));
        registry.require(first).finish(DomainAnalysisJobStatus.SUCCEEDED, null);

        String second = service.startDomainAnalysis(request("example.com"));

        assertThat(second).isNotEqualTo(first);
    }

    @Test
    void startWithoutDomainOrUrlsIsABadRequest() {
        assertThatThrownBy(() -> service.startDomainAnalysis(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.startDomainAnalysis(new DomainAnalysisRequest(" ", List.of(), null, null, null, null)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void explicitUrlsSupplyTheDomain() {
        String jobId = service.startDomainAnalysis(
            new DomainAnalysisRequest(null, List.of("shop.example.com/about", "shop.example.com/about"), null, null, null, null)
        );

        DomainAnalysisJob job = registry.require(jobId);
        assertThat(job.domain()).isEqualTo("shop.example.com");
        assertThat(job.explicitUrls()).containsExactly("https://shop.example.com/about");
    }

    @Test
    void cancellingAPendingJobFinishesItImmediately() {
        String jobId = service.startDomainAnalysis(request("example.com"));

        DomainAnalysisStatus status = service.cancelDomainAnalysis(jobId);

        assertThat(status.status()).isEqualTo(DomainAnalysisJobStatus.CANCELLED);
        assertThat(status.cancelledAt()).isEqualTo(clock.instant());
        assertThat(registry.require(jobId).cancellationToken().isCancelled()).isTrue();
    }

    @Test
    void cancellingARunningJobOnlyFlipsTheToken() {
        String jobId = service.startDomainAnalysis(request("example.com"));
        registry.require(jobId).markRunning();

        DomainAnalysisStatus status = service.cancelDomainAnalysis(jobId);

        assertThat(status.status()).isEqualTo(DomainAnalysisJobStatus.RUNNING);
        assertThat(status.cancelledAt()).isNotNull();
    }

    @Test
    void cancellingAFinishedJobLeavesItRetryable() {
        String jobId = service.startDomainAnalysis(request("example.com"));
        DomainAnalysisJob job = registry.require(jobId);
        job.markRunning();
        job.setDiscovered(List.of("https://example.com/a"), 1, null);
        job.recordFailure(new FailedPage("https://example.com/a", "Page did not finish loading within 25000ms",
            "SESSION_TIMEOUT", List.of(15000L, 20000L, 25000L), clock.instant()));
        job.finish(job.completionStatus(), null);

        DomainAnalysisStatus status = service.cancelDomainAnalysis(jobId);

        assertThat(status.status()).isEqualTo(DomainAnalysisJobStatus.PARTIALLY_SUCCEEDED);
        assertThat(status.cancelledAt()).isNull();
        assertThat(job.cancellationToken().isCancelled()).isFalse();
        assertThat(service.retryFailedPage(jobId, "https://example.com/a").status()).isEqualTo(DomainAnalysisJobStatus.RUNNING);
    }

    @Test
    void unknownJobIsNotFound() {
        assertThatThrownBy(() -> service.getStatus("missing")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> service.cancelDomainAnalysis("missing")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void resultIsOnlyAvailableOnceTheJobFinished() {
        String jobId = service.startDomainAnalysis(request("example.com"));
        assertThatThrownBy(() -> service.getResult(jobId)).isInstanceOf(JobNotFinishedException.class);

        DomainAnalysisJob job = registry.require(jobId);
        job.markRunning();
        job.setDiscovered(List.of("https://example.com/"), 1, null);
        job.recordSuccess("https://example.com/", page("https://example.com/"), merger);
        job.finish(DomainAnalysisJobStatus.SUCCEEDED, null);

        DomainAnalysisReport report = service.getResult(jobId);

        assertThat(report.status()).isEqualTo(DomainAnalysisJobStatus.SUCCEEDED);
        assertThat(report.counts().pages()).isEqualTo(1);
        assertThat(report.colorTable().clusters()).containsOnlyKeys("#1a1a1a");
        assertThat(report.colorConsistency().score()).isEqualTo(10.0);
    }

    @Test
    void failedJobHasNoResult() {
        String jobId = service.startDomainAnalysis(request("example.com"));
        registry.require(jobId).finish(DomainAnalysisJobStatus.FAILED, "No pages found");

        assertThatThrownBy(() -> service.getResult(jobId))
            .isInstanceOfSatisfying(ResponseStatusException.class,
                e -> assertThat(e.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY));
    }

    @Test
    void retryNeedsAFinishedJobAndAKnownFailedPage() {
        String jobId = service.startDomainAnalysis(request("example.com"));
        DomainAnalysisJob job = registry.require(jobId);
        assertThatThrownBy(() -> service.retryFailedPage(jobId, "https://example.com/a"))
            .isInstanceOf(JobNotFinishedException.class);

        job.markRunning();
        job.setDiscovered(List.of("https://example.com/a"), 1, null);
        job.recordFailure(new FailedPage("https://example.com/a", "Page did not finish loading within 25000ms",
            "SESSION_TIMEOUT", List.of(15000L, 20000L, 25000L), clock.instant()));
        job.finish(job.completionStatus(), null);

        assertThatThrownBy(() -> service.retryFailedPage(jobId, "https://example.com/b"))
            .isInstanceOf(IllegalArgumentException.class);

        DomainAnalysisStatus status = service.retryFailedPage(jobId, "https://example.com/a");

        assertThat(status.status()).isEqualTo(DomainAnalysisJobStatus.RUNNING);
        assertThat(status.currentUrl()).isEqualTo("https://example.com/a");
        verify(executor, times(2)).submit(any(Runnable.class));
    }

    @Test
    void resetForgetsTheJob() {
        String jobId = service.startDomainAnalysis(request("example.com"));

        DomainAnalysisJob job = registry.require(jobId);

        service.resetJob(jobId);

        assertThat(job.isDiscarded()).isTrue();
        assertThat(job.cancellationToken().isCancelled()).isTrue();
        assertThat(registry.find(jobId)).isEmpty();
        verify(recorder).forget(jobId);
        assertThatThrownBy(() -> service.getStatus(jobId)).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void startupResumesOnlyActiveJobs() {
        AnalysisOptions options = new AnalysisOptions(10, 0, List.of(15000), AnalysisMode.DESKTOP_ONLY);
        DomainAnalysisJob running = new DomainAnalysisJob("running", "a.com", options, List.of(), clock);
        running.markRunning();
        running.setDiscovered(List.of("https://a.com/", "https://a.com/x"), 2, null);
        DomainAnalysisJob done = new DomainAnalysisJob("done", "b.com", options, List.of(), clock);
        done.finish(DomainAnalysisJobStatus.SUCCEEDED, null);
        when(recorder.loadSnapshots()).thenReturn(List.of(running.snapshot(), done.snapshot()));

        service.resumeInterruptedJobs();

        assertThat(registry.find("running")).isPresent();
        assertThat(registry.find("done")).isPresent();
        verify(executor, times(1)).submit(any(Runnable.class));
    }

    @Test
    void resumeCanBeDisabled() {
        properties.getProgress().setResumeOnStartup(false);

        service.resumeInterruptedJobs();

        verify(recorder, never()).loadSnapshots();
    }

    @Test
    void requestValuesOverrideConfiguredDefaults() {
        AnalysisOptions defaults = service.resolveOptions(request("example.com"));
        assertThat(defaults.maxPages()).isEqualTo(100);
        assertThat(defaults.delayBetweenPagesMs()).isEqualTo(2000);
        assertThat(defaults.timeoutScheduleMs()).containsExactly(15000, 20000, 25000);
        assertThat(defaults.mode()).isEqualTo(AnalysisMode.DESKTOP_ONLY);

        AnalysisOptions custom = service.resolveOptions(new DomainAnalysisRequest(
            "example.com", null, 0, -5, Arrays.asList(25000, 0, null, 15000), AnalysisMode.MOBILE_ONLY));
        assertThat(custom.maxPages()).isEqualTo(1);
        assertThat(custom.delayBetweenPagesMs()).isZero();
        assertThat(custom.timeoutScheduleMs()).containsExactly(15000, 25000);
        assertThat(custom.mode()).isEqualTo(AnalysisMode.MOBILE_ONLY);
    }

    private static DomainAnalysisRequest request(String domain) {
        return new DomainAnalysisRequest(domain, null, null, null, null, null);
    }

    private static ExtractionRecord page(String url) {
        ColorObservation observation = new ColorObservation("#1A1A1A", ColorUsage.TEXT, url, "P", "p", "Hello");
        return ExtractionRecord.desktop(url, Map.of(), List.of(observation), List.of());
    }
}
