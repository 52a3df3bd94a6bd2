package com.designauditor.crawl.service;

import com.designauditor.config.AuditorProperties;
import com.designauditor.crawl.job.DomainAnalysisJob;
import com.designauditor.crawl.merge.ResultMerger;
import com.designauditor.crawl.model.AnalysisMode;
import com.designauditor.crawl.model.AnalysisOptions;
import com.designauditor.crawl.model.DomainAnalysisJobStatus;
import com.designauditor.crawl.model.FailedPage;
import com.designauditor.crawl.model.MobileAuditResult;
import com.designauditor.crawl.model.PageTask;
import com.designauditor.crawl.model.PageTaskStatus;
import com.designauditor.crawl.model.SitemapDiscoveryResult;
import com.designauditor.crawl.model.SitemapUrlEntry;
import com.designauditor.crawl.persistence.JobProgressRecorder;
import com.designauditor.crawl.render.ContentManagedSiteDetector;
import com.designauditor.crawl.sitemap.SitemapDiscovery;
import com.designauditor.crawl.util.FailureReasonClassifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class CrawlOrchestratorServiceTest {
    private static final String HOME = "https://example.com/";
    private static final String ABOUT = "https://example.com/about";
    private static final String CONTACT = "https://example.com/contact";
    private static final List<Integer> SCHEDULE = List.of(15000, 20000, 25000);

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final MutableClock clock = new MutableClock();
    private final JobProgressRecorder recorder = Mockito.mock(JobProgressRecorder.class);
    private final SitemapDiscovery noSitemap = domain -> new SitemapDiscoveryResult(
        List.of(),
        List.of(),
        Map.of("no_sitemaps", 1),
        "No sitemap found for " + domain + "; analyze pages individually"
    );

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void pageThatNeverLoadsIsRecordedAfterTheFullScheduleWhileOthersComplete() {
        ScriptedSessionFactory factory = new ScriptedSessionFactory((url, attempt) ->
            url.equals(ABOUT) ? FakeRenderSession.neverReady(url) : FakeRenderSession.ready(url));
        CrawlOrchestratorService orchestrator = orchestrator(factory, noSitemap);
        DomainAnalysisJob job = job(List.of(HOME, ABOUT, CONTACT));

        orchestrator.run(job);

        assertThat(job.status()).isEqualTo(DomainAnalysisJobStatus.PARTIALLY_SUCCEEDED);
        assertThat(job.completed()).isEqualTo(2);
        assertThat(job.failedPages()).hasSize(1);
        FailedPage failed = job.failedPages().get(0);
        assertThat(failed.url()).isEqualTo(ABOUT);
        assertThat(failed.reasonCode()).isEqualTo(FailureReasonClassifier.SESSION_TIMEOUT);
        assertThat(failed.attemptedTimeouts()).containsExactly(15000L, 20000L, 25000L);
        assertThat(job.result().getPagePaths()).containsExactly("/", "/contact");
        assertThat(job.toStatus().percent()).isEqualTo(100);
        assertThat(factory.attempts(ABOUT)).isEqualTo(3);
        assertThat(factory.created()).hasSize(5).allSatisfy(session -> assertThat(session.disposeCount()).isEqualTo(1));
        verify(recorder, atLeast(4)).record(job);
    }

    @Test
    void retriesUntilALargerTimeoutSucceeds() {
        ScriptedSessionFactory factory = new ScriptedSessionFactory((url, attempt) ->
            attempt < 3 ? FakeRenderSession.neverReady(url) : FakeRenderSession.ready(url));
        CrawlOrchestratorService orchestrator = orchestrator(factory, noSitemap);
        PageTask task = new PageTask(HOME, AnalysisMode.DESKTOP_ONLY, SCHEDULE.size());

        CrawlOrchestratorService.PageOutcome outcome = orchestrator.analyzeWithRetries(task, SCHEDULE, new CancellationToken(clock));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.attemptedTimeouts()).containsExactly(15000L, 20000L, 25000L);
        assertThat(task.status()).isEqualTo(PageTaskStatus.SUCCEEDED);
        assertThat(task.attemptsStarted()).isEqualTo(3);
        assertThatThrownBy(task::startAttempt).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cancellingMidPageStopsWithoutRecordingAFailure() {
        DomainAnalysisJob job = job(List.of(HOME, ABOUT, CONTACT));
        ScriptedSessionFactory factory = new ScriptedSessionFactory((url, attempt) ->
            url.equals(ABOUT)
                ? FakeRenderSession.neverReady(url).onPoll(() -> job.cancellationToken().cancel())
                : FakeRenderSession.ready(url));
        CrawlOrchestratorService orchestrator = orchestrator(factory, noSitemap);

        orchestrator.run(job);

        assertThat(job.status()).isEqualTo(DomainAnalysisJobStatus.CANCELLED);
        assertThat(job.completed()).isEqualTo(1);
        assertThat(job.failedPages()).isEmpty();
        assertThat(job.toStatus().cancelledAt()).isNotNull();
        assertThat(factory.attempts(CONTACT)).isZero();
        assertThat(factory.created()).allSatisfy(session -> assertThat(session.disposeCount()).isEqualTo(1));
    }

    @Test
    void jobCancelledBeforeStartNeverDiscovers() {
        SitemapDiscovery discovery = Mockito.mock(SitemapDiscovery.class);
        ScriptedSessionFactory factory = new ScriptedSessionFactory((url, attempt) -> FakeRenderSession.ready(url));
        DomainAnalysisJob job = job(List.of());
        job.cancellationToken().cancel();

        orchestrator(factory, discovery).run(job);

        assertThat(job.status()).isEqualTo(DomainAnalysisJobStatus.CANCELLED);
        verifyNoInteractions(discovery);
        assertThat(factory.created()).isEmpty();
    }

    @Test
    void domainWithoutSitemapFailsWithNotice() {
        ScriptedSessionFactory factory = new ScriptedSessionFactory((url, attempt) -> FakeRenderSession.ready(url));
        DomainAnalysisJob job = job(List.of());

        orchestrator(factory, noSitemap).run(job);

        assertThat(job.status()).isEqualTo(DomainAnalysisJobStatus.FAILED);
        assertThat(job.notice()).isEqualTo("No sitemap found for example.com; analyze pages individually");
        assertThat(job.toStatus().finishedAt()).isNotNull();
        verify(recorder).record(job);
    }

    @Test
    void sitemapUrlsAreCappedAtMaxPages() {
        SitemapDiscovery discovery = domain -> new SitemapDiscoveryResult(
            List.of(),
            List.of(entry(HOME), entry(ABOUT), entry(CONTACT)),
            Map.of(),
            null
        );
        ScriptedSessionFactory factory = new ScriptedSessionFactory((url, attempt) -> FakeRenderSession.ready(url));
        DomainAnalysisJob job = new DomainAnalysisJob(
            "job-cap",
            "example.com",
            new AnalysisOptions(2, 2000, SCHEDULE, AnalysisMode.DESKTOP_ONLY),
            List.of(),
            clock
        );

        orchestrator(factory, discovery).run(job);

        assertThat(job.status()).isEqualTo(DomainAnalysisJobStatus.SUCCEEDED);
        assertThat(job.total()).isEqualTo(2);
        assertThat(job.toStatus().totalInSitemap()).isEqualTo(3);
        assertThat(factory.attempts(CONTACT)).isZero();
    }

    @Test
    void duplicatePathCountsAsCompletedButMergesOnce() {
        ScriptedSessionFactory factory = new ScriptedSessionFactory((url, attempt) -> FakeRenderSession.ready(url));
        DomainAnalysisJob job = job(List.of(ABOUT, ABOUT + "/"));

        orchestrator(factory, noSitemap).run(job);

        assertThat(job.status()).isEqualTo(DomainAnalysisJobStatus.SUCCEEDED);
        assertThat(job.completed()).isEqualTo(2);
        assertThat(job.result().getPagesAnalyzed()).containsExactly(ABOUT);
        assertThat(job.result().getColorObservations()).hasSize(1);
    }

    @Test
    void pagesAreSpacedByTheConfiguredDelay() {
        ScriptedSessionFactory factory = new ScriptedSessionFactory((url, attempt) -> FakeRenderSession.ready(url));
        DomainAnalysisJob job = job(List.of(HOME, ABOUT, CONTACT));

        orchestrator(factory, noSitemap).run(job);

        // two gaps of 2000ms plus a 1000ms settle per page
        assertThat(clock.sleptMs()).isEqualTo(2 * 2000 + 3 * 1000);
    }

    @Test
    void retryingAFailedPageResolvesIt() {
        boolean[] healthy = {false};
        ScriptedSessionFactory factory = new ScriptedSessionFactory((url, attempt) ->
            url.equals(ABOUT) && !healthy[0] ? FakeRenderSession.neverReady(url) : FakeRenderSession.ready(url));
        CrawlOrchestratorService orchestrator = orchestrator(factory, noSitemap);
        DomainAnalysisJob job = job(List.of(HOME, ABOUT));
        orchestrator.run(job);
        assertThat(job.status()).isEqualTo(DomainAnalysisJobStatus.PARTIALLY_SUCCEEDED);

        healthy[0] = true;
        job.beginRetry(ABOUT);
        orchestrator.retryFailedPage(job, ABOUT);

        assertThat(job.status()).isEqualTo(DomainAnalysisJobStatus.SUCCEEDED);
        assertThat(job.failedPages()).isEmpty();
        assertThat(job.completed()).isEqualTo(2);
        assertThat(job.result().getPagePaths()).containsExactly("/", "/about");
    }

    @Test
    void retryThatFailsAgainReplacesTheFailure() {
        ScriptedSessionFactory factory = new ScriptedSessionFactory((url, attempt) ->
            url.equals(ABOUT) ? FakeRenderSession.neverReady(url) : FakeRenderSession.ready(url));
        CrawlOrchestratorService orchestrator = orchestrator(factory, noSitemap);
        DomainAnalysisJob job = job(List.of(HOME, ABOUT));
        orchestrator.run(job);

        orchestrator.retryFailedPage(job, ABOUT);

        assertThat(job.status()).isEqualTo(DomainAnalysisJobStatus.PARTIALLY_SUCCEEDED);
        assertThat(job.failedPages()).hasSize(1);
        assertThat(factory.attempts(ABOUT)).isEqualTo(6);
    }

    @Test
    void retryCancelledBeforeItStartsKeepsTheFailure() {
        ScriptedSessionFactory factory = new ScriptedSessionFactory((url, attempt) ->
            url.equals(ABOUT) ? FakeRenderSession.neverReady(url) : FakeRenderSession.ready(url));
        CrawlOrchestratorService orchestrator = orchestrator(factory, noSitemap);
        DomainAnalysisJob job = job(List.of(HOME, ABOUT));
        orchestrator.run(job);
        List<FailedPage> before = job.failedPages();

        job.beginRetry(ABOUT);
        job.cancellationToken().cancel();
        orchestrator.retryFailedPage(job, ABOUT);

        assertThat(job.status()).isEqualTo(DomainAnalysisJobStatus.CANCELLED);
        assertThat(job.failedPages()).isEqualTo(before);
        assertThat(factory.attempts(ABOUT)).isEqualTo(3);
    }

    @Test
    void cancellingARetryStopsItsAttempts() {
        DomainAnalysisJob job = job(List.of(HOME, ABOUT));
        boolean[] retrying = {false};
        ScriptedSessionFactory factory = new ScriptedSessionFactory((url, attempt) -> {
            if (!url.equals(ABOUT)) {
                return FakeRenderSession.ready(url);
            }
            FakeRenderSession session = FakeRenderSession.neverReady(url);
            return retrying[0] ? session.onPoll(() -> job.cancellationToken().cancel()) : session;
        });
        CrawlOrchestratorService orchestrator = orchestrator(factory, noSitemap);
        orchestrator.run(job);

        retrying[0] = true;
        job.beginRetry(ABOUT);
        orchestrator.retryFailedPage(job, ABOUT);

        assertThat(job.status()).isEqualTo(DomainAnalysisJobStatus.CANCELLED);
        assertThat(job.failedPages()).extracting(FailedPage::url).containsExactly(ABOUT);
        assertThat(factory.attempts(ABOUT)).isEqualTo(4);
        assertThat(factory.created()).allSatisfy(session -> assertThat(session.disposeCount()).isEqualTo(1));
    }

    private CrawlOrchestratorService orchestrator(ScriptedSessionFactory factory, SitemapDiscovery discovery) {
        PageAnalysisAttemptManager attemptManager = new PageAnalysisAttemptManager(
            factory,
            PageAnalysisAttemptManagerTest::desktopRecord,
            (session, url, contrast) -> new MobileAuditResult(null, List.of()),
            new ContentManagedSiteDetector(),
            new AuditorProperties(),
            executor,
            clock,
            clock::advance
        );
        return new CrawlOrchestratorService(discovery, attemptManager, new ResultMerger(), recorder, clock, clock::advance);
    }

    private DomainAnalysisJob job(List<String> urls) {
        return new DomainAnalysisJob(
            "job-1",
            "example.com",
            new AnalysisOptions(100, 2000, SCHEDULE, AnalysisMode.DESKTOP_ONLY),
            urls,
            clock
        );
    }

    private static SitemapUrlEntry entry(String url) {
        return new SitemapUrlEntry(url, null);
    }
}
