package com.designauditor.crawl.service;

import com.designauditor.crawl.job.DomainAnalysisJob;
import com.designauditor.crawl.merge.MergeOutcome;
import com.designauditor.crawl.merge.ResultMerger;
import com.designauditor.crawl.model.AnalysisOptions;
import com.designauditor.crawl.model.DomainAnalysisJobStatus;
import com.designauditor.crawl.model.ExtractionRecord;
import com.designauditor.crawl.model.FailedPage;
import com.designauditor.crawl.model.PageTask;
import com.designauditor.crawl.model.SitemapDiscoveryResult;
import com.designauditor.crawl.persistence.JobProgressRecorder;
import com.designauditor.crawl.sitemap.SitemapDiscovery;
import com.designauditor.crawl.util.FailureReasonClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives one domain job page by page: discovery, per-page retries with growing timeouts,
 * throttling between pages, progress recording and cancellation.
 */
@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);
    private static final long CANCEL_CHECK_SLICE_MS = 250;

    private final SitemapDiscovery sitemapDiscovery;
    private final PageAnalysisAttemptManager attemptManager;
    private final ResultMerger merger;
    private final JobProgressRecorder recorder;
    private final Clock clock;
    private final Sleeper sleeper;

    public CrawlOrchestratorService(
        SitemapDiscovery sitemapDiscovery,
        PageAnalysisAttemptManager attemptManager,
        ResultMerger merger,
        JobProgressRecorder recorder,
        Clock clock,
        Sleeper sleeper
    ) {
        this.sitemapDiscovery = sitemapDiscovery;
        this.attemptManager = attemptManager;
        this.merger = merger;
        this.recorder = recorder;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public void run(DomainAnalysisJob job) {
        CancellationToken token = job.cancellationToken();
        AnalysisOptions options = job.options();
        try {
            if (token.isCancelled()) {
                job.finish(DomainAnalysisJobStatus.CANCELLED, null);
                return;
            }
            job.markRunning();
            if (!job.hasDiscoveredUrls()) {
                discover(job);
            }
            if (job.total() == 0) {
                log.info("Job {} has no pages to analyze for {}", job.jobId(), job.domain());
                job.finish(DomainAnalysisJobStatus.FAILED, job.notice() == null ? "No pages found" : job.notice());
                return;
            }
            recorder.record(job);
            log.info("Job {} analyzing {} pages of {}", job.jobId(), job.total(), job.domain());

            boolean first = true;
            for (String url : job.pendingUrls()) {
                if (token.isCancelled()) {
                    break;
                }
                if (!first) {
                    pauseBetweenPages(options.delayBetweenPagesMs(), token);
                    if (token.isCancelled()) {
                        break;
                    }
                }
                first = false;
                job.setCurrentUrl(url);
                PageTask task = new PageTask(url, options.mode(), options.timeoutScheduleMs().size());
                PageOutcome outcome;
                try {
                    outcome = analyzeWithRetries(task, options.timeoutScheduleMs(), token);
                } catch (AnalysisCancelledException e) {
                    log.info("Job {} cancelled while analyzing {}", job.jobId(), url);
                    break;
                }
                applyOutcome(job, url, outcome);
                recorder.record(job);
            }

            if (token.isCancelled()) {
                job.finish(DomainAnalysisJobStatus.CANCELLED, null);
                log.info("Job {} cancelled after {} completed / {} failed", job.jobId(), job.completed(), job.failedPages().size());
            } else {
                job.finish(job.completionStatus(), null);
                log.info(
                    "Job {} finished {}: {} completed / {} failed of {}",
                    job.jobId(),
                    job.status(),
                    job.completed(),
                    job.failedPages().size(),
                    job.total()
                );
            }
        } catch (RuntimeException e) {
            log.error("Job {} failed unexpectedly", job.jobId(), e);
            job.finish(DomainAnalysisJobStatus.FAILED, "Analysis failed: " + e.getMessage());
        } finally {
            recorder.record(job);
        }
    }

    /**
     * Runs the full timeout schedule again for one failed page of a finished job.
     */
    public void retryFailedPage(DomainAnalysisJob job, String url) {
        AnalysisOptions options = job.options();
        try {
            PageTask task = new PageTask(url, options.mode(), options.timeoutScheduleMs().size());
            PageOutcome outcome = analyzeWithRetries(task, options.timeoutScheduleMs(), job.cancellationToken());
            if (outcome.isSuccess()) {
                job.resolveFailure(url, outcome.record(), merger);
                log.info("Job {} retry of {} succeeded after {} attempts", job.jobId(), url, outcome.attemptedTimeouts().size());
            } else {
                job.replaceFailure(toFailedPage(url, outcome));
                log.warn("Job {} retry of {} failed again: {}", job.jobId(), url, outcome.failure().getMessage());
            }
            job.finish(job.completionStatus(), null);
        } catch (AnalysisCancelledException e) {
            job.finish(DomainAnalysisJobStatus.CANCELLED, null);
            log.info("Job {} retry of {} cancelled", job.jobId(), url);
        } catch (RuntimeException e) {
            log.error("Job {} retry of {} failed unexpectedly", job.jobId(), url, e);
            job.finish(job.completionStatus(), "Retry of " + url + " failed: " + e.getMessage());
        } finally {
            recorder.record(job);
        }
    }

    PageOutcome analyzeWithRetries(PageTask task, List<Integer> schedule, CancellationToken token) {
        List<Long> attempted = new ArrayList<>();
        PageAnalysisException lastFailure = null;
        while (task.hasAttemptsRemaining()) {
            int attemptIndex = task.startAttempt();
            long timeoutMs = schedule.get(attemptIndex);
            attempted.add(timeoutMs);
            try {
                ExtractionRecord record = attemptManager.runAttempt(task.url(), task.mode(), Duration.ofMillis(timeoutMs), token);
                task.succeed();
                return new PageOutcome(record, null, attempted);
            } catch (AnalysisCancelledException e) {
                task.cancel();
                throw e;
            } catch (PageAnalysisException e) {
                lastFailure = e;
            } catch (RuntimeException e) {
                lastFailure = new ExtractionException(task.url(), "Unexpected failure: " + e.getMessage(), e);
            }
            log.debug(
                "Attempt {} for {} failed ({}ms): {}",
                attemptIndex + 1,
                task.url(),
                timeoutMs,
                lastFailure.getMessage()
            );
            if (!FailureReasonClassifier.isRetryable(lastFailure.reasonCode())) {
                break;
            }
        }
        task.fail();
        return new PageOutcome(null, lastFailure, attempted);
    }

    private void discover(DomainAnalysisJob job) {
        AnalysisOptions options = job.options();
        List<String> explicit = job.explicitUrls();
        if (!explicit.isEmpty()) {
            job.setDiscovered(limit(explicit, options.maxPages()), explicit.size(), null);
            return;
        }
        SitemapDiscoveryResult discovery = sitemapDiscovery.discover(job.domain());
        List<String> urls = discovery.urls();
        job.setDiscovered(limit(urls, options.maxPages()), urls.size(), discovery.notice());
    }

    private void applyOutcome(DomainAnalysisJob job, String url, PageOutcome outcome) {
        if (outcome.isSuccess()) {
            MergeOutcome merged = job.recordSuccess(url, outcome.record(), merger);
            if (merged == MergeOutcome.ALREADY_ANALYZED) {
                log.debug("Job {} page {} duplicates an analyzed path", job.jobId(), url);
            }
            return;
        }
        FailedPage failedPage = toFailedPage(url, outcome);
        if (job.recordFailure(failedPage)) {
            log.warn(
                "Job {} giving up on {} after timeouts {}: {}",
                job.jobId(),
                url,
                failedPage.attemptedTimeouts(),
                failedPage.reason()
            );
        }
    }

    private FailedPage toFailedPage(String url, PageOutcome outcome) {
        PageAnalysisException failure = outcome.failure();
        return new FailedPage(
            url,
            failure == null ? "Unknown failure" : failure.getMessage(),
            FailureReasonClassifier.fromException(failure),
            outcome.attemptedTimeouts(),
            clock.instant()
        );
    }

    private void pauseBetweenPages(long delayMs, CancellationToken token) {
        long left = delayMs;
        while (left > 0 && !token.isCancelled()) {
            long slice = Math.min(left, CANCEL_CHECK_SLICE_MS);
            try {
                sleeper.sleep(slice);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                token.cancel();
                return;
            }
            left -= slice;
        }
    }

    private static List<String> limit(List<String> urls, int maxPages) {
        return urls.size() <= maxPages ? List.copyOf(urls) : List.copyOf(urls.subList(0, maxPages));
    }

    record PageOutcome(ExtractionRecord record, PageAnalysisException failure, List<Long> attemptedTimeouts) {
        PageOutcome {
            attemptedTimeouts = List.copyOf(attemptedTimeouts);
        }

        boolean isSuccess() {
            return record != null;
        }
    }
}
