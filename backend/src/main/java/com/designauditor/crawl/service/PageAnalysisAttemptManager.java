package com.designauditor.crawl.service;

import com.designauditor.config.AuditorProperties;
import com.designauditor.crawl.extract.ColorSampleCollector;
import com.designauditor.crawl.extract.MobileUsabilityAuditor;
import com.designauditor.crawl.model.AnalysisMode;
import com.designauditor.crawl.model.ExtractionRecord;
import com.designauditor.crawl.model.MobileAuditResult;
import com.designauditor.crawl.render.ContentManagedSiteDetector;
import com.designauditor.crawl.render.ReadyState;
import com.designauditor.crawl.render.RenderSession;
import com.designauditor.crawl.render.RenderSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one analysis attempt for one page inside a fresh render session with a hard deadline.
 * The session is disposed exactly once on every exit path.
 */
@Service
public class PageAnalysisAttemptManager {
    private static final Logger log = LoggerFactory.getLogger(PageAnalysisAttemptManager.class);
    private static final long WORKER_STOP_GRACE_MS = 1000;

    private final RenderSessionFactory sessionFactory;
    private final ColorSampleCollector collector;
    private final MobileUsabilityAuditor mobileAuditor;
    private final ContentManagedSiteDetector cmsDetector;
    private final AuditorProperties properties;
    private final ExecutorService attemptExecutor;
    private final Clock clock;
    private final Sleeper sleeper;

    public PageAnalysisAttemptManager(
        RenderSessionFactory sessionFactory,
        ColorSampleCollector collector,
        MobileUsabilityAuditor mobileAuditor,
        ContentManagedSiteDetector cmsDetector,
        AuditorProperties properties,
        @Qualifier("attemptExecutor") ExecutorService attemptExecutor,
        Clock clock,
        Sleeper sleeper
    ) {
        this.sessionFactory = sessionFactory;
        this.collector = collector;
        this.mobileAuditor = mobileAuditor;
        this.cmsDetector = cmsDetector;
        this.properties = properties;
        this.attemptExecutor = attemptExecutor;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public ExtractionRecord runAttempt(String url, AnalysisMode mode, Duration timeout, CancellationToken token) {
        token.throwIfCancelled("before opening " + url);
        Instant deadline = clock.instant().plus(timeout);
        RenderSession session = openSession(url);
        try {
            awaitReady(session, deadline, timeout, token);
            token.throwIfCancelled("before settling " + url);

            boolean cms = detectCms(session);
            long settleMs = cms
                ? properties.getCrawl().getCmsSettleDelayMs()
                : properties.getCrawl().getSettleDelayMs();
            log.debug("Settling {} for {}ms (cms={})", url, settleMs, cms);
            pause(settleMs, deadline, timeout, token, url);
            token.throwIfCancelled("after settling " + url);

            ExtractionRecord record = extract(session, mode, deadline, timeout, token);
            token.throwIfCancelled("before returning " + url);
            return record;
        } finally {
            disposeQuietly(session);
        }
    }

    private RenderSession openSession(String url) {
        try {
            RenderSession session = sessionFactory.create(url);
            if (session == null) {
                throw new SessionCreationFailedException(url, "Render session factory returned no session", null);
            }
            return session;
        } catch (PageAnalysisException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SessionCreationFailedException(url, "Could not create render session: " + e.getMessage(), e);
        }
    }

    private void awaitReady(RenderSession session, Instant deadline, Duration timeout, CancellationToken token) {
        long pollMs = properties.getCrawl().getReadyPollIntervalMs();
        while (true) {
            token.throwIfCancelled("while loading " + session.url());
            ReadyState state;
            try {
                state = session.pollReady();
            } catch (PageAnalysisException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new SessionCreationFailedException(session.url(), "Render session failed while loading: " + e.getMessage(), e);
            }
            if (state == ReadyState.READY) {
                return;
            }
            long remaining = remainingMillis(deadline);
            if (remaining <= 0) {
                throw new SessionTimeoutException(session.url(), timeout, "loading");
            }
            sleep(Math.min(pollMs, remaining));
        }
    }

    private boolean detectCms(RenderSession session) {
        try {
            return cmsDetector.isContentManaged(session);
        } catch (RuntimeException e) {
            throw new ExtractionException(session.url(), "Site platform detection failed: " + e.getMessage(), e);
        }
    }

    private void pause(long millis, Instant deadline, Duration timeout, CancellationToken token, String url) {
        long pollMs = properties.getCrawl().getReadyPollIntervalMs();
        Instant until = clock.instant().plusMillis(millis);
        while (true) {
            token.throwIfCancelled("while settling " + url);
            long left = Duration.between(clock.instant(), until).toMillis();
            if (left <= 0) {
                return;
            }
            long remaining = remainingMillis(deadline);
            if (remaining <= 0) {
                throw new SessionTimeoutException(url, timeout, "settling");
            }
            sleep(Math.min(pollMs, Math.min(left, remaining)));
        }
    }

    private ExtractionRecord extract(
        RenderSession session,
        AnalysisMode mode,
        Instant deadline,
        Duration timeout,
        CancellationToken token
    ) {
        long pollMs = properties.getCrawl().getReadyPollIntervalMs();
        AtomicBoolean started = new AtomicBoolean();
        CountDownLatch stopped = new CountDownLatch(1);
        Future<ExtractionRecord> future = attemptExecutor.submit(() -> {
            started.set(true);
            try {
                return runPasses(session, mode, token);
            } finally {
                stopped.countDown();
            }
        });
        try {
            while (true) {
                ExtractionRecord record = awaitSlice(future, pollMs);
                if (record != null) {
                    return record;
                }
                if (token.isCancelled()) {
                    stopWorker(future, started, stopped, session.url());
                    token.throwIfCancelled("while extracting " + session.url());
                }
                if (remainingMillis(deadline) <= 0) {
                    stopWorker(future, started, stopped, session.url());
                    throw new SessionTimeoutException(session.url(), timeout, "extracting");
                }
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AnalysisCancelledException cancelled) {
                throw cancelled;
            }
            if (cause instanceof PageAnalysisException pageError) {
                throw pageError;
            }
            throw new ExtractionException(session.url(), "Extraction failed: " + cause, cause);
        } catch (CancellationException e) {
            throw new AnalysisCancelledException("Extraction cancelled for " + session.url());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException("Interrupted while extracting " + session.url());
        }
    }

    // The session must not be disposed while a pass still reads from it.
    private void stopWorker(Future<ExtractionRecord> future, AtomicBoolean started, CountDownLatch stopped, String url) {
        future.cancel(true);
        if (!started.get()) {
            return;
        }
        try {
            if (!stopped.await(WORKER_STOP_GRACE_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Extraction worker for {} did not stop within {}ms; disposing its session anyway", url, WORKER_STOP_GRACE_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException("Interrupted while stopping extraction of " + url);
        }
    }

    private ExtractionRecord awaitSlice(Future<ExtractionRecord> future, long sliceMs)
        throws ExecutionException, InterruptedException {
        try {
            return future.get(sliceMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return null;
        }
    }

    private ExtractionRecord runPasses(RenderSession session, AnalysisMode mode, CancellationToken token) {
        String url = session.url();
        if (!mode.includesDesktop()) {
            return ExtractionRecord.mobileOnly(url, mobileAuditor.audit(session, url, null));
        }
        ExtractionRecord desktop = collector.collect(session);
        if (desktop == null) {
            throw new ExtractionException(url, "Collector returned no record", null);
        }
        if (!mode.includesMobile()) {
            return desktop;
        }
        token.throwIfCancelled("before mobile audit of " + url);
        MobileAuditResult audit = mobileAuditor.audit(session, url, desktop.contrastIssues());
        return desktop.withMobile(audit);
    }

    private void disposeQuietly(RenderSession session) {
        try {
            session.dispose();
        } catch (RuntimeException e) {
            log.warn("Failed to dispose render session for {}", session.url(), e);
        }
    }

    private long remainingMillis(Instant deadline) {
        return Duration.between(clock.instant(), deadline).toMillis();
    }

    private void sleep(long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException("Interrupted while waiting");
        }
    }
}
