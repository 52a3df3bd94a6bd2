package com.designauditor.crawl.job;

import com.designauditor.crawl.merge.AggregateResult;
import com.designauditor.crawl.merge.MergeOutcome;
import com.designauditor.crawl.merge.ResultMerger;
import com.designauditor.crawl.model.AnalysisOptions;
import com.designauditor.crawl.model.DomainAnalysisJobStatus;
import com.designauditor.crawl.model.DomainAnalysisStatus;
import com.designauditor.crawl.model.ExtractionRecord;
import com.designauditor.crawl.model.FailedPage;
import com.designauditor.crawl.service.CancellationToken;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * State of one domain crawl. Counts, failed pages and the merged result change together
 * under this object's lock.
 */
public class DomainAnalysisJob {
    private final String jobId;
    private final String domain;
    private final AnalysisOptions options;
    private final List<String> explicitUrls;
    private final CancellationToken cancellationToken;
    private final Clock clock;
    private final Instant createdAt;

    private DomainAnalysisJobStatus status = DomainAnalysisJobStatus.PENDING;
    private List<String> urls = List.of();
    private final Set<String> processedUrls = new LinkedHashSet<>();
    private int completed;
    private final List<FailedPage> failedPages = new ArrayList<>();
    private int totalInSitemap;
    private String notice;
    private String currentUrl;
    private Instant startedAt;
    private Instant finishedAt;
    private AggregateResult result = new AggregateResult();
    private volatile boolean discarded;

    public DomainAnalysisJob(String jobId, String domain, AnalysisOptions options, List<String> explicitUrls, Clock clock) {
        this.jobId = jobId;
        this.domain = domain;
        this.options = options;
        this.explicitUrls = explicitUrls == null ? List.of() : List.copyOf(explicitUrls);
        this.clock = clock;
        this.cancellationToken = new CancellationToken(clock);
        this.createdAt = clock.instant();
    }

    public String jobId() {
        return jobId;
    }

    public String domain() {
        return domain;
    }

    public AnalysisOptions options() {
        return options;
    }

    public List<String> explicitUrls() {
        return explicitUrls;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    /**
     * Marks the job as reset. A discarded job is never written to the progress store again,
     * even by a run that is still unwinding.
     */
    public void discard() {
        discarded = true;
    }

    public boolean isDiscarded() {
        return discarded;
    }

    public synchronized DomainAnalysisJobStatus status() {
        return status;
    }

    public synchronized boolean hasDiscoveredUrls() {
        return !urls.isEmpty();
    }

    public synchronized void markRunning() {
        status = DomainAnalysisJobStatus.RUNNING;
        if (startedAt == null) {
            startedAt = clock.instant();
        }
    }

    public synchronized void setDiscovered(List<String> discovered, int sitemapTotal, String discoveryNotice) {
        this.urls = List.copyOf(discovered);
        this.totalInSitemap = Math.max(sitemapTotal, discovered.size());
        this.notice = discoveryNotice;
    }

    public synchronized List<String> pendingUrls() {
        List<String> pending = new ArrayList<>();
        for (String url : urls) {
            if (!processedUrls.contains(url)) {
                pending.add(url);
            }
        }
        return pending;
    }

    public synchronized void setCurrentUrl(String url) {
        this.currentUrl = url;
    }

    /**
     * A page whose path was already merged still counts as completed.
     */
    public synchronized MergeOutcome recordSuccess(String url, ExtractionRecord record, ResultMerger merger) {
        processedUrls.add(url);
        MergeOutcome outcome = merger.merge(result, record);
        completed++;
        return outcome;
    }

    /**
     * @return false when the job was already cancelled and the failure was not recorded
     */
    public synchronized boolean recordFailure(FailedPage failedPage) {
        if (cancellationToken.isCancelled()) {
            return false;
        }
        processedUrls.add(failedPage.url());
        failedPages.add(failedPage);
        return true;
    }

    public synchronized Optional<FailedPage> failedPage(String url) {
        return failedPages.stream().filter(page -> page.url().equals(url)).findFirst();
    }

    public synchronized void beginRetry(String url) {
        status = DomainAnalysisJobStatus.RUNNING;
        currentUrl = url;
        finishedAt = null;
    }

    public synchronized MergeOutcome resolveFailure(String url, ExtractionRecord record, ResultMerger merger) {
        failedPages.removeIf(page -> page.url().equals(url));
        MergeOutcome outcome = merger.merge(result, record);
        completed++;
        return outcome;
    }

    public synchronized void replaceFailure(FailedPage failedPage) {
        failedPages.removeIf(page -> page.url().equals(failedPage.url()));
        failedPages.add(failedPage);
    }

    public synchronized void finish(DomainAnalysisJobStatus finalStatus, String finishNotice) {
        status = finalStatus;
        currentUrl = null;
        finishedAt = clock.instant();
        if (finishNotice != null) {
            notice = finishNotice;
        }
    }

    /**
     * Success when nothing failed, partial success otherwise.
     */
    public synchronized DomainAnalysisJobStatus completionStatus() {
        return failedPages.isEmpty()
            ? DomainAnalysisJobStatus.SUCCEEDED
            : DomainAnalysisJobStatus.PARTIALLY_SUCCEEDED;
    }

    public synchronized int completed() {
        return completed;
    }

    public synchronized List<FailedPage> failedPages() {
        return List.copyOf(failedPages);
    }

    public synchronized int total() {
        return urls.size();
    }

    public synchronized String notice() {
        return notice;
    }

    public synchronized AggregateResult result() {
        return result;
    }

    public synchronized DomainAnalysisStatus toStatus() {
        int total = urls.size();
        int done = completed + failedPages.size();
        int percent = total == 0 ? 0 : (int) Math.min(100, Math.round(done * 100.0 / total));
        return new DomainAnalysisStatus(
            jobId,
            domain,
            status,
            completed,
            failedPages.size(),
            total,
            totalInSitemap,
            percent,
            currentUrl,
            notice,
            startedAt,
            finishedAt,
            cancellationToken.cancelledAt()
        );
    }

    public synchronized JobSnapshot snapshot() {
        return new JobSnapshot(
            jobId,
            domain,
            options,
            explicitUrls,
            status,
            urls,
            new ArrayList<>(processedUrls),
            completed,
            List.copyOf(failedPages),
            totalInSitemap,
            notice,
            createdAt,
            startedAt,
            finishedAt,
            cancellationToken.cancelledAt(),
            result
        );
    }

    public static DomainAnalysisJob restore(JobSnapshot snapshot, Clock clock) {
        DomainAnalysisJob job = new DomainAnalysisJob(
            snapshot.jobId(),
            snapshot.domain(),
            snapshot.options(),
            snapshot.explicitUrls(),
            clock
        );
        synchronized (job) {
            job.status = snapshot.status() == null ? DomainAnalysisJobStatus.PENDING : snapshot.status();
            job.urls = snapshot.urls() == null ? List.of() : List.copyOf(snapshot.urls());
            if (snapshot.processedUrls() != null) {
                job.processedUrls.addAll(snapshot.processedUrls());
            }
            job.completed = snapshot.completed();
            if (snapshot.failedPages() != null) {
                job.failedPages.addAll(snapshot.failedPages());
            }
            job.totalInSitemap = snapshot.totalInSitemap();
            job.notice = snapshot.notice();
            job.startedAt = snapshot.startedAt();
            job.finishedAt = snapshot.finishedAt();
            job.result = snapshot.result() == null ? new AggregateResult() : snapshot.result();
        }
        job.cancellationToken.restoreCancelledAt(snapshot.cancelledAt());
        return job;
    }
}
