package com.designauditor.crawl.service;

import com.designauditor.config.AuditorProperties;
import com.designauditor.crawl.job.DomainAnalysisJob;
import com.designauditor.crawl.job.DomainAnalysisJobRegistry;
import com.designauditor.crawl.job.JobSnapshot;
import com.designauditor.crawl.model.AnalysisMode;
import com.designauditor.crawl.model.AnalysisOptions;
import com.designauditor.crawl.model.DomainAnalysisJobStatus;
import com.designauditor.crawl.model.DomainAnalysisRequest;
import com.designauditor.crawl.model.DomainAnalysisStatus;
import com.designauditor.crawl.persistence.JobProgressRecorder;
import com.designauditor.crawl.report.DomainAnalysisReport;
import com.designauditor.crawl.report.ReportExportService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

import static org.springframework.http.HttpStatus.UNPROCESSABLE_ENTITY;

@Service
public class DomainAnalysisService {
    private static final Logger log = LoggerFactory.getLogger(DomainAnalysisService.class);

    private final DomainAnalysisJobRegistry registry;
    private final CrawlOrchestratorService orchestrator;
    private final JobProgressRecorder recorder;
    private final ReportExportService reportService;
    private final AuditorProperties properties;
    private final ExecutorService crawlRunExecutor;
    private final Clock clock;

    public DomainAnalysisService(
        DomainAnalysisJobRegistry registry,
        CrawlOrchestratorService orchestrator,
        JobProgressRecorder recorder,
        ReportExportService reportService,
        AuditorProperties properties,
        @Qualifier("crawlRunExecutor") ExecutorService crawlRunExecutor,
        Clock clock
    ) {
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.recorder = recorder;
        this.reportService = reportService;
        this.properties = properties;
        this.crawlRunExecutor = crawlRunExecutor;
        this.clock = clock;
    }

    public String startDomainAnalysis(DomainAnalysisRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        String domain = request.normalizedDomain();
        if (domain == null) {
            throw new IllegalArgumentException("domain or urls is required");
        }
        synchronized (registry) {
            registry.findActiveByDomain(domain).ifPresent(active -> {
                throw new ActiveAnalysisJobException("Analysis " + active.jobId() + " is already running for " + domain);
            });
            DomainAnalysisJob job = new DomainAnalysisJob(
                UUID.randomUUID().toString(),
                domain,
                resolveOptions(request),
                request.normalizedUrls(),
                clock
            );
            registry.register(job);
            recorder.record(job);
            log.info("Starting analysis {} for {}", job.jobId(), domain);
            crawlRunExecutor.submit(() -> orchestrator.run(job));
            return job.jobId();
        }
    }

    public DomainAnalysisStatus cancelDomainAnalysis(String jobId) {
        DomainAnalysisJob job = registry.require(jobId);
        synchronized (job) {
            // a finished job keeps a live token so its failed pages can still be retried
            DomainAnalysisJobStatus status = job.status();
            if (!status.isActive()) {
                return job.toStatus();
            }
            if (job.cancellationToken().cancel()) {
                log.info("Cancellation requested for analysis {}", jobId);
            }
            if (status == DomainAnalysisJobStatus.PENDING) {
                job.finish(DomainAnalysisJobStatus.CANCELLED, null);
            }
        }
        recorder.record(job);
        return job.toStatus();
    }

    public DomainAnalysisStatus getStatus(String jobId) {
        return registry.require(jobId).toStatus();
    }

    public DomainAnalysisReport getResult(String jobId) {
        DomainAnalysisJob job = registry.require(jobId);
        DomainAnalysisJobStatus status = job.status();
        if (status.isActive()) {
            throw new JobNotFinishedException("Analysis " + jobId + " is still " + status);
        }
        if (!status.hasResult()) {
            throw new ResponseStatusException(UNPROCESSABLE_ENTITY, "Analysis " + jobId + " failed: " + job.notice());
        }
        return reportService.buildReport(job);
    }

    public DomainAnalysisStatus retryFailedPage(String jobId, String url) {
        DomainAnalysisJob job = registry.require(jobId);
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        synchronized (job) {
            DomainAnalysisJobStatus status = job.status();
            if (status != DomainAnalysisJobStatus.SUCCEEDED && status != DomainAnalysisJobStatus.PARTIALLY_SUCCEEDED) {
                throw new JobNotFinishedException("Analysis " + jobId + " is " + status + "; retry needs a finished job");
            }
            if (job.failedPage(url).isEmpty()) {
                throw new IllegalArgumentException("No failed page " + url + " in analysis " + jobId);
            }
            job.beginRetry(url);
        }
        recorder.record(job);
        log.info("Retrying failed page {} of analysis {}", url, jobId);
        crawlRunExecutor.submit(() -> orchestrator.retryFailedPage(job, url));
        return job.toStatus();
    }

    public void resetJob(String jobId) {
        DomainAnalysisJob job = registry.require(jobId);
        job.discard();
        job.cancellationToken().cancel();
        registry.remove(jobId);
        recorder.forget(jobId);
        log.info("Reset analysis {}", jobId);
    }

    public List<DomainAnalysisStatus> listJobs() {
        return registry.all().stream().map(DomainAnalysisJob::toStatus).toList();
    }

    @PostConstruct
    public void resumeInterruptedJobs() {
        if (!properties.getProgress().isResumeOnStartup()) {
            return;
        }
        List<JobSnapshot> snapshots;
        try {
            snapshots = recorder.loadSnapshots();
        } catch (RuntimeException e) {
            log.warn("Could not load stored analyses; starting without them", e);
            return;
        }
        for (JobSnapshot snapshot : snapshots) {
            DomainAnalysisJob job = DomainAnalysisJob.restore(snapshot, clock);
            registry.register(job);
            if (job.status().isActive()) {
                log.info("Resuming analysis {} for {} with {} pages left", job.jobId(), job.domain(), job.pendingUrls().size());
                crawlRunExecutor.submit(() -> orchestrator.run(job));
            }
        }
    }

    AnalysisOptions resolveOptions(DomainAnalysisRequest request) {
        AuditorProperties.Crawl crawl = properties.getCrawl();
        int maxPages = request.maxPages() == null ? crawl.getMaxPages() : Math.max(1, request.maxPages());
        long delay = request.delayBetweenPagesMs() == null
            ? crawl.getDelayBetweenPagesMs()
            : Math.max(0, request.delayBetweenPagesMs());
        List<Integer> schedule = request.timeoutScheduleMs() == null
            ? crawl.getTimeoutScheduleMs()
            : AuditorProperties.normalizeTimeoutSchedule(request.timeoutScheduleMs());
        AnalysisMode mode = request.mode() == null ? crawl.getDefaultMode() : request.mode();
        return new AnalysisOptions(maxPages, delay, schedule, mode);
    }
}
