package com.designauditor.crawl.job;

import com.designauditor.crawl.service.JobNotFoundException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class DomainAnalysisJobRegistry {
    private final Map<String, DomainAnalysisJob> jobs = new ConcurrentHashMap<>();

    public void register(DomainAnalysisJob job) {
        jobs.put(job.jobId(), job);
    }

    public Optional<DomainAnalysisJob> find(String jobId) {
        return jobId == null ? Optional.empty() : Optional.ofNullable(jobs.get(jobId));
    }

    public DomainAnalysisJob require(String jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public Optional<DomainAnalysisJob> findActiveByDomain(String domain) {
        return jobs.values().stream()
            .filter(job -> job.domain() != null && job.domain().equals(domain))
            .filter(job -> job.status().isActive())
            .findFirst();
    }

    public void remove(String jobId) {
        jobs.remove(jobId);
    }

    public List<DomainAnalysisJob> all() {
        return List.copyOf(jobs.values());
    }
}
