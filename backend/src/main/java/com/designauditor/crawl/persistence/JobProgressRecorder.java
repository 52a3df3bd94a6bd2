package com.designauditor.crawl.persistence;

import com.designauditor.crawl.job.DomainAnalysisJob;
import com.designauditor.crawl.job.JobSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mirrors jobs into the progress store: a small status entry for pollers, a full snapshot
 * for resuming, and an index of known job ids. Store failures never stop a crawl.
 */
@Component
public class JobProgressRecorder {
    private static final Logger log = LoggerFactory.getLogger(JobProgressRecorder.class);
    static final String INDEX_KEY = "domainAnalysisJobs";
    static final String PROGRESS_PREFIX = "domainAnalysisProgress:";
    static final String SNAPSHOT_PREFIX = "domainAnalysisJob:";

    private final ProgressStore store;
    private final ObjectMapper objectMapper;
    private final Object indexLock = new Object();

    public JobProgressRecorder(ProgressStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public void record(DomainAnalysisJob job) {
        try {
            JsonNode status;
            JsonNode snapshot;
            // status and snapshot must describe the same moment of the job
            synchronized (job) {
                status = objectMapper.valueToTree(job.toStatus());
                snapshot = objectMapper.valueToTree(job.snapshot());
            }
            synchronized (indexLock) {
                if (job.isDiscarded()) {
                    log.debug("Skipping progress for discarded job {}", job.jobId());
                    return;
                }
                store.set(PROGRESS_PREFIX + job.jobId(), status);
                store.set(SNAPSHOT_PREFIX + job.jobId(), snapshot);
                updateIndex(job.jobId(), true);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to persist progress for job {}", job.jobId(), e);
        }
    }

    public List<JobSnapshot> loadSnapshots() {
        List<JobSnapshot> snapshots = new ArrayList<>();
        List<String> keys = new ArrayList<>();
        for (String jobId : readIndex()) {
            keys.add(SNAPSHOT_PREFIX + jobId);
        }
        if (keys.isEmpty()) {
            return snapshots;
        }
        for (Map.Entry<String, JsonNode> entry : store.get(keys).entrySet()) {
            try {
                snapshots.add(objectMapper.treeToValue(entry.getValue(), JobSnapshot.class));
            } catch (JsonProcessingException e) {
                log.warn("Ignoring unreadable job snapshot {}", entry.getKey(), e);
            }
        }
        return snapshots;
    }

    public void forget(String jobId) {
        try {
            synchronized (indexLock) {
                store.remove(List.of(PROGRESS_PREFIX + jobId, SNAPSHOT_PREFIX + jobId));
                updateIndex(jobId, false);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to remove stored progress for job {}", jobId, e);
        }
    }

    private void updateIndex(String jobId, boolean present) {
        synchronized (indexLock) {
            Set<String> ids = readIndex();
            boolean changed = present ? ids.add(jobId) : ids.remove(jobId);
            if (!changed) {
                return;
            }
            ArrayNode array = objectMapper.createArrayNode();
            ids.forEach(array::add);
            store.set(INDEX_KEY, array);
        }
    }

    private Set<String> readIndex() {
        Set<String> ids = new LinkedHashSet<>();
        store.get(INDEX_KEY).ifPresent(node -> node.forEach(id -> ids.add(id.asText())));
        return ids;
    }
}
