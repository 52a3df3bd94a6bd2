package com.designauditor.crawl.model;

public enum DomainAnalysisJobStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    PARTIALLY_SUCCEEDED,
    CANCELLED,
    FAILED;

    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    public boolean hasResult() {
        return this == SUCCEEDED || this == PARTIALLY_SUCCEEDED || this == CANCELLED;
    }
}
