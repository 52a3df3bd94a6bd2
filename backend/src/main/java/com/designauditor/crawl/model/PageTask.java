package com.designauditor.crawl.model;

/**
 * One URL's analysis intent. Only the orchestrator thread mutates it.
 */
public final class PageTask {
    private final String url;
    private final AnalysisMode mode;
    private final int maxAttempts;
    private int attemptIndex;
    private int attemptsStarted;
    private PageTaskStatus status = PageTaskStatus.PENDING;

    public PageTask(String url, AnalysisMode mode, int maxAttempts) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        this.url = url;
        this.mode = mode == null ? AnalysisMode.DESKTOP_ONLY : mode;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public String url() {
        return url;
    }

    public AnalysisMode mode() {
        return mode;
    }

    public int attemptIndex() {
        return attemptIndex;
    }

    public int attemptsStarted() {
        return attemptsStarted;
    }

    public PageTaskStatus status() {
        return status;
    }

    public boolean hasAttemptsRemaining() {
        return attemptsStarted < maxAttempts;
    }

    public int startAttempt() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Task already finished: " + url);
        }
        if (!hasAttemptsRemaining()) {
            throw new IllegalStateException("No attempts left for " + url);
        }
        attemptIndex = attemptsStarted;
        attemptsStarted++;
        status = PageTaskStatus.RUNNING;
        return attemptIndex;
    }

    public void succeed() {
        status = PageTaskStatus.SUCCEEDED;
    }

    public void fail() {
        status = PageTaskStatus.FAILED;
    }

    public void cancel() {
        status = PageTaskStatus.CANCELLED;
    }
}
