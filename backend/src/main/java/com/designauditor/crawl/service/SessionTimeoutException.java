package com.designauditor.crawl.service;

import com.designauditor.crawl.util.FailureReasonClassifier;

import java.time.Duration;

public class SessionTimeoutException extends PageAnalysisException {
    private final Duration timeout;

    public SessionTimeoutException(String url, Duration timeout, String phase) {
        super(url, "Page did not finish " + phase + " within " + timeout.toMillis() + "ms", null);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public String reasonCode() {
        return FailureReasonClassifier.SESSION_TIMEOUT;
    }
}
