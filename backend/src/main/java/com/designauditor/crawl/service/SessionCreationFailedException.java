package com.designauditor.crawl.service;

import com.designauditor.crawl.util.FailureReasonClassifier;

public class SessionCreationFailedException extends PageAnalysisException {
    private final String detailCode;

    public SessionCreationFailedException(String url, String message, String detailCode, Throwable cause) {
        super(url, message, cause);
        this.detailCode = detailCode == null ? FailureReasonClassifier.UNKNOWN : detailCode;
    }

    public SessionCreationFailedException(String url, String message, Throwable cause) {
        this(url, message, FailureReasonClassifier.UNKNOWN, cause);
    }

    public String detailCode() {
        return detailCode;
    }

    @Override
    public String reasonCode() {
        return FailureReasonClassifier.SESSION_CREATION_FAILED;
    }
}
