package com.designauditor.crawl.service;

import com.designauditor.crawl.util.FailureReasonClassifier;

public class ExtractionException extends PageAnalysisException {
    public ExtractionException(String url, String message, Throwable cause) {
        super(url, message, cause);
    }

    @Override
    public String reasonCode() {
        return FailureReasonClassifier.EXTRACTION_ERROR;
    }
}
