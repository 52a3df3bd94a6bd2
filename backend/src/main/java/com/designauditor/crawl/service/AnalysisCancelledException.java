package com.designauditor.crawl.service;

/**
 * Raised when cancellation is observed. Never treated as a page failure.
 */
public class AnalysisCancelledException extends RuntimeException {
    public AnalysisCancelledException(String message) {
        super(message);
    }
}
