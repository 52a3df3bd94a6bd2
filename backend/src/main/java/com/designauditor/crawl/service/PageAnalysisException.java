package com.designauditor.crawl.service;

/**
 * A failure of a single page attempt. Contained per page and retried with the next timeout.
 */
public abstract class PageAnalysisException extends RuntimeException {
    private final String url;

    protected PageAnalysisException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String url() {
        return url;
    }

    public abstract String reasonCode();
}
