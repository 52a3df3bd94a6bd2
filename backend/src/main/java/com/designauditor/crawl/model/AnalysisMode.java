package com.designauditor.crawl.model;

public enum AnalysisMode {
    DESKTOP_ONLY,
    DESKTOP_PLUS_MOBILE,
    MOBILE_ONLY;

    public boolean includesDesktop() {
        return this != MOBILE_ONLY;
    }

    public boolean includesMobile() {
        return this != DESKTOP_ONLY;
    }
}
