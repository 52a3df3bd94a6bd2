package com.designauditor.crawl.model;

public enum MobileIssueType {
    VIEWPORT_MISSING,
    VIEWPORT_IMPROPER,
    VIEWPORT_BLOCKS_ZOOM,
    VIEWPORT_LIMITS_ZOOM,
    SMALL_TAP_TARGET,
    SMALL_TEXT,
    LOW_CONTRAST
}
