package com.designauditor.crawl.model;

public record MobileIssue(
    MobileIssueType type,
    String severity,
    String pageUrl,
    String selector,
    String detail
) {
}
