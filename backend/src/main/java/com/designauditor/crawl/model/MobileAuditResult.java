package com.designauditor.crawl.model;

import java.util.List;

public record MobileAuditResult(ViewportMeta viewportMeta, List<MobileIssue> issues) {
    public MobileAuditResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
