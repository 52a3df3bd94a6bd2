package com.designauditor.crawl.model;

public record ContrastIssue(
    String pageUrl,
    String section,
    String block,
    String selector,
    String foregroundHex,
    String backgroundHex,
    double ratio,
    double requiredRatio,
    boolean largeText,
    String text
) {
    public String locationKey() {
        return pageUrl + "|" + section + "|" + block + "|" + selector;
    }
}
