package com.designauditor.crawl.model;

public record AnalysisCounts(
    int pages,
    int headings,
    int paragraphs,
    int buttons,
    int links,
    int images,
    int colorObservations,
    int contrastFailures,
    int mobileIssues
) {
}
