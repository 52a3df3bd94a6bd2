package com.designauditor.crawl.model;

import java.time.Instant;

public record SitemapFetchRecord(
    String sitemapUrl,
    Instant fetchedAt,
    int urlCount
) {
}
