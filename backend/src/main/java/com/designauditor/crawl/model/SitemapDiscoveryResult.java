package com.designauditor.crawl.model;

import java.util.List;
import java.util.Map;

public record SitemapDiscoveryResult(
    List<SitemapFetchRecord> fetchedSitemaps,
    List<SitemapUrlEntry> discoveredUrls,
    Map<String, Integer> errors,
    String notice
) {
    public List<String> urls() {
        return discoveredUrls.stream().map(SitemapUrlEntry::url).toList();
    }

    public boolean isEmpty() {
        return discoveredUrls.isEmpty();
    }
}
