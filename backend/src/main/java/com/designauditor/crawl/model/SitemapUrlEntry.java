package com.designauditor.crawl.model;

public record SitemapUrlEntry(String url, String lastmod) {
}
