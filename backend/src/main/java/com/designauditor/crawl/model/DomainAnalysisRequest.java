package com.designauditor.crawl.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

public record DomainAnalysisRequest(
    String domain,
    List<String> urls,
    Integer maxPages,
    Integer delayBetweenPagesMs,
    List<Integer> timeoutScheduleMs,
    AnalysisMode mode
) {
    public List<String> normalizedUrls() {
        if (urls == null) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String url : urls) {
            if (url == null) {
                continue;
            }
            String trimmed = url.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (!trimmed.startsWith("http://") && !trimmed.startsWith("https://")) {
                trimmed = "https://" + trimmed;
            }
            out.add(trimmed);
        }
        return new ArrayList<>(out);
    }

    /**
     * Bare lower-case host: scheme, path and trailing dots stripped.
     */
    public String normalizedDomain() {
        String source = domain;
        if ((source == null || source.isBlank()) && !normalizedUrls().isEmpty()) {
            source = normalizedUrls().get(0);
        }
        if (source == null || source.isBlank()) {
            return null;
        }
        String value = source.trim().toLowerCase(Locale.ROOT);
        int scheme = value.indexOf("://");
        if (scheme >= 0) {
            value = value.substring(scheme + 3);
        }
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }
        while (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1);
        }
        return value.isEmpty() ? null : value;
    }
}
