package com.designauditor.crawl.sitemap;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Reads {@code Sitemap:} directives out of a robots.txt body.
 */
final class RobotsSitemapHints {

    private RobotsSitemapHints() {
    }

    static List<String> parse(String robotsBody) {
        if (robotsBody == null || robotsBody.isBlank()) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String rawLine : robotsBody.split("\\r?\\n")) {
            String line = rawLine;
            int comment = line.indexOf('#');
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            line = line.trim();
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();
            if (key.equals("sitemap") && !value.isEmpty()) {
                out.add(value);
            }
        }
        return new ArrayList<>(out);
    }
}
