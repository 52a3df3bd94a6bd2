package com.designauditor.crawl.render;

import java.util.List;

public record SelectorSet(List<String> selectors, int limit) {
    public SelectorSet {
        selectors = List.copyOf(selectors);
        limit = Math.max(1, limit);
    }

    public static SelectorSet of(String selector, int limit) {
        return new SelectorSet(List.of(selector), limit);
    }

    public String joined() {
        return String.join(", ", selectors);
    }
}
