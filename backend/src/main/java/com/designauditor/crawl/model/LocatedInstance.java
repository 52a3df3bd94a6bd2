package com.designauditor.crawl.model;

import java.util.Map;

/**
 * One element found on a page together with where it sits and the style values that were read.
 */
public record LocatedInstance(
    String pageUrl,
    String tagName,
    String selector,
    String section,
    String block,
    String text,
    Map<String, String> style
) {
    public LocatedInstance {
        style = style == null ? Map.of() : Map.copyOf(style);
    }
}
