package com.designauditor.crawl.model;

public record ViewportMeta(
    String pageUrl,
    boolean present,
    String content,
    String width,
    Double initialScale,
    Double maximumScale,
    boolean userScalable
) {
    public static ViewportMeta missing(String pageUrl) {
        return new ViewportMeta(pageUrl, false, null, null, null, null, true);
    }
}
