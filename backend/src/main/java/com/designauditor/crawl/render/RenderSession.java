package com.designauditor.crawl.render;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An isolated page-rendering context used by exactly one analysis attempt.
 * Callers own the lifetime and must call {@link #dispose()} on every exit path.
 */
public interface RenderSession {

    String url();

    /**
     * Non-blocking readiness check.
     */
    ReadyState pollReady();

    List<RenderedNode> queryDom(SelectorSet selectors);

    Map<String, String> computedStyle(RenderedNode node);

    Optional<RenderedNode> parentOf(RenderedNode node);

    Optional<byte[]> screenshot();

    /**
     * Document-level metadata such as generator and viewport meta tags, keyed by meta name.
     */
    Map<String, String> metaTags();

    void dispose();

    boolean isDisposed();
}
