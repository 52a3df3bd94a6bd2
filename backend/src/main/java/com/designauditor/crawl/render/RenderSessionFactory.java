package com.designauditor.crawl.render;

public interface RenderSessionFactory {

    /**
     * Opens a fresh session for the url. Implementations start loading asynchronously;
     * readiness is observed through {@link RenderSession#pollReady()}.
     */
    RenderSession create(String url);
}
