package com.designauditor.crawl.render;

import com.designauditor.crawl.http.PoliteHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@Component
public class JsoupRenderSessionFactory implements RenderSessionFactory {
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.1";
    private static final int MAX_PAGE_BYTES = 5_000_000;

    private final PoliteHttpClient httpClient;
    private final ExecutorService executor;

    public JsoupRenderSessionFactory(
        PoliteHttpClient httpClient,
        @Qualifier("attemptExecutor") ExecutorService executor
    ) {
        this.httpClient = httpClient;
        this.executor = executor;
    }

    @Override
    public RenderSession create(String url) {
        return new JsoupRenderSession(
            url,
            CompletableFuture.supplyAsync(() -> httpClient.get(url, HTML_ACCEPT, MAX_PAGE_BYTES), executor)
        );
    }
}
