package com.designauditor.crawl.service;

import com.designauditor.crawl.render.ReadyState;
import com.designauditor.crawl.render.RenderSession;
import com.designauditor.crawl.render.RenderedNode;
import com.designauditor.crawl.render.SelectorSet;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

final class FakeRenderSession implements RenderSession {
    static final int NEVER = -1;

    private final String url;
    private final int pollsUntilReady;
    private final Map<String, String> metaTags;
    private final AtomicInteger polls = new AtomicInteger();
    private final AtomicInteger disposeCount = new AtomicInteger();
    private volatile Runnable onPoll = () -> { };

    FakeRenderSession(String url, int pollsUntilReady, Map<String, String> metaTags) {
        this.url = url;
        this.pollsUntilReady = pollsUntilReady;
        this.metaTags = metaTags;
    }

    static FakeRenderSession ready(String url) {
        return new FakeRenderSession(url, 0, Map.of());
    }

    static FakeRenderSession neverReady(String url) {
        return new FakeRenderSession(url, NEVER, Map.of());
    }

    FakeRenderSession onPoll(Runnable action) {
        this.onPoll = action;
        return this;
    }

    int disposeCount() {
        return disposeCount.get();
    }

    int polls() {
        return polls.get();
    }

    @Override
    public String url() {
        return url;
    }

    @Override
    public ReadyState pollReady() {
        int count = polls.getAndIncrement();
        onPoll.run();
        if (pollsUntilReady != NEVER && count >= pollsUntilReady) {
            return ReadyState.READY;
        }
        return ReadyState.PENDING;
    }

    @Override
    public List<RenderedNode> queryDom(SelectorSet selectors) {
        return List.of();
    }

    @Override
    public Map<String, String> computedStyle(RenderedNode node) {
        return Map.of();
    }

    @Override
    public Optional<RenderedNode> parentOf(RenderedNode node) {
        return Optional.empty();
    }

    @Override
    public Optional<byte[]> screenshot() {
        return Optional.empty();
    }

    @Override
    public Map<String, String> metaTags() {
        return metaTags;
    }

    @Override
    public void dispose() {
        disposeCount.incrementAndGet();
    }

    @Override
    public boolean isDisposed() {
        return disposeCount.get() > 0;
    }
}
