package com.designauditor.crawl.service;

import com.designauditor.crawl.render.RenderSession;
import com.designauditor.crawl.render.RenderSessionFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Hands out sessions per url and attempt number and remembers every session it created.
 */
final class ScriptedSessionFactory implements RenderSessionFactory {
    private final BiFunction<String, Integer, FakeRenderSession> script;
    private final Map<String, Integer> attempts = new HashMap<>();
    private final List<FakeRenderSession> created = new ArrayList<>();

    ScriptedSessionFactory(BiFunction<String, Integer, FakeRenderSession> script) {
        this.script = script;
    }

    @Override
    public synchronized RenderSession create(String url) {
        int attempt = attempts.merge(url, 1, Integer::sum);
        FakeRenderSession session = script.apply(url, attempt);
        created.add(session);
        return session;
    }

    synchronized List<FakeRenderSession> created() {
        return List.copyOf(created);
    }

    synchronized int attempts(String url) {
        return attempts.getOrDefault(url, 0);
    }
}
