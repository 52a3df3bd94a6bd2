package com.designauditor.crawl.persistence;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value store that survives restarts. Missing keys are simply absent from results.
 */
public interface ProgressStore {

    void set(String key, JsonNode value);

    Map<String, JsonNode> get(Collection<String> keys);

    default Optional<JsonNode> get(String key) {
        return Optional.ofNullable(get(List.of(key)).get(key));
    }

    void remove(Collection<String> keys);
}
