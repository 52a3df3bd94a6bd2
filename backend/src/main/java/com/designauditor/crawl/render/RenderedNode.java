package com.designauditor.crawl.render;

import java.util.Map;

/**
 * Handle to one DOM node of a session. Only valid while the owning session is open.
 */
public record RenderedNode(
    String nodeId,
    String tagName,
    String selector,
    String text,
    String section,
    String block,
    Map<String, String> attributes
) {
    public RenderedNode {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String attribute(String name) {
        return attributes.get(name);
    }
}
