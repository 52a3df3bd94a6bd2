package com.designauditor.crawl.render;

import com.designauditor.crawl.model.HttpFetchResult;
import com.designauditor.crawl.service.SessionCreationFailedException;
import com.designauditor.crawl.util.FailureReasonClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Static rendering: the page is fetched once and styles come from inline {@code <style>}
 * rules, {@code style} attributes and legacy presentational attributes. Inherited text
 * properties are resolved from ancestors the way a browser's computed style would.
 */
public class JsoupRenderSession implements RenderSession {
    private static final Logger log = LoggerFactory.getLogger(JsoupRenderSession.class);
    private static final Set<String> INHERITED = Set.of(
        "color", "font-size", "font-family", "font-weight", "line-height", "text-align"
    );
    private static final int MAX_TEXT_LENGTH = 120;

    private final String url;
    private final CompletableFuture<HttpFetchResult> fetch;
    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final Map<String, Element> nodes = new HashMap<>();
    private final Map<Element, String> nodeIds = new HashMap<>();
    private final Map<Element, Map<String, String>> declaredCache = new HashMap<>();
    private Document document;
    private StyleSheetRules styleSheet;

    public JsoupRenderSession(String url, CompletableFuture<HttpFetchResult> fetch) {
        this.url = url;
        this.fetch = fetch;
    }

    @Override
    public String url() {
        return url;
    }

    @Override
    public synchronized ReadyState pollReady() {
        ensureOpen();
        if (document != null) {
            return ReadyState.READY;
        }
        if (!fetch.isDone()) {
            return ReadyState.PENDING;
        }
        HttpFetchResult result;
        try {
            result = fetch.join();
        } catch (CompletionException e) {
            throw new SessionCreationFailedException(url, "Page fetch failed: " + e.getCause(), e.getCause());
        }
        if (result == null || !result.isSuccessful()) {
            String detail = result == null ? "no response" : result.describeFailure();
            throw new SessionCreationFailedException(
                url,
                "Page fetch failed: " + detail,
                FailureReasonClassifier.fromFetch(result),
                null
            );
        }
        String contentType = result.contentType();
        if (contentType != null && !contentType.toLowerCase(Locale.ROOT).contains("html")) {
            throw new SessionCreationFailedException(
                url,
                "Not an HTML page: " + contentType,
                FailureReasonClassifier.NOT_HTML,
                null
            );
        }
        String body = result.body() == null ? "" : result.body();
        document = Jsoup.parse(body, result.finalUrlOrRequested());
        styleSheet = StyleSheetRules.from(document);
        log.debug("Loaded {} with {} stylesheet rules", url, styleSheet.size());
        return ReadyState.READY;
    }

    @Override
    public synchronized List<RenderedNode> queryDom(SelectorSet selectors) {
        Document doc = requireDocument();
        List<RenderedNode> out = new ArrayList<>();
        for (Element element : doc.select(selectors.joined())) {
            if (out.size() >= selectors.limit()) {
                break;
            }
            out.add(toNode(element));
        }
        return out;
    }

    @Override
    public synchronized Map<String, String> computedStyle(RenderedNode node) {
        requireDocument();
        Element element = elementOf(node);
        Map<String, String> style = new LinkedHashMap<>(declared(element));
        for (String property : INHERITED) {
            if (!style.containsKey(property)) {
                inherited(element, property).ifPresent(value -> style.put(property, value));
            }
        }
        style.putIfAbsent("color", "rgb(0, 0, 0)");
        style.putIfAbsent("font-size", "16px");
        style.putIfAbsent("background-color", "transparent");
        return style;
    }

    @Override
    public synchronized Optional<RenderedNode> parentOf(RenderedNode node) {
        requireDocument();
        Element parent = elementOf(node).parent();
        if (parent == null || parent instanceof Document) {
            return Optional.empty();
        }
        return Optional.of(toNode(parent));
    }

    @Override
    public Optional<byte[]> screenshot() {
        ensureOpen();
        return Optional.empty();
    }

    @Override
    public synchronized Map<String, String> metaTags() {
        Document doc = requireDocument();
        Map<String, String> out = new LinkedHashMap<>();
        for (Element meta : doc.select("meta[name]")) {
            String name = meta.attr("name").trim().toLowerCase(Locale.ROOT);
            if (!name.isEmpty()) {
                out.putIfAbsent(name, meta.attr("content"));
            }
        }
        return out;
    }

    @Override
    public synchronized void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        fetch.cancel(true);
        nodes.clear();
        nodeIds.clear();
        declaredCache.clear();
        document = null;
    }

    @Override
    public boolean isDisposed() {
        return disposed.get();
    }

    private Map<String, String> declared(Element element) {
        return declaredCache.computeIfAbsent(element, el -> {
            Map<String, String> out = new LinkedHashMap<>(styleSheet.declarationsFor(el));
            if (el.hasAttr("bgcolor")) {
                out.put("background-color", el.attr("bgcolor"));
            }
            if (el.hasAttr("color")) {
                out.put("color", el.attr("color"));
            }
            out.putAll(StyleSheetRules.parseDeclarations(el.attr("style")));
            String shorthand = out.get("background");
            if (shorthand != null && !out.containsKey("background-color")) {
                out.put("background-color", shorthand.trim().split("\\s+")[0]);
            }
            return out;
        });
    }

    private Optional<String> inherited(Element element, String property) {
        Element current = element.parent();
        while (current != null && !(current instanceof Document)) {
            String value = declared(current).get(property);
            if (value != null && !value.equalsIgnoreCase("inherit")) {
                return Optional.of(value);
            }
            current = current.parent();
        }
        return Optional.empty();
    }

    private RenderedNode toNode(Element element) {
        String id = nodeIds.computeIfAbsent(element, ignored -> "n" + (nodeIds.size() + 1));
        nodes.put(id, element);
        Map<String, String> attributes = new LinkedHashMap<>();
        for (Attribute attribute : element.attributes()) {
            attributes.put(attribute.getKey(), attribute.getValue());
        }
        return new RenderedNode(
            id,
            element.tagName().toUpperCase(Locale.ROOT),
            selectorOf(element),
            truncate(element.text()),
            sectionOf(element),
            blockOf(element),
            attributes
        );
    }

    private Element elementOf(RenderedNode node) {
        Element element = nodes.get(node.nodeId());
        if (element == null) {
            throw new IllegalArgumentException("Node " + node.nodeId() + " does not belong to session for " + url);
        }
        return element;
    }

    private static String selectorOf(Element element) {
        List<String> parts = new ArrayList<>();
        Element current = element;
        while (current != null && !(current instanceof Document) && parts.size() < 3) {
            parts.add(0, simpleSelector(current));
            if (!current.id().isEmpty()) {
                break;
            }
            current = current.parent();
        }
        return String.join(" > ", parts);
    }

    private static String simpleSelector(Element element) {
        String tag = element.tagName().toLowerCase(Locale.ROOT);
        if (!element.id().isEmpty()) {
            return tag + "#" + element.id();
        }
        for (String className : element.classNames()) {
            if (!className.isBlank()) {
                return tag + "." + className;
            }
        }
        return tag;
    }

    private static String sectionOf(Element element) {
        Element section = element.closest("[data-section-id]");
        if (section != null) {
            return section.attr("data-section-id");
        }
        Element landmark = element.closest("header, footer, nav, main, section");
        if (landmark == null) {
            return "page";
        }
        return landmark.id().isEmpty() ? landmark.tagName() : landmark.tagName() + "#" + landmark.id();
    }

    private static String blockOf(Element element) {
        Element block = element.closest("[data-block-id]");
        if (block != null) {
            return block.attr("data-block-id");
        }
        Element container = element.closest(".sqs-block, .wp-block-group, .elementor-widget, article");
        return container == null ? "-" : simpleSelector(container);
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        return trimmed.length() <= MAX_TEXT_LENGTH ? trimmed : trimmed.substring(0, MAX_TEXT_LENGTH);
    }

    private void ensureOpen() {
        if (disposed.get()) {
            throw new IllegalStateException("Render session for " + url + " is disposed");
        }
    }

    private Document requireDocument() {
        ensureOpen();
        if (document == null) {
            throw new IllegalStateException("Render session for " + url + " is not ready");
        }
        return document;
    }
}
