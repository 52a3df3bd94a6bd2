package com.designauditor.crawl.render;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flat rules from the page's inline {@code <style>} blocks. At-rules are skipped and
 * later rules win over earlier ones regardless of specificity.
 */
final class StyleSheetRules {
    private static final Logger log = LoggerFactory.getLogger(StyleSheetRules.class);

    private final List<Rule> rules;

    private StyleSheetRules(List<Rule> rules) {
        this.rules = rules;
    }

    static StyleSheetRules from(Document document) {
        List<Rule> rules = new ArrayList<>();
        for (Element style : document.select("style")) {
            parseInto(style.data(), rules);
        }
        return new StyleSheetRules(rules);
    }

    Map<String, String> declarationsFor(Element element) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Rule rule : rules) {
            if (matches(element, rule.selector())) {
                out.putAll(rule.declarations());
            }
        }
        return out;
    }

    int size() {
        return rules.size();
    }

    static Map<String, String> parseDeclarations(String block) {
        Map<String, String> out = new LinkedHashMap<>();
        if (block == null || block.isBlank()) {
            return out;
        }
        for (String declaration : block.split(";")) {
            int colon = declaration.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String property = declaration.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = declaration.substring(colon + 1).replace("!important", "").trim();
            if (!property.isEmpty() && !value.isEmpty()) {
                out.put(property, value);
            }
        }
        return out;
    }

    private static boolean matches(Element element, String selector) {
        try {
            return element.is(selector);
        } catch (Selector.SelectorParseException e) {
            log.debug("Ignoring unsupported selector '{}': {}", selector, e.getMessage());
            return false;
        }
    }

    private static void parseInto(String css, List<Rule> rules) {
        String source = css.replaceAll("(?s)/\\*.*?\\*/", "");
        int index = 0;
        while (index < source.length()) {
            int open = source.indexOf('{', index);
            if (open < 0) {
                return;
            }
            String prelude = source.substring(index, open).trim();
            int close = matchingBrace(source, open);
            if (close < 0) {
                return;
            }
            if (!prelude.startsWith("@")) {
                Map<String, String> declarations = parseDeclarations(source.substring(open + 1, close));
                if (!declarations.isEmpty()) {
                    for (String selector : prelude.split(",")) {
                        String trimmed = selector.trim();
                        if (!trimmed.isEmpty() && !trimmed.contains(":")) {
                            rules.add(new Rule(trimmed, declarations));
                        }
                    }
                }
            }
            index = close + 1;
        }
    }

    private static int matchingBrace(String source, int open) {
        int depth = 0;
        for (int i = open; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private record Rule(String selector, Map<String, String> declarations) {
    }
}
