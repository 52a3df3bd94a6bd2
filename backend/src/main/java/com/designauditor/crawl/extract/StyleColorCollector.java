package com.designauditor.crawl.extract;

import com.designauditor.color.ColorMath;
import com.designauditor.color.ColorObservation;
import com.designauditor.color.ColorUsage;
import com.designauditor.color.ColorValues;
import com.designauditor.color.Rgb;
import com.designauditor.crawl.model.ContrastIssue;
import com.designauditor.crawl.model.ElementCategory;
import com.designauditor.crawl.model.ExtractionRecord;
import com.designauditor.crawl.model.LocatedInstance;
import com.designauditor.crawl.render.RenderSession;
import com.designauditor.crawl.render.RenderedNode;
import com.designauditor.crawl.render.SelectorSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
public class StyleColorCollector implements ColorSampleCollector {
    private static final Logger log = LoggerFactory.getLogger(StyleColorCollector.class);
    private static final int MAX_NODES_PER_CATEGORY = 250;
    private static final int MAX_ANCESTOR_DEPTH = 25;
    private static final int SNIPPET_LENGTH = 60;
    private static final double AA_NORMAL = 4.5;
    private static final double AA_LARGE = 3.0;
    private static final List<String> COLOR_PROPERTIES = List.of(
        "color", "background-color", "border-color", "fill", "stroke"
    );
    private static final List<String> KEPT_STYLE = List.of(
        "color", "background-color", "font-family", "font-size", "font-weight", "line-height"
    );
    private static final Rgb PAGE_BACKGROUND = new Rgb(255, 255, 255);

    @Override
    public ExtractionRecord collect(RenderSession session) {
        String url = session.url();
        Map<ElementCategory, List<LocatedInstance>> elements = new EnumMap<>(ElementCategory.class);
        List<ColorObservation> observations = new ArrayList<>();
        List<ContrastIssue> contrastIssues = new ArrayList<>();
        Set<String> colorSeen = new HashSet<>();

        for (ElementCategory category : ElementCategory.values()) {
            List<LocatedInstance> bucket = new ArrayList<>();
            for (RenderedNode node : session.queryDom(SelectorSet.of(category.selector(), MAX_NODES_PER_CATEGORY))) {
                Map<String, String> style = session.computedStyle(node);
                bucket.add(locate(url, node, style));
                if (!colorSeen.add(node.nodeId())) {
                    continue;
                }
                observe(url, node, style, category, observations);
                if (category != ElementCategory.IMAGES && !node.text().isBlank()) {
                    checkContrast(session, url, node, style).ifPresent(contrastIssues::add);
                }
            }
            elements.put(category, bucket);
        }
        log.debug(
            "Collected {} color observations and {} contrast issues on {}",
            observations.size(),
            contrastIssues.size(),
            url
        );
        return ExtractionRecord.desktop(url, elements, observations, contrastIssues);
    }

    private LocatedInstance locate(String url, RenderedNode node, Map<String, String> style) {
        Map<String, String> kept = new LinkedHashMap<>();
        for (String property : KEPT_STYLE) {
            String value = style.get(property);
            if (value != null) {
                kept.put(property, value);
            }
        }
        return new LocatedInstance(url, node.tagName(), node.selector(), node.section(), node.block(), node.text(), kept);
    }

    private void observe(
        String url,
        RenderedNode node,
        Map<String, String> style,
        ElementCategory category,
        List<ColorObservation> observations
    ) {
        for (String property : COLOR_PROPERTIES) {
            String value = style.get(property);
            if (value == null || value.isBlank()) {
                continue;
            }
            if (property.equals("color") && (category == ElementCategory.IMAGES || node.text().isBlank())) {
                continue;
            }
            if (!property.equals("color") && isUnset(value)) {
                continue;
            }
            ColorUsage usage = ColorUsage.fromProperty(property).orElseThrow();
            observations.add(new ColorObservation(
                value,
                usage,
                url,
                node.tagName(),
                node.selector(),
                snippet(node.text())
            ));
        }
    }

    private Optional<ContrastIssue> checkContrast(
        RenderSession session,
        String url,
        RenderedNode node,
        Map<String, String> style
    ) {
        Optional<Rgb> foreground = ColorValues.parse(style.get("color"));
        if (foreground.isEmpty()) {
            return Optional.empty();
        }
        Rgb background = effectiveBackground(session, node, style);
        double ratio = ColorMath.contrastRatio(foreground.get(), background);
        boolean large = isLargeText(style);
        double required = large ? AA_LARGE : AA_NORMAL;
        if (ratio >= required) {
            return Optional.empty();
        }
        return Optional.of(new ContrastIssue(
            url,
            node.section(),
            node.block(),
            node.selector(),
            foreground.get().toHex(),
            background.toHex(),
            Math.round(ratio * 100.0) / 100.0,
            required,
            large,
            snippet(node.text())
        ));
    }

    private Rgb effectiveBackground(RenderSession session, RenderedNode node, Map<String, String> style) {
        Optional<Rgb> own = ColorValues.parse(style.get("background-color"));
        if (own.isPresent()) {
            return own.get();
        }
        Optional<RenderedNode> current = session.parentOf(node);
        int depth = 0;
        while (current.isPresent() && depth < MAX_ANCESTOR_DEPTH) {
            Optional<Rgb> candidate = ColorValues.parse(session.computedStyle(current.get()).get("background-color"));
            if (candidate.isPresent()) {
                return candidate.get();
            }
            current = session.parentOf(current.get());
            depth++;
        }
        return PAGE_BACKGROUND;
    }

    private static boolean isLargeText(Map<String, String> style) {
        double size = StyleValues.toPixels(style.get("font-size")).orElse(16.0);
        int weight = StyleValues.fontWeight(style.get("font-weight"));
        return size >= 24.0 || (size >= 18.66 && weight >= 700);
    }

    private static boolean isUnset(String value) {
        String lower = value.trim().toLowerCase(Locale.ROOT);
        return lower.equals("none") || lower.equals("currentcolor") || ColorValues.isTransparent(lower);
    }

    private static String snippet(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH);
    }
}
