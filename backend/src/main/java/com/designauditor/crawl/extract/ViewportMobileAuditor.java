package com.designauditor.crawl.extract;

import com.designauditor.crawl.model.ContrastIssue;
import com.designauditor.crawl.model.ElementCategory;
import com.designauditor.crawl.model.MobileAuditResult;
import com.designauditor.crawl.model.MobileIssue;
import com.designauditor.crawl.model.MobileIssueType;
import com.designauditor.crawl.model.ViewportMeta;
import com.designauditor.crawl.render.RenderSession;
import com.designauditor.crawl.render.RenderedNode;
import com.designauditor.crawl.render.SelectorSet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

@Component
public class ViewportMobileAuditor implements MobileUsabilityAuditor {
    static final double MIN_TAP_TARGET_PX = 44.0;
    static final double MIN_FONT_PX = 12.0;
    static final double MIN_MAXIMUM_SCALE = 5.0;
    private static final int MAX_NODES = 200;

    @Override
    public MobileAuditResult audit(RenderSession session, String url, List<ContrastIssue> contrastContext) {
        List<MobileIssue> issues = new ArrayList<>();
        ViewportMeta viewport = checkViewport(session, url, issues);
        checkTapTargets(session, url, issues);
        checkFontSizes(session, url, issues);
        if (contrastContext != null) {
            for (ContrastIssue contrast : contrastContext) {
                issues.add(new MobileIssue(
                    MobileIssueType.LOW_CONTRAST,
                    "warning",
                    url,
                    contrast.selector(),
                    String.format(Locale.ROOT, "Contrast %.2f:1 below %.1f:1", contrast.ratio(), contrast.requiredRatio())
                ));
            }
        }
        return new MobileAuditResult(viewport, issues);
    }

    static Map<String, String> parseViewportContent(String content) {
        Map<String, String> out = new LinkedHashMap<>();
        if (content == null) {
            return out;
        }
        for (String part : content.split("[,;]")) {
            int eq = part.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            out.put(
                part.substring(0, eq).trim().toLowerCase(Locale.ROOT),
                part.substring(eq + 1).trim().toLowerCase(Locale.ROOT)
            );
        }
        return out;
    }

    private ViewportMeta checkViewport(RenderSession session, String url, List<MobileIssue> issues) {
        String content = session.metaTags().get("viewport");
        if (content == null || content.isBlank()) {
            issues.add(new MobileIssue(
                MobileIssueType.VIEWPORT_MISSING,
                "error",
                url,
                "head",
                "No viewport meta tag; the page renders at desktop width on phones"
            ));
            return ViewportMeta.missing(url);
        }
        Map<String, String> values = parseViewportContent(content);
        String width = values.get("width");
        Double initialScale = parseScale(values.get("initial-scale"));
        Double maximumScale = parseScale(values.get("maximum-scale"));
        String scalable = values.get("user-scalable");
        boolean userScalable = scalable == null || !(scalable.equals("no") || scalable.equals("0"));

        if (!"device-width".equals(width) || (initialScale != null && initialScale != 1.0)) {
            issues.add(new MobileIssue(
                MobileIssueType.VIEWPORT_IMPROPER,
                "warning",
                url,
                "head",
                "Viewport should be width=device-width, initial-scale=1 (found \"" + content.trim() + "\")"
            ));
        }
        if (!userScalable) {
            issues.add(new MobileIssue(
                MobileIssueType.VIEWPORT_BLOCKS_ZOOM,
                "error",
                url,
                "head",
                "user-scalable=" + scalable + " prevents pinch zoom"
            ));
        }
        if (maximumScale != null && maximumScale < MIN_MAXIMUM_SCALE) {
            issues.add(new MobileIssue(
                MobileIssueType.VIEWPORT_LIMITS_ZOOM,
                "warning",
                url,
                "head",
                "maximum-scale=" + values.get("maximum-scale") + " limits zoom below 5x"
            ));
        }
        return new ViewportMeta(url, true, content.trim(), width, initialScale, maximumScale, userScalable);
    }

    private void checkTapTargets(RenderSession session, String url, List<MobileIssue> issues) {
        SelectorSet targets = new SelectorSet(
            List.of(ElementCategory.BUTTONS.selector(), ElementCategory.LINKS.selector()),
            MAX_NODES
        );
        for (RenderedNode node : session.queryDom(targets)) {
            Map<String, String> style = session.computedStyle(node);
            OptionalDouble width = StyleValues.toPixels(style.get("width"));
            OptionalDouble height = StyleValues.toPixels(firstPresent(style, "height", "min-height"));
            if (width.isEmpty() && height.isEmpty()) {
                continue;
            }
            double w = width.orElse(Double.MAX_VALUE);
            double h = height.orElse(Double.MAX_VALUE);
            if (w < MIN_TAP_TARGET_PX || h < MIN_TAP_TARGET_PX) {
                issues.add(new MobileIssue(
                    MobileIssueType.SMALL_TAP_TARGET,
                    "warning",
                    url,
                    node.selector(),
                    String.format(Locale.ROOT, "Tap target %s x %s px is under %.0f px", size(w), size(h), MIN_TAP_TARGET_PX)
                ));
            }
        }
    }

    private void checkFontSizes(RenderSession session, String url, List<MobileIssue> issues) {
        SelectorSet text = SelectorSet.of(ElementCategory.PARAGRAPHS.selector() + ", li, span", MAX_NODES);
        for (RenderedNode node : session.queryDom(text)) {
            if (node.text().isBlank()) {
                continue;
            }
            OptionalDouble size = StyleValues.toPixels(session.computedStyle(node).get("font-size"));
            if (size.isPresent() && size.getAsDouble() < MIN_FONT_PX) {
                issues.add(new MobileIssue(
                    MobileIssueType.SMALL_TEXT,
                    "warning",
                    url,
                    node.selector(),
                    String.format(Locale.ROOT, "Font size %.1fpx is under %.0fpx", size.getAsDouble(), MIN_FONT_PX)
                ));
            }
        }
    }

    private static String firstPresent(Map<String, String> style, String... properties) {
        for (String property : properties) {
            String value = style.get(property);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Double parseScale(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String size(double value) {
        return value == Double.MAX_VALUE ? "?" : String.format(Locale.ROOT, "%.0f", value);
    }
}
