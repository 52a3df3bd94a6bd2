package com.designauditor.crawl.model;

import com.designauditor.color.ColorObservation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Raw output of one successfully analyzed page. Immutable once built.
 */
public record ExtractionRecord(
    String url,
    Map<ElementCategory, List<LocatedInstance>> elements,
    List<ColorObservation> colorObservations,
    List<ContrastIssue> contrastIssues,
    ViewportMeta viewportMeta,
    List<MobileIssue> mobileIssues,
    boolean mobileOnly
) {
    public ExtractionRecord {
        EnumMap<ElementCategory, List<LocatedInstance>> copy = new EnumMap<>(ElementCategory.class);
        for (ElementCategory category : ElementCategory.values()) {
            List<LocatedInstance> bucket = elements == null ? null : elements.get(category);
            copy.put(category, bucket == null ? List.of() : List.copyOf(bucket));
        }
        elements = Collections.unmodifiableMap(copy);
        colorObservations = colorObservations == null ? List.of() : List.copyOf(colorObservations);
        contrastIssues = contrastIssues == null ? List.of() : List.copyOf(contrastIssues);
        mobileIssues = mobileIssues == null ? List.of() : List.copyOf(mobileIssues);
    }

    public static ExtractionRecord desktop(
        String url,
        Map<ElementCategory, List<LocatedInstance>> elements,
        List<ColorObservation> colorObservations,
        List<ContrastIssue> contrastIssues
    ) {
        return new ExtractionRecord(url, elements, colorObservations, contrastIssues, null, List.of(), false);
    }

    public static ExtractionRecord mobileOnly(String url, MobileAuditResult audit) {
        return new ExtractionRecord(url, Map.of(), List.of(), List.of(), audit.viewportMeta(), audit.issues(), true);
    }

    public ExtractionRecord withMobile(MobileAuditResult audit) {
        return new ExtractionRecord(
            url,
            elements,
            colorObservations,
            contrastIssues,
            audit.viewportMeta(),
            new ArrayList<>(audit.issues()),
            false
        );
    }

    public List<LocatedInstance> instances(ElementCategory category) {
        return elements.getOrDefault(category, List.of());
    }

    public boolean hasMobileData() {
        return viewportMeta != null || !mobileIssues.isEmpty();
    }
}
