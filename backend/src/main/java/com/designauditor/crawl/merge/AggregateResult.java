package com.designauditor.crawl.merge;

import com.designauditor.color.ColorObservation;
import com.designauditor.crawl.model.ContrastIssue;
import com.designauditor.crawl.model.ElementCategory;
import com.designauditor.crawl.model.LocatedInstance;
import com.designauditor.crawl.model.MobileIssue;
import com.designauditor.crawl.model.ViewportMeta;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Running merge of every analyzed page of a job. Written only through {@link ResultMerger};
 * bean accessors exist for JSON round trips through the progress store.
 */
public class AggregateResult {
    private List<String> pagesAnalyzed = new ArrayList<>();
    private Set<String> pagePaths = new LinkedHashSet<>();
    private Map<ElementCategory, List<LocatedInstance>> elements = emptyElements();
    private List<ColorObservation> colorObservations = new ArrayList<>();
    private List<ContrastIssue> contrastFailures = new ArrayList<>();
    private ViewportMeta viewportMeta;
    private List<MobileIssue> mobileIssues = new ArrayList<>();
    private int desktopPages;
    private int mobilePages;

    public List<String> getPagesAnalyzed() {
        return pagesAnalyzed;
    }

    public void setPagesAnalyzed(List<String> pagesAnalyzed) {
        this.pagesAnalyzed = pagesAnalyzed == null ? new ArrayList<>() : new ArrayList<>(pagesAnalyzed);
    }

    public Set<String> getPagePaths() {
        return pagePaths;
    }

    public void setPagePaths(Set<String> pagePaths) {
        this.pagePaths = pagePaths == null ? new LinkedHashSet<>() : new LinkedHashSet<>(pagePaths);
    }

    public Map<ElementCategory, List<LocatedInstance>> getElements() {
        return elements;
    }

    public void setElements(Map<ElementCategory, List<LocatedInstance>> elements) {
        Map<ElementCategory, List<LocatedInstance>> copy = emptyElements();
        if (elements != null) {
            elements.forEach((category, instances) -> copy.get(category).addAll(instances));
        }
        this.elements = copy;
    }

    public List<ColorObservation> getColorObservations() {
        return colorObservations;
    }

    public void setColorObservations(List<ColorObservation> colorObservations) {
        this.colorObservations = colorObservations == null ? new ArrayList<>() : new ArrayList<>(colorObservations);
    }

    public List<ContrastIssue> getContrastFailures() {
        return contrastFailures;
    }

    public void setContrastFailures(List<ContrastIssue> contrastFailures) {
        this.contrastFailures = contrastFailures == null ? new ArrayList<>() : new ArrayList<>(contrastFailures);
    }

    public ViewportMeta getViewportMeta() {
        return viewportMeta;
    }

    public void setViewportMeta(ViewportMeta viewportMeta) {
        this.viewportMeta = viewportMeta;
    }

    public List<MobileIssue> getMobileIssues() {
        return mobileIssues;
    }

    public void setMobileIssues(List<MobileIssue> mobileIssues) {
        this.mobileIssues = mobileIssues == null ? new ArrayList<>() : new ArrayList<>(mobileIssues);
    }

    public int getDesktopPages() {
        return desktopPages;
    }

    public void setDesktopPages(int desktopPages) {
        this.desktopPages = desktopPages;
    }

    public int getMobilePages() {
        return mobilePages;
    }

    public void setMobilePages(int mobilePages) {
        this.mobilePages = mobilePages;
    }

    @JsonIgnore
    public boolean containsPath(String path) {
        return pagePaths.contains(path);
    }

    @JsonIgnore
    Set<String> contrastKeys() {
        Set<String> keys = new HashSet<>();
        for (ContrastIssue issue : contrastFailures) {
            keys.add(issue.locationKey());
        }
        return keys;
    }

    private static Map<ElementCategory, List<LocatedInstance>> emptyElements() {
        Map<ElementCategory, List<LocatedInstance>> map = new EnumMap<>(ElementCategory.class);
        for (ElementCategory category : ElementCategory.values()) {
            map.put(category, new ArrayList<>());
        }
        return map;
    }
}
