package com.designauditor.crawl.merge;

import com.designauditor.crawl.model.AnalysisCounts;
import com.designauditor.crawl.model.ContrastIssue;
import com.designauditor.crawl.model.ElementCategory;
import com.designauditor.crawl.model.ExtractionRecord;
import com.designauditor.crawl.util.PagePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;

/**
 * Folds page records into an aggregate. A page path is merged at most once and a contrast
 * failure at most once per page, section, block and selector.
 */
@Component
public class ResultMerger {
    private static final Logger log = LoggerFactory.getLogger(ResultMerger.class);

    public MergeOutcome merge(AggregateResult aggregate, ExtractionRecord record) {
        String path = PagePaths.pathOf(record.url());
        if (aggregate.containsPath(path)) {
            log.debug("Skipping already merged page {} ({})", record.url(), path);
            return MergeOutcome.ALREADY_ANALYZED;
        }
        aggregate.getPagePaths().add(path);
        aggregate.getPagesAnalyzed().add(record.url());

        for (ElementCategory category : ElementCategory.values()) {
            aggregate.getElements().get(category).addAll(record.instances(category));
        }
        aggregate.getColorObservations().addAll(record.colorObservations());

        Set<String> seen = aggregate.contrastKeys();
        for (ContrastIssue issue : record.contrastIssues()) {
            if (seen.add(issue.locationKey())) {
                aggregate.getContrastFailures().add(issue);
            }
        }

        if (record.viewportMeta() != null) {
            aggregate.setViewportMeta(record.viewportMeta());
        }
        aggregate.getMobileIssues().addAll(record.mobileIssues());
        if (!record.mobileOnly()) {
            aggregate.setDesktopPages(aggregate.getDesktopPages() + 1);
        }
        if (record.mobileOnly() || record.hasMobileData()) {
            aggregate.setMobilePages(aggregate.getMobilePages() + 1);
        }
        return MergeOutcome.MERGED;
    }

    public AggregateResult mergeAll(Collection<ExtractionRecord> records) {
        AggregateResult aggregate = new AggregateResult();
        for (ExtractionRecord record : records) {
            merge(aggregate, record);
        }
        return aggregate;
    }

    public AnalysisCounts counts(AggregateResult aggregate) {
        return new AnalysisCounts(
            aggregate.getPagePaths().size(),
            aggregate.getElements().get(ElementCategory.HEADINGS).size(),
            aggregate.getElements().get(ElementCategory.PARAGRAPHS).size(),
            aggregate.getElements().get(ElementCategory.BUTTONS).size(),
            aggregate.getElements().get(ElementCategory.LINKS).size(),
            aggregate.getElements().get(ElementCategory.IMAGES).size(),
            aggregate.getColorObservations().size(),
            aggregate.getContrastFailures().size(),
            aggregate.getMobileIssues().size()
        );
    }

    public boolean isMobileOnlyData(AggregateResult aggregate) {
        return aggregate.getDesktopPages() == 0 && aggregate.getMobilePages() > 0;
    }

    public boolean hasMobileData(AggregateResult aggregate) {
        return aggregate.getMobilePages() > 0
            || aggregate.getViewportMeta() != null
            || !aggregate.getMobileIssues().isEmpty();
    }
}
