package com.designauditor.crawl.extract;

import com.designauditor.crawl.model.ExtractionRecord;
import com.designauditor.crawl.render.RenderSession;

public interface ColorSampleCollector {

    /**
     * Walks a ready session and returns the page's desktop extraction record.
     */
    ExtractionRecord collect(RenderSession session);
}
