package com.designauditor.crawl.extract;

import com.designauditor.crawl.model.ContrastIssue;
import com.designauditor.crawl.model.MobileAuditResult;
import com.designauditor.crawl.render.RenderSession;

import java.util.List;

public interface MobileUsabilityAuditor {

    /**
     * @param contrastContext contrast failures from the style pass of the same session, or null
     */
    MobileAuditResult audit(RenderSession session, String url, List<ContrastIssue> contrastContext);
}
