package com.designauditor.crawl.sitemap;

import com.designauditor.crawl.model.SitemapDiscoveryResult;

public interface SitemapDiscovery {

    /**
     * Best effort page discovery. A site without a usable sitemap yields an empty
     * result carrying a notice, never an exception.
     */
    SitemapDiscoveryResult discover(String domain);
}
