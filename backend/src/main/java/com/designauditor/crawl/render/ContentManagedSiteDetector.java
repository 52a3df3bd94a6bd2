package com.designauditor.crawl.render;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Recognizes pages rendered by site builders, which need a longer settle delay
 * before their styles are stable.
 */
@Component
public class ContentManagedSiteDetector {
    private static final List<String> GENERATORS = List.of("squarespace", "wordpress", "wix");
    private static final SelectorSet MARKERS = SelectorSet.of(
        "[data-section-id], [data-block-id], .sqs-block",
        1
    );

    public Optional<String> detectPlatform(RenderSession session) {
        String generator = session.metaTags().getOrDefault("generator", "").toLowerCase(Locale.ROOT);
        for (String platform : GENERATORS) {
            if (generator.contains(platform)) {
                return Optional.of(platform);
            }
        }
        if (!session.queryDom(MARKERS).isEmpty()) {
            return Optional.of("squarespace");
        }
        return Optional.empty();
    }

    public boolean isContentManaged(RenderSession session) {
        return detectPlatform(session).isPresent();
    }
}
