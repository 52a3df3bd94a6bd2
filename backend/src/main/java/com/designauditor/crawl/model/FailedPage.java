package com.designauditor.crawl.model;

import java.time.Instant;
import java.util.List;

public record FailedPage(
    String url,
    String reason,
    String reasonCode,
    List<Long> attemptedTimeouts,
    Instant timestamp
) {
    public FailedPage {
        attemptedTimeouts = attemptedTimeouts == null ? List.of() : List.copyOf(attemptedTimeouts);
    }
}
