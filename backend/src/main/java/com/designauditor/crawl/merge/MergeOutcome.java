package com.designauditor.crawl.merge;

public enum MergeOutcome {
    MERGED,
    ALREADY_ANALYZED
}
