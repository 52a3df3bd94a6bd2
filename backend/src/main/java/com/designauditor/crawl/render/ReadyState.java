package com.designauditor.crawl.render;

public enum ReadyState {
    PENDING,
    READY
}
