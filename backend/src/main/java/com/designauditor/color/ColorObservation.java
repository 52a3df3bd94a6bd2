package com.designauditor.color;

public record ColorObservation(
    String hex,
    ColorUsage usedAs,
    String pageUrl,
    String elementTag,
    String selector,
    String contextSnippet
) {
    public ColorObservation withHex(String newHex) {
        return new ColorObservation(newHex, usedAs, pageUrl, elementTag, selector, contextSnippet);
    }
}
