package com.designauditor.crawl.model;

public enum ElementCategory {
    HEADINGS("h1, h2, h3, h4, h5, h6"),
    PARAGRAPHS("p"),
    BUTTONS("button, input[type=submit], input[type=button], a.button, a.btn, a.sqs-block-button-element, [role=button]"),
    LINKS("a[href]"),
    IMAGES("img");

    private final String selector;

    ElementCategory(String selector) {
        this.selector = selector;
    }

    public String selector() {
        return selector;
    }
}
