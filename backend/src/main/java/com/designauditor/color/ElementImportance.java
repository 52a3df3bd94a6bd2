package com.designauditor.color;

import java.util.Locale;

/**
 * Ranking used to break ties when two shades of one cluster are equally common.
 */
public enum ElementImportance {
    HEADING(100),
    INTERACTIVE(50),
    CONTENT(20),
    OTHER(1);

    private final int score;

    ElementImportance(int score) {
        this.score = score;
    }

    public int score() {
        return score;
    }

    public static ElementImportance of(String tagName) {
        if (tagName == null) {
            return OTHER;
        }
        return switch (tagName.trim().toUpperCase(Locale.ROOT)) {
            case "H1", "H2", "H3", "H4", "H5", "H6" -> HEADING;
            case "BUTTON", "A" -> INTERACTIVE;
            case "P", "SPAN", "STRONG", "EM" -> CONTENT;
            default -> OTHER;
        };
    }
}
