package com.designauditor.crawl.extract;

import java.util.Locale;
import java.util.OptionalDouble;

final class StyleValues {
    private static final double ROOT_FONT_PX = 16.0;

    private StyleValues() {
    }

    /**
     * Converts px, pt, em and rem lengths to pixels. Percentages and keywords are unknown.
     */
    static OptionalDouble toPixels(String value) {
        if (value == null || value.isBlank()) {
            return OptionalDouble.empty();
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        try {
            if (trimmed.endsWith("rem")) {
                return OptionalDouble.of(number(trimmed, 3) * ROOT_FONT_PX);
            }
            if (trimmed.endsWith("px")) {
                return OptionalDouble.of(number(trimmed, 2));
            }
            if (trimmed.endsWith("pt")) {
                return OptionalDouble.of(number(trimmed, 2) * 4.0 / 3.0);
            }
            if (trimmed.endsWith("em")) {
                return OptionalDouble.of(number(trimmed, 2) * ROOT_FONT_PX);
            }
            if (trimmed.equals("0")) {
                return OptionalDouble.of(0.0);
            }
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.empty();
    }

    static int fontWeight(String value) {
        if (value == null || value.isBlank()) {
            return 400;
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        if (trimmed.equals("bold") || trimmed.equals("bolder")) {
            return 700;
        }
        if (trimmed.equals("normal") || trimmed.equals("lighter")) {
            return 400;
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            return 400;
        }
    }

    private static double number(String value, int suffixLength) {
        return Double.parseDouble(value.substring(0, value.length() - suffixLength).trim());
    }
}
