package com.designauditor.color;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the CSS color syntaxes found in computed styles into {@link Rgb}.
 * Anything that is not an opaque-enough concrete color comes back empty.
 */
public final class ColorValues {
    private static final Pattern HEX = Pattern.compile("^#([0-9a-f]{3}|[0-9a-f]{6}|[0-9a-f]{8})$");
    private static final Pattern RGB_FUNCTION = Pattern.compile(
        "^rgba?\\(\\s*([0-9.]+)\\s*[, ]\\s*([0-9.]+)\\s*[, ]\\s*([0-9.]+)\\s*(?:[,/]\\s*([0-9.]+%?)\\s*)?\\)$"
    );

    private ColorValues() {
    }

    public static Optional<Rgb> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        Matcher hex = HEX.matcher(trimmed);
        if (hex.matches()) {
            return parseHex(hex.group(1));
        }
        Matcher rgb = RGB_FUNCTION.matcher(trimmed);
        if (rgb.matches()) {
            return parseFunction(rgb);
        }
        return Optional.empty();
    }

    /**
     * Lower-case six digit form of a parseable color, or empty for malformed input.
     */
    public static Optional<String> normalizeHex(String value) {
        return parse(value).map(Rgb::toHex);
    }

    public static boolean isTransparent(String value) {
        if (value == null || value.isBlank()) {
            return true;
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        if (trimmed.equals("transparent")) {
            return true;
        }
        return parse(trimmed).isEmpty() && (trimmed.startsWith("rgba(") || trimmed.startsWith("#"));
    }

    private static Optional<Rgb> parseHex(String digits) {
        if (digits.length() == 3) {
            int r = Integer.parseInt(digits.substring(0, 1).repeat(2), 16);
            int g = Integer.parseInt(digits.substring(1, 2).repeat(2), 16);
            int b = Integer.parseInt(digits.substring(2, 3).repeat(2), 16);
            return Optional.of(new Rgb(r, g, b));
        }
        if (digits.length() == 8 && Integer.parseInt(digits.substring(6, 8), 16) == 0) {
            return Optional.empty();
        }
        int r = Integer.parseInt(digits.substring(0, 2), 16);
        int g = Integer.parseInt(digits.substring(2, 4), 16);
        int b = Integer.parseInt(digits.substring(4, 6), 16);
        return Optional.of(new Rgb(r, g, b));
    }

    private static Optional<Rgb> parseFunction(Matcher matcher) {
        try {
            double r = Double.parseDouble(matcher.group(1));
            double g = Double.parseDouble(matcher.group(2));
            double b = Double.parseDouble(matcher.group(3));
            if (r > 255 || g > 255 || b > 255) {
                return Optional.empty();
            }
            String alpha = matcher.group(4);
            if (alpha != null && alphaValue(alpha) <= 0.0) {
                return Optional.empty();
            }
            return Optional.of(new Rgb((int) Math.round(r), (int) Math.round(g), (int) Math.round(b)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static double alphaValue(String alpha) {
        if (alpha.endsWith("%")) {
            return Double.parseDouble(alpha.substring(0, alpha.length() - 1)) / 100.0;
        }
        return Double.parseDouble(alpha);
    }
}
