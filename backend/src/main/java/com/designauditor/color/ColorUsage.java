package com.designauditor.color;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum ColorUsage {
    BACKGROUND("background"),
    TEXT("text"),
    BORDER("border"),
    FILL("fill");

    private final String label;

    ColorUsage(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ColorUsage fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("usedAs is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ColorUsage usage : values()) {
            if (usage.label.equals(normalized) || usage.name().equalsIgnoreCase(normalized)) {
                return usage;
            }
        }
        throw new IllegalArgumentException("Unknown color usage: " + value);
    }

    /**
     * Maps a CSS property name to the usage bucket it feeds.
     */
    public static Optional<ColorUsage> fromProperty(String property) {
        if (property == null) {
            return Optional.empty();
        }
        return switch (property.trim().toLowerCase(Locale.ROOT)) {
            case "color" -> Optional.of(TEXT);
            case "background-color", "background" -> Optional.of(BACKGROUND);
            case "border-color", "border-top-color", "border-bottom-color", "border-left-color",
                "border-right-color" -> Optional.of(BORDER);
            case "fill", "stroke" -> Optional.of(FILL);
            default -> Optional.empty();
        };
    }
}
