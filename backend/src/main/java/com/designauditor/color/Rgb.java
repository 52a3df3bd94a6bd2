package com.designauditor.color;

import java.util.Locale;

public record Rgb(int red, int green, int blue) {
    public Rgb {
        if (red < 0 || red > 255 || green < 0 || green > 255 || blue < 0 || blue > 255) {
            throw new IllegalArgumentException("RGB channel out of range: " + red + "," + green + "," + blue);
        }
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02x%02x%02x", red, green, blue);
    }

    public int maxChannel() {
        return Math.max(red, Math.max(green, blue));
    }

    public int minChannel() {
        return Math.min(red, Math.min(green, blue));
    }
}
