package com.designauditor.color;

public final class ColorMath {
    /** Plain Euclidean distance between black and white, rounded. */
    public static final double MAX_RGB_DISTANCE = 441.0;

    private ColorMath() {
    }

    /**
     * Redmean-weighted Euclidean distance. The red and blue weights shift with the
     * average red level of the two colors.
     */
    public static double redmeanDistance(Rgb first, Rgb second) {
        double rmean = (first.red() + second.red()) / 2.0;
        double dr = first.red() - second.red();
        double dg = first.green() - second.green();
        double db = first.blue() - second.blue();
        double weightRed = 2.0 + rmean / 256.0;
        double weightGreen = 4.0;
        double weightBlue = 2.0 + (255.0 - rmean) / 256.0;
        return Math.sqrt(weightRed * dr * dr + weightGreen * dg * dg + weightBlue * db * db);
    }

    public static double euclideanDistance(Rgb first, Rgb second) {
        double dr = first.red() - second.red();
        double dg = first.green() - second.green();
        double db = first.blue() - second.blue();
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    public static double relativeLuminance(Rgb color) {
        return 0.2126 * linearize(color.red())
            + 0.7152 * linearize(color.green())
            + 0.0722 * linearize(color.blue());
    }

    public static double contrastRatio(Rgb foreground, Rgb background) {
        double l1 = relativeLuminance(foreground);
        double l2 = relativeLuminance(background);
        double lighter = Math.max(l1, l2);
        double darker = Math.min(l1, l2);
        return (lighter + 0.05) / (darker + 0.05);
    }

    public static boolean isNeutral(Rgb color, int tolerance) {
        return color.maxChannel() - color.minChannel() < tolerance;
    }

    private static double linearize(int channel) {
        double c = channel / 255.0;
        return c <= 0.03928 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }
}
