package com.designauditor.color;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores palette discipline out of 10. Deductions stack for palette size, wide
 * families, too many grays, one-off colors and contrast failures.
 */
@Component
public class ColorConsistencyScorer {

    public ColorConsistencyReport score(ColorSummary summary, int uniqueContrastFailures) {
        double score = 10.0;
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<ColorConsistencyReport.Deduction> deductions = new ArrayList<>();

        int total = summary.totalColors();
        if (total > 50) {
            score -= deduct(deductions, "Excessive colors: " + total + " total (recommend 10-15)", 3.0);
            issues.add("Excessive colors detected: " + total + " colors found");
        } else if (total > 35) {
            score -= deduct(deductions, "Too many colors: " + total + " total (recommend 10-15)", 2.0);
        } else if (total > 25) {
            score -= deduct(deductions, "High color count: " + total + " total (recommend 10-15)", 1.0);
        }

        for (ColorFamily family : summary.families()) {
            int variations = family.variations().size();
            if (variations > 8) {
                score -= deduct(deductions, "Color family with " + variations + " variations (consolidate similar shades)", 1.5);
                issues.add("Color family " + family.mainHex() + " has " + variations + " variations");
            } else if (variations > 5) {
                score -= deduct(deductions, "Color family with " + variations + " variations", 1.0);
            }
        }

        int grays = summary.neutrals().size();
        if (grays > 12) {
            score -= deduct(deductions, "Too many gray shades: " + grays + " (recommend 3-5)", 1.5);
            issues.add("Too many gray shades: " + grays);
        } else if (grays > 8) {
            score -= deduct(deductions, "Many gray shades: " + grays + " (recommend 3-5)", 1.0);
        }

        int outliers = summary.outliers().size();
        if (outliers > 10) {
            score -= deduct(deductions, outliers + " outlier colors (may be accidental)", 2.0);
            issues.add(outliers + " outlier colors detected (may be accidental)");
        } else if (outliers > 5) {
            score -= deduct(deductions, outliers + " outlier colors", 1.0);
        }

        if (uniqueContrastFailures > 5) {
            score -= deduct(deductions, uniqueContrastFailures + " WCAG contrast failures", 1.5);
            issues.add(uniqueContrastFailures + " accessibility contrast failures (WCAG)");
        } else if (uniqueContrastFailures > 2) {
            score -= deduct(deductions, uniqueContrastFailures + " WCAG contrast issues", 0.5);
            warnings.add(uniqueContrastFailures + " accessibility contrast issues");
        }

        double clamped = Math.max(0.0, Math.min(10.0, score));
        return new ColorConsistencyReport(
            Math.round(clamped * 10.0) / 10.0,
            total,
            summary.families(),
            summary.neutrals(),
            summary.outliers(),
            uniqueContrastFailures,
            List.copyOf(issues),
            List.copyOf(warnings),
            List.copyOf(deductions)
        );
    }

    private static double deduct(List<ColorConsistencyReport.Deduction> deductions, String reason, double points) {
        deductions.add(new ColorConsistencyReport.Deduction(reason, points));
        return points;
    }
}
