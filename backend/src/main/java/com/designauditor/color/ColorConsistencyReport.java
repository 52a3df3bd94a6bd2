package com.designauditor.color;

import java.util.List;

public record ColorConsistencyReport(
    double score,
    int totalColors,
    List<ColorFamily> families,
    List<String> neutrals,
    List<String> outliers,
    int contrastFailures,
    List<String> issues,
    List<String> warnings,
    List<Deduction> deductions
) {
    public record Deduction(String reason, double points) {
    }
}
