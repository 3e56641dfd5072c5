package com.boxsort.model;

/**
 * Where a scans-per-hour rate sits against the 71 items/hour industry average.
 */
public enum IndustryBenchmark {
    TOP_10("Top 10%", "Significantly above industry average"),
    TOP_25("Top 25%", "Well above industry average"),
    INDUSTRY_AVERAGE("Industry Average", "Meeting industry standards"),
    BELOW_AVERAGE("Below Average", "Below industry standards"),
    BOTTOM_25("Bottom 25%", "Significantly below industry average");

    private final String label;
    private final String comparison;

    IndustryBenchmark(String label, String comparison) {
        this.label = label;
        this.comparison = comparison;
    }

    public static IndustryBenchmark of(double scansPerHour) {
        if (scansPerHour >= 100) return TOP_10;
        if (scansPerHour >= 85) return TOP_25;
        if (scansPerHour >= 71) return INDUSTRY_AVERAGE;
        if (scansPerHour >= 50) return BELOW_AVERAGE;
        return BOTTOM_25;
    }

    public String getLabel() { return label; }
    public String getComparison() { return comparison; }
}
