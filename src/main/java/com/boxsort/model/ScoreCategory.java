package com.boxsort.model;

public enum ScoreCategory {
    EXCELLENT("Excellent", "Outstanding performance"),
    GOOD("Good", "Above average performance"),
    AVERAGE("Average", "Meeting basic expectations"),
    BELOW_AVERAGE("Below Average", "Needs improvement"),
    POOR("Poor", "Significant improvement needed");

    private final String label;
    private final String description;

    ScoreCategory(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public static ScoreCategory of(double score) {
        if (score >= 9) return EXCELLENT;
        if (score >= 7) return GOOD;
        if (score >= 5) return AVERAGE;
        if (score >= 3) return BELOW_AVERAGE;
        return POOR;
    }

    public String getLabel() { return label; }
    public String getDescription() { return description; }
}
