package com.boxsort.model;

public record PerformanceMetrics(
    int totalScans,
    double scansPerHour,
    int accuracyPct,
    double score,
    int errorCount,
    int undoCount,
    int extraItemCount,
    long sessionDurationSeconds,
    long averageTimePerScanSeconds,
    ScoreCategory scoreCategory,
    IndustryBenchmark benchmark
) {
}
