package com.boxsort.model;

import java.util.List;

public record JobProgress(
    String jobId,
    int totalItems,
    int scannedItems,
    int completionPercentage,
    int completedBoxes,
    int totalBoxes,
    int activeSessions,
    int pausedSessions,
    List<WorkerProgress> workers
) {

    public record WorkerProgress(
        String workerId,
        Long sessionId,
        String assignedColor,
        SessionStatus status,
        int totalScans,
        double scansPerHour,
        double score
    ) {
    }
}
