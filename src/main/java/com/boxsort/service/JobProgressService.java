package com.boxsort.service;

import com.boxsort.model.BoxRequirement;
import com.boxsort.model.JobProgress;
import com.boxsort.model.PerformanceMetrics;
import com.boxsort.model.ScanSession;
import com.boxsort.model.SessionStatus;
import com.boxsort.model.WorkerAssignment;
import com.boxsort.repository.ScanSessionRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only progress overview of a job, and the authoritative box snapshot an
 * observer re-reads after reconnecting.
 */
@Service
public class JobProgressService {

    @Autowired
    private RequirementStore requirementStore;

    @Autowired
    private ScanSessionRepository sessionRepository;

    @Autowired
    private AssignmentService assignmentService;

    @Autowired
    private PerformanceCalculator performanceCalculator;

    public List<BoxRequirement> boxes(String jobId) {
        return requirementStore.snapshot(jobId);
    }

    public JobProgress progress(String jobId) {
        List<BoxRequirement> rows = requirementStore.snapshot(jobId);
        int totalItems = rows.stream().mapToInt(BoxRequirement::getRequiredQty).sum();
        int scannedItems = rows.stream().mapToInt(BoxRequirement::getFulfilledQty).sum();
        int completion = totalItems > 0 ? (int) Math.round(scannedItems * 100.0 / totalItems) : 0;

        Map<Integer, Boolean> boxComplete = rows.stream().collect(Collectors.toMap(
            BoxRequirement::getBoxNumber,
            BoxRequirement::getComplete,
            (a, b) -> a && b));
        int completedBoxes = (int) boxComplete.values().stream().filter(Boolean::booleanValue).count();

        List<ScanSession> sessions = sessionRepository.findByJobIdOrderByStartTimeAsc(jobId);
        int active = (int) sessions.stream().filter(s -> s.getStatus() == SessionStatus.ACTIVE).count();
        int paused = (int) sessions.stream().filter(s -> s.getStatus() == SessionStatus.PAUSED).count();

        Map<String, String> colours = assignmentService.listActive(jobId).stream()
            .collect(Collectors.toMap(WorkerAssignment::getWorkerId, WorkerAssignment::getAssignedColor, (a, b) -> a));

        // latest session per worker wins
        Map<String, ScanSession> latest = new LinkedHashMap<>();
        for (ScanSession session : sessions) {
            latest.put(session.getWorkerId(), session);
        }
        List<JobProgress.WorkerProgress> workers = new ArrayList<>();
        for (ScanSession session : latest.values()) {
            PerformanceMetrics metrics = performanceCalculator.compute(session.getId());
            workers.add(new JobProgress.WorkerProgress(session.getWorkerId(), session.getId(),
                colours.get(session.getWorkerId()), session.getStatus(), metrics.totalScans(),
                metrics.scansPerHour(), metrics.score()));
        }

        return new JobProgress(jobId, totalItems, scannedItems, completion, completedBoxes, boxComplete.size(),
            active, paused, workers);
    }
}
