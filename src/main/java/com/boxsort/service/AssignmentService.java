package com.boxsort.service;

import com.boxsort.model.AllocationPattern;
import com.boxsort.model.WorkerAssignment;
import com.boxsort.repository.WorkerAssignmentRepository;
import com.boxsort.util.RowLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Attaches workers to jobs and hands each one a traversal pattern and colour.
 *
 * The n-th worker attached to a job gets pattern {@code n mod 4} (ascending,
 * descending, middle_up, middle_down) and, unless one is given, the palette colour
 * at {@code n mod palette size}.
 */
@Service
public class AssignmentService {

    private static final Logger log = LoggerFactory.getLogger(AssignmentService.class);

    private static final Duration ASSIGN_LOCK_TIMEOUT = Duration.ofSeconds(5);

    @Autowired
    private WorkerAssignmentRepository assignmentRepository;

    @Autowired
    private RowLockRegistry rowLocks;

    @Autowired
    private Clock clock;

    @Value("${boxsort.assignment.colors:#3b82f6,#ef4444,#10b981,#f59e0b}")
    private String[] palette;

    @Cacheable(value = "assignments", key = "#jobId + ':' + #workerId")
    public Optional<WorkerAssignment> findActive(String jobId, String workerId) {
        return assignmentRepository.findFirstByJobIdAndWorkerIdAndActiveTrue(jobId, workerId);
    }

    public List<WorkerAssignment> listActive(String jobId) {
        return assignmentRepository.findByJobIdAndActiveTrueOrderByWorkerIndexAsc(jobId);
    }

    @CacheEvict(value = "assignments", key = "#jobId + ':' + #workerId")
    public WorkerAssignment assignWorker(String jobId, String workerId, String color) {
        return rowLocks.withLock("assign:" + jobId, ASSIGN_LOCK_TIMEOUT, () -> {
            if (assignmentRepository.findFirstByJobIdAndWorkerIdAndActiveTrue(jobId, workerId).isPresent()) {
                throw new ScanCoordinationException(ErrorKind.ALREADY_ASSIGNED,
                    "Worker " + workerId + " is already assigned to job " + jobId, jobId, null, null);
            }
            int workerIndex = (int) assignmentRepository.countByJobId(jobId);
            AllocationPattern pattern = AllocationPattern.forWorkerIndex(workerIndex);
            String assignedColor = color != null && !color.isBlank() ? color : defaultColor(workerIndex);

            WorkerAssignment saved = assignmentRepository.save(
                new WorkerAssignment(jobId, workerId, assignedColor, pattern, workerIndex, clock.instant()));
            log.info("Assigned worker {} to job {} as #{} with pattern {} and colour {}",
                workerId, jobId, workerIndex, pattern.getWireName(), assignedColor);
            return saved;
        });
    }

    @CacheEvict(value = "assignments", key = "#jobId + ':' + #workerId")
    public WorkerAssignment unassignWorker(String jobId, String workerId) {
        WorkerAssignment assignment = assignmentRepository.findFirstByJobIdAndWorkerIdAndActiveTrue(jobId, workerId)
            .orElseThrow(() -> new ScanCoordinationException(ErrorKind.ASSIGNMENT_NOT_FOUND,
                "Worker " + workerId + " has no active assignment on job " + jobId, jobId, null, null));
        assignment.deactivate(clock.instant());
        log.info("Unassigned worker {} from job {}", workerId, jobId);
        return assignmentRepository.save(assignment);
    }

    String defaultColor(int workerIndex) {
        return palette[Math.floorMod(workerIndex, palette.length)];
    }
}
