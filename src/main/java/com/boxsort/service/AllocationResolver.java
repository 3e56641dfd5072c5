package com.boxsort.service;

import com.boxsort.model.BoxRequirement;
import com.boxsort.model.WorkerAssignment;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Picks the target box for a scan from a freshly read candidate set, using the
 * worker's traversal pattern. Holds no state between calls; the pick is only a
 * proposal that {@link RequirementStore#tryFulfill} re-validates.
 */
@Service
public class AllocationResolver {

    @Autowired
    private AssignmentService assignmentService;

    @Autowired
    private RequirementStore requirementStore;

    /**
     * @return the target box number, or empty if no box can currently accept the barcode
     * @throws ScanCoordinationException {@code NO_ASSIGNMENT} if the worker has no active assignment on the job
     */
    public Optional<Integer> resolveTarget(String jobId, String barCode, String workerId) {
        return resolveTarget(jobId, barCode, requireAssignment(jobId, workerId));
    }

    public Optional<Integer> resolveTarget(String jobId, String barCode, WorkerAssignment assignment) {
        List<Integer> boxNumbers = requirementStore.findCandidateBoxes(jobId, barCode).stream()
            .map(BoxRequirement::getBoxNumber)
            .toList();
        return assignment.getAllocationPattern().select(boxNumbers);
    }

    public WorkerAssignment requireAssignment(String jobId, String workerId) {
        return assignmentService.findActive(jobId, workerId)
            .orElseThrow(() -> new ScanCoordinationException(ErrorKind.NO_ASSIGNMENT,
                "Worker " + workerId + " has no allocation pattern for job " + jobId, jobId, null, null));
    }
}
