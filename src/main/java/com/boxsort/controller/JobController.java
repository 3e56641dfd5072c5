package com.boxsort.controller;

import com.boxsort.model.BoxRequirement;
import com.boxsort.model.JobProgress;
import com.boxsort.model.WorkerAssignment;
import com.boxsort.service.AssignmentService;
import com.boxsort.service.JobProgressService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/jobs/{jobId}")
public class JobController {

    @Autowired
    private AssignmentService assignmentService;

    @Autowired
    private JobProgressService jobProgressService;

    @GetMapping("/workers")
    public ResponseEntity<List<WorkerAssignment>> listWorkers(@PathVariable String jobId) {
        return ResponseEntity.ok(assignmentService.listActive(jobId));
    }

    @PostMapping("/workers")
    public ResponseEntity<WorkerAssignment> assignWorker(@PathVariable String jobId,
                                                         @Valid @RequestBody AssignWorkerRequest request) {
        return ResponseEntity.ok(assignmentService.assignWorker(jobId, request.workerId(), request.color()));
    }

    @DeleteMapping("/workers/{workerId}")
    public ResponseEntity<Void> unassignWorker(@PathVariable String jobId, @PathVariable String workerId) {
        assignmentService.unassignWorker(jobId, workerId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/progress")
    public ResponseEntity<JobProgress> progress(@PathVariable String jobId) {
        return ResponseEntity.ok(jobProgressService.progress(jobId));
    }

    @GetMapping("/boxes")
    public ResponseEntity<List<BoxRequirement>> boxes(@PathVariable String jobId) {
        return ResponseEntity.ok(jobProgressService.boxes(jobId));
    }

    public record AssignWorkerRequest(@NotBlank String workerId, String color) {
    }
}
