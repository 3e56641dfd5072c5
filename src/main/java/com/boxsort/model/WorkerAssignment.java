package com.boxsort.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One worker's traversal contract for a job. Immutable while active apart from deactivation.
 */
@Entity
@Table(name = "worker_assignments",
    indexes = @Index(name = "idx_assignment_job_worker", columnList = "job_id, worker_id"))
public class WorkerAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 64)
    private String jobId;

    @Column(name = "worker_id", nullable = false, length = 64)
    private String workerId;

    @Column(name = "assigned_color", nullable = false, length = 16)
    private String assignedColor;

    @Enumerated(EnumType.STRING)
    @Column(name = "allocation_pattern", nullable = false, length = 16)
    private AllocationPattern allocationPattern;

    @Column(name = "worker_index", nullable = false)
    private Integer workerIndex;

    @Column(name = "is_active", nullable = false)
    private Boolean active = true;

    @Column(name = "assigned_at", nullable = false)
    private Instant assignedAt;

    @Column(name = "deactivated_at")
    private Instant deactivatedAt;

    public WorkerAssignment() {
    }

    public WorkerAssignment(String jobId, String workerId, String assignedColor,
                            AllocationPattern allocationPattern, int workerIndex, Instant assignedAt) {
        this.jobId = jobId;
        this.workerId = workerId;
        this.assignedColor = assignedColor;
        this.allocationPattern = allocationPattern;
        this.workerIndex = workerIndex;
        this.assignedAt = assignedAt;
    }

    public void deactivate(Instant at) {
        this.active = false;
        this.deactivatedAt = at;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getJobId() { return jobId; }
    public String getWorkerId() { return workerId; }
    public String getAssignedColor() { return assignedColor; }
    public AllocationPattern getAllocationPattern() { return allocationPattern; }
    public Integer getWorkerIndex() { return workerIndex; }
    public Boolean getActive() { return active; }
    public Instant getAssignedAt() { return assignedAt; }
    public Instant getDeactivatedAt() { return deactivatedAt; }
}
