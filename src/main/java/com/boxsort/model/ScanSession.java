package com.boxsort.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A worker's continuous scanning period on one job.
 *
 * The counters are derived from the session's scan events and are rewritten
 * wholesale by {@link com.boxsort.service.SessionService#recomputeAggregates}.
 */
@Entity
@Table(name = "scan_sessions",
    indexes = {
        @Index(name = "idx_session_worker_status", columnList = "worker_id, status"),
        @Index(name = "idx_session_job", columnList = "job_id")
    })
public class ScanSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 64)
    private String jobId;

    @Column(name = "worker_id", nullable = false, length = 64)
    private String workerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SessionStatus status = SessionStatus.ACTIVE;

    @Column(name = "total_scans", nullable = false)
    private Integer totalScans = 0;

    @Column(name = "successful_scans", nullable = false)
    private Integer successfulScans = 0;

    @Column(name = "error_scans", nullable = false)
    private Integer errorScans = 0;

    @Column(name = "undo_operations", nullable = false)
    private Integer undoOperations = 0;

    @Column(name = "extra_item_scans", nullable = false)
    private Integer extraItemScans = 0;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "last_activity_time")
    private Instant lastActivityTime;

    public ScanSession() {
    }

    public ScanSession(String jobId, String workerId, Instant startTime) {
        this.jobId = jobId;
        this.workerId = workerId;
        this.startTime = startTime;
        this.lastActivityTime = startTime;
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public String getWorkerId() { return workerId; }
    public void setWorkerId(String workerId) { this.workerId = workerId; }
    public SessionStatus getStatus() { return status; }
    public void setStatus(SessionStatus status) { this.status = status; }
    public Integer getTotalScans() { return totalScans; }
    public void setTotalScans(Integer totalScans) { this.totalScans = totalScans; }
    public Integer getSuccessfulScans() { return successfulScans; }
    public void setSuccessfulScans(Integer successfulScans) { this.successfulScans = successfulScans; }
    public Integer getErrorScans() { return errorScans; }
    public void setErrorScans(Integer errorScans) { this.errorScans = errorScans; }
    public Integer getUndoOperations() { return undoOperations; }
    public void setUndoOperations(Integer undoOperations) { this.undoOperations = undoOperations; }
    public Integer getExtraItemScans() { return extraItemScans; }
    public void setExtraItemScans(Integer extraItemScans) { this.extraItemScans = extraItemScans; }
    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }
    public Instant getEndTime() { return endTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }
    public Instant getLastActivityTime() { return lastActivityTime; }
    public void setLastActivityTime(Instant lastActivityTime) { this.lastActivityTime = lastActivityTime; }
}
