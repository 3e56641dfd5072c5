package com.boxsort.service;

/**
 * Failure surfaced to the caller of a scan, undo, session or assignment operation.
 *
 * Carries the identifiers needed to diagnose the failure (job, session, barcode)
 * without exposing internal state. Any of them may be null when not known at the
 * point of failure.
 */
public class ScanCoordinationException extends RuntimeException {

    private final ErrorKind kind;
    private final String jobId;
    private final Long sessionId;
    private final String barCode;

    public ScanCoordinationException(ErrorKind kind, String message, String jobId, Long sessionId, String barCode) {
        this(kind, message, jobId, sessionId, barCode, null);
    }

    public ScanCoordinationException(ErrorKind kind, String message, String jobId, Long sessionId,
                                     String barCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.jobId = jobId;
        this.sessionId = sessionId;
        this.barCode = barCode;
    }

    public static ScanCoordinationException sessionNotFound(Long sessionId) {
        return new ScanCoordinationException(ErrorKind.SESSION_NOT_FOUND,
            "Session not found: " + sessionId, null, sessionId, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getJobId() {
        return jobId;
    }

    public Long getSessionId() {
        return sessionId;
    }

    public String getBarCode() {
        return barCode;
    }
}
