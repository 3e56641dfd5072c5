package com.boxsort.util;

import org.slf4j.MDC;

/**
 * Puts the scan's diagnostic context (job, session, worker) into the SLF4J MDC
 * for the duration of a try-with-resources block.
 *
 * MDC is thread-bound, so the scope must be opened and closed on the thread
 * that handles the request.
 */
public final class ScanMdc implements AutoCloseable {

    public static final String JOB_ID_KEY = "jobId";
    public static final String SESSION_ID_KEY = "sessionId";
    public static final String WORKER_ID_KEY = "workerId";

    private final String previousJobId;
    private final String previousSessionId;
    private final String previousWorkerId;

    private ScanMdc(String jobId, Long sessionId, String workerId) {
        previousJobId = MDC.get(JOB_ID_KEY);
        previousSessionId = MDC.get(SESSION_ID_KEY);
        previousWorkerId = MDC.get(WORKER_ID_KEY);
        put(JOB_ID_KEY, jobId);
        put(SESSION_ID_KEY, sessionId != null ? sessionId.toString() : null);
        put(WORKER_ID_KEY, workerId);
    }

    public static ScanMdc open(String jobId, Long sessionId, String workerId) {
        return new ScanMdc(jobId, sessionId, workerId);
    }

    @Override
    public void close() {
        put(JOB_ID_KEY, previousJobId);
        put(SESSION_ID_KEY, previousSessionId);
        put(WORKER_ID_KEY, previousWorkerId);
    }

    private static void put(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
