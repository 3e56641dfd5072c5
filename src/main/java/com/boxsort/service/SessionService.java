package com.boxsort.service;

import com.boxsort.model.ScanEventType;
import com.boxsort.model.ScanSession;
import com.boxsort.model.SessionStatus;
import com.boxsort.repository.ScanEventRepository;
import com.boxsort.repository.ScanSessionRepository;
import com.boxsort.util.RowLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;

/**
 * Session lifecycle: at most one active session per worker, superseded sessions
 * are completed, and aggregate counters are always recounted from the event log.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private static final Duration WORKER_LOCK_TIMEOUT = Duration.ofSeconds(5);

    @Autowired
    private ScanSessionRepository sessionRepository;

    @Autowired
    private ScanEventRepository eventRepository;

    @Autowired
    private RowLockRegistry rowLocks;

    @Autowired
    private Clock clock;

    public ScanSession startSession(String jobId, String workerId) {
        return rowLocks.withLock(workerKey(workerId), WORKER_LOCK_TIMEOUT, () -> {
            Instant now = clock.instant();
            completeOpenSessions(workerId, null, now);
            ScanSession session = sessionRepository.save(new ScanSession(jobId, workerId, now));
            log.info("Worker {} started session {} on job {}", workerId, session.getId(), jobId);
            return session;
        });
    }

    public Optional<ScanSession> getActiveSession(String workerId) {
        return sessionRepository.findFirstByWorkerIdAndStatusOrderByStartTimeDesc(workerId, SessionStatus.ACTIVE);
    }

    public ScanSession getSession(Long sessionId) {
        return sessionRepository.findById(sessionId)
            .orElseThrow(() -> ScanCoordinationException.sessionNotFound(sessionId));
    }

    /**
     * Loads the session and checks that it accepts scans.
     */
    public ScanSession requireActive(Long sessionId) {
        ScanSession session = getSession(sessionId);
        if (!session.isActive()) {
            throw new ScanCoordinationException(ErrorKind.SESSION_NOT_ACTIVE,
                "Session " + sessionId + " is " + session.getStatus().getWireName(),
                session.getJobId(), sessionId, null);
        }
        return session;
    }

    public ScanSession updateStatus(Long sessionId, SessionStatus target) {
        ScanSession current = getSession(sessionId);
        return rowLocks.withLock(workerKey(current.getWorkerId()), WORKER_LOCK_TIMEOUT, () -> {
            ScanSession session = getSession(sessionId);
            if (!session.getStatus().canTransitionTo(target)) {
                throw new ScanCoordinationException(ErrorKind.INVALID_SESSION_TRANSITION,
                    "Session " + sessionId + " cannot move from " + session.getStatus().getWireName()
                        + " to " + target.getWireName(), session.getJobId(), sessionId, null);
            }
            Instant now = clock.instant();
            if (target == SessionStatus.ACTIVE) {
                completeOpenSessions(session.getWorkerId(), sessionId, now);
            }
            session.setStatus(target);
            session.setLastActivityTime(now);
            if (target == SessionStatus.COMPLETED) {
                session.setEndTime(now);
            }
            log.info("Session {} is now {}", sessionId, target.getWireName());
            return sessionRepository.save(session);
        });
    }

    /**
     * Rewrites the session counters from its scan events.
     */
    public ScanSession recomputeAggregates(Long sessionId) {
        ScanSession session = getSession(sessionId);
        session.setTotalScans((int) eventRepository.countBySessionId(sessionId));
        session.setSuccessfulScans(count(sessionId, ScanEventType.SCAN));
        session.setErrorScans(count(sessionId, ScanEventType.ERROR));
        session.setUndoOperations(count(sessionId, ScanEventType.UNDO));
        session.setExtraItemScans(count(sessionId, ScanEventType.EXTRA_ITEM));
        session.setLastActivityTime(clock.instant());
        return sessionRepository.save(session);
    }

    private int count(Long sessionId, ScanEventType type) {
        return (int) eventRepository.countBySessionIdAndEventType(sessionId, type);
    }

    private void completeOpenSessions(String workerId, Long keepSessionId, Instant now) {
        for (ScanSession open : sessionRepository.findByWorkerIdAndStatusIn(workerId,
                EnumSet.of(SessionStatus.ACTIVE, SessionStatus.PAUSED))) {
            if (open.getId().equals(keepSessionId)) {
                continue;
            }
            if (open.getStatus() == SessionStatus.PAUSED && keepSessionId != null) {
                // resuming one session leaves the worker's other paused sessions alone
                continue;
            }
            open.setStatus(SessionStatus.COMPLETED);
            open.setEndTime(now);
            open.setLastActivityTime(now);
            sessionRepository.save(open);
            log.info("Session {} of worker {} superseded", open.getId(), workerId);
        }
    }

    private static String workerKey(String workerId) {
        return "worker:" + workerId;
    }

    /**
     * Lock key held while a scan or undo of the session runs.
     */
    static String sessionLockKey(Long sessionId) {
        return "session:" + sessionId;
    }
}
