package com.boxsort.service;

import com.boxsort.model.BoxDelta;
import com.boxsort.model.BoxRequirement;
import com.boxsort.model.ScanEvent;
import com.boxsort.model.ScanEventType;
import com.boxsort.model.ScanSession;
import com.boxsort.repository.ScanEventRepository;
import com.boxsort.util.RowLockRegistry;
import com.boxsort.util.ScanMdc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reverses a session's most recent scans by releasing one unit from each scan's
 * box and appending an {@code undo} record. Original scan records are never touched.
 *
 * Undos and scans of one session hold the same session lock, so two undos can
 * never pick the same scan.
 */
@Service
public class UndoCoordinator {

    private static final Logger log = LoggerFactory.getLogger(UndoCoordinator.class);

    @Autowired
    private SessionService sessionService;

    @Autowired
    private RequirementStore requirementStore;

    @Autowired
    private ScanEventRepository eventRepository;

    @Autowired
    private RealtimeBroadcaster broadcaster;

    @Autowired
    private RowLockRegistry rowLocks;

    @Autowired
    private Clock clock;

    @Value("${boxsort.session.lock-timeout-ms:10000}")
    private long sessionLockTimeoutMs;

    /**
     * @return the compensating records, most recent scan first; empty if nothing is left to undo
     * @throws ScanCoordinationException {@code UNDO_TARGET_EMPTIED} if a targeted box no longer
     *                                   holds any unit; undos already applied in the batch stay applied
     */
    public List<ScanEvent> undo(Long sessionId, int count) {
        if (count < 1) {
            throw new ScanCoordinationException(ErrorKind.INVALID_REQUEST,
                "Undo count must be at least 1, got " + count, null, sessionId, null);
        }
        try {
            return rowLocks.withLock(SessionService.sessionLockKey(sessionId), Duration.ofMillis(sessionLockTimeoutMs),
                () -> undoLocked(sessionId, count));
        } catch (RowLockRegistry.LockTimeoutException e) {
            log.warn("Session {} busy for more than {} ms, undo rejected", sessionId, sessionLockTimeoutMs);
            throw new ScanCoordinationException(ErrorKind.STORE_BUSY,
                "Session " + sessionId + " is busy, try again", null, sessionId, null, e);
        }
    }

    private List<ScanEvent> undoLocked(Long sessionId, int count) {
        ScanSession session = sessionService.requireActive(sessionId);
        String jobId = session.getJobId();

        try (ScanMdc ignored = ScanMdc.open(jobId, sessionId, session.getWorkerId())) {
            List<ScanEvent> history = eventRepository.findBySessionIdOrderByScanTimeAscIdAsc(sessionId);
            List<ScanEvent> targets = undoableScans(history, count);
            if (targets.isEmpty()) {
                log.info("Nothing to undo");
                return List.of();
            }

            Instant previousTime = history.get(history.size() - 1).getScanTime();
            List<ScanEvent> compensations = new ArrayList<>();
            try {
                for (ScanEvent scan : targets) {
                    BoxRequirement released = requirementStore.release(jobId, scan.getBoxNumber(), scan.getBarCode())
                        .orElseThrow(() -> targetEmptied(jobId, sessionId, scan));
                    Instant now = clock.instant();
                    ScanEvent undo = appendUndo(session, scan, ScanEvent.builder(sessionId, scan.getBarCode(), ScanEventType.UNDO)
                        .product(scan.getProductName(), scan.getCustomerName())
                        .boxNumber(scan.getBoxNumber())
                        .scanTime(now)
                        .timeSincePreviousMs(Duration.between(previousTime, now).toMillis())
                        .workerColor(scan.getWorkerColor())
                        .build());
                    previousTime = now;
                    compensations.add(undo);
                    broadcaster.publish(jobId, BoxDelta.forBox(released, session, scan.getWorkerColor(), ScanEventType.UNDO));
                    log.info("Undid barcode {} in box {} ({}/{})", scan.getBarCode(), scan.getBoxNumber(),
                        released.getFulfilledQty(), released.getRequiredQty());
                }
            } finally {
                if (!compensations.isEmpty()) {
                    sessionService.recomputeAggregates(sessionId);
                }
            }
            return compensations;
        }
    }

    /**
     * Saves the undo record; if that fails the released unit is put back so the
     * box never loses a unit whose scan record is still effective.
     */
    private ScanEvent appendUndo(ScanSession session, ScanEvent scan, ScanEvent undo) {
        try {
            return eventRepository.save(undo);
        } catch (RuntimeException e) {
            log.error("Undo record for barcode {} in box {} not saved, restoring the unit",
                scan.getBarCode(), scan.getBoxNumber(), e);
            try {
                requirementStore.tryFulfill(session.getJobId(), scan.getBoxNumber(), scan.getBarCode(),
                    session.getWorkerId(), scan.getWorkerColor());
            } catch (RuntimeException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw e;
        }
    }

    /**
     * Replays the history as a stack (a scan pushes, an undo pops) and returns up to
     * {@code count} still-effective scans, most recent first.
     */
    static List<ScanEvent> undoableScans(List<ScanEvent> history, int count) {
        Deque<ScanEvent> effective = new ArrayDeque<>();
        for (ScanEvent event : history) {
            if (event.getEventType() == ScanEventType.SCAN) {
                effective.push(event);
            } else if (event.getEventType() == ScanEventType.UNDO && !effective.isEmpty()) {
                effective.pop();
            }
        }
        List<ScanEvent> targets = new ArrayList<>(Math.min(count, effective.size()));
        while (targets.size() < count && !effective.isEmpty()) {
            targets.add(effective.pop());
        }
        return targets;
    }

    private ScanCoordinationException targetEmptied(String jobId, Long sessionId, ScanEvent scan) {
        log.warn("Undo of barcode {} rejected: box {} holds no units", scan.getBarCode(), scan.getBoxNumber());
        return new ScanCoordinationException(ErrorKind.UNDO_TARGET_EMPTIED,
            "Box " + scan.getBoxNumber() + " no longer holds barcode " + scan.getBarCode(),
            jobId, sessionId, scan.getBarCode());
    }
}
