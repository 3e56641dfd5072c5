package com.boxsort.service;

import com.boxsort.model.BoxDelta;
import com.boxsort.model.BoxRequirement;
import com.boxsort.model.ScanEvent;
import com.boxsort.model.ScanEventType;
import com.boxsort.model.ScanSession;
import com.boxsort.model.WorkerAssignment;
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
import java.util.Optional;

/**
 * Handles one scan end to end: resolve a target box, commit the unit through
 * {@link RequirementStore}, classify the outcome, append the audit record and
 * publish the resulting delta.
 *
 * A box that fills between resolution and commit costs one re-resolution; if the
 * second attempt also loses, the scan is classified as an extra item rather than
 * retried further. Scans of one session run one at a time under the session lock
 * shared with {@link UndoCoordinator}.
 */
@Service
public class ScanEventProcessor {

    private static final Logger log = LoggerFactory.getLogger(ScanEventProcessor.class);

    static final int MAX_ALLOCATION_ATTEMPTS = 2;
    static final String UNKNOWN_PRODUCT = "Unknown";
    static final String UNASSIGNED_CUSTOMER = "Unassigned";

    @Autowired
    private SessionService sessionService;

    @Autowired
    private AllocationResolver allocationResolver;

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

    public ScanEvent process(Long sessionId, String barCode) {
        if (sessionId == null) {
            throw new ScanCoordinationException(ErrorKind.INVALID_REQUEST, "sessionId is required", null, null, barCode);
        }
        if (barCode == null || barCode.isBlank()) {
            throw new ScanCoordinationException(ErrorKind.INVALID_REQUEST, "barCode is required", null, sessionId, barCode);
        }
        String code = barCode.trim();
        try {
            return rowLocks.withLock(SessionService.sessionLockKey(sessionId), Duration.ofMillis(sessionLockTimeoutMs),
                () -> processLocked(sessionId, code));
        } catch (RowLockRegistry.LockTimeoutException e) {
            log.warn("Session {} busy for more than {} ms, scan of {} rejected", sessionId, sessionLockTimeoutMs, code);
            throw new ScanCoordinationException(ErrorKind.STORE_BUSY,
                "Session " + sessionId + " is busy, try again", null, sessionId, code, e);
        }
    }

    private ScanEvent processLocked(Long sessionId, String code) {
        ScanSession session = sessionService.requireActive(sessionId);
        String jobId = session.getJobId();

        try (ScanMdc ignored = ScanMdc.open(jobId, sessionId, session.getWorkerId())) {
            WorkerAssignment assignment = allocationResolver.requireAssignment(jobId, session.getWorkerId());
            String workerColor = assignment.getAssignedColor();
            Instant now = clock.instant();
            Long sincePrevious = eventRepository.findFirstBySessionIdOrderByScanTimeDescIdDesc(sessionId)
                .map(previous -> Duration.between(previous.getScanTime(), now).toMillis())
                .orElse(null);

            Optional<BoxRequirement> placed = allocate(jobId, code, session.getWorkerId(), assignment);

            ScanEvent event;
            BoxDelta delta;
            if (placed.isPresent()) {
                BoxRequirement box = placed.get();
                event = appendScan(jobId, box, ScanEvent.builder(sessionId, code, ScanEventType.SCAN)
                    .product(box.getProductName(), box.getCustomerName())
                    .boxNumber(box.getBoxNumber())
                    .scanTime(now)
                    .timeSincePreviousMs(sincePrevious)
                    .workerColor(workerColor)
                    .build());
                delta = BoxDelta.forBox(box, session, workerColor, ScanEventType.SCAN);
                log.info("Barcode {} placed in box {} ({}/{})", code, box.getBoxNumber(),
                    box.getFulfilledQty(), box.getRequiredQty());
            } else {
                event = eventRepository.save(classifyUnplaced(sessionId, jobId, code, now, sincePrevious, workerColor));
                delta = BoxDelta.forUnplaced(event, session);
            }

            sessionService.recomputeAggregates(sessionId);
            broadcaster.publish(jobId, delta);
            return event;
        }
    }

    /**
     * Saves the scan record; if that fails the unit just committed is released so
     * the box never holds a unit without a scan record to undo it.
     */
    private ScanEvent appendScan(String jobId, BoxRequirement box, ScanEvent scan) {
        try {
            return eventRepository.save(scan);
        } catch (RuntimeException e) {
            log.error("Scan record for barcode {} in box {} not saved, releasing the unit",
                scan.getBarCode(), box.getBoxNumber(), e);
            try {
                requirementStore.release(jobId, box.getBoxNumber(), box.getBarCode());
            } catch (RuntimeException releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }
    }

    private Optional<BoxRequirement> allocate(String jobId, String barCode, String workerId,
                                              WorkerAssignment assignment) {
        for (int attempt = 1; attempt <= MAX_ALLOCATION_ATTEMPTS; attempt++) {
            Optional<Integer> target = allocationResolver.resolveTarget(jobId, barCode, assignment);
            if (target.isEmpty()) {
                return Optional.empty();
            }
            Optional<BoxRequirement> updated = requirementStore.tryFulfill(jobId, target.get(), barCode,
                workerId, assignment.getAssignedColor());
            if (updated.isPresent()) {
                return updated;
            }
            log.warn("Allocation race lost for barcode {} on box {} (attempt {} of {})",
                barCode, target.get(), attempt, MAX_ALLOCATION_ATTEMPTS);
        }
        return Optional.empty();
    }

    private ScanEvent classifyUnplaced(Long sessionId, String jobId, String barCode, Instant now,
                                       Long sincePrevious, String workerColor) {
        if (!requirementStore.hasRequirements(jobId)) {
            log.warn("Job {} has no box requirements; scan of {} recorded as error", jobId, barCode);
            return ScanEvent.builder(sessionId, barCode, ScanEventType.ERROR)
                .scanTime(now)
                .timeSincePreviousMs(sincePrevious)
                .workerColor(workerColor)
                .build();
        }

        ScanEvent.Builder extra = ScanEvent.builder(sessionId, barCode, ScanEventType.EXTRA_ITEM)
            .scanTime(now)
            .timeSincePreviousMs(sincePrevious)
            .workerColor(workerColor);
        Optional<BoxRequirement> known = requirementStore.findAnyForBarCode(jobId, barCode);
        if (known.isPresent()) {
            log.info("Barcode {} already fulfilled in every box, recorded as extra item", barCode);
            extra.product(known.get().getProductName(), known.get().getCustomerName());
        } else {
            log.info("Barcode {} is not part of job {}, recorded as extra item", barCode, jobId);
            extra.product(UNKNOWN_PRODUCT, UNASSIGNED_CUSTOMER);
        }
        return extra.build();
    }
}
