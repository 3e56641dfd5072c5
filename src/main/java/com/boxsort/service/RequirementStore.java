package com.boxsort.service;

import com.boxsort.model.BoxRequirement;
import com.boxsort.repository.BoxRequirementRepository;
import com.boxsort.util.RowLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Owner of box requirement progress. {@link #tryFulfill} and {@link #release} are
 * the only operations that change a row's fulfilled quantity.
 *
 * Each mutation holds the row's lock from {@link RowLockRegistry} for the whole
 * read-check-write and commits in its own transaction before the lock is released,
 * so no caller can observe a gap between the check and the write. Different rows
 * never contend.
 */
@Service
public class RequirementStore {

    private static final Logger log = LoggerFactory.getLogger(RequirementStore.class);

    @Autowired
    private BoxRequirementRepository requirementRepository;

    @Autowired
    private RowLockRegistry rowLocks;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private Clock clock;

    @Value("${boxsort.store.lock-timeout-ms:5000}")
    private long lockTimeoutMs;

    /**
     * Rows of the job for this barcode that can still accept a unit, ordered by box number.
     */
    public List<BoxRequirement> findCandidateBoxes(String jobId, String barCode) {
        return requirementRepository.findCandidates(jobId, barCode);
    }

    /**
     * Adds one unit to the box if it still has room.
     *
     * @return the updated row, or empty if the box filled up since it was resolved
     * @throws ScanCoordinationException {@code UNKNOWN_REQUIREMENT} if the row does not exist
     */
    public Optional<BoxRequirement> tryFulfill(String jobId, int boxNumber, String barCode,
                                               String workerId, String workerColor) {
        return mutate(jobId, boxNumber, barCode, row -> {
            if (!row.canAccept()) {
                return Optional.empty();
            }
            row.setFulfilledQty(row.getFulfilledQty() + 1);
            row.setComplete(row.getFulfilledQty().equals(row.getRequiredQty()));
            row.setLastWorkerId(workerId);
            row.setLastWorkerColor(workerColor);
            row.setUpdatedAt(clock.instant());
            return Optional.of(requirementRepository.save(row));
        });
    }

    /**
     * Removes one unit from the box.
     *
     * @return the updated row, or empty if the box holds nothing to remove
     * @throws ScanCoordinationException {@code UNKNOWN_REQUIREMENT} if the row does not exist
     */
    public Optional<BoxRequirement> release(String jobId, int boxNumber, String barCode) {
        return mutate(jobId, boxNumber, barCode, row -> {
            if (row.getFulfilledQty() <= 0) {
                return Optional.empty();
            }
            row.setFulfilledQty(row.getFulfilledQty() - 1);
            row.setComplete(row.getFulfilledQty().equals(row.getRequiredQty()));
            row.setUpdatedAt(clock.instant());
            return Optional.of(requirementRepository.save(row));
        });
    }

    /**
     * Any row of the job carrying this barcode, used to name extra items.
     */
    public Optional<BoxRequirement> findAnyForBarCode(String jobId, String barCode) {
        return requirementRepository.findFirstByJobIdAndBarCodeOrderByBoxNumberAsc(jobId, barCode);
    }

    public boolean hasRequirements(String jobId) {
        return requirementRepository.countByJobId(jobId) > 0;
    }

    public List<BoxRequirement> snapshot(String jobId) {
        return requirementRepository.findByJobIdOrderByBoxNumberAscBarCodeAsc(jobId);
    }

    private Optional<BoxRequirement> mutate(String jobId, int boxNumber, String barCode,
                                            Function<BoxRequirement, Optional<BoxRequirement>> change) {
        String key = rowKey(jobId, boxNumber, barCode);
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        try {
            return rowLocks.withLock(key, Duration.ofMillis(lockTimeoutMs), () -> tx.execute(status -> {
                BoxRequirement row = requirementRepository.findByJobIdAndBoxNumberAndBarCode(jobId, boxNumber, barCode)
                    .orElseThrow(() -> unknownRequirement(jobId, boxNumber, barCode));
                return change.apply(row);
            }));
        } catch (RowLockRegistry.LockTimeoutException e) {
            log.warn("Row {} busy for more than {} ms", key, lockTimeoutMs);
            throw new ScanCoordinationException(ErrorKind.STORE_BUSY,
                "Box " + boxNumber + " is busy, try again", jobId, null, barCode, e);
        }
    }

    private ScanCoordinationException unknownRequirement(String jobId, int boxNumber, String barCode) {
        log.error("No requirement row for job {} box {} barcode {}", jobId, boxNumber, barCode);
        return new ScanCoordinationException(ErrorKind.UNKNOWN_REQUIREMENT,
            "No requirement for box " + boxNumber + " and barcode " + barCode, jobId, null, barCode);
    }

    static String rowKey(String jobId, int boxNumber, String barCode) {
        return jobId + ":box:" + boxNumber + ":barcode:" + barCode;
    }
}
