package com.boxsort.integration;

import com.boxsort.model.AllocationPattern;
import com.boxsort.model.BoxDelta;
import com.boxsort.model.BoxRequirement;
import com.boxsort.model.JobProgress;
import com.boxsort.model.ScanEvent;
import com.boxsort.model.ScanEventType;
import com.boxsort.model.ScanSession;
import com.boxsort.model.SessionStatus;
import com.boxsort.model.WorkerAssignment;
import com.boxsort.repository.BoxRequirementRepository;
import com.boxsort.repository.ScanEventRepository;
import com.boxsort.service.AssignmentService;
import com.boxsort.service.ErrorKind;
import com.boxsort.service.JobObserver;
import com.boxsort.service.JobProgressService;
import com.boxsort.service.RealtimeBroadcaster;
import com.boxsort.service.RequirementStore;
import com.boxsort.service.ScanCoordinationException;
import com.boxsort.service.ScanEventProcessor;
import com.boxsort.service.SessionService;
import com.boxsort.service.UndoCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Tag("integration")
public class ScanFlowIntegrationTest {

    @Autowired
    private ScanEventProcessor processor;

    @Autowired
    private UndoCoordinator undoCoordinator;

    @Autowired
    private SessionService sessionService;

    @Autowired
    private AssignmentService assignmentService;

    @Autowired
    private RequirementStore requirementStore;

    @Autowired
    private JobProgressService jobProgressService;

    @Autowired
    private RealtimeBroadcaster broadcaster;

    @Autowired
    private BoxRequirementRepository requirementRepository;

    @Autowired
    private ScanEventRepository eventRepository;

    private String jobId;

    @BeforeEach
    void setUp() {
        jobId = "job-" + UUID.randomUUID();
    }

    @Test
    void test_scan_fills_last_unit_of_box() {
        seed(3, "X", 2, 1);
        ScanSession session = startWorker("w1");

        ScanEvent event = processor.process(session.getId(), "X");

        assertEquals(ScanEventType.SCAN, event.getEventType());
        assertEquals(3, event.getBoxNumber());
        assertNotNull(event.getId());
        BoxRequirement row = reload(3, "X");
        assertEquals(2, row.getFulfilledQty());
        assertTrue(row.getComplete());
        assertEquals(session.getWorkerId(), row.getLastWorkerId());
        assertEquals("#3b82f6", row.getLastWorkerColor());
    }

    @Test
    void test_scan_of_satisfied_barcode_is_extra_item() {
        seed(3, "X", 2, 2);
        ScanSession session = startWorker("w1");

        ScanEvent event = processor.process(session.getId(), "X");

        assertEquals(ScanEventType.EXTRA_ITEM, event.getEventType());
        assertNull(event.getBoxNumber());
        assertEquals("Product X", event.getProductName());
        assertEquals("Customer 3", event.getCustomerName());
        assertEquals(2, reload(3, "X").getFulfilledQty(), "Extra items never touch requirement rows");
    }

    @Test
    void test_unknown_barcode_is_extra_item_with_placeholders() {
        seed(3, "X", 2, 0);
        ScanSession session = startWorker("w1");

        ScanEvent event = processor.process(session.getId(), "Y");

        assertEquals(ScanEventType.EXTRA_ITEM, event.getEventType());
        assertEquals("Unknown", event.getProductName());
        assertEquals("Unassigned", event.getCustomerName());
    }

    @Test
    void test_job_without_requirements_records_error() {
        ScanSession session = startWorker("w1");

        ScanEvent event = processor.process(session.getId(), "X");

        assertEquals(ScanEventType.ERROR, event.getEventType());
        assertEquals(1, sessionService.getSession(session.getId()).getErrorScans());
    }

    @Test
    void test_undo_releases_unit_and_keeps_history() {
        seed(3, "X", 2, 1);
        ScanSession session = startWorker("w1");
        processor.process(session.getId(), "X");

        List<ScanEvent> undone = undoCoordinator.undo(session.getId(), 1);

        assertEquals(1, undone.size());
        assertEquals(ScanEventType.UNDO, undone.get(0).getEventType());
        assertEquals(3, undone.get(0).getBoxNumber());
        BoxRequirement row = reload(3, "X");
        assertEquals(1, row.getFulfilledQty());
        assertFalse(row.getComplete());
        List<ScanEvent> history = eventRepository.findBySessionIdOrderByScanTimeAscIdAsc(session.getId());
        assertEquals(List.of(ScanEventType.SCAN, ScanEventType.UNDO),
            history.stream().map(ScanEvent::getEventType).toList(), "Scan record survives its undo");

        assertTrue(undoCoordinator.undo(session.getId(), 1).isEmpty(), "Nothing left to undo");
    }

    @Test
    void test_undo_of_externally_emptied_box_fails() {
        seed(3, "X", 2, 0);
        ScanSession session = startWorker("w1");
        processor.process(session.getId(), "X");
        BoxRequirement row = reload(3, "X");
        row.setFulfilledQty(0);
        requirementRepository.save(row);

        ScanCoordinationException e = assertThrows(ScanCoordinationException.class,
            () -> undoCoordinator.undo(session.getId(), 1));

        assertEquals(ErrorKind.UNDO_TARGET_EMPTIED, e.getKind());
        assertEquals(0, reload(3, "X").getFulfilledQty(), "Quantity never goes negative");
    }

    @Test
    void test_session_counters_follow_events() {
        seed(3, "X", 2, 1);
        ScanSession session = startWorker("w1");
        processor.process(session.getId(), "X");
        processor.process(session.getId(), "X");
        processor.process(session.getId(), "Y");
        undoCoordinator.undo(session.getId(), 1);

        ScanSession reloaded = sessionService.getSession(session.getId());
        assertEquals(4, reloaded.getTotalScans());
        assertEquals(1, reloaded.getSuccessfulScans());
        assertEquals(2, reloaded.getExtraItemScans());
        assertEquals(1, reloaded.getUndoOperations());
        assertEquals(0, reloaded.getErrorScans());
    }

    @Test
    void test_release_undoes_try_fulfill() {
        seed(6, "Q", 3, 1);

        requirementStore.tryFulfill(jobId, 6, "Q", "w1", "#3b82f6").orElseThrow();
        requirementStore.release(jobId, 6, "Q").orElseThrow();

        BoxRequirement row = reload(6, "Q");
        assertEquals(1, row.getFulfilledQty());
        assertFalse(row.getComplete());
    }

    @Test
    void test_full_box_rejects_fulfil_and_empty_box_rejects_release() {
        seed(1, "F", 1, 1);
        seed(2, "E", 1, 0);

        assertTrue(requirementStore.tryFulfill(jobId, 1, "F", "w1", "#3b82f6").isEmpty());
        assertTrue(requirementStore.release(jobId, 2, "E").isEmpty());
    }

    @Test
    void test_missing_row_is_unknown_requirement() {
        ScanCoordinationException e = assertThrows(ScanCoordinationException.class,
            () -> requirementStore.tryFulfill(jobId, 77, "NOPE", "w1", "#3b82f6"));
        assertEquals(ErrorKind.UNKNOWN_REQUIREMENT, e.getKind());
    }

    @Test
    void test_workers_follow_their_patterns() {
        for (int box = 1; box <= 4; box++) {
            seed(box, "Z", 1, 0);
        }
        ScanSession ascending = startWorker("w1");
        ScanSession descending = startWorker("w2");

        assertEquals(1, processor.process(ascending.getId(), "Z").getBoxNumber());
        assertEquals(4, processor.process(descending.getId(), "Z").getBoxNumber());
        assertEquals(2, processor.process(ascending.getId(), "Z").getBoxNumber());
        assertEquals(3, processor.process(descending.getId(), "Z").getBoxNumber());
        assertEquals(ScanEventType.EXTRA_ITEM, processor.process(ascending.getId(), "Z").getEventType());
    }

    @Test
    void test_assignment_hands_out_patterns_and_colours() {
        WorkerAssignment first = assignmentService.assignWorker(jobId, "a", null);
        WorkerAssignment second = assignmentService.assignWorker(jobId, "b", null);
        WorkerAssignment third = assignmentService.assignWorker(jobId, "c", "#000000");

        assertEquals(AllocationPattern.ASCENDING, first.getAllocationPattern());
        assertEquals(AllocationPattern.DESCENDING, second.getAllocationPattern());
        assertEquals(AllocationPattern.MIDDLE_UP, third.getAllocationPattern());
        assertEquals("#3b82f6", first.getAssignedColor());
        assertEquals("#ef4444", second.getAssignedColor());
        assertEquals("#000000", third.getAssignedColor());

        ScanCoordinationException e = assertThrows(ScanCoordinationException.class,
            () -> assignmentService.assignWorker(jobId, "a", null));
        assertEquals(ErrorKind.ALREADY_ASSIGNED, e.getKind());
    }

    @Test
    void test_unassigned_worker_cannot_scan() {
        seed(1, "X", 1, 0);
        ScanSession session = startWorker("w1");
        assignmentService.unassignWorker(jobId, session.getWorkerId());

        ScanCoordinationException e = assertThrows(ScanCoordinationException.class,
            () -> processor.process(session.getId(), "X"));
        assertEquals(ErrorKind.NO_ASSIGNMENT, e.getKind());
        assertTrue(assignmentService.findActive(jobId, session.getWorkerId()).isEmpty());
    }

    @Test
    void test_paused_session_rejects_scans() {
        seed(1, "X", 1, 0);
        ScanSession session = startWorker("w1");
        sessionService.updateStatus(session.getId(), SessionStatus.PAUSED);

        ScanCoordinationException e = assertThrows(ScanCoordinationException.class,
            () -> processor.process(session.getId(), "X"));
        assertEquals(ErrorKind.SESSION_NOT_ACTIVE, e.getKind());
        assertEquals(0, reload(1, "X").getFulfilledQty());
    }

    @Test
    void test_observer_receives_delta() {
        seed(3, "X", 2, 1);
        ScanSession session = startWorker("w1");
        List<BoxDelta> received = Collections.synchronizedList(new ArrayList<>());
        JobObserver observer = new JobObserver() {
            @Override
            public String getObserverId() {
                return "test-observer";
            }

            @Override
            public void onDelta(BoxDelta delta) {
                received.add(delta);
            }
        };
        broadcaster.subscribe(jobId, observer);
        try {
            processor.process(session.getId(), "X");
        } finally {
            broadcaster.unsubscribe(jobId, observer);
        }

        assertEquals(1, received.size());
        BoxDelta delta = received.get(0);
        assertEquals(3, delta.boxNumber());
        assertEquals(2, delta.fulfilledQty());
        assertTrue(delta.complete());
        assertEquals(ScanEventType.SCAN, delta.eventType());
        assertEquals(session.getId(), delta.sessionId());
    }

    @Test
    void test_row_deltas_carry_increasing_versions() {
        seed(4, "V", 5, 0);
        ScanSession session = startWorker("w1");
        List<BoxDelta> received = Collections.synchronizedList(new ArrayList<>());
        JobObserver observer = new JobObserver() {
            @Override
            public String getObserverId() {
                return "version-observer";
            }

            @Override
            public void onDelta(BoxDelta delta) {
                received.add(delta);
            }
        };
        broadcaster.subscribe(jobId, observer);
        try {
            processor.process(session.getId(), "V");
            processor.process(session.getId(), "V");
            undoCoordinator.undo(session.getId(), 1);
        } finally {
            broadcaster.unsubscribe(jobId, observer);
        }

        assertEquals(3, received.size());
        for (int i = 1; i < received.size(); i++) {
            assertNotNull(received.get(i).rowVersion());
            assertTrue(received.get(i).rowVersion() > received.get(i - 1).rowVersion(),
                "Each change of a row must be published with a newer version");
        }
        assertEquals(reload(4, "V").getVersion(), received.get(2).rowVersion());
        assertEquals(1, received.get(2).fulfilledQty());
    }

    @Test
    void test_progress_summarises_job() {
        seed(1, "A", 2, 0);
        seed(1, "B", 1, 0);
        seed(2, "A", 1, 0);
        ScanSession session = startWorker("w1");
        processor.process(session.getId(), "A");
        processor.process(session.getId(), "B");
        processor.process(session.getId(), "A");

        JobProgress progress = jobProgressService.progress(jobId);

        assertEquals(4, progress.totalItems());
        assertEquals(3, progress.scannedItems());
        assertEquals(75, progress.completionPercentage());
        assertEquals(2, progress.totalBoxes());
        assertEquals(1, progress.completedBoxes(), "Box 1 is done, box 2 still waits for its A");
        assertEquals(1, progress.activeSessions());
        assertEquals(1, progress.workers().size());
        assertEquals("#3b82f6", progress.workers().get(0).assignedColor());
        assertEquals(3, progress.workers().get(0).totalScans());
    }

    private ScanSession startWorker(String workerId) {
        String scopedWorker = jobId + "-" + workerId;
        assignmentService.assignWorker(jobId, scopedWorker, null);
        return sessionService.startSession(jobId, scopedWorker);
    }

    private void seed(int box, String barCode, int required, int fulfilled) {
        BoxRequirement row = new BoxRequirement(jobId, box, "Customer " + box, barCode, "Product " + barCode, required);
        row.setFulfilledQty(fulfilled);
        row.setComplete(fulfilled >= required);
        requirementRepository.save(row);
    }

    private BoxRequirement reload(int box, String barCode) {
        Optional<BoxRequirement> row = requirementRepository.findByJobIdAndBoxNumberAndBarCode(jobId, box, barCode);
        return row.orElseThrow();
    }
}
