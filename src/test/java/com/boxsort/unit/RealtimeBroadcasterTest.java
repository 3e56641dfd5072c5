package com.boxsort.unit;

import com.boxsort.model.BoxDelta;
import com.boxsort.model.ScanEventType;
import com.boxsort.service.JobObserver;
import com.boxsort.service.RealtimeBroadcaster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class RealtimeBroadcasterTest {

    private RealtimeBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new RealtimeBroadcaster();
    }

    @Test
    void test_delta_reaches_every_observer_of_the_job() {
        RecordingObserver first = new RecordingObserver("a");
        RecordingObserver second = new RecordingObserver("b");
        RecordingObserver otherJob = new RecordingObserver("c");
        broadcaster.subscribe("job-1", first);
        broadcaster.subscribe("job-1", second);
        broadcaster.subscribe("job-2", otherJob);

        broadcaster.publish("job-1", delta("job-1", 3));

        assertEquals(1, first.received.size());
        assertEquals(1, second.received.size());
        assertTrue(otherJob.received.isEmpty(), "Observers of other jobs must not receive the delta");
    }

    @Test
    void test_publish_without_observers_is_ignored() {
        assertDoesNotThrow(() -> broadcaster.publish("nobody-listens", delta("nobody-listens", 1)));
        assertEquals(0, broadcaster.getObserverCount("nobody-listens"));
    }

    @Test
    void test_failing_observer_is_dropped() {
        RecordingObserver healthy = new RecordingObserver("healthy");
        JobObserver broken = new JobObserver() {
            @Override
            public String getObserverId() {
                return "broken";
            }

            @Override
            public void onDelta(BoxDelta delta) throws Exception {
                throw new IllegalStateException("socket gone");
            }
        };
        broadcaster.subscribe("job-1", broken);
        broadcaster.subscribe("job-1", healthy);

        broadcaster.publish("job-1", delta("job-1", 1));
        broadcaster.publish("job-1", delta("job-1", 2));

        assertEquals(2, healthy.received.size(), "Healthy observer keeps receiving");
        assertEquals(1, broadcaster.getObserverCount("job-1"));
    }

    @Test
    void test_unsubscribed_observer_stops_receiving() {
        RecordingObserver observer = new RecordingObserver("a");
        broadcaster.subscribe("job-1", observer);
        broadcaster.publish("job-1", delta("job-1", 1));
        broadcaster.unsubscribe("job-1", observer);
        broadcaster.publish("job-1", delta("job-1", 2));

        assertEquals(1, observer.received.size());
        assertEquals(0, broadcaster.getObserverCount("job-1"));
    }

    @Test
    void test_deltas_arrive_in_publish_order() {
        RecordingObserver observer = new RecordingObserver("a");
        broadcaster.subscribe("job-1", observer);

        for (int box = 1; box <= 50; box++) {
            broadcaster.publish("job-1", delta("job-1", box));
        }

        for (int i = 0; i < 50; i++) {
            assertEquals(i + 1, observer.received.get(i).boxNumber());
        }
    }

    @Test
    void test_older_row_version_is_discarded() {
        RecordingObserver observer = new RecordingObserver("a");
        broadcaster.subscribe("job-1", observer);

        broadcaster.publish("job-1", versioned(3, "X", 2, 5L));
        broadcaster.publish("job-1", versioned(3, "X", 1, 4L));
        broadcaster.publish("job-1", versioned(3, "X", 1, 5L));

        assertEquals(1, observer.received.size(), "Late delta with an older or equal version must be dropped");
        assertEquals(2, observer.received.get(0).fulfilledQty());

        broadcaster.publish("job-1", versioned(3, "X", 1, 6L));
        assertEquals(2, observer.received.size());
        assertEquals(1, observer.received.get(1).fulfilledQty());
    }

    @Test
    void test_row_versions_are_tracked_per_box_and_barcode() {
        RecordingObserver observer = new RecordingObserver("a");
        broadcaster.subscribe("job-1", observer);

        broadcaster.publish("job-1", versioned(3, "X", 2, 9L));
        broadcaster.publish("job-1", versioned(4, "X", 1, 1L));
        broadcaster.publish("job-1", versioned(3, "Y", 1, 1L));

        assertEquals(3, observer.received.size());
    }

    @Test
    void test_unplaced_deltas_are_never_discarded() {
        RecordingObserver observer = new RecordingObserver("a");
        broadcaster.subscribe("job-1", observer);
        BoxDelta extra = new BoxDelta("job-1", 1L, "w1", null, "Q", "Unassigned", "Unknown", null, null, null,
            "#3b82f6", ScanEventType.EXTRA_ITEM, null);

        broadcaster.publish("job-1", extra);
        broadcaster.publish("job-1", extra);

        assertEquals(2, observer.received.size());
    }

    @Test
    void test_job_entry_removed_when_last_observer_leaves() {
        RecordingObserver observer = new RecordingObserver("a");
        broadcaster.subscribe("job-1", observer);
        broadcaster.subscribe("job-2", new RecordingObserver("b"));
        assertEquals(2, broadcaster.getSubscribedJobCount());

        broadcaster.unsubscribe("job-1", observer);

        assertEquals(1, broadcaster.getSubscribedJobCount());
        assertEquals(0, broadcaster.getObserverCount("job-1"));
    }

    @Test
    void test_job_entry_removed_when_last_observer_fails() {
        broadcaster.subscribe("job-1", new JobObserver() {
            @Override
            public String getObserverId() {
                return "broken";
            }

            @Override
            public void onDelta(BoxDelta delta) throws Exception {
                throw new IllegalStateException("socket gone");
            }
        });

        broadcaster.publish("job-1", delta("job-1", 1));

        assertEquals(0, broadcaster.getSubscribedJobCount());
    }

    @Test
    void test_resubscribe_after_cleanup_receives_deltas() {
        RecordingObserver first = new RecordingObserver("a");
        broadcaster.subscribe("job-1", first);
        broadcaster.unsubscribe("job-1", first);
        RecordingObserver second = new RecordingObserver("b");
        broadcaster.subscribe("job-1", second);

        broadcaster.publish("job-1", delta("job-1", 1));

        assertEquals(1, second.received.size());
        assertTrue(first.received.isEmpty());
    }

    private static BoxDelta versioned(int boxNumber, String barCode, int fulfilled, long version) {
        return new BoxDelta("job-1", 1L, "w1", boxNumber, barCode, "Acme", "Widget", fulfilled, 2,
            fulfilled == 2, "#3b82f6", ScanEventType.SCAN, version);
    }

    private static BoxDelta delta(String jobId, int boxNumber) {
        return new BoxDelta(jobId, 1L, "w1", boxNumber, "X", "Acme", "Widget", 1, 2, false,
            "#3b82f6", ScanEventType.SCAN, null);
    }

    static class RecordingObserver implements JobObserver {

        private final String id;
        final List<BoxDelta> received = Collections.synchronizedList(new ArrayList<>());

        RecordingObserver(String id) {
            this.id = id;
        }

        @Override
        public String getObserverId() {
            return id;
        }

        @Override
        public void onDelta(BoxDelta delta) {
            received.add(delta);
        }
    }
}
