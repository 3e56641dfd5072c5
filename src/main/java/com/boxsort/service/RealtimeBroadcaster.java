package com.boxsort.service;

import com.boxsort.model.BoxDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans box deltas out to every observer subscribed to a job.
 *
 * Delivery is best-effort and at most once: there is no replay log, and an
 * observer that throws is dropped. Publishing is serialised per job so each
 * observer sees a job's deltas in publish order; different jobs never wait on
 * each other. A row delta whose version is not newer than the last one delivered
 * for that row is discarded, so observers never step back to an older count.
 * A job's entry is removed once its last observer leaves.
 */
@Service
public class RealtimeBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(RealtimeBroadcaster.class);

    private final Map<String, JobChannel> channels = new ConcurrentHashMap<>();

    public void subscribe(String jobId, JobObserver observer) {
        channels.compute(jobId, (id, channel) -> {
            JobChannel target = channel != null ? channel : new JobChannel();
            target.observers.add(observer);
            return target;
        });
        log.debug("Observer {} subscribed to job {}", observer.getObserverId(), jobId);
    }

    public void unsubscribe(String jobId, JobObserver observer) {
        channels.computeIfPresent(jobId, (id, channel) -> {
            if (channel.observers.remove(observer)) {
                log.debug("Observer {} unsubscribed from job {}", observer.getObserverId(), jobId);
            }
            return channel.observers.isEmpty() ? null : channel;
        });
    }

    public void publish(String jobId, BoxDelta delta) {
        if (delta == null) {
            return;
        }
        JobChannel channel = channels.get(jobId);
        if (channel == null) {
            return;
        }
        boolean dropped = false;
        synchronized (channel) {
            if (channel.isStale(delta)) {
                log.debug("Discarding stale delta for box {} barcode {} at version {}",
                    delta.boxNumber(), delta.barCode(), delta.rowVersion());
                return;
            }
            for (JobObserver observer : channel.observers) {
                try {
                    observer.onDelta(delta);
                } catch (Exception e) {
                    log.error("Dropping observer {} of job {} after delivery failure",
                        observer.getObserverId(), jobId, e);
                    channel.observers.remove(observer);
                    dropped = true;
                }
            }
        }
        if (dropped) {
            channels.computeIfPresent(jobId, (id, current) -> current.observers.isEmpty() ? null : current);
        }
    }

    public int getObserverCount(String jobId) {
        JobChannel channel = channels.get(jobId);
        return channel != null ? channel.observers.size() : 0;
    }

    public int getSubscribedJobCount() {
        return channels.size();
    }

    private static final class JobChannel {

        private final List<JobObserver> observers = new CopyOnWriteArrayList<>();

        // last delivered version per box and barcode; guarded by the channel monitor
        private final Map<String, Long> rowVersions = new HashMap<>();

        boolean isStale(BoxDelta delta) {
            String rowKey = delta.rowKey();
            if (rowKey == null || delta.rowVersion() == null) {
                return false;
            }
            Long last = rowVersions.get(rowKey);
            if (last != null && delta.rowVersion() <= last) {
                return true;
            }
            rowVersions.put(rowKey, delta.rowVersion());
            return false;
        }
    }
}
