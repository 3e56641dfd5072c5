package com.boxsort.service;

import com.boxsort.model.IndustryBenchmark;
import com.boxsort.model.PerformanceMetrics;
import com.boxsort.model.ScanEvent;
import com.boxsort.model.ScanSession;
import com.boxsort.model.ScoreCategory;
import com.boxsort.repository.ScanEventRepository;
import com.boxsort.repository.ScanSessionRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Derives throughput, accuracy and a 1-10 score from a session's event history.
 * Read-only.
 *
 * Base score by scans per hour:
 * <pre>
 *   x &lt; 18          1
 *   18  &lt;= x &lt; 36   2 + 2(x - 18)/18
 *   36  &lt;= x &lt; 71   4 + 2(x - 36)/35
 *   71  &lt;= x &lt; 180  6 + 2(x - 71)/109
 *   180 &lt;= x &lt; 360  8 + 2(x - 180)/180
 *   x &gt;= 360        10
 * </pre>
 * then 0.1 off per error and 0.05 off per undo, clamped to [1, 10] and rounded to one decimal.
 */
@Service
public class PerformanceCalculator {

    static final double ERROR_PENALTY = 0.1;
    static final double UNDO_PENALTY = 0.05;

    @Autowired
    private ScanSessionRepository sessionRepository;

    @Autowired
    private ScanEventRepository eventRepository;

    @Autowired
    private Clock clock;

    public PerformanceMetrics compute(Long sessionId) {
        ScanSession session = sessionRepository.findById(sessionId)
            .orElseThrow(() -> ScanCoordinationException.sessionNotFound(sessionId));
        List<ScanEvent> events = eventRepository.findBySessionIdOrderByScanTimeAscIdAsc(sessionId);
        return calculate(events, elapsed(session));
    }

    /**
     * Pools every session the worker has had on the job.
     */
    public PerformanceMetrics compute(String jobId, String workerId) {
        List<ScanSession> sessions = sessionRepository.findByJobIdAndWorkerIdOrderByStartTimeAsc(jobId, workerId);
        if (sessions.isEmpty()) {
            throw new ScanCoordinationException(ErrorKind.SESSION_NOT_FOUND,
                "Worker " + workerId + " has no sessions on job " + jobId, jobId, null, null);
        }
        Duration elapsed = Duration.ZERO;
        for (ScanSession session : sessions) {
            elapsed = elapsed.plus(elapsed(session));
        }
        List<Long> sessionIds = sessions.stream().map(ScanSession::getId).toList();
        return calculate(eventRepository.findBySessionIdInOrderByScanTimeAscIdAsc(sessionIds), elapsed);
    }

    public PerformanceMetrics calculate(List<ScanEvent> events, Duration elapsed) {
        int successful = 0;
        int errors = 0;
        int undos = 0;
        int extras = 0;
        for (ScanEvent event : events) {
            switch (event.getEventType()) {
                case SCAN -> successful++;
                case ERROR -> errors++;
                case UNDO -> undos++;
                case EXTRA_ITEM -> extras++;
            }
        }

        long elapsedMs = Math.max(0, elapsed.toMillis());
        double elapsedHours = elapsedMs / 3_600_000.0;
        double scansPerHour = elapsedHours > 0 ? successful / elapsedHours : 0;
        double score = score(scansPerHour, errors, undos);
        long averageSecondsPerScan = successful > 0 ? Math.round(elapsedMs / (double) successful / 1000.0) : 0;

        return new PerformanceMetrics(
            successful,
            scansPerHour,
            accuracy(successful, errors),
            score,
            errors,
            undos,
            extras,
            Math.round(elapsedMs / 1000.0),
            averageSecondsPerScan,
            ScoreCategory.of(score),
            IndustryBenchmark.of(scansPerHour));
    }

    public static double baseScore(double scansPerHour) {
        if (scansPerHour >= 360) {
            return 10;
        } else if (scansPerHour >= 180) {
            return 8 + 2 * (scansPerHour - 180) / 180;
        } else if (scansPerHour >= 71) {
            return 6 + 2 * (scansPerHour - 71) / 109;
        } else if (scansPerHour >= 36) {
            return 4 + 2 * (scansPerHour - 36) / 35;
        } else if (scansPerHour >= 18) {
            return 2 + 2 * (scansPerHour - 18) / 18;
        }
        return 1;
    }

    public static double score(double scansPerHour, int errorCount, int undoCount) {
        double penalised = baseScore(scansPerHour) - ERROR_PENALTY * errorCount - UNDO_PENALTY * undoCount;
        double clamped = Math.min(10, Math.max(1, penalised));
        return Math.round(clamped * 10) / 10.0;
    }

    public static int accuracy(int successfulScans, int errorCount) {
        int denominator = successfulScans + errorCount;
        if (denominator == 0) {
            return 100;
        }
        return (int) Math.round(successfulScans * 100.0 / denominator);
    }

    private Duration elapsed(ScanSession session) {
        Instant end = session.getEndTime() != null ? session.getEndTime() : clock.instant();
        return Duration.between(session.getStartTime(), end);
    }
}
