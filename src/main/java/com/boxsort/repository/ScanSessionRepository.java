package com.boxsort.repository;

import com.boxsort.model.ScanSession;
import com.boxsort.model.SessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ScanSessionRepository extends JpaRepository<ScanSession, Long> {

    Optional<ScanSession> findFirstByWorkerIdAndStatusOrderByStartTimeDesc(String workerId, SessionStatus status);

    List<ScanSession> findByWorkerIdAndStatusIn(String workerId, Collection<SessionStatus> statuses);

    List<ScanSession> findByJobIdOrderByStartTimeAsc(String jobId);

    List<ScanSession> findByJobIdAndWorkerIdOrderByStartTimeAsc(String jobId, String workerId);
}
