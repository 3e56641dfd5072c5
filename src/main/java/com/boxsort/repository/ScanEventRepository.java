package com.boxsort.repository;

import com.boxsort.model.ScanEvent;
import com.boxsort.model.ScanEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Scan events are append-only; callers only save new records and read.
 */
@Repository
public interface ScanEventRepository extends JpaRepository<ScanEvent, Long> {

    Optional<ScanEvent> findFirstBySessionIdOrderByScanTimeDescIdDesc(Long sessionId);

    List<ScanEvent> findBySessionIdOrderByScanTimeAscIdAsc(Long sessionId);

    List<ScanEvent> findBySessionIdInOrderByScanTimeAscIdAsc(Collection<Long> sessionIds);

    long countBySessionId(Long sessionId);

    long countBySessionIdAndEventType(Long sessionId, ScanEventType eventType);
}
