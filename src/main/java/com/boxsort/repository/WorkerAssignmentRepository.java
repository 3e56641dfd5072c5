package com.boxsort.repository;

import com.boxsort.model.WorkerAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WorkerAssignmentRepository extends JpaRepository<WorkerAssignment, Long> {

    Optional<WorkerAssignment> findFirstByJobIdAndWorkerIdAndActiveTrue(String jobId, String workerId);

    List<WorkerAssignment> findByJobIdAndActiveTrueOrderByWorkerIndexAsc(String jobId);

    long countByJobId(String jobId);
}
