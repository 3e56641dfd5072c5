package com.boxsort.repository;

import com.boxsort.model.BoxRequirement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BoxRequirementRepository extends JpaRepository<BoxRequirement, Long> {

    @Query("SELECT b FROM BoxRequirement b WHERE b.jobId = :jobId AND b.barCode = :barCode "
        + "AND b.fulfilledQty < b.requiredQty ORDER BY b.boxNumber ASC")
    List<BoxRequirement> findCandidates(@Param("jobId") String jobId, @Param("barCode") String barCode);

    Optional<BoxRequirement> findByJobIdAndBoxNumberAndBarCode(String jobId, Integer boxNumber, String barCode);

    Optional<BoxRequirement> findFirstByJobIdAndBarCodeOrderByBoxNumberAsc(String jobId, String barCode);

    List<BoxRequirement> findByJobIdOrderByBoxNumberAscBarCodeAsc(String jobId);

    long countByJobId(String jobId);
}
