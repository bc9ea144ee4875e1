package com.openforge.docrouter.repository;

import com.openforge.docrouter.domain.ConflictRecord;
import com.openforge.docrouter.domain.ConflictResolution;
import org.springframework.stereotype.Repository;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

@Repository
public interface ConflictRecordRepository extends JpaRepository<ConflictRecord, Long> {

    List<ConflictRecord> findByResolutionOrderByCreateTimeAsc(ConflictResolution resolution);

    List<ConflictRecord> findByIngestRef(String ingestRef);

    long countByResolution(ConflictResolution resolution);
}
