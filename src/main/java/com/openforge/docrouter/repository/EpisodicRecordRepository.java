package com.openforge.docrouter.repository;

import com.openforge.docrouter.domain.EpisodicRecord;
import com.openforge.docrouter.domain.ExperienceSource;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface EpisodicRecordRepository extends KnowledgeFactRepository<EpisodicRecord> {

    List<EpisodicRecord> findAllByOrderByOccurredAtDesc(Pageable pageable);

    List<EpisodicRecord> findBySourceOrderByOccurredAtAsc(ExperienceSource source, Pageable pageable);

    @Modifying
    @Query("delete from EpisodicRecord e where e.source = :source and e.occurredAt < :cutoff")
    int deleteBySourceOlderThan(@Param("source") ExperienceSource source,
                                @Param("cutoff") LocalDateTime cutoff);
}
