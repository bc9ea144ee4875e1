package com.openforge.docrouter.repository;

import com.openforge.docrouter.domain.FeedbackRecord;
import org.springframework.stereotype.Repository;

@Repository
public interface FeedbackRecordRepository extends KnowledgeFactRepository<FeedbackRecord> {
}
