package com.openforge.docrouter.repository;

import com.openforge.docrouter.domain.SenderMapping;
import org.springframework.stereotype.Repository;

@Repository
public interface SenderMappingRepository extends KnowledgeFactRepository<SenderMapping> {
}
