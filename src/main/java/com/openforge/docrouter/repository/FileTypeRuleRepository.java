package com.openforge.docrouter.repository;

import com.openforge.docrouter.domain.FileTypeRule;
import org.springframework.stereotype.Repository;

@Repository
public interface FileTypeRuleRepository extends KnowledgeFactRepository<FileTypeRule> {
}
