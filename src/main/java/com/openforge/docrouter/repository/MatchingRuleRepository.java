package com.openforge.docrouter.repository;

import com.openforge.docrouter.domain.MatchingRule;
import org.springframework.stereotype.Repository;

@Repository
public interface MatchingRuleRepository extends KnowledgeFactRepository<MatchingRule> {
}
