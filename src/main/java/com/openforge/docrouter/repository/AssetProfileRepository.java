package com.openforge.docrouter.repository;

import com.openforge.docrouter.domain.AssetProfile;
import org.springframework.stereotype.Repository;

@Repository
public interface AssetProfileRepository extends KnowledgeFactRepository<AssetProfile> {
}
