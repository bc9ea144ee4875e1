package com.openforge.docrouter.repository;

import com.openforge.docrouter.domain.AssetType;
import com.openforge.docrouter.domain.ClassificationPattern;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ClassificationPatternRepository extends KnowledgeFactRepository<ClassificationPattern> {

    List<ClassificationPattern> findByAssetType(AssetType assetType);
}
