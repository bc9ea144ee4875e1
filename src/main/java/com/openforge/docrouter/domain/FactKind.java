package com.openforge.docrouter.domain;

/** Concrete fact type stored in a partition; one knowledge store per kind. */
public enum FactKind {

    ASSET_PROFILE(KnowledgePartition.SEMANTIC),
    FILE_TYPE_RULE(KnowledgePartition.SEMANTIC),
    FEEDBACK(KnowledgePartition.SEMANTIC),
    CLASSIFICATION_PATTERN(KnowledgePartition.PROCEDURAL),
    MATCHING_RULE(KnowledgePartition.PROCEDURAL),
    EPISODE(KnowledgePartition.EPISODIC),
    SENDER_MAPPING(KnowledgePartition.CONTACT);

    private final KnowledgePartition partition;

    FactKind(KnowledgePartition partition) {
        this.partition = partition;
    }

    public KnowledgePartition partition() {
        return partition;
    }
}
