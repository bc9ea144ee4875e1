package com.openforge.docrouter.domain;

import jakarta.persistence.*;
import lombok.*;

/** One accepted mutation of a knowledge store, with the reason it was accepted. */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "audit_entries",
    indexes = @Index(name = "idx_audit_fact", columnList = "fact_kind, fact_id")
)
public class AuditEntry extends BaseEntity {

    @Enumerated(EnumType.STRING)
    @Column(name = "knowledge_partition", nullable = false, length = 16)
    private KnowledgePartition partition;

    @Enumerated(EnumType.STRING)
    @Column(name = "fact_kind", nullable = false, length = 32)
    private FactKind factKind;

    @Column(name = "fact_id", nullable = false)
    private Long factId;

    @Column(name = "identity_key", length = 600)
    private String identityKey;

    /** INSERT, UPDATE, MERGE, REFINE, CONFLICT_UPDATE, RESOLVED_UPDATE. */
    @Column(name = "action", nullable = false, length = 32)
    private String action;

    @Column(name = "rationale", length = 1024)
    private String rationale;
}
