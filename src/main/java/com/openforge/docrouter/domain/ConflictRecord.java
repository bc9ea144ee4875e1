package com.openforge.docrouter.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A detected contradiction between a stored fact and an incoming candidate.
 *
 * Retained for audit whatever the outcome. One ingest can produce several
 * records (e.g. allow flag and security level both differ); they share an
 * {@code ingestRef} and are resolved together.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "conflict_records",
    indexes = {
        @Index(name = "idx_conflict_resolution", columnList = "resolution"),
        @Index(name = "idx_conflict_ingest_ref", columnList = "ingest_ref")
    }
)
public class ConflictRecord extends BaseEntity {

    @Enumerated(EnumType.STRING)
    @Column(name = "conflict_type", nullable = false, length = 48)
    private ConflictType conflictType;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 16)
    private ConflictSeverity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "knowledge_partition", nullable = false, length = 16)
    private KnowledgePartition partition;

    @Enumerated(EnumType.STRING)
    @Column(name = "fact_kind", nullable = false, length = 32)
    private FactKind factKind;

    @Column(name = "identity_key", nullable = false, length = 600)
    private String identityKey;

    @Column(name = "existing_fact_id", nullable = false)
    private Long existingFactId;

    @Enumerated(EnumType.STRING)
    @Column(name = "existing_confidence", nullable = false, length = 16)
    private ConfidenceTier existingConfidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "candidate_confidence", nullable = false, length = 16)
    private ConfidenceTier candidateConfidence;

    @Column(name = "existing_snapshot", columnDefinition = "TEXT")
    private String existingSnapshot;

    @Column(name = "candidate_snapshot", columnDefinition = "TEXT")
    private String candidateSnapshot;

    @Column(name = "detail", length = 1024)
    private String detail;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 16)
    private ResolutionAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution", nullable = false, length = 16)
    private ConflictResolution resolution;

    @Column(name = "ingest_ref", nullable = false, length = 36)
    private String ingestRef;

    @Column(name = "resolved_by", length = 128)
    private String resolvedBy;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
