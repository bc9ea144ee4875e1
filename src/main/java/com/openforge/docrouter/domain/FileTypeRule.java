package com.openforge.docrouter.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Whether attachments with a given extension may be processed, and how
 * often processing them has actually worked.
 *
 * The success/failure counters are statistics, not content: they are left
 * out of the fingerprint and only change through the gate's refine path.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "file_type_rules",
    uniqueConstraints = @UniqueConstraint(name = "uq_file_type_identity", columnNames = "identity_key"),
    indexes = @Index(name = "idx_file_type_fingerprint", columnList = "fingerprint")
)
public class FileTypeRule extends BaseEntity implements KnowledgeFact {

    /** Lowercase with leading dot, e.g. ".pdf". */
    @Column(name = "extension", nullable = false, length = 16)
    private String extension;

    @Column(name = "allowed", nullable = false)
    private boolean allowed;

    @Enumerated(EnumType.STRING)
    @Column(name = "security_level", nullable = false, length = 16)
    private SecurityLevel securityLevel;

    @Builder.Default
    @Convert(converter = JsonColumnConverters.StringListConverter.class)
    @Column(name = "asset_types", columnDefinition = "TEXT")
    private List<String> assetTypes = new ArrayList<>();

    @Builder.Default
    @Convert(converter = JsonColumnConverters.StringListConverter.class)
    @Column(name = "document_categories", columnDefinition = "TEXT")
    private List<String> documentCategories = new ArrayList<>();

    @Builder.Default
    @Column(name = "success_count", nullable = false)
    private Integer successCount = 0;

    @Builder.Default
    @Column(name = "failure_count", nullable = false)
    private Integer failureCount = 0;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "confidence_tier", nullable = false, length = 16)
    private ConfidenceTier confidenceTier = ConfidenceTier.MEDIUM;

    @JsonIgnore
    @Column(name = "identity_key", length = 128)
    private String identityKey;

    @JsonIgnore
    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;
}
