package com.openforge.docrouter.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * An attachment parked for human classification.
 *
 * Lifecycle: PENDING → RESOLVED (STORED with corrected asset/category, or
 * DISCARDED). Resolved items are kept for audit.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "review_items",
    indexes = @Index(name = "idx_review_status", columnList = "status, create_time")
)
public class ReviewItem extends BaseEntity {

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ReviewStatus status = ReviewStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 32)
    private ReviewReason reason;

    /** Storage location, e.g. "i3/needs_review" or "to_be_reviewed/no_asset_match". */
    @Column(name = "location", nullable = false, length = 256)
    private String location;

    @Column(name = "asset_id", length = 64)
    private String assetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_type", length = 48)
    private AssetType assetType;

    @Column(name = "predicted_category", length = 64)
    private String predictedCategory;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Column(name = "filename", nullable = false, length = 512)
    private String filename;

    @Column(name = "sender_address", length = 320)
    private String senderAddress;

    @Column(name = "email_subject", length = 1024)
    private String emailSubject;

    @Column(name = "body_excerpt", columnDefinition = "TEXT")
    private String bodyExcerpt;

    @Column(name = "rationale", columnDefinition = "TEXT")
    private String rationale;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", length = 16)
    private ReviewOutcome outcome;

    @Column(name = "resolved_category", length = 64)
    private String resolvedCategory;

    @Column(name = "resolved_asset_id", length = 64)
    private String resolvedAssetId;

    @Column(name = "resolved_by", length = 128)
    private String resolvedBy;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
