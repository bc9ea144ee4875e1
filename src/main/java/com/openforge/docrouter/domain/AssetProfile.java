package com.openforge.docrouter.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A tracked investment vehicle whose documents this service routes.
 *
 * identifiers - short lowercase tokens ("i3", "i3 verticals") used to
 *               recognise the asset in free text; disjoint across assets.
 *
 * Rows are created at bootstrap or by admin action and only ever changed
 * through the deduplication gate. There is no delete path.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "asset_profiles",
    uniqueConstraints = @UniqueConstraint(name = "uq_asset_identity", columnNames = "identity_key"),
    indexes = @Index(name = "idx_asset_fingerprint", columnList = "fingerprint")
)
public class AssetProfile extends BaseEntity implements KnowledgeFact {

    @Column(name = "asset_id", nullable = false, length = 64)
    private String assetId;

    @Column(name = "deal_name", nullable = false, length = 256)
    private String dealName;

    @Column(name = "display_name", length = 256)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_type", nullable = false, length = 48)
    private AssetType assetType;

    @Builder.Default
    @Convert(converter = JsonColumnConverters.StringListConverter.class)
    @Column(name = "identifiers", nullable = false, columnDefinition = "TEXT")
    private List<String> identifiers = new ArrayList<>();

    @Builder.Default
    @Convert(converter = JsonColumnConverters.StringMapConverter.class)
    @Column(name = "business_context", columnDefinition = "TEXT")
    private Map<String, String> businessContext = new LinkedHashMap<>();

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "confidence_tier", nullable = false, length = 16)
    private ConfidenceTier confidenceTier = ConfidenceTier.HIGH;

    @JsonIgnore
    @Column(name = "identity_key", length = 128)
    private String identityKey;

    @JsonIgnore
    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;
}
