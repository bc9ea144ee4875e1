package com.openforge.docrouter.knowledge.bootstrap;

import com.openforge.docrouter.domain.AssetProfile;
import com.openforge.docrouter.domain.AssetType;
import com.openforge.docrouter.domain.ConfidenceTier;
import com.openforge.docrouter.domain.FileTypeRule;
import com.openforge.docrouter.domain.SecurityLevel;
import com.openforge.docrouter.domain.SenderMapping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shapes of the files under classpath:knowledge/ (snake_case on the
 * wire). The admin ingest endpoints accept the same shapes.
 */
public final class SeedRecords {

    private SeedRecords() {}

    public record AssetSeed(
            String assetId,
            String dealName,
            String assetName,
            String assetType,
            List<String> identifiers,
            Map<String, String> businessContext,
            String confidence
    ) {

        public AssetProfile toAsset() {
            return AssetProfile.builder()
                    .assetId(assetId)
                    .dealName(dealName)
                    .displayName(assetName)
                    .assetType(AssetType.fromValue(assetType).orElse(null))
                    .identifiers(identifiers == null ? new ArrayList<>() : new ArrayList<>(identifiers))
                    .businessContext(businessContext == null ? new LinkedHashMap<>() : new LinkedHashMap<>(businessContext))
                    .confidenceTier(ConfidenceTier.fromValue(confidence, ConfidenceTier.HIGH))
                    .build();
        }
    }

    public record FileTypeSeed(
            String extension,
            Boolean isAllowed,
            String securityLevel,
            List<String> assetTypes,
            List<String> documentCategories,
            Integer successCount,
            Integer failureCount,
            String confidence
    ) {

        public FileTypeRule toFileType() {
            return FileTypeRule.builder()
                    .extension(extension)
                    .allowed(Boolean.TRUE.equals(isAllowed))
                    .securityLevel(SecurityLevel.fromValue(securityLevel))
                    .assetTypes(assetTypes == null ? new ArrayList<>() : new ArrayList<>(assetTypes))
                    .documentCategories(documentCategories == null ? new ArrayList<>() : new ArrayList<>(documentCategories))
                    .successCount(successCount == null ? 0 : successCount)
                    .failureCount(failureCount == null ? 0 : failureCount)
                    .confidenceTier(ConfidenceTier.fromValue(confidence, ConfidenceTier.MEDIUM))
                    .build();
        }
    }

    /** One category's patterns for one asset type. */
    public record PatternSeed(
            String assetType,
            String category,
            List<String> patterns,
            String confidence
    ) {

        public AssetType resolvedAssetType() {
            return AssetType.fromValue(assetType).orElse(null);
        }

        public ConfidenceTier tier() {
            return ConfidenceTier.fromValue(confidence, ConfidenceTier.MEDIUM);
        }

        public List<String> patternList() {
            return patterns == null ? List.of() : patterns;
        }
    }

    public record SenderSeed(
            String senderAddress,
            List<String> assetIds,
            Double trustScore,
            String organization
    ) {

        static final double DEFAULT_TRUST = 0.8;

        public SenderMapping toSender() {
            return SenderMapping.builder()
                    .senderAddress(senderAddress)
                    .assetIds(assetIds == null ? new ArrayList<>() : new ArrayList<>(assetIds))
                    .trustScore(trustScore == null ? DEFAULT_TRUST : trustScore)
                    .organization(organization)
                    .build();
        }
    }
}
