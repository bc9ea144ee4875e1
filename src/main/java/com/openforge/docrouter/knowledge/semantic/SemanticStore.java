package com.openforge.docrouter.knowledge.semantic;

import com.openforge.docrouter.domain.AssetProfile;
import com.openforge.docrouter.domain.AssetType;
import com.openforge.docrouter.domain.FeedbackRecord;
import com.openforge.docrouter.domain.FileTypeRule;
import com.openforge.docrouter.knowledge.DeduplicationGate;
import com.openforge.docrouter.knowledge.IngestResult;
import com.openforge.docrouter.knowledge.procedural.ClassificationProperties;
import com.openforge.docrouter.repository.AssetProfileRepository;
import com.openforge.docrouter.repository.FileTypeRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Semantic knowledge: asset profiles, file-type rules and human feedback.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SemanticStore {

    private final AssetProfileStore        assetStore;
    private final FileTypeRuleStore        fileTypeStore;
    private final FeedbackRecordStore      feedbackStore;
    private final AssetProfileRepository   assetRepository;
    private final FileTypeRuleRepository   fileTypeRepository;
    private final DeduplicationGate        gate;
    private final ClassificationProperties classificationProperties;

    // ── Assets ───────────────────────────────────────────────────────────────

    public List<AssetProfile> allAssets() {
        return assetRepository.findAll();
    }

    public Optional<AssetProfile> findAsset(String assetId) {
        if (assetId == null || assetId.isBlank()) return Optional.empty();
        return assetRepository.findByIdentityKey(assetId.strip().toLowerCase(Locale.ROOT));
    }

    public IngestResult ingestAsset(AssetProfile candidate) {
        return gate.ingest(assetStore, candidate);
    }

    // ── File types ───────────────────────────────────────────────────────────

    public Optional<FileTypeRule> checkFileType(String filename) {
        String extension = extensionOf(filename);
        if (extension == null) return Optional.empty();
        return fileTypeRepository.findByIdentityKey(extension);
    }

    public IngestResult ingestFileType(FileTypeRule candidate) {
        return gate.ingest(fileTypeStore, candidate);
    }

    /** Bumps the success or failure counter for the extension; no-op for unknown types. */
    public void recordFileTypeOutcome(String filename, boolean success) {
        String extension = extensionOf(filename);
        if (extension == null) return;
        gate.refine(fileTypeStore, extension, success ? "processing succeeded" : "processing failed", rule -> {
            if (success) rule.setSuccessCount(rule.getSuccessCount() + 1);
            else rule.setFailureCount(rule.getFailureCount() + 1);
        });
    }

    // ── Feedback ─────────────────────────────────────────────────────────────

    public IngestResult ingestFeedback(FeedbackRecord candidate) {
        return gate.ingest(feedbackStore, candidate);
    }

    // ── Categories ───────────────────────────────────────────────────────────

    /**
     * Allowed document categories for an asset type. Unknown or missing types
     * fall back to the default set; that is logged, never fatal.
     */
    public List<String> allowedCategories(AssetType assetType) {
        if (assetType != null) {
            List<String> categories = classificationProperties.categories().get(assetType.value());
            if (categories != null && !categories.isEmpty()) {
                return categories;
            }
        }
        log.warn("[Semantic] No category list for asset type {}, using default categories", assetType);
        return classificationProperties.defaultCategories();
    }

    public static String extensionOf(String filename) {
        if (filename == null) return null;
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) return null;
        return FileTypeRuleStore.normalizeExtension(filename.substring(dot));
    }
}
