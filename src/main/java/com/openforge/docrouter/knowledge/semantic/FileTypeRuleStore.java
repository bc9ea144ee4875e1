package com.openforge.docrouter.knowledge.semantic;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.docrouter.domain.ConflictType;
import com.openforge.docrouter.domain.FactKind;
import com.openforge.docrouter.domain.FileTypeRule;
import com.openforge.docrouter.knowledge.ConflictFinding;
import com.openforge.docrouter.knowledge.Fingerprints;
import com.openforge.docrouter.knowledge.JpaKnowledgeStore;
import com.openforge.docrouter.knowledge.KnowledgeValidationException;
import com.openforge.docrouter.repository.FileTypeRuleRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** File-type rules keyed by normalized extension (".pdf"). Counters are not content. */
@Component
public class FileTypeRuleStore extends JpaKnowledgeStore<FileTypeRule> {

    public FileTypeRuleStore(FileTypeRuleRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper, FileTypeRule.class);
    }

    @Override
    public FactKind kind() {
        return FactKind.FILE_TYPE_RULE;
    }

    @Override
    public void validate(FileTypeRule candidate) {
        String extension = normalizeExtension(candidate.getExtension());
        if (extension == null) {
            throw new KnowledgeValidationException("extension is required");
        }
        candidate.setExtension(extension);
        require(candidate.getSecurityLevel(), "security_level");
        require(candidate.getConfidenceTier(), "confidence");
        if (candidate.getSuccessCount() == null || candidate.getSuccessCount() < 0) candidate.setSuccessCount(0);
        if (candidate.getFailureCount() == null || candidate.getFailureCount() < 0) candidate.setFailureCount(0);
        if (candidate.getAssetTypes() == null) candidate.setAssetTypes(new ArrayList<>());
        if (candidate.getDocumentCategories() == null) candidate.setDocumentCategories(new ArrayList<>());
    }

    @Override
    public String identityKey(FileTypeRule candidate) {
        return normalizeExtension(candidate.getExtension());
    }

    @Override
    public String fingerprint(FileTypeRule fact) {
        return Fingerprints.of(fact.getExtension(), fact.isAllowed(), fact.getSecurityLevel(),
                fact.getAssetTypes(), fact.getDocumentCategories());
    }

    @Override
    public List<ConflictFinding> detectConflicts(FileTypeRule existing, FileTypeRule candidate) {
        List<ConflictFinding> findings = new ArrayList<>();
        if (existing.isAllowed() != candidate.isAllowed()) {
            findings.add(ConflictFinding.of(ConflictType.FILE_PERMISSION_MISMATCH, "allowed",
                    existing.isAllowed(), candidate.isAllowed()));
        }
        if (existing.getSecurityLevel() != candidate.getSecurityLevel()) {
            findings.add(ConflictFinding.of(ConflictType.SECURITY_LEVEL_MISMATCH, "security_level",
                    existing.getSecurityLevel(), candidate.getSecurityLevel()));
        }
        return findings;
    }

    @Override
    public void applyCandidate(FileTypeRule existing, FileTypeRule candidate) {
        existing.setAllowed(candidate.isAllowed());
        existing.setSecurityLevel(candidate.getSecurityLevel());
        existing.setAssetTypes(new ArrayList<>(candidate.getAssetTypes()));
        existing.setDocumentCategories(new ArrayList<>(candidate.getDocumentCategories()));
        existing.setConfidenceTier(candidate.getConfidenceTier());
    }

    @Override
    public boolean merge(FileTypeRule existing, FileTypeRule candidate) {
        boolean changed = false;
        Set<String> types = new LinkedHashSet<>(existing.getAssetTypes());
        if (types.addAll(candidate.getAssetTypes())) {
            existing.setAssetTypes(new ArrayList<>(types));
            changed = true;
        }
        Set<String> categories = new LinkedHashSet<>(existing.getDocumentCategories());
        if (categories.addAll(candidate.getDocumentCategories())) {
            existing.setDocumentCategories(new ArrayList<>(categories));
            changed = true;
        }
        return changed;
    }

    /** "PDF", "pdf", ".pdf " → ".pdf"; blank → null. */
    public static String normalizeExtension(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String ext = raw.strip().toLowerCase(Locale.ROOT);
        return ext.startsWith(".") ? ext : "." + ext;
    }
}
