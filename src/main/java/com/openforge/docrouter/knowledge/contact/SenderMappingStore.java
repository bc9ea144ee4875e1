package com.openforge.docrouter.knowledge.contact;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.docrouter.domain.ConflictType;
import com.openforge.docrouter.domain.FactKind;
import com.openforge.docrouter.domain.SenderMapping;
import com.openforge.docrouter.knowledge.ConflictFinding;
import com.openforge.docrouter.knowledge.Fingerprints;
import com.openforge.docrouter.knowledge.JpaKnowledgeStore;
import com.openforge.docrouter.knowledge.KnowledgeValidationException;
import com.openforge.docrouter.repository.SenderMappingRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Sender → asset associations keyed by normalized address.
 * Asset ids are unioned on merge and trust only ever rises through a merge;
 * lowering trust is an admin conflict decision.
 */
@Component
public class SenderMappingStore extends JpaKnowledgeStore<SenderMapping> {

    public SenderMappingStore(SenderMappingRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper, SenderMapping.class);
    }

    @Override
    public FactKind kind() {
        return FactKind.SENDER_MAPPING;
    }

    @Override
    public void validate(SenderMapping candidate) {
        String address = normalizeAddress(candidate.getSenderAddress());
        if (address == null || address.indexOf('@') <= 0) {
            throw new KnowledgeValidationException("sender address is missing or malformed: " + candidate.getSenderAddress());
        }
        candidate.setSenderAddress(address);
        requireUnit(candidate.getTrustScore(), "trust_score");
        Set<String> assetIds = new LinkedHashSet<>();
        if (candidate.getAssetIds() != null) {
            candidate.getAssetIds().stream()
                    .filter(id -> id != null && !id.isBlank())
                    .map(String::strip)
                    .forEach(assetIds::add);
        }
        candidate.setAssetIds(new ArrayList<>(assetIds));
        if (candidate.getOrganization() != null && candidate.getOrganization().isBlank()) {
            candidate.setOrganization(null);
        }
        if (candidate.getInteractionCount() == null) candidate.setInteractionCount(0);
    }

    @Override
    public String identityKey(SenderMapping candidate) {
        return normalizeAddress(candidate.getSenderAddress());
    }

    @Override
    public String fingerprint(SenderMapping fact) {
        return Fingerprints.of(fact.getSenderAddress(), fact.getAssetIds(), fact.getOrganization(),
                String.format(Locale.ROOT, "%.4f", fact.getTrustScore()));
    }

    @Override
    public List<ConflictFinding> detectConflicts(SenderMapping existing, SenderMapping candidate) {
        String before = existing.getOrganization();
        String after  = candidate.getOrganization();
        if (before != null && after != null && !before.strip().equalsIgnoreCase(after.strip())) {
            return List.of(ConflictFinding.of(ConflictType.SENDER_ORGANIZATION_MISMATCH, "organization", before, after));
        }
        return List.of();
    }

    @Override
    public void applyCandidate(SenderMapping existing, SenderMapping candidate) {
        existing.setOrganization(candidate.getOrganization());
        existing.setAssetIds(new ArrayList<>(candidate.getAssetIds()));
        existing.setTrustScore(candidate.getTrustScore());
    }

    @Override
    public boolean merge(SenderMapping existing, SenderMapping candidate) {
        boolean changed = false;
        Set<String> assetIds = new LinkedHashSet<>(existing.getAssetIds());
        if (assetIds.addAll(candidate.getAssetIds())) {
            existing.setAssetIds(new ArrayList<>(assetIds));
            changed = true;
        }
        if (existing.getOrganization() == null && candidate.getOrganization() != null) {
            existing.setOrganization(candidate.getOrganization());
            changed = true;
        }
        if (candidate.getTrustScore() > existing.getTrustScore()) {
            existing.setTrustScore(candidate.getTrustScore());
            changed = true;
        }
        return changed;
    }

    public static String normalizeAddress(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String address = raw.strip().toLowerCase(Locale.ROOT);
        // "Jane Doe <jane@acme.com>" → "jane@acme.com"
        int open = address.lastIndexOf('<');
        int close = address.lastIndexOf('>');
        if (open >= 0 && close > open) {
            address = address.substring(open + 1, close).strip();
        }
        return address;
    }
}
