package com.openforge.docrouter.knowledge.semantic;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.docrouter.domain.AssetProfile;
import com.openforge.docrouter.domain.ConflictType;
import com.openforge.docrouter.domain.FactKind;
import com.openforge.docrouter.knowledge.ConflictFinding;
import com.openforge.docrouter.knowledge.Fingerprints;
import com.openforge.docrouter.knowledge.JpaKnowledgeStore;
import com.openforge.docrouter.knowledge.KnowledgeValidationException;
import com.openforge.docrouter.repository.AssetProfileRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Asset profiles keyed by asset id.
 *
 * Identifier sets must stay disjoint across assets, otherwise identification
 * can no longer rank the owner of an identifier above everyone else. The deal
 * name counts as an identifier. {@link #checkConsistency} runs under the gate's
 * lock, which {@link #lockScope} widens to every asset.
 */
@Component
public class AssetProfileStore extends JpaKnowledgeStore<AssetProfile> {

    private final AssetProfileRepository assets;

    public AssetProfileStore(AssetProfileRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper, AssetProfile.class);
        this.assets = repository;
    }

    @Override
    public FactKind kind() {
        return FactKind.ASSET_PROFILE;
    }

    @Override
    public void validate(AssetProfile candidate) {
        candidate.setAssetId(require(candidate.getAssetId(), "asset_id"));
        candidate.setDealName(require(candidate.getDealName(), "deal_name"));
        require(candidate.getAssetType(), "asset_type");
        require(candidate.getConfidenceTier(), "confidence");

        List<String> identifiers = normalizeIdentifiers(candidate.getIdentifiers());
        if (identifiers.isEmpty()) {
            throw new KnowledgeValidationException("asset " + candidate.getAssetId() + " has no identifiers");
        }
        candidate.setIdentifiers(identifiers);
        if (candidate.getBusinessContext() == null) {
            candidate.setBusinessContext(new LinkedHashMap<>());
        }
    }

    /** Identifiers and deal names must not be owned by two assets. */
    @Override
    public void checkConsistency(AssetProfile candidate) {
        String key = identityKey(candidate);
        List<String> claimed = ownedTerms(candidate);
        for (AssetProfile other : assets.findAll()) {
            if (key.equals(other.getIdentityKey())) continue;
            List<String> owned = ownedTerms(other);
            for (String term : claimed) {
                if (owned.contains(term)) {
                    throw new KnowledgeValidationException("identifier '%s' already belongs to asset %s"
                            .formatted(term, other.getAssetId()));
                }
            }
        }
    }

    /** Every asset write shares one lock, so the check above sees all committed assets. */
    @Override
    public String lockScope(String identityKey) {
        return "*";
    }

    @Override
    public String identityKey(AssetProfile candidate) {
        return candidate.getAssetId().strip().toLowerCase(Locale.ROOT);
    }

    @Override
    public String fingerprint(AssetProfile fact) {
        return Fingerprints.of(fact.getAssetId(), fact.getDealName(), fact.getDisplayName(),
                fact.getAssetType(), fact.getIdentifiers(), fact.getBusinessContext());
    }

    @Override
    public List<ConflictFinding> detectConflicts(AssetProfile existing, AssetProfile candidate) {
        List<ConflictFinding> findings = new ArrayList<>();
        if (existing.getAssetType() != candidate.getAssetType()) {
            findings.add(ConflictFinding.of(ConflictType.ASSET_TYPE_MISMATCH, "asset_type",
                    existing.getAssetType(), candidate.getAssetType()));
        }
        return findings;
    }

    @Override
    public void applyCandidate(AssetProfile existing, AssetProfile candidate) {
        existing.setDealName(candidate.getDealName());
        existing.setDisplayName(candidate.getDisplayName());
        existing.setAssetType(candidate.getAssetType());
        existing.setIdentifiers(new ArrayList<>(candidate.getIdentifiers()));
        existing.setBusinessContext(new LinkedHashMap<>(candidate.getBusinessContext()));
        existing.setConfidenceTier(candidate.getConfidenceTier());
    }

    /** New identifiers and context entries are added; nothing is removed. */
    @Override
    public boolean merge(AssetProfile existing, AssetProfile candidate) {
        boolean changed = false;

        Set<String> identifiers = new LinkedHashSet<>(existing.getIdentifiers());
        if (identifiers.addAll(candidate.getIdentifiers())) {
            existing.setIdentifiers(new ArrayList<>(identifiers));
            changed = true;
        }

        Map<String, String> context = new LinkedHashMap<>(existing.getBusinessContext());
        context.putAll(candidate.getBusinessContext());
        if (!context.equals(existing.getBusinessContext())) {
            existing.setBusinessContext(context);
            changed = true;
        }

        if (!Objects.equals(existing.getDealName(), candidate.getDealName())) {
            existing.setDealName(candidate.getDealName());
            changed = true;
        }
        if (candidate.getDisplayName() != null && !candidate.getDisplayName().equals(existing.getDisplayName())) {
            existing.setDisplayName(candidate.getDisplayName());
            changed = true;
        }
        return changed;
    }

    private static List<String> ownedTerms(AssetProfile asset) {
        List<String> terms = asset.getIdentifiers() == null ? new ArrayList<>() : new ArrayList<>(asset.getIdentifiers());
        terms.add(asset.getDealName());
        return normalizeIdentifiers(terms);
    }

    static List<String> normalizeIdentifiers(List<String> raw) {
        if (raw == null) return new ArrayList<>();
        Set<String> normalized = new LinkedHashSet<>();
        for (String identifier : raw) {
            if (identifier == null) continue;
            String cleaned = identifier.strip().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
            if (!cleaned.isEmpty()) normalized.add(cleaned);
        }
        return new ArrayList<>(normalized);
    }
}
