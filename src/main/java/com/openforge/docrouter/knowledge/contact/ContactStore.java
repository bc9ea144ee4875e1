package com.openforge.docrouter.knowledge.contact;

import com.openforge.docrouter.domain.SenderMapping;
import com.openforge.docrouter.knowledge.DeduplicationGate;
import com.openforge.docrouter.knowledge.IngestResult;
import com.openforge.docrouter.repository.SenderMappingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sender trust. Read-heavy: identification takes a snapshot of all mappings
 * per attachment; learning goes through the gate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContactStore {

    /** Trust given to a sender the first time a human ties it to an asset. */
    static final double LEARNED_TRUST = 0.4;
    static final double TRUST_STEP    = 0.1;

    private final SenderMappingStore      store;
    private final SenderMappingRepository repository;
    private final DeduplicationGate       gate;

    public Optional<SenderMapping> find(String senderAddress) {
        String key = SenderMappingStore.normalizeAddress(senderAddress);
        if (key == null) return Optional.empty();
        return repository.findByIdentityKey(key);
    }

    /** All mappings keyed by normalized address. */
    public Map<String, SenderMapping> senderMap() {
        return repository.findAll().stream()
                .collect(Collectors.toMap(SenderMapping::getIdentityKey, Function.identity(), (a, b) -> a));
    }

    public IngestResult ingest(SenderMapping candidate) {
        return gate.ingest(store, candidate);
    }

    /**
     * Tie a sender to an asset after a human confirmed it. A new sender starts
     * below the trust floor, so one correction alone does not make it a
     * routing shortcut; each repeat confirmation raises trust by a step.
     */
    public void learnAssociation(String senderAddress, String assetId) {
        String key = SenderMappingStore.normalizeAddress(senderAddress);
        if (key == null || assetId == null || assetId.isBlank()) return;

        Optional<SenderMapping> existing = repository.findByIdentityKey(key);
        if (existing.isPresent() && existing.get().getAssetIds().contains(assetId)) {
            gate.refine(store, key, "confirmed association with " + assetId,
                    m -> m.setTrustScore(Math.min(1.0, m.getTrustScore() + TRUST_STEP)));
            return;
        }
        IngestResult result = gate.ingest(store, SenderMapping.builder()
                .senderAddress(key)
                .assetIds(new ArrayList<>(List.of(assetId)))
                .trustScore(existing.map(SenderMapping::getTrustScore).orElse(LEARNED_TRUST))
                .organization(existing.map(SenderMapping::getOrganization).orElse(null))
                .build());
        log.info("[Contact] Learned {} → {} ({})", key, assetId, result.outcome());
    }

    public void recordInteraction(String senderAddress) {
        String key = SenderMappingStore.normalizeAddress(senderAddress);
        if (key == null) return;
        gate.refine(store, key, "interaction", m -> m.setInteractionCount(m.getInteractionCount() + 1));
    }
}
