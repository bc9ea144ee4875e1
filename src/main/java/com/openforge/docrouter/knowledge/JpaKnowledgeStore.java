package com.openforge.docrouter.knowledge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.docrouter.domain.BaseEntity;
import com.openforge.docrouter.domain.KnowledgeFact;
import com.openforge.docrouter.repository.KnowledgeFactRepository;

import java.util.Optional;

/**
 * The parts of {@link KnowledgeStore} that are the same for every table:
 * lookups, persistence and JSON snapshots.
 */
public abstract class JpaKnowledgeStore<F extends BaseEntity & KnowledgeFact> implements KnowledgeStore<F> {

    protected final KnowledgeFactRepository<F> repository;
    private final ObjectMapper objectMapper;
    private final Class<F> factType;

    protected JpaKnowledgeStore(KnowledgeFactRepository<F> repository,
                                ObjectMapper objectMapper,
                                Class<F> factType) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
        this.factType     = factType;
    }

    @Override
    public Optional<F> findById(Long id) {
        return repository.findById(id);
    }

    @Override
    public Optional<F> findByFingerprint(String fingerprint) {
        return repository.findFirstByFingerprint(fingerprint);
    }

    @Override
    public Optional<F> findByIdentityKey(String identityKey) {
        return repository.findByIdentityKey(identityKey);
    }

    @Override
    public F save(F fact) {
        return repository.save(fact);
    }

    @Override
    public long count() {
        return repository.count();
    }

    @Override
    public String snapshot(F fact) {
        try {
            return objectMapper.writeValueAsString(fact);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot snapshot " + kind() + " fact", e);
        }
    }

    @Override
    public F restore(String snapshot) {
        try {
            F fact = objectMapper.readValue(snapshot, factType);
            fact.setIdentityKey(identityKey(fact));
            fact.setFingerprint(fingerprint(fact));
            return fact;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + kind() + " snapshot", e);
        }
    }

    /** Default for append-only facts: no identity key, so never a collision. */
    @Override
    public boolean merge(F existing, F candidate) {
        return false;
    }

    // ── Validation helpers ───────────────────────────────────────────────────

    protected static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new KnowledgeValidationException(field + " is required");
        }
        return value.strip();
    }

    protected static <T> T require(T value, String field) {
        if (value == null) {
            throw new KnowledgeValidationException(field + " is required");
        }
        return value;
    }

    protected static double requireUnit(double value, String field) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new KnowledgeValidationException(field + " must be within [0,1], was " + value);
        }
        return value;
    }
}
