package com.openforge.docrouter.repository;

import com.openforge.docrouter.domain.BaseEntity;
import com.openforge.docrouter.domain.KnowledgeFact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.repository.NoRepositoryBean;

import java.util.Optional;

/** Lookups every gate-guarded table supports. */
@NoRepositoryBean
public interface KnowledgeFactRepository<F extends BaseEntity & KnowledgeFact> extends JpaRepository<F, Long> {

    Optional<F> findFirstByFingerprint(String fingerprint);

    Optional<F> findByIdentityKey(String identityKey);
}
