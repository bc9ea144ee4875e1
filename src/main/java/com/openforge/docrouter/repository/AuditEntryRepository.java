package com.openforge.docrouter.repository;

import com.openforge.docrouter.domain.AuditEntry;
import com.openforge.docrouter.domain.FactKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditEntryRepository extends JpaRepository<AuditEntry, Long> {

    List<AuditEntry> findByFactKindAndFactIdOrderByIdAsc(FactKind factKind, Long factId);
}
