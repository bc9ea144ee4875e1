package com.openforge.docrouter.knowledge;

import com.openforge.docrouter.domain.AuditEntry;
import com.openforge.docrouter.domain.BaseEntity;
import com.openforge.docrouter.domain.KnowledgeFact;
import com.openforge.docrouter.repository.AuditEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Appends one audit row per accepted knowledge mutation. Runs inside the gate's transaction. */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditTrail {

    private final AuditEntryRepository repository;

    public <F extends BaseEntity & KnowledgeFact> void record(KnowledgeStore<F> store,
                                                             F fact,
                                                             String action,
                                                             String rationale) {
        repository.save(AuditEntry.builder()
                .partition(store.partition())
                .factKind(store.kind())
                .factId(fact.getId())
                .identityKey(fact.getIdentityKey())
                .action(action)
                .rationale(truncate(rationale, 1000))
                .build());
        log.debug("[Audit] {} {} id={} key={} - {}",
                action, store.kind(), fact.getId(), fact.getIdentityKey(), rationale);
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }
}
