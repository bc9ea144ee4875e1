package com.openforge.docrouter.knowledge;

import com.openforge.docrouter.domain.FactKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Looks up the store for a fact kind; used when a conflict is settled later by a human. */
@Component
public class KnowledgeStoreRegistry {

    private final Map<FactKind, KnowledgeStore<?>> stores = new EnumMap<>(FactKind.class);

    public KnowledgeStoreRegistry(List<KnowledgeStore<?>> stores) {
        for (KnowledgeStore<?> store : stores) {
            KnowledgeStore<?> previous = this.stores.put(store.kind(), store);
            if (previous != null) {
                throw new IllegalStateException("Two knowledge stores registered for " + store.kind());
            }
        }
    }

    public KnowledgeStore<?> get(FactKind kind) {
        KnowledgeStore<?> store = stores.get(kind);
        if (store == null) throw new IllegalStateException("No knowledge store for " + kind);
        return store;
    }

    public Map<FactKind, KnowledgeStore<?>> all() {
        return Map.copyOf(stores);
    }
}
