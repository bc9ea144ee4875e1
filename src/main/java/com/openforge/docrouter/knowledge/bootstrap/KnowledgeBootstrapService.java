package com.openforge.docrouter.knowledge.bootstrap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.docrouter.domain.*;
import com.openforge.docrouter.knowledge.IngestOutcome;
import com.openforge.docrouter.knowledge.IngestResult;
import com.openforge.docrouter.knowledge.KnowledgeProperties;
import com.openforge.docrouter.knowledge.KnowledgeValidationException;
import com.openforge.docrouter.knowledge.contact.ContactStore;
import com.openforge.docrouter.knowledge.procedural.ProceduralStore;
import com.openforge.docrouter.knowledge.semantic.SemanticStore;
import com.openforge.docrouter.repository.BootstrapMarkerRepository;
import com.openforge.docrouter.websocket.EventType;
import com.openforge.docrouter.websocket.RoutingEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Seeds the knowledge base from classpath JSON, once per collection.
 *
 * Each collection is guarded twice: an in-JVM lock serialises concurrent
 * calls inside this process, and a {@link BootstrapMarker} row (unique on
 * the collection name) written in the same transaction as the seeded items
 * stops a second node. A node that loses the unique-constraint race rolls
 * back its items and reports ALREADY_LOADED.
 */
@Slf4j
@Service
public class KnowledgeBootstrapService {

    static final String ASSETS     = "asset_profiles";
    static final String FILE_TYPES = "file_type_rules";
    static final String PATTERNS   = "classification_patterns";
    static final String SENDERS    = "sender_mappings";
    static final String RULES      = "matching_rules";

    private final SemanticStore             semanticStore;
    private final ProceduralStore           proceduralStore;
    private final ContactStore              contactStore;
    private final BootstrapMarkerRepository markers;
    private final ResourceLoader            resourceLoader;
    private final ObjectMapper              objectMapper;
    private final KnowledgeProperties       properties;
    private final RoutingEventPublisher     publisher;
    private final TransactionTemplate       tx;
    private final Map<String, ReentrantLock> collectionLocks = new ConcurrentHashMap<>();

    public KnowledgeBootstrapService(SemanticStore semanticStore,
                                     ProceduralStore proceduralStore,
                                     ContactStore contactStore,
                                     BootstrapMarkerRepository markers,
                                     ResourceLoader resourceLoader,
                                     ObjectMapper objectMapper,
                                     KnowledgeProperties properties,
                                     RoutingEventPublisher publisher,
                                     PlatformTransactionManager transactionManager) {
        this.semanticStore   = semanticStore;
        this.proceduralStore = proceduralStore;
        this.contactStore    = contactStore;
        this.markers         = markers;
        this.resourceLoader  = resourceLoader;
        this.objectMapper    = objectMapper;
        this.properties      = properties;
        this.publisher       = publisher;
        this.tx              = new TransactionTemplate(transactionManager);
    }

    public BootstrapReport bootstrap() {
        List<BootstrapReport.CollectionReport> reports = new ArrayList<>();
        reports.add(load(ASSETS, () -> read("assets.json", new TypeReference<List<SeedRecords.AssetSeed>>() {}),
                seed -> semanticStore.ingestAsset(seed.toAsset())));
        reports.add(load(FILE_TYPES, () -> read("file_type_rules.json", new TypeReference<List<SeedRecords.FileTypeSeed>>() {}),
                seed -> semanticStore.ingestFileType(seed.toFileType())));
        reports.add(load(PATTERNS, () -> expandPatterns(read("classification_patterns.json",
                        new TypeReference<List<SeedRecords.PatternSeed>>() {})),
                Supplier::get));
        reports.add(load(SENDERS, () -> read("sender_mappings.json", new TypeReference<List<SeedRecords.SenderSeed>>() {}),
                seed -> contactStore.ingest(seed.toSender())));
        reports.add(load(RULES, () -> new ArrayList<>(proceduralStore.configuredRules().entrySet()),
                rule -> proceduralStore.ingestRule(rule.getKey(), rule.getValue(), "configured default", ConfidenceTier.HIGH)));

        BootstrapReport report = new BootstrapReport(reports);
        log.info("[Bootstrap] {}: {}", report.status(), reports);
        publisher.publish(EventType.BOOTSTRAP_COMPLETED, "knowledge", report);
        return report;
    }

    // ── Per-collection guard ─────────────────────────────────────────────────

    private <T> BootstrapReport.CollectionReport load(String collection,
                                                      Supplier<List<T>> seeds,
                                                      Function<T, IngestResult> ingest) {
        ReentrantLock lock = collectionLocks.computeIfAbsent(collection, c -> new ReentrantLock());
        lock.lock();
        try {
            Optional<BootstrapMarker> marker = markers.findByCollectionName(collection);
            if (marker.isPresent()) {
                log.info("[Bootstrap] {} already loaded at {} ({} items)",
                        collection, marker.get().getLoadedAt(), marker.get().getItemCount());
                return new BootstrapReport.CollectionReport(collection, BootstrapStatus.ALREADY_LOADED,
                        marker.get().getItemCount(), 0);
            }
            List<T> items = seeds.get();
            return tx.execute(status -> seed(collection, items, ingest));
        } catch (DataIntegrityViolationException e) {
            log.info("[Bootstrap] {} was loaded concurrently by another instance", collection);
            int count = markers.findByCollectionName(collection).map(BootstrapMarker::getItemCount).orElse(0);
            return new BootstrapReport.CollectionReport(collection, BootstrapStatus.ALREADY_LOADED, count, 0);
        } finally {
            lock.unlock();
        }
    }

    private <T> BootstrapReport.CollectionReport seed(String collection, List<T> items, Function<T, IngestResult> ingest) {
        BootstrapMarker marker = markers.saveAndFlush(BootstrapMarker.builder()
                .collectionName(collection)
                .loadedAt(LocalDateTime.now())
                .itemCount(0)
                .build());

        int loaded = 0;
        int rejected = 0;
        for (T item : items) {
            try {
                IngestResult result = ingest.apply(item);
                if (result.outcome() == IngestOutcome.REJECTED || result.outcome() == IngestOutcome.QUEUED_FOR_REVIEW) {
                    rejected++;
                } else {
                    loaded++;
                }
            } catch (KnowledgeValidationException | IllegalArgumentException e) {
                rejected++;
                log.warn("[Bootstrap] Skipped invalid {} item: {}", collection, e.getMessage());
            }
        }
        marker.setItemCount(loaded);
        markers.save(marker);
        log.info("[Bootstrap] {} loaded: {} item(s), {} rejected", collection, loaded, rejected);
        return new BootstrapReport.CollectionReport(collection, BootstrapStatus.LOADED, loaded, rejected);
    }

    // ── Seed files ───────────────────────────────────────────────────────────

    private <T> List<T> read(String file, TypeReference<List<T>> type) {
        Resource resource = resourceLoader.getResource(properties.seedLocation() + file);
        if (!resource.exists()) {
            log.warn("[Bootstrap] Seed file {} not found, collection stays empty", resource.getDescription());
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read seed file " + file, e);
        }
    }

    private List<Supplier<IngestResult>> expandPatterns(List<SeedRecords.PatternSeed> seeds) {
        List<Supplier<IngestResult>> ingests = new ArrayList<>();
        for (SeedRecords.PatternSeed seed : seeds) {
            for (String pattern : seed.patternList()) {
                ingests.add(() -> proceduralStore.ingestPattern(seed.resolvedAssetType(), seed.category(), pattern,
                        null, seed.tier()));
            }
        }
        return ingests;
    }
}
