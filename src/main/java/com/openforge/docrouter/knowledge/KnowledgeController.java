package com.openforge.docrouter.knowledge;

import com.openforge.docrouter.knowledge.bootstrap.BootstrapReport;
import com.openforge.docrouter.knowledge.bootstrap.KnowledgeBootstrapService;
import com.openforge.docrouter.knowledge.bootstrap.SeedRecords;
import com.openforge.docrouter.knowledge.contact.ContactStore;
import com.openforge.docrouter.knowledge.procedural.ProceduralStore;
import com.openforge.docrouter.knowledge.semantic.SemanticStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Knowledge administration.
 *
 *   GET  /api/knowledge/stats       - per-collection counts
 *   POST /api/knowledge/bootstrap   - load seed files (idempotent per collection)
 *   POST /api/knowledge/assets      - admin ingest; bodies use the seed-file shapes
 *   POST /api/knowledge/senders
 *   POST /api/knowledge/file-types
 *   POST /api/knowledge/patterns    - one result per pattern in the body
 *
 * Every ingest goes through the deduplication gate and may come back as
 * DUPLICATE, REJECTED or QUEUED_FOR_REVIEW instead of a write.
 */
@RestController
@RequestMapping("/api/knowledge")
@RequiredArgsConstructor
public class KnowledgeController {

    private final KnowledgeStatsService     statsService;
    private final KnowledgeBootstrapService bootstrapService;
    private final SemanticStore             semanticStore;
    private final ProceduralStore           proceduralStore;
    private final ContactStore              contactStore;

    @GetMapping("/stats")
    public KnowledgeStats getKnowledgeStats() {
        return statsService.getKnowledgeStats();
    }

    @PostMapping("/bootstrap")
    public BootstrapReport bootstrap() {
        return bootstrapService.bootstrap();
    }

    @PostMapping("/assets")
    public IngestResult ingestAsset(@RequestBody SeedRecords.AssetSeed asset) {
        return semanticStore.ingestAsset(asset.toAsset());
    }

    @PostMapping("/senders")
    public IngestResult ingestSender(@RequestBody SeedRecords.SenderSeed sender) {
        return contactStore.ingest(sender.toSender());
    }

    @PostMapping("/file-types")
    public IngestResult ingestFileType(@RequestBody SeedRecords.FileTypeSeed fileType) {
        return semanticStore.ingestFileType(fileType.toFileType());
    }

    @PostMapping("/patterns")
    public List<IngestResult> ingestPatterns(@RequestBody SeedRecords.PatternSeed seed) {
        return seed.patternList().stream()
                .map(pattern -> proceduralStore.ingestPattern(seed.resolvedAssetType(), seed.category(), pattern,
                        null, seed.tier()))
                .toList();
    }
}
