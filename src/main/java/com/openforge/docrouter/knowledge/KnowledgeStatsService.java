package com.openforge.docrouter.knowledge;

import com.openforge.docrouter.domain.BootstrapMarker;
import com.openforge.docrouter.domain.ConflictResolution;
import com.openforge.docrouter.domain.FactKind;
import com.openforge.docrouter.domain.ReviewStatus;
import com.openforge.docrouter.repository.BootstrapMarkerRepository;
import com.openforge.docrouter.repository.ConflictRecordRepository;
import com.openforge.docrouter.repository.ReviewItemRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

@Service
@RequiredArgsConstructor
public class KnowledgeStatsService {

    private final KnowledgeStoreRegistry    registry;
    private final ConflictRecordRepository  conflicts;
    private final ReviewItemRepository      reviews;
    private final BootstrapMarkerRepository markers;

    public KnowledgeStats getKnowledgeStats() {
        Map<String, Long> collections = new TreeMap<>();
        Map<String, Long> partitions  = new TreeMap<>();
        for (Map.Entry<FactKind, KnowledgeStore<?>> entry : registry.all().entrySet()) {
            long count = entry.getValue().count();
            collections.put(collectionName(entry.getKey()), count);
            partitions.merge(entry.getKey().partition().name().toLowerCase(Locale.ROOT), count, Long::sum);
        }
        Map<String, Integer> bootstrapped = new TreeMap<>();
        for (BootstrapMarker marker : markers.findAll()) {
            bootstrapped.put(marker.getCollectionName(), marker.getItemCount());
        }
        return new KnowledgeStats(collections, partitions,
                conflicts.countByResolution(ConflictResolution.PENDING),
                reviews.countByStatus(ReviewStatus.PENDING),
                bootstrapped);
    }

    static String collectionName(FactKind kind) {
        return switch (kind) {
            case ASSET_PROFILE          -> "asset_profiles";
            case FILE_TYPE_RULE         -> "file_type_rules";
            case FEEDBACK               -> "feedback_records";
            case CLASSIFICATION_PATTERN -> "classification_patterns";
            case MATCHING_RULE          -> "matching_rules";
            case EPISODE                -> "episodic_records";
            case SENDER_MAPPING         -> "sender_mappings";
        };
    }
}
