package com.openforge.docrouter.knowledge.episodic;

import com.openforge.docrouter.domain.EpisodicRecord;
import com.openforge.docrouter.domain.ExperienceSource;
import com.openforge.docrouter.knowledge.DeduplicationGate;
import com.openforge.docrouter.knowledge.IngestOutcome;
import com.openforge.docrouter.knowledge.IngestResult;
import com.openforge.docrouter.memory.ExperienceProperties;
import com.openforge.docrouter.memory.ExperienceRecallService;
import com.openforge.docrouter.repository.EpisodicRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Append-only log of routing decisions and human corrections.
 *
 * Eviction keeps corrections longest: automatic episodes expire at the max
 * age, corrections at twice that, and when the size cap is exceeded the
 * oldest automatic episodes go before any correction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EpisodicStore {

    private final EpisodicRecordStore      store;
    private final EpisodicRecordRepository repository;
    private final DeduplicationGate        gate;
    private final ExperienceRecallService  recallService;
    private final ExperienceProperties     properties;

    public IngestResult append(EpisodicRecord record) {
        IngestResult result = gate.ingest(store, record);
        if (result.outcome() == IngestOutcome.INSERTED) {
            repository.findById(result.factId()).ifPresent(recallService::index);
        }
        return result;
    }

    public long count() {
        return repository.count();
    }

    // ── Eviction ─────────────────────────────────────────────────────────────

    @Scheduled(cron = "${docrouter.experience.eviction-cron:0 30 3 * * *}")
    @Transactional
    public int evict() {
        LocalDateTime now = LocalDateTime.now();
        int removed = repository.deleteBySourceOlderThan(ExperienceSource.AUTO,
                now.minusDays(properties.maxAgeDays()));
        removed += repository.deleteBySourceOlderThan(ExperienceSource.HUMAN_CORRECTION,
                now.minusDays(2L * properties.maxAgeDays()));

        long overflow = repository.count() - properties.maxRecords();
        removed += trimOldest(ExperienceSource.AUTO, overflow);
        overflow = repository.count() - properties.maxRecords();
        removed += trimOldest(ExperienceSource.HUMAN_CORRECTION, overflow);

        if (removed > 0) {
            log.info("[Episodic] Evicted {} episode(s), {} remain", removed, repository.count());
        }
        return removed;
    }

    private int trimOldest(ExperienceSource source, long overflow) {
        if (overflow <= 0) return 0;
        List<EpisodicRecord> oldest = repository.findBySourceOrderByOccurredAtAsc(source,
                PageRequest.of(0, (int) Math.min(overflow, Integer.MAX_VALUE)));
        repository.deleteAllInBatch(oldest);
        return oldest.size();
    }
}
