package com.openforge.docrouter.knowledge.episodic;

import com.openforge.docrouter.domain.EpisodicRecord;
import com.openforge.docrouter.domain.ExperienceSource;
import com.openforge.docrouter.knowledge.IngestOutcome;
import com.openforge.docrouter.knowledge.IngestResult;
import com.openforge.docrouter.repository.EpisodicRecordRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:episodic;MODE=MySQL;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE",
        "docrouter.experience.max-age-days=30"
})
@ActiveProfiles("test")
class EpisodicStoreTest {

    @Autowired private EpisodicStore            episodicStore;
    @Autowired private EpisodicRecordRepository repository;

    private static EpisodicRecord episode(String filename, ExperienceSource source, int daysAgo) {
        return EpisodicRecord.builder()
                .filename(filename)
                .subjectExcerpt("quarterly pack")
                .predictedCategory("financial_statements")
                .confidence(0.8)
                .source(source)
                .occurredAt(LocalDateTime.now().minusDays(daysAgo))
                .build();
    }

    @Test
    void appendIsIdempotentForTheSameEpisode() {
        IngestResult first = episodicStore.append(episode("same.pdf", ExperienceSource.AUTO, 1));
        IngestResult second = episodicStore.append(episode("same.pdf", ExperienceSource.AUTO, 0));

        assertEquals(IngestOutcome.INSERTED, first.outcome());
        assertEquals(IngestOutcome.DUPLICATE, second.outcome());
        assertEquals(first.factId(), second.factId());
    }

    @Test
    void correctionsOutliveAutomaticEpisodes() {
        episodicStore.append(episode("old_auto.pdf", ExperienceSource.AUTO, 45));
        episodicStore.append(episode("old_fix.pdf", ExperienceSource.HUMAN_CORRECTION, 45));
        episodicStore.append(episode("ancient_fix.pdf", ExperienceSource.HUMAN_CORRECTION, 90));
        episodicStore.append(episode("fresh_auto.pdf", ExperienceSource.AUTO, 2));

        int removed = episodicStore.evict();

        List<String> left = repository.findAll().stream().map(EpisodicRecord::getFilename).toList();
        assertTrue(removed >= 2);
        assertFalse(left.contains("old_auto.pdf"));
        assertFalse(left.contains("ancient_fix.pdf"));
        assertTrue(left.contains("old_fix.pdf"));
        assertTrue(left.contains("fresh_auto.pdf"));
    }
}
