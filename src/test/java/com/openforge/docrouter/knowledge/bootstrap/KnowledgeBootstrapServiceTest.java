package com.openforge.docrouter.knowledge.bootstrap;

import com.openforge.docrouter.knowledge.KnowledgeStats;
import com.openforge.docrouter.knowledge.KnowledgeStatsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties =
        "spring.datasource.url=jdbc:h2:mem:bootstrap;MODE=MySQL;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE")
@ActiveProfiles("test")
class KnowledgeBootstrapServiceTest {

    @Autowired private KnowledgeBootstrapService bootstrapService;
    @Autowired private KnowledgeStatsService     statsService;

    @Test
    void secondRunReportsAlreadyLoadedAndChangesNothing() {
        BootstrapReport first = bootstrapService.bootstrap();
        KnowledgeStats afterFirst = statsService.getKnowledgeStats();

        BootstrapReport second = bootstrapService.bootstrap();
        KnowledgeStats afterSecond = statsService.getKnowledgeStats();

        assertEquals(BootstrapStatus.LOADED, first.status());
        assertFalse(first.alreadyLoaded());
        assertTrue(second.alreadyLoaded());
        assertEquals(BootstrapStatus.ALREADY_LOADED, second.status());
        assertEquals(afterFirst.collections(), afterSecond.collections());

        for (BootstrapReport.CollectionReport report : first.collections()) {
            assertEquals(report.loaded(), afterSecond.bootstrapped().get(report.collection()), report.collection());
        }
        assertTrue(afterSecond.collections().get("asset_profiles") >= 4);
        assertTrue(afterSecond.collections().get("file_type_rules") > 0);
        assertTrue(afterSecond.collections().get("classification_patterns") > 0);
        assertTrue(afterSecond.collections().get("sender_mappings") > 0);
        assertEquals(0, afterSecond.pendingConflicts());
    }
}
