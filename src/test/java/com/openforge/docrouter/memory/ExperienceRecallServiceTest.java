package com.openforge.docrouter.memory;

import com.openforge.docrouter.domain.EpisodicRecord;
import com.openforge.docrouter.domain.ExperienceSource;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class ExperienceRecallServiceTest {

    private static final ExperienceProperties PROPERTIES =
            new ExperienceProperties(0.5, 10, 100, 0.4, 0.1, 10000, 180, 500);

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ExperienceRecallService service(SimilarityLookup lookup) {
        TimeLimiter limiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(100))
                .cancelRunningFuture(true)
                .build());
        return new ExperienceRecallService(lookup, executor, limiter,
                CircuitBreaker.ofDefaults("test-lookup"), Retry.ofDefaults("test-index"), PROPERTIES);
    }

    private static EpisodicRecord episode(String filename) {
        return EpisodicRecord.builder()
                .filename(filename)
                .predictedCategory("loan_documents")
                .assetId("I3")
                .source(ExperienceSource.AUTO)
                .confidence(0.9)
                .build();
    }

    @Test
    void slowLookupDegradesInsteadOfBlocking() {
        SimilarityLookup slow = new SimilarityLookup() {
            @Override
            public List<SimilarExperience> findSimilar(String queryText, int topK) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of();
            }

            @Override
            public void index(EpisodicRecord record) {
            }
        };

        long started = System.nanoTime();
        ExperienceRecall recall = service(slow).recall("RLV_TRM_i3_TD.pdf i3 loan docs");
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertTrue(recall.degraded());
        assertTrue(recall.note().startsWith(ExperienceRecall.UNAVAILABLE));
        assertTrue(recall.experiences().isEmpty());
        assertTrue(elapsedMillis < 2_000, "recall took " + elapsedMillis + " ms");
    }

    @Test
    void failingLookupDegrades() {
        SimilarityLookup broken = new SimilarityLookup() {
            @Override
            public List<SimilarExperience> findSimilar(String queryText, int topK) {
                throw new IllegalStateException("index offline");
            }

            @Override
            public void index(EpisodicRecord record) {
            }
        };

        ExperienceRecall recall = service(broken).recall("statement.pdf");

        assertTrue(recall.degraded());
        assertTrue(recall.note().startsWith(ExperienceRecall.UNAVAILABLE));
    }

    @Test
    void hitsBelowTheFloorAreDropped() {
        SimilarityLookup fixed = new SimilarityLookup() {
            @Override
            public List<SimilarExperience> findSimilar(String queryText, int topK) {
                return List.of(new SimilarExperience(episode("a.pdf"), 0.9),
                        new SimilarExperience(episode("b.pdf"), 0.2));
            }

            @Override
            public void index(EpisodicRecord record) {
            }
        };

        ExperienceRecall recall = service(fixed).recall("a.pdf");

        assertFalse(recall.degraded());
        assertNull(recall.note());
        assertEquals(1, recall.experiences().size());
        assertEquals("a.pdf", recall.experiences().get(0).record().getFilename());
    }

    @Test
    void blankQueryRecallsNothing() {
        ExperienceRecall recall = service(null).recall("  ");

        assertFalse(recall.degraded());
        assertTrue(recall.experiences().isEmpty());
    }
}
