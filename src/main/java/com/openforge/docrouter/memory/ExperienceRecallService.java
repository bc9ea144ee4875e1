package com.openforge.docrouter.memory;

import com.openforge.docrouter.domain.EpisodicRecord;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Asynchronous, time-bounded access to the similarity capability.
 *
 * A recall never fails the caller: timeout, lookup error, open circuit or
 * a saturated executor all yield a degraded {@link ExperienceRecall} and
 * scoring continues on the remaining signals.
 */
@Slf4j
@Service
public class ExperienceRecallService {

    private final SimilarityLookup     lookup;
    private final ExecutorService      executor;
    private final TimeLimiter          timeLimiter;
    private final CircuitBreaker       circuitBreaker;
    private final Retry                indexRetry;
    private final ExperienceProperties properties;

    public ExperienceRecallService(SimilarityLookup lookup,
                                   @Qualifier("similarityExecutor") ExecutorService executor,
                                   @Qualifier("similarityLookupTimeLimiter") TimeLimiter timeLimiter,
                                   @Qualifier("similarityLookupCircuitBreaker") CircuitBreaker circuitBreaker,
                                   @Qualifier("similarityIndexRetry") Retry indexRetry,
                                   ExperienceProperties properties) {
        this.lookup         = lookup;
        this.executor       = executor;
        this.timeLimiter    = timeLimiter;
        this.circuitBreaker = circuitBreaker;
        this.indexRetry     = indexRetry;
        this.properties     = properties;
    }

    // ── Recall ───────────────────────────────────────────────────────────────

    public ExperienceRecall recall(String queryText) {
        if (queryText == null || queryText.isBlank()) return ExperienceRecall.none();

        Callable<List<SimilarExperience>> bounded = TimeLimiter.decorateFutureSupplier(timeLimiter,
                () -> CompletableFuture.supplyAsync(() -> lookup.findSimilar(queryText, properties.topK()), executor));
        Callable<List<SimilarExperience>> guarded = CircuitBreaker.decorateCallable(circuitBreaker, bounded);

        try {
            List<SimilarExperience> hits = guarded.call().stream()
                    .filter(hit -> hit.similarity() >= properties.similarityFloor())
                    .toList();
            log.debug("[Recall] '{}' → {} similar episode(s)", queryText, hits.size());
            return new ExperienceRecall(hits, false, null);
        } catch (TimeoutException e) {
            log.warn("[Recall] Similarity lookup exceeded {} ms, continuing without experience",
                    properties.lookupTimeoutMillis());
            return ExperienceRecall.degraded("timeout");
        } catch (CallNotPermittedException e) {
            log.warn("[Recall] Similarity circuit is open, continuing without experience");
            return ExperienceRecall.degraded("circuit_open");
        } catch (RejectedExecutionException e) {
            log.warn("[Recall] Similarity executor saturated, continuing without experience");
            return ExperienceRecall.degraded("saturated");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExperienceRecall.degraded("interrupted");
        } catch (Exception e) {
            log.warn("[Recall] Similarity lookup failed: {}", e.getMessage());
            return ExperienceRecall.degraded("lookup_failed");
        }
    }

    // ── Index ────────────────────────────────────────────────────────────────

    /** Index a stored episode in the background, retrying transient failures. */
    public void index(EpisodicRecord record) {
        Runnable indexing = Retry.decorateRunnable(indexRetry, () -> lookup.index(record));
        try {
            CompletableFuture.runAsync(indexing, executor).exceptionally(t -> {
                log.warn("[Recall] Could not index episode {}: {}", record.getId(), t.getMessage());
                return null;
            });
        } catch (RejectedExecutionException e) {
            log.warn("[Recall] Similarity executor saturated, episode {} not indexed", record.getId());
        }
    }
}
