package com.openforge.docrouter.memory;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.openforge.docrouter.domain.EpisodicRecord;
import com.openforge.docrouter.repository.EpisodicRecordRepository;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Embeds the query and searches the experience collection in Milvus.
 * Hits are mapped back to their episodic_records rows; hits whose row has
 * since been evicted are dropped.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "docrouter.milvus.enabled", havingValue = "true")
public class MilvusSimilarityLookup implements SimilarityLookup {

    private final MilvusClientV2           milvusClient;
    private final EmbeddingClient          embeddingClient;
    private final MilvusProperties         props;
    private final EpisodicRecordRepository episodes;

    public MilvusSimilarityLookup(@Nullable MilvusClientV2 milvusClient,
                                  EmbeddingClient embeddingClient,
                                  MilvusProperties props,
                                  EpisodicRecordRepository episodes) {
        this.milvusClient    = milvusClient;
        this.embeddingClient = embeddingClient;
        this.props           = props;
        this.episodes        = episodes;
        if (milvusClient == null) {
            log.warn("[Milvus] Client unavailable, every similarity recall will be degraded.");
        }
    }

    @Override
    public List<SimilarExperience> findSimilar(String queryText, int topK) {
        requireClient();
        List<Float> vector = embeddingClient.embed(queryText);
        SearchResp resp = milvusClient.search(SearchReq.builder()
                .collectionName(props.collectionName())
                .data(List.of(new FloatVec(vector)))
                .annsField("embedding")
                .topK(topK)
                .outputFields(List.of("episode_id"))
                .build());

        Map<Long, Double> scores = new LinkedHashMap<>();
        if (resp != null && resp.getSearchResults() != null) {
            for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
                for (SearchResp.SearchResult hit : row) {
                    Object id = hit.getId();
                    Float score = hit.getScore();
                    if (id instanceof Number n && score != null) {
                        scores.putIfAbsent(n.longValue(), Math.max(0.0, Math.min(1.0, score.doubleValue())));
                    }
                }
            }
        }
        if (scores.isEmpty()) return List.of();

        Map<Long, EpisodicRecord> byId = episodes.findAllById(scores.keySet()).stream()
                .collect(Collectors.toMap(EpisodicRecord::getId, Function.identity()));
        List<SimilarExperience> results = new ArrayList<>();
        scores.forEach((id, score) -> {
            EpisodicRecord record = byId.get(id);
            if (record != null) results.add(new SimilarExperience(record, score));
        });
        return results;
    }

    @Override
    public void index(EpisodicRecord record) {
        requireClient();
        List<Float> vector = embeddingClient.embed(record.queryText());

        JsonObject row = new JsonObject();
        row.addProperty("episode_id", record.getId());
        row.addProperty("asset_id", record.getAssetId() == null ? "" : record.getAssetId());
        row.addProperty("category", record.getPredictedCategory());
        row.addProperty("source", record.getSource().name());
        row.addProperty("content", truncate(record.queryText(), 2000));
        JsonArray embedding = new JsonArray();
        for (Float f : vector) embedding.add(f);
        row.add("embedding", embedding);

        milvusClient.upsert(UpsertReq.builder()
                .collectionName(props.collectionName())
                .data(List.of(row))
                .build());
        log.debug("[Milvus] Indexed episode {} ({})", record.getId(), record.getSource());
    }

    private void requireClient() {
        if (milvusClient == null) {
            throw new IllegalStateException("Milvus client is not connected");
        }
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
