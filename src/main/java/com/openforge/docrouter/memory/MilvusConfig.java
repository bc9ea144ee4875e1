package com.openforge.docrouter.memory;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Milvus client and the experience collection.
 *
 * Collection schema (routing_experience):
 * ┌──────────────────┬─────────────────┬──────────────────────────────────┐
 * │ Field            │ Type            │ Notes                            │
 * ├──────────────────┼─────────────────┼──────────────────────────────────┤
 * │ episode_id       │ INT64 PK        │ id of the episodic_records row   │
 * │ asset_id         │ VARCHAR(64)     │ empty when no asset              │
 * │ category         │ VARCHAR(64)     │ predicted or corrected category  │
 * │ source           │ VARCHAR(24)     │ AUTO / HUMAN_CORRECTION          │
 * │ content          │ VARCHAR(2048)   │ filename + subject               │
 * │ embedding        │ FLOAT_VECTOR    │ dim = vectorDimensions           │
 * └──────────────────┴─────────────────┴──────────────────────────────────┘
 *
 * HNSW index with inner-product metric. When the connection fails the client
 * bean is null and similarity recall runs degraded.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "docrouter.milvus.enabled", havingValue = "true")
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    @Nullable
    public MilvusClientV2 milvusClient(MilvusProperties props) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        try {
            MilvusClientV2 client = new MilvusClientV2(
                    ConnectConfig.builder()
                            .uri("http://%s:%d".formatted(props.host(), props.port()))
                            .connectTimeoutMs(15_000)
                            .build()
            );
            ensureCollectionExists(client, props);
            return client;
        } catch (Exception e) {
            log.warn("[Milvus] Connection failed, similarity recall will run degraded. Cause: {}. " +
                     "Set docrouter.milvus.enabled=false to use the lexical lookup instead.", e.getMessage());
            return null;
        }
    }

    private void ensureCollectionExists(MilvusClientV2 client, MilvusProperties props) {
        String name = props.collectionName();
        if (client.hasCollection(HasCollectionReq.builder().collectionName(name).build())) {
            log.info("[Milvus] Collection '{}' already exists.", name);
            return;
        }

        log.info("[Milvus] Creating collection '{}' (dim={})...", name, props.vectorDimensions());
        CreateCollectionReq.CollectionSchema schema = CreateCollectionReq.CollectionSchema.builder().build();
        schema.addField(AddFieldReq.builder().fieldName("episode_id")
                .dataType(DataType.Int64).isPrimaryKey(true).autoID(false).build());
        schema.addField(AddFieldReq.builder().fieldName("asset_id")
                .dataType(DataType.VarChar).maxLength(64).build());
        schema.addField(AddFieldReq.builder().fieldName("category")
                .dataType(DataType.VarChar).maxLength(64).build());
        schema.addField(AddFieldReq.builder().fieldName("source")
                .dataType(DataType.VarChar).maxLength(24).build());
        schema.addField(AddFieldReq.builder().fieldName("content")
                .dataType(DataType.VarChar).maxLength(2048).build());
        schema.addField(AddFieldReq.builder().fieldName("embedding")
                .dataType(DataType.FloatVector).dimension(props.vectorDimensions()).build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName("embedding")
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.IP)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();

        client.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex))
                .build());
        log.info("[Milvus] Collection '{}' created.", name);
    }
}
