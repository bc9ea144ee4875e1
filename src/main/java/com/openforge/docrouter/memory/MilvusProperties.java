package com.openforge.docrouter.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * docrouter:
 *   milvus:
 *     enabled: false              # lexical lookup over recent episodes when off
 *     host: localhost
 *     port: 19530
 *     collection-name: routing_experience
 *     vector-dimensions: 1536
 */
@ConfigurationProperties(prefix = "docrouter.milvus")
public record MilvusProperties(
        @DefaultValue("false")              boolean enabled,
        @DefaultValue("localhost")          String  host,
        @DefaultValue("19530")              int     port,
        @DefaultValue("routing_experience") String  collectionName,
        @DefaultValue("1536")               int     vectorDimensions
) {}
