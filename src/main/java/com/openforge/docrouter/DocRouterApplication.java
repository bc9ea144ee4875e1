package com.openforge.docrouter;

import com.openforge.docrouter.knowledge.KnowledgeProperties;
import com.openforge.docrouter.knowledge.procedural.ClassificationProperties;
import com.openforge.docrouter.knowledge.procedural.MatchingProperties;
import com.openforge.docrouter.memory.EmbeddingProperties;
import com.openforge.docrouter.memory.ExperienceProperties;
import com.openforge.docrouter.memory.MilvusProperties;
import com.openforge.docrouter.routing.RoutingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

// Register ConfigurationProperties globally so they are available
// regardless of whether the conditional Milvus beans are loaded.
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
        RoutingProperties.class,
        MatchingProperties.class,
        ClassificationProperties.class,
        ExperienceProperties.class,
        KnowledgeProperties.class,
        MilvusProperties.class,
        EmbeddingProperties.class
})
public class DocRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocRouterApplication.class, args);
    }
}
