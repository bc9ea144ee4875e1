package com.openforge.docrouter.config;

import com.openforge.docrouter.knowledge.procedural.ProceduralStore;
import com.openforge.docrouter.knowledge.procedural.RoutingThresholds;
import com.openforge.docrouter.memory.EmbeddingProperties;
import com.openforge.docrouter.memory.ExperienceProperties;
import com.openforge.docrouter.memory.MilvusProperties;
import com.openforge.docrouter.routing.RoutingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Prints a structured startup summary once the context is ready and the
 * knowledge bootstrap has run.
 *
 * Checks performed:
 *   - Database: opens a real JDBC connection and reads the server version
 *   - Similarity: Milvus address or the lexical fallback
 *   - Routing: effective thresholds (stored rules override configuration)
 *   - Worker pools: concurrent emails × attachments
 */
@Slf4j
@Component
@Order(10)
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource           dataSource;
    private final ProceduralStore      proceduralStore;
    private final RoutingProperties    routingProperties;
    private final ExperienceProperties experienceProperties;
    private final EmbeddingProperties  embeddingProperties;
    private final MilvusProperties     milvusProperties;
    private final Environment          env;

    @Override
    public void run(ApplicationArguments args) {
        String dbStatus    = probeDatabase();
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");
        String thresholds  = describeThresholds();
        String similarity  = milvusProperties.enabled()
                ? "Milvus %s:%s  collection=%s  dim=%d  model=%s".formatted(
                        milvusProperties.host(), milvusProperties.port(), milvusProperties.collectionName(),
                        milvusProperties.vectorDimensions(), embeddingProperties.model())
                : "lexical (recent " + experienceProperties.lexicalWindow() + " episodes)";

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              DocRouter  -  Startup Summary               ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Similarity                                              ║
                ║    Lookup         : {}
                ║    Timeout        : {} ms  floor={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Routing                                                 ║
                ║    Thresholds     : {}
                ║    Workers        : {} emails × {} attachments
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,

                dbStatus,

                similarity,
                experienceProperties.lookupTimeoutMillis(), experienceProperties.similarityFloor(),

                thresholds,
                routingProperties.maxConcurrentEmails(), routingProperties.maxConcurrentAttachments()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Opens a real JDBC connection and reads the DB server version.
     * Returns a one-line summary or error message.
     */
    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductName() + " "
                    + conn.getMetaData().getDatabaseProductVersion();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  " + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }

    private String describeThresholds() {
        try {
            RoutingThresholds t = proceduralStore.routingThresholds();
            return "high=%.2f medium=%.2f low=%.2f asset-weight=%.2f".formatted(t.high(), t.medium(), t.low(), t.assetWeight());
        } catch (RuntimeException e) {
            return "✘ unavailable: " + e.getMessage();
        }
    }
}
