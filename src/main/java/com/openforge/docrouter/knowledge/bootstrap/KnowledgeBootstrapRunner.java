package com.openforge.docrouter.knowledge.bootstrap;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Seeds the knowledge base when the application starts. Safe to run on every node. */
@Slf4j
@Component
@Order(0)
@RequiredArgsConstructor
@ConditionalOnProperty(name = "docrouter.knowledge.bootstrap-on-startup", havingValue = "true", matchIfMissing = true)
public class KnowledgeBootstrapRunner implements ApplicationRunner {

    private final KnowledgeBootstrapService bootstrapService;

    @Override
    public void run(ApplicationArguments args) {
        try {
            bootstrapService.bootstrap();
        } catch (RuntimeException e) {
            log.error("[Bootstrap] Knowledge bootstrap failed; the service starts with whatever is stored", e);
        }
    }
}
