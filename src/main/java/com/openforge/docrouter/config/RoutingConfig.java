package com.openforge.docrouter.config;

import com.openforge.docrouter.routing.DocumentSink;
import com.openforge.docrouter.routing.LoggingDocumentSink;
import com.openforge.docrouter.routing.PassThroughSecurityScanner;
import com.openforge.docrouter.routing.SecurityScanner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback collaborators. A deployment that provides its own file store or
 * antivirus bean replaces these.
 */
@Configuration
public class RoutingConfig {

    @Bean
    @ConditionalOnMissingBean(DocumentSink.class)
    public DocumentSink documentSink() {
        return new LoggingDocumentSink();
    }

    @Bean
    @ConditionalOnMissingBean(SecurityScanner.class)
    public SecurityScanner securityScanner() {
        return new PassThroughSecurityScanner();
    }
}
