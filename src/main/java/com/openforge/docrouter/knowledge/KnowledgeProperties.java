package com.openforge.docrouter.knowledge;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Knowledge-base settings.
 *
 * docrouter:
 *   knowledge:
 *     confidence-margin: 1          # tiers a candidate must exceed the stored fact by to overwrite it
 *     lock-stripes: 64              # per-identity-key lock stripes in the gate
 *     bootstrap-on-startup: true
 *     seed-location: classpath:knowledge/
 */
@ConfigurationProperties(prefix = "docrouter.knowledge")
public record KnowledgeProperties(
        @DefaultValue("1")                   int     confidenceMargin,
        @DefaultValue("64")                  int     lockStripes,
        @DefaultValue("true")                boolean bootstrapOnStartup,
        @DefaultValue("classpath:knowledge/") String seedLocation
) {}
