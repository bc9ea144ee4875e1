package com.openforge.docrouter.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Episodic experience settings.
 *
 * human-weight / auto-weight - contribution of one similar episode is
 *                              weight × similarity; corrections count four times as much
 * lexical-window             - how many recent episodes the lexical lookup scans
 */
@ConfigurationProperties(prefix = "docrouter.experience")
public record ExperienceProperties(
        @DefaultValue("0.5")   double similarityFloor,
        @DefaultValue("10")    int    topK,
        @DefaultValue("800")   long   lookupTimeoutMillis,
        @DefaultValue("0.4")   double humanWeight,
        @DefaultValue("0.1")   double autoWeight,
        @DefaultValue("10000") int    maxRecords,
        @DefaultValue("180")   int    maxAgeDays,
        @DefaultValue("500")   int    lexicalWindow
) {}
