package com.openforge.gazetranslate.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Memory store settings.
 *
 * application.yml:
 *
 * app:
 *   memory:
 *     stale-horizon: 30d
 *     purge-batch-size: 200
 *     purge-cron: "0 30 3 * * *"
 *     fuzzy-threshold: 0.7
 *     max-suggestions: 5
 *     promote-strength: 0.8
 *     demote-strength: 0.3
 *     lock-stripes: 64
 */
@ConfigurationProperties(prefix = "app.memory")
public record MemoryProperties(
        @DefaultValue("30d")           Duration staleHorizon,
        @DefaultValue("200")           int      purgeBatchSize,
        @DefaultValue("0 30 3 * * *")  String   purgeCron,
        @DefaultValue("0.7")           double   fuzzyThreshold,
        @DefaultValue("5")             int      maxSuggestions,
        @DefaultValue("0.8")           double   promoteStrength,
        @DefaultValue("0.3")           double   demoteStrength,
        @DefaultValue("64")            int      lockStripes
) {

    public static MemoryProperties defaults() {
        return new MemoryProperties(Duration.ofDays(30), 200, "0 30 3 * * *", 0.7, 5, 0.8, 0.3, 64);
    }
}
