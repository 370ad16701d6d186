package com.openforge.gazetranslate.retention;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables of the forgetting curve. The defaults are product heuristics,
 * not derived constants, so all of them are overridable.
 *
 * application.yml:
 *
 * app:
 *   retention:
 *     remember-threshold: 0.30
 *     low-success-rate: 0.6
 *     high-success-rate: 0.9
 *     base-forgetting-hours: 24
 *     default-difficulty: 3
 *     slow-response-ms: 10000
 *     fast-response-ms: 3000
 *     mastery-min-successful-reviews: 5
 *     mastery-min-strength: 0.95
 */
@ConfigurationProperties(prefix = "app.retention")
public record RetentionProperties(
        @DefaultValue("0.30")  double rememberThreshold,
        @DefaultValue("0.6")   double lowSuccessRate,
        @DefaultValue("0.9")   double highSuccessRate,
        @DefaultValue("24")    double baseForgettingHours,
        @DefaultValue("3")     double defaultDifficulty,
        @DefaultValue("10000") long   slowResponseMs,
        @DefaultValue("3000")  long   fastResponseMs,
        @DefaultValue("5")     int    masteryMinSuccessfulReviews,
        @DefaultValue("0.95")  double masteryMinStrength
) {

    public static RetentionProperties defaults() {
        return new RetentionProperties(0.30, 0.6, 0.9, 24, 3, 10_000, 3_000, 5, 0.95);
    }
}
