package com.openforge.gazetranslate.gaze;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Calibration presets for new gaze sessions.
 *
 * application.yml:
 *
 * app:
 *   fixation:
 *     default-mode: EYE
 *     eye-stability-radius-px: 50
 *     eye-min-duration-ms: 1000
 *     eye-min-confidence: 0.5
 *     head-stability-radius-px: 80
 *     head-min-duration-ms: 1500
 *     head-min-confidence: 0.0
 */
@ConfigurationProperties(prefix = "app.fixation")
public record FixationProperties(
        @DefaultValue("EYE")  GazeMode defaultMode,
        @DefaultValue("50")   double   eyeStabilityRadiusPx,
        @DefaultValue("1000") long     eyeMinDurationMs,
        @DefaultValue("0.5")  double   eyeMinConfidence,
        @DefaultValue("80")   double   headStabilityRadiusPx,
        @DefaultValue("1500") long     headMinDurationMs,
        @DefaultValue("0.0")  double   headMinConfidence
) {

    public FixationConfig configFor(GazeMode mode) {
        return switch (mode == null ? defaultMode : mode) {
            case EYE  -> new FixationConfig(eyeStabilityRadiusPx, eyeMinDurationMs, eyeMinConfidence);
            case HEAD -> new FixationConfig(headStabilityRadiusPx, headMinDurationMs, headMinConfidence);
        };
    }

    public static FixationProperties defaults() {
        return new FixationProperties(GazeMode.EYE, 50, 1000, 0.5, 80, 1500, 0.0);
    }
}
