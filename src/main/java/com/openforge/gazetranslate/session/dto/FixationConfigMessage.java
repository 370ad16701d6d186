package com.openforge.gazetranslate.session.dto;

import com.openforge.gazetranslate.gaze.FixationConfig;
import com.openforge.gazetranslate.gaze.FixationProperties;
import com.openforge.gazetranslate.gaze.GazeMode;

/**
 * Inbound STOMP body for {@code /app/sessions/{id}/config}. Fields left out
 * keep their current value; {@code gazeMode} first switches to that preset.
 */
public record FixationConfigMessage(
        GazeMode gazeMode,
        Double   stabilityRadiusPx,
        Long     minDurationMs,
        Double   minConfidence
) {

    public FixationConfig applyTo(FixationConfig current, FixationProperties presets) {
        FixationConfig base = gazeMode != null ? presets.configFor(gazeMode) : current;
        return new FixationConfig(
                stabilityRadiusPx != null ? stabilityRadiusPx : base.stabilityRadiusPx(),
                minDurationMs != null ? minDurationMs : base.minDurationMs(),
                minConfidence != null ? minConfidence : base.minConfidence());
    }
}
