package com.openforge.gazetranslate.session.dto;

import com.openforge.gazetranslate.gaze.GazeMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/gaze/sessions.
 *
 * @param gazeMode   EYE or HEAD; selects the calibration preset, defaults to the configured mode
 * @param deviceType optional client label, stored with captured fragments
 */
public record OpenSessionRequest(
        @NotBlank String sourceLang,
        @NotBlank String targetLang,
        GazeMode gazeMode,
        @Size(max = 32) String deviceType
) {}
