package com.openforge.gazetranslate.memory;

import com.openforge.gazetranslate.domain.CaptureTrigger;
import org.springframework.lang.Nullable;

/**
 * Where and how a fragment was captured. Every field is optional.
 */
public record CaptureContext(
        @Nullable String         sessionId,
        @Nullable Double         gazeX,
        @Nullable Double         gazeY,
        @Nullable CaptureTrigger trigger,
        @Nullable String         deviceType
) {

    public static CaptureContext manual() {
        return new CaptureContext(null, null, null, CaptureTrigger.MANUAL, null);
    }

    public static CaptureContext gaze(String sessionId, double x, double y, @Nullable String deviceType) {
        return new CaptureContext(sessionId, x, y, CaptureTrigger.GAZE, deviceType);
    }
}
