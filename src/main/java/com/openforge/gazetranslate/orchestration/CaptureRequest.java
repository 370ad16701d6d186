package com.openforge.gazetranslate.orchestration;

import com.openforge.gazetranslate.domain.CaptureTrigger;
import com.openforge.gazetranslate.gaze.TriggerEvent;
import com.openforge.gazetranslate.memory.CaptureContext;
import com.openforge.gazetranslate.memory.LanguagePair;
import org.springframework.lang.Nullable;

/**
 * A screenshot to translate, plus who asked and where they were looking.
 *
 * @param trigger the fixation that asked for the screenshot, null for manual uploads
 */
public record CaptureRequest(
        String                 ownerId,
        byte[]                 image,
        LanguagePair           languages,
        @Nullable String       sessionId,
        @Nullable TriggerEvent trigger,
        @Nullable String       deviceType
) {

    CaptureContext context() {
        if (trigger != null) {
            return CaptureContext.gaze(sessionId, trigger.x(), trigger.y(), deviceType);
        }
        return new CaptureContext(sessionId, null, null, CaptureTrigger.MANUAL, deviceType);
    }
}
