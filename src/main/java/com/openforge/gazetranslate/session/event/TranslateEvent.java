package com.openforge.gazetranslate.session.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.gazetranslate.error.ErrorCode;
import com.openforge.gazetranslate.gaze.FixationConfig;
import com.openforge.gazetranslate.gaze.TriggerEvent;
import com.openforge.gazetranslate.orchestration.TranslationOutcome;

/**
 * Envelope for everything sent to {@code /topic/translate/{sessionId}}.
 *
 *   type      discriminator, see {@link EventType}
 *   content   human-readable text (status line, error message)
 *   payload   structured body for rich events
 *   timestamp epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranslateEvent(
        String    sessionId,
        EventType type,
        String    content,
        Object    payload,
        long      timestamp
) {

    public static TranslateEvent requestScreenshot(String sessionId, TriggerEvent trigger) {
        return new TranslateEvent(sessionId, EventType.REQUEST_SCREENSHOT, null,
                new ScreenshotRequestPayload(trigger.x(), trigger.y(), trigger.confidence()), now());
    }

    public static TranslateEvent status(String sessionId, String message) {
        return new TranslateEvent(sessionId, EventType.STATUS, message, null, now());
    }

    public static TranslateEvent result(String sessionId, TranslationOutcome outcome) {
        return new TranslateEvent(sessionId, EventType.TRANSLATION_RESULT, outcome.translation(), outcome, now());
    }

    public static TranslateEvent noText(String sessionId) {
        return new TranslateEvent(sessionId, EventType.NO_TEXT, "No text found in the captured area", null, now());
    }

    public static TranslateEvent configUpdated(String sessionId, FixationConfig config) {
        return new TranslateEvent(sessionId, EventType.CONFIG_UPDATED, null, config, now());
    }

    public static TranslateEvent error(String sessionId, ErrorCode code, String message) {
        return new TranslateEvent(sessionId, EventType.ERROR, message, new ErrorPayload(code, message), now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    public record ScreenshotRequestPayload(double x, double y, double confidence) {}

    public record ErrorPayload(ErrorCode code, String message) {}
}
