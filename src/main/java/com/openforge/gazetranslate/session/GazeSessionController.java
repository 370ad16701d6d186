package com.openforge.gazetranslate.session;

import com.openforge.gazetranslate.error.ErrorCode;
import com.openforge.gazetranslate.error.GazeTranslateException;
import com.openforge.gazetranslate.error.ValidationException;
import com.openforge.gazetranslate.gaze.FixationConfig;
import com.openforge.gazetranslate.gaze.FixationProperties;
import com.openforge.gazetranslate.memory.LanguagePair;
import com.openforge.gazetranslate.orchestration.CaptureRequest;
import com.openforge.gazetranslate.orchestration.TranslationOrchestrator;
import com.openforge.gazetranslate.orchestration.TranslationOutcome;
import com.openforge.gazetranslate.session.dto.FixationConfigMessage;
import com.openforge.gazetranslate.session.dto.GazeSampleMessage;
import com.openforge.gazetranslate.session.dto.ScreenshotMessage;
import com.openforge.gazetranslate.session.event.TranslateEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.util.Base64;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Inbound STOMP traffic of a gaze session.
 *
 *   /app/sessions/{id}/gaze        GazeSampleMessage   → maybe REQUEST_SCREENSHOT
 *   /app/sessions/{id}/screenshot  ScreenshotMessage   → STATUS, then TRANSLATION_RESULT | NO_TEXT | ERROR
 *   /app/sessions/{id}/config      FixationConfigMessage → CONFIG_UPDATED
 *
 * Replies go to /topic/translate/{id}. Screenshots are handled on the
 * capture pool so OCR and translation never block the inbound channel.
 */
@Slf4j
@Controller
public class GazeSessionController {

    private static final String DATA_URL_MARKER = ";base64,";

    private final GazeSessionRegistry      registry;
    private final TranslationOrchestrator  orchestrator;
    private final TranslateEventPublisher  publisher;
    private final FixationProperties       fixationProps;
    private final ExecutorService          captureExecutor;

    public GazeSessionController(GazeSessionRegistry registry,
                                 TranslationOrchestrator orchestrator,
                                 TranslateEventPublisher publisher,
                                 FixationProperties fixationProps,
                                 @Qualifier("captureExecutor") ExecutorService captureExecutor) {
        this.registry        = registry;
        this.orchestrator    = orchestrator;
        this.publisher       = publisher;
        this.fixationProps   = fixationProps;
        this.captureExecutor = captureExecutor;
    }

    @MessageMapping("/sessions/{sessionId}/gaze")
    public void gaze(@DestinationVariable String sessionId,
                     @Payload GazeSampleMessage message,
                     SimpMessageHeaderAccessor headers) {
        try {
            GazeSession session = registry.attach(sessionId, headers.getSessionId());
            session.onSample(message.toSample(), registry.clock().instant(), registry.captureTimeout())
                    .ifPresent(trigger -> {
                        log.info("[Session] {} fixation at ({}, {}), requesting screenshot",
                                sessionId, trigger.x(), trigger.y());
                        publisher.publish(TranslateEvent.requestScreenshot(sessionId, trigger));
                    });
        } catch (GazeTranslateException e) {
            reportError(sessionId, e);
        }
    }

    @MessageMapping("/sessions/{sessionId}/screenshot")
    public void screenshot(@DestinationVariable String sessionId,
                           @Payload ScreenshotMessage message,
                           SimpMessageHeaderAccessor headers) {
        GazeSession attached = null;
        CaptureRequest built;
        try {
            attached = registry.attach(sessionId, headers.getSessionId());
            built = new CaptureRequest(
                    attached.ownerId(),
                    decodeImage(message.image()),
                    languagesFor(attached, message),
                    sessionId,
                    attached.pendingTrigger(),
                    attached.deviceType());
        } catch (GazeTranslateException e) {
            if (attached != null) {
                attached.finishCapture();
                attached.detector().reset();
            }
            reportError(sessionId, e);
            return;
        }
        final GazeSession session = attached;
        final CaptureRequest request = built;

        publisher.publish(TranslateEvent.status(sessionId, "Recognising text…"));
        try {
            captureExecutor.submit(() -> runCapture(session, request));
        } catch (RejectedExecutionException e) {
            log.warn("[Session] {} capture rejected: {}", sessionId, e.getMessage());
            session.finishCapture();
            session.detector().reset();
            publisher.publish(TranslateEvent.error(sessionId, ErrorCode.INTERNAL_ERROR,
                    "Translation unavailable, server is busy"));
        }
    }

    @MessageMapping("/sessions/{sessionId}/config")
    public void config(@DestinationVariable String sessionId,
                       @Payload FixationConfigMessage message,
                       SimpMessageHeaderAccessor headers) {
        try {
            GazeSession session = registry.attach(sessionId, headers.getSessionId());
            FixationConfig updated = message.applyTo(session.detector().config(), fixationProps);
            session.detector().updateConfig(updated);
            publisher.publish(TranslateEvent.configUpdated(sessionId, updated));
        } catch (GazeTranslateException e) {
            reportError(sessionId, e);
        }
    }

    /** Bodies that are not valid JSON for the target type never reach a handler. */
    @MessageExceptionHandler(MessageConversionException.class)
    public void unreadablePayload(@DestinationVariable String sessionId, MessageConversionException e) {
        reportError(sessionId,
                new ValidationException("Malformed message body: " + e.getMostSpecificCause().getMessage()));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private void runCapture(GazeSession session, CaptureRequest request) {
        String sessionId = session.sessionId();
        try {
            TranslationOutcome outcome = orchestrator.handleCapture(request, session.detector());
            if (registry.find(sessionId).isEmpty()) {
                log.debug("[Session] {} closed before its capture finished, dropping result", sessionId);
                return;
            }
            switch (outcome.status()) {
                case TRANSLATED -> publisher.publish(TranslateEvent.result(sessionId, outcome));
                case NO_TEXT    -> publisher.publish(TranslateEvent.noText(sessionId));
                case FAILED     -> publisher.publish(
                        TranslateEvent.error(sessionId, outcome.errorCode(), outcome.errorMessage()));
            }
        } catch (Exception e) {
            log.error("[Session] {} uncaught exception in capture: {}", sessionId, e.getMessage(), e);
            publisher.publish(TranslateEvent.error(sessionId, ErrorCode.INTERNAL_ERROR,
                    "Translation unavailable, please try again"));
        } finally {
            session.finishCapture();
        }
    }

    private static LanguagePair languagesFor(GazeSession session, ScreenshotMessage message) {
        if (message.sourceLang() == null && message.targetLang() == null) {
            return session.languages();
        }
        LanguagePair current = session.languages();
        return LanguagePair.of(
                message.sourceLang() != null ? message.sourceLang() : current.sourceLang(),
                message.targetLang() != null ? message.targetLang() : current.targetLang());
    }

    static byte[] decodeImage(String image) {
        if (image == null || image.isBlank()) {
            throw new ValidationException("Screenshot image is empty");
        }
        int marker = image.indexOf(DATA_URL_MARKER);
        String base64 = marker >= 0 ? image.substring(marker + DATA_URL_MARKER.length()) : image;
        try {
            return Base64.getMimeDecoder().decode(base64.strip());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Screenshot image is not valid base64");
        }
    }

    private void reportError(String sessionId, GazeTranslateException e) {
        log.warn("[Session] {} rejected message ({}): {}", sessionId, e.code(), e.getMessage());
        publisher.publish(TranslateEvent.error(sessionId, e.code(), e.getMessage()));
    }
}
