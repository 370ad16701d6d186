package com.openforge.gazetranslate.session;

import com.openforge.gazetranslate.error.ErrorCode;
import com.openforge.gazetranslate.error.ValidationException;
import com.openforge.gazetranslate.gaze.FixationConfig;
import com.openforge.gazetranslate.gaze.FixationDetector;
import com.openforge.gazetranslate.gaze.FixationProperties;
import com.openforge.gazetranslate.gaze.GazeMode;
import com.openforge.gazetranslate.memory.LanguagePair;
import com.openforge.gazetranslate.orchestration.CaptureRequest;
import com.openforge.gazetranslate.orchestration.TranslationOrchestrator;
import com.openforge.gazetranslate.orchestration.TranslationOutcome;
import com.openforge.gazetranslate.session.dto.FixationConfigMessage;
import com.openforge.gazetranslate.session.dto.GazeSampleMessage;
import com.openforge.gazetranslate.session.dto.ScreenshotMessage;
import com.openforge.gazetranslate.session.event.EventType;
import com.openforge.gazetranslate.session.event.TranslateEvent;
import com.openforge.gazetranslate.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GazeSessionControllerTest {

    private static final String PNG = Base64.getEncoder().encodeToString("fake-png".getBytes(StandardCharsets.UTF_8));

    @Mock
    private TranslationOrchestrator orchestrator;

    @Mock
    private TranslateEventPublisher publisher;

    private ExecutorService executor;
    private GazeSessionRegistry registry;
    private GazeSessionController controller;
    private GazeSession session;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        registry = new GazeSessionRegistry(FixationProperties.defaults(), SessionProperties.defaults(),
                new MutableClock(Instant.parse("2024-03-01T08:00:00Z")));
        controller = new GazeSessionController(registry, orchestrator, publisher,
                FixationProperties.defaults(), executor);
        session = registry.open("alice", LanguagePair.of("auto", "en"), GazeMode.EYE, "quest-3");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void stableGazeRequestsOneScreenshot() {
        controller.gaze(session.sessionId(), sample(400, 300, 0, 0.9), headers());
        controller.gaze(session.sessionId(), sample(402, 301, 1_000, 0.9), headers());
        // a second fixation while the screenshot is outstanding
        controller.gaze(session.sessionId(), sample(402, 301, 1_100, 0.9), headers());
        controller.gaze(session.sessionId(), sample(402, 301, 2_100, 0.9), headers());

        List<TranslateEvent> events = published();
        assertThat(events).extracting(TranslateEvent::type).containsExactly(EventType.REQUEST_SCREENSHOT);
        assertThat(events.get(0).payload())
                .isEqualTo(new TranslateEvent.ScreenshotRequestPayload(400, 300, 0.9));
    }

    @Test
    void screenshotIsTranslatedOffTheInboundThread() throws Exception {
        controller.gaze(session.sessionId(), sample(400, 300, 0, 0.9), headers());
        controller.gaze(session.sessionId(), sample(400, 300, 1_000, 0.9), headers());
        TranslationOutcome outcome = new TranslationOutcome(TranslationOutcome.Status.TRANSLATED,
                "Sortie", "Exit", false, 12, 4L, List.of(), null, null);
        when(orchestrator.handleCapture(any(CaptureRequest.class), any(FixationDetector.class))).thenReturn(outcome);

        controller.screenshot(session.sessionId(),
                new ScreenshotMessage("data:image/png;base64," + PNG, null, null), headers());
        awaitCaptures();

        ArgumentCaptor<CaptureRequest> request = ArgumentCaptor.forClass(CaptureRequest.class);
        verify(orchestrator).handleCapture(request.capture(), any(FixationDetector.class));
        assertThat(new String(request.getValue().image(), StandardCharsets.UTF_8)).isEqualTo("fake-png");
        assertThat(request.getValue().trigger()).isNotNull();
        assertThat(request.getValue().ownerId()).isEqualTo("alice");
        assertThat(request.getValue().languages()).isEqualTo(LanguagePair.of("auto", "en"));

        assertThat(published()).extracting(TranslateEvent::type).containsExactly(
                EventType.REQUEST_SCREENSHOT, EventType.STATUS, EventType.TRANSLATION_RESULT);
        assertThat(session.captureInFlight()).isFalse();
    }

    @Test
    void screenshotMayOverrideLanguages() throws Exception {
        when(orchestrator.handleCapture(any(CaptureRequest.class), any(FixationDetector.class)))
                .thenReturn(new TranslationOutcome(TranslationOutcome.Status.NO_TEXT,
                        null, null, false, 3, null, List.of(), null, null));

        controller.screenshot(session.sessionId(), new ScreenshotMessage(PNG, "fr", "de"), headers());
        awaitCaptures();

        ArgumentCaptor<CaptureRequest> request = ArgumentCaptor.forClass(CaptureRequest.class);
        verify(orchestrator).handleCapture(request.capture(), any(FixationDetector.class));
        assertThat(request.getValue().languages()).isEqualTo(LanguagePair.of("fr", "de"));
        assertThat(request.getValue().trigger()).isNull();
        assertThat(published()).extracting(TranslateEvent::type).containsExactly(EventType.STATUS, EventType.NO_TEXT);
    }

    @Test
    void failedOutcomeIsReportedAsError() throws Exception {
        when(orchestrator.handleCapture(any(CaptureRequest.class), any(FixationDetector.class)))
                .thenReturn(new TranslationOutcome(TranslationOutcome.Status.FAILED, null, null, false, 30_000,
                        null, List.of(), ErrorCode.TIMEOUT, "Translation unavailable: timed out"));

        controller.screenshot(session.sessionId(), new ScreenshotMessage(PNG, null, null), headers());
        awaitCaptures();

        TranslateEvent last = published().get(1);
        assertThat(last.type()).isEqualTo(EventType.ERROR);
        assertThat(last.payload()).isEqualTo(
                new TranslateEvent.ErrorPayload(ErrorCode.TIMEOUT, "Translation unavailable: timed out"));
    }

    @Test
    void undecodableScreenshotIsRejectedAndRearmsDetector() {
        controller.gaze(session.sessionId(), sample(400, 300, 0, 0.9), headers());
        controller.gaze(session.sessionId(), sample(400, 300, 1_000, 0.9), headers());

        controller.screenshot(session.sessionId(), new ScreenshotMessage("data:image/png;base64,A", null, null), headers());

        TranslateEvent error = published().get(1);
        assertThat(error.type()).isEqualTo(EventType.ERROR);
        assertThat(((TranslateEvent.ErrorPayload) error.payload()).code()).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(session.captureInFlight()).isFalse();
        verifyNoInteractions(orchestrator);
    }

    @Test
    void messagesForUnknownSessionReportNotFound() {
        controller.gaze("missing", sample(1, 1, 0, 1.0), headers());

        TranslateEvent error = published().get(0);
        assertThat(error.sessionId()).isEqualTo("missing");
        assertThat(((TranslateEvent.ErrorPayload) error.payload()).code()).isEqualTo(ErrorCode.NOT_FOUND);
    }

    @Test
    void gazeSampleWithMissingFieldsIsRejected() {
        GazeSession head = registry.open("carol", LanguagePair.of("auto", "en"), GazeMode.HEAD, "quest-3");

        controller.gaze(head.sessionId(), new GazeSampleMessage(null, null, 1_000L, 0.9), headers());
        controller.gaze(head.sessionId(), new GazeSampleMessage(100.0, 100.0, null, null), headers());

        List<TranslateEvent> events = published();
        assertThat(events).extracting(TranslateEvent::type).containsExactly(EventType.ERROR, EventType.ERROR);
        TranslateEvent.ErrorPayload first = (TranslateEvent.ErrorPayload) events.get(0).payload();
        assertThat(first.code()).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(first.message()).contains("x, y");
        assertThat(((TranslateEvent.ErrorPayload) events.get(1).payload()).message())
                .contains("timestamp_ms, confidence");
        assertThat(head.detector().currentWindow()).isNull();
    }

    @Test
    void unreadableGazeBodyIsReportedAsValidationError() {
        controller.unreadablePayload(session.sessionId(),
                new MessageConversionException("Could not read JSON: Unexpected character"));

        TranslateEvent error = published().get(0);
        assertThat(error.type()).isEqualTo(EventType.ERROR);
        assertThat(((TranslateEvent.ErrorPayload) error.payload()).code()).isEqualTo(ErrorCode.VALIDATION_ERROR);
    }

    @Test
    void configMessageRecalibratesDetector() {
        controller.config(session.sessionId(), new FixationConfigMessage(null, 75.0, null, null), headers());

        assertThat(session.detector().config()).isEqualTo(new FixationConfig(75, 1000, 0.5));
        assertThat(published().get(0).type()).isEqualTo(EventType.CONFIG_UPDATED);

        controller.config(session.sessionId(), new FixationConfigMessage(GazeMode.HEAD, null, null, null), headers());
        assertThat(session.detector().config()).isEqualTo(new FixationConfig(80, 1500, 0.0));
    }

    @Test
    void invalidConfigIsRejected() {
        controller.config(session.sessionId(), new FixationConfigMessage(null, -5.0, null, null), headers());

        assertThat(session.detector().config()).isEqualTo(new FixationConfig(50, 1000, 0.5));
        assertThat(published().get(0).type()).isEqualTo(EventType.ERROR);
    }

    @Test
    void decodeImageAcceptsDataUrlsAndWrappedBase64() {
        assertThat(GazeSessionController.decodeImage("data:image/jpeg;base64," + PNG))
                .isEqualTo("fake-png".getBytes(StandardCharsets.UTF_8));
        assertThat(GazeSessionController.decodeImage(PNG.substring(0, 4) + "\r\n" + PNG.substring(4)))
                .isEqualTo("fake-png".getBytes(StandardCharsets.UTF_8));
        assertThatThrownBy(() -> GazeSessionController.decodeImage(" "))
                .isInstanceOf(ValidationException.class);
    }

    private static GazeSampleMessage sample(double x, double y, long timestampMs, double confidence) {
        return new GazeSampleMessage(x, y, timestampMs, confidence);
    }

    private List<TranslateEvent> published() {
        ArgumentCaptor<TranslateEvent> events = ArgumentCaptor.forClass(TranslateEvent.class);
        verify(publisher, atLeastOnce()).publish(events.capture());
        return events.getAllValues();
    }

    private void awaitCaptures() throws InterruptedException {
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    }

    private static SimpMessageHeaderAccessor headers() {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create();
        accessor.setSessionId("conn-1");
        return accessor;
    }
}
