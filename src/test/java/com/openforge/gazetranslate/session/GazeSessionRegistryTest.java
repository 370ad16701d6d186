package com.openforge.gazetranslate.session;

import com.openforge.gazetranslate.error.SessionNotFoundException;
import com.openforge.gazetranslate.error.ValidationException;
import com.openforge.gazetranslate.gaze.FixationConfig;
import com.openforge.gazetranslate.gaze.FixationProperties;
import com.openforge.gazetranslate.gaze.GazeMode;
import com.openforge.gazetranslate.gaze.GazeSample;
import com.openforge.gazetranslate.memory.LanguagePair;
import com.openforge.gazetranslate.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GazeSessionRegistryTest {

    private static final LanguagePair AUTO_EN = LanguagePair.of("auto", "en");

    private MutableClock clock;
    private GazeSessionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T08:00:00Z"));
        registry = new GazeSessionRegistry(FixationProperties.defaults(),
                new SessionProperties(Duration.ofSeconds(30), 2), clock);
    }

    @Test
    void openUsesPresetForRequestedMode() {
        GazeSession eye = registry.open("alice", AUTO_EN, null, "quest-3");
        GazeSession head = registry.open("alice", AUTO_EN, GazeMode.HEAD, null);

        assertThat(eye.mode()).isEqualTo(GazeMode.EYE);
        assertThat(eye.detector().config()).isEqualTo(new FixationConfig(50, 1000, 0.5));
        assertThat(head.detector().config()).isEqualTo(new FixationConfig(80, 1500, 0.0));
        assertThat(eye.sessionId()).isNotEqualTo(head.sessionId());
        assertThat(registry.get(eye.sessionId())).isSameAs(eye);
    }

    @Test
    void sessionCountIsBounded() {
        registry.open("alice", AUTO_EN, null, null);
        registry.open("bob", AUTO_EN, null, null);

        assertThatThrownBy(() -> registry.open("carol", AUTO_EN, null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void unknownSessionIsNotFound() {
        assertThatThrownBy(() -> registry.get("nope")).isInstanceOf(SessionNotFoundException.class);
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void sessionBindsToFirstConnection() {
        GazeSession session = registry.open("alice", AUTO_EN, null, null);

        assertThat(registry.attach(session.sessionId(), "conn-1")).isSameAs(session);
        assertThat(registry.attach(session.sessionId(), "conn-1")).isSameAs(session);
        assertThatThrownBy(() -> registry.attach(session.sessionId(), "conn-2"))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void disconnectDiscardsBoundSessions() {
        GazeSession bound = registry.open("alice", AUTO_EN, null, null);
        GazeSession other = registry.open("bob", AUTO_EN, null, null);
        registry.attach(bound.sessionId(), "conn-1");

        registry.onDisconnect(new SessionDisconnectEvent(this,
                MessageBuilder.withPayload(new byte[0]).build(), "conn-1", CloseStatus.NORMAL));

        assertThat(registry.find(bound.sessionId())).isEmpty();
        assertThat(registry.find(other.sessionId())).isPresent();
    }

    @Test
    void closeRemovesSession() {
        GazeSession session = registry.open("alice", AUTO_EN, null, null);

        assertThat(registry.close(session.sessionId())).isTrue();
        assertThat(registry.close(session.sessionId())).isFalse();
    }

    @Test
    void secondFixationIsSuppressedWhileCaptureIsPending() {
        GazeSession session = registry.open("alice", AUTO_EN, null, null);
        Duration timeout = registry.captureTimeout();

        session.onSample(new GazeSample(100, 100, 0, 0.9), clock.instant(), timeout);
        assertThat(session.onSample(new GazeSample(100, 100, 1_000, 0.9), clock.instant(), timeout)).isPresent();
        assertThat(session.captureInFlight()).isTrue();

        session.onSample(new GazeSample(300, 300, 1_100, 0.9), clock.instant(), timeout);
        assertThat(session.onSample(new GazeSample(300, 300, 2_100, 0.9), clock.instant(), timeout)).isEmpty();
        assertThat(session.pendingTrigger().x()).isEqualTo(100);

        session.finishCapture();
        session.onSample(new GazeSample(300, 300, 2_200, 0.9), clock.instant(), timeout);
        assertThat(session.onSample(new GazeSample(300, 300, 3_200, 0.9), clock.instant(), timeout)).isPresent();
    }

    @Test
    void staleCaptureNoLongerBlocksNewTriggers() {
        GazeSession session = registry.open("alice", AUTO_EN, null, null);
        Duration timeout = registry.captureTimeout();

        session.onSample(new GazeSample(100, 100, 0, 0.9), clock.instant(), timeout);
        session.onSample(new GazeSample(100, 100, 1_000, 0.9), clock.instant(), timeout);
        clock.advance(Duration.ofSeconds(31));

        session.onSample(new GazeSample(100, 100, 32_000, 0.9), clock.instant(), timeout);
        assertThat(session.onSample(new GazeSample(100, 100, 33_000, 0.9), clock.instant(), timeout)).isPresent();
    }
}
