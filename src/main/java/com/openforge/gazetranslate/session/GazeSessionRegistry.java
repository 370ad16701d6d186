package com.openforge.gazetranslate.session;

import com.openforge.gazetranslate.error.SessionNotFoundException;
import com.openforge.gazetranslate.error.ValidationException;
import com.openforge.gazetranslate.gaze.FixationDetector;
import com.openforge.gazetranslate.gaze.FixationProperties;
import com.openforge.gazetranslate.gaze.GazeMode;
import com.openforge.gazetranslate.memory.LanguagePair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.event.EventListener;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live gaze sessions, in memory. A session is bound to the STOMP connection
 * that first talks to it; when that connection drops, the session and its
 * detector are discarded.
 */
@Slf4j
@Component
@EnableConfigurationProperties({FixationProperties.class, SessionProperties.class})
public class GazeSessionRegistry {

    private final Map<String, GazeSession> sessions = new ConcurrentHashMap<>();

    private final FixationProperties fixationProps;
    private final SessionProperties  sessionProps;
    private final Clock              clock;

    public GazeSessionRegistry(FixationProperties fixationProps, SessionProperties sessionProps, Clock clock) {
        this.fixationProps = fixationProps;
        this.sessionProps  = sessionProps;
        this.clock         = clock;
    }

    public GazeSession open(String ownerId,
                            LanguagePair languages,
                            @Nullable GazeMode mode,
                            @Nullable String deviceType) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("ownerId is required");
        }
        if (sessions.size() >= sessionProps.maxSessions()) {
            throw new ValidationException("Too many open gaze sessions");
        }
        GazeMode effective = mode != null ? mode : fixationProps.defaultMode();
        FixationDetector detector = new FixationDetector(fixationProps.configFor(effective));
        String sessionId = UUID.randomUUID().toString();
        GazeSession session = new GazeSession(sessionId, ownerId, languages, effective, detector,
                deviceType, clock.instant());
        sessions.put(sessionId, session);
        log.info("[Session] Opened {} for owner {} ({}, {})", sessionId, ownerId, languages, effective);
        return session;
    }

    public GazeSession get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Optional<GazeSession> find(String sessionId) {
        return Optional.ofNullable(sessionId).map(sessions::get);
    }

    /**
     * Resolves the session for an inbound STOMP message and binds it to the
     * connection on first contact. A session bound to another connection is
     * treated as unknown.
     */
    public GazeSession attach(String sessionId, @Nullable String connectionId) {
        GazeSession session = get(sessionId);
        if (connectionId == null) {
            return session;
        }
        synchronized (session) {
            if (session.connectionId() == null) {
                session.bindConnection(connectionId);
                log.debug("[Session] {} bound to connection {}", sessionId, connectionId);
            } else if (!session.connectionId().equals(connectionId)) {
                throw new SessionNotFoundException(sessionId);
            }
        }
        return session;
    }

    public boolean close(String sessionId) {
        GazeSession removed = sessions.remove(sessionId);
        if (removed != null) {
            log.info("[Session] Closed {}", sessionId);
        }
        return removed != null;
    }

    public Collection<GazeSession> all() {
        return List.copyOf(sessions.values());
    }

    public Duration captureTimeout() {
        return sessionProps.captureTimeout();
    }

    public Clock clock() {
        return clock;
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        String connectionId = event.getSessionId();
        sessions.values().removeIf(s -> {
            boolean bound = connectionId.equals(s.connectionId());
            if (bound) {
                log.info("[Session] Discarded {} after connection {} closed", s.sessionId(), connectionId);
            }
            return bound;
        });
    }
}
