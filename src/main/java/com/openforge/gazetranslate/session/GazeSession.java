package com.openforge.gazetranslate.session;

import com.openforge.gazetranslate.gaze.FixationDetector;
import com.openforge.gazetranslate.gaze.GazeMode;
import com.openforge.gazetranslate.gaze.GazeSample;
import com.openforge.gazetranslate.gaze.TriggerEvent;
import com.openforge.gazetranslate.memory.LanguagePair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * One connected headset: its detector, language pair and the screenshot it
 * was asked for. Samples are processed one at a time; at most one capture is
 * in flight, so a fixation completed meanwhile does not request another
 * screenshot.
 */
@Slf4j
public class GazeSession {

    private final String           sessionId;
    private final String           ownerId;
    private final GazeMode         mode;
    private final FixationDetector detector;
    private final Instant          createdAt;
    @Nullable
    private final String           deviceType;

    private volatile LanguagePair languages;
    private volatile String       connectionId;

    // Guarded by this.
    private TriggerEvent pendingTrigger;
    private Instant      captureRequestedAt;

    public GazeSession(String sessionId,
                       String ownerId,
                       LanguagePair languages,
                       GazeMode mode,
                       FixationDetector detector,
                       @Nullable String deviceType,
                       Instant createdAt) {
        this.sessionId  = sessionId;
        this.ownerId    = ownerId;
        this.languages  = languages;
        this.mode       = mode;
        this.detector   = detector;
        this.deviceType = deviceType;
        this.createdAt  = createdAt;
    }

    /**
     * Feeds one sample. Returns the trigger only when it should result in a
     * screenshot request, that is when no other capture is pending.
     */
    public synchronized Optional<TriggerEvent> onSample(GazeSample sample, Instant now, Duration captureTimeout) {
        Optional<TriggerEvent> trigger = detector.processSample(sample);
        if (trigger.isEmpty()) {
            return Optional.empty();
        }
        if (pendingTrigger != null && now.isBefore(captureRequestedAt.plus(captureTimeout))) {
            log.debug("[Session] {} trigger suppressed, capture already in flight", sessionId);
            return Optional.empty();
        }
        pendingTrigger = trigger.get();
        captureRequestedAt = now;
        return trigger;
    }

    /** The trigger the incoming screenshot answers, or null for an unsolicited one. */
    @Nullable
    public synchronized TriggerEvent pendingTrigger() {
        return pendingTrigger;
    }

    public synchronized boolean captureInFlight() {
        return pendingTrigger != null;
    }

    public synchronized void finishCapture() {
        pendingTrigger = null;
        captureRequestedAt = null;
    }

    public String sessionId()           { return sessionId; }
    public String ownerId()             { return ownerId; }
    public GazeMode mode()              { return mode; }
    public FixationDetector detector()  { return detector; }
    public Instant createdAt()          { return createdAt; }
    @Nullable public String deviceType() { return deviceType; }

    public LanguagePair languages() {
        return languages;
    }

    public void changeLanguages(LanguagePair languages) {
        this.languages = languages;
    }

    @Nullable
    public String connectionId() {
        return connectionId;
    }

    void bindConnection(String connectionId) {
        this.connectionId = connectionId;
    }
}
