package com.openforge.gazetranslate.gaze;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Optional;

/**
 * Turns a noisy gaze stream into discrete "stable enough to act on" events.
 *
 * The decision itself lives in {@link #transition}, a pure function of
 * (open window, sample, config). This object only remembers the current
 * window and config between calls.
 *
 * Threading: one gaze stream drives one detector, but {@link #reset()} usually
 * comes from the thread that finished handling a trigger. Every state change
 * holds the detector's monitor so a reset is never overwritten by a sample
 * that read the window before it.
 */
@Slf4j
public class FixationDetector {

    private FixationConfig config;
    private FixationWindow window;

    public FixationDetector(FixationConfig config) {
        config.validate();
        this.config = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Feeds one sample.
     *
     * @return the trigger when this sample completes a fixation, otherwise empty
     * @throws com.openforge.gazetranslate.error.ValidationException for malformed samples;
     *         the open window is left untouched
     */
    public synchronized Optional<TriggerEvent> processSample(GazeSample sample) {
        sample.validate();
        Transition next = transition(window, sample, config);
        window = next.window();
        next.trigger().ifPresent(t ->
                log.debug("[Fixation] Trigger at ({}, {}) confidence={}", t.x(), t.y(), t.confidence()));
        return next.trigger();
    }

    /** Applies a new calibration and drops the open window so it takes effect at once. */
    public synchronized void updateConfig(FixationConfig newConfig) {
        newConfig.validate();
        this.config = newConfig;
        this.window = null;
        log.info("[Fixation] Config updated: radius={}px duration={}ms minConfidence={}",
                newConfig.stabilityRadiusPx(), newConfig.minDurationMs(), newConfig.minConfidence());
    }

    /** Discards any open window; a re-fixation on the same spot can trigger again. */
    public synchronized void reset() {
        window = null;
    }

    public synchronized FixationConfig config() {
        return config;
    }

    @Nullable
    public synchronized FixationWindow currentWindow() {
        return window;
    }

    // ── State transition ─────────────────────────────────────────────────────

    /**
     * One step of the fixation state machine. No side effects.
     *
     * @param window open window or {@code null}
     * @param sample a sample that already passed {@link GazeSample#validate()}
     * @param config calibration in force
     */
    public static Transition transition(@Nullable FixationWindow window,
                                        GazeSample sample,
                                        FixationConfig config) {
        // Confidence dropouts must not cancel a fixation in progress.
        if (sample.confidence() < config.minConfidence()) {
            return new Transition(window, Optional.empty());
        }
        if (window == null) {
            return new Transition(FixationWindow.openAt(sample), Optional.empty());
        }

        double distance = sample.distanceTo(window.anchorX(), window.anchorY());
        if (distance > config.stabilityRadiusPx()) {
            // Attention moved: restart, partial progress is discarded.
            return new Transition(FixationWindow.openAt(sample), Optional.empty());
        }

        FixationWindow grown = window.withSample();
        if (sample.timestampMs() - grown.startedAt() >= config.minDurationMs()) {
            TriggerEvent trigger = new TriggerEvent(
                    grown.anchorX(), grown.anchorY(), sample.confidence(), sample.timestampMs());
            return new Transition(null, Optional.of(trigger));
        }
        return new Transition(grown, Optional.empty());
    }

    /** Result of {@link #transition}: the next window (nullable) and an optional trigger. */
    public record Transition(@Nullable FixationWindow window, Optional<TriggerEvent> trigger) {}
}
