package com.openforge.gazetranslate.gaze;

import com.openforge.gazetranslate.error.ValidationException;

/**
 * One timestamped gaze point in screen space, as delivered by the headset.
 * Transient: consumed once by a {@link FixationDetector}, never stored.
 *
 * @param x           horizontal position in pixels
 * @param y           vertical position in pixels
 * @param timestampMs client clock in epoch millis
 * @param confidence  tracker confidence, 0..1 (head gaze sends 1.0)
 */
public record GazeSample(double x, double y, long timestampMs, double confidence) {

    /**
     * Rejects samples that would poison the detector's arithmetic.
     *
     * @throws ValidationException on NaN/infinite coordinates or confidence outside [0,1]
     */
    public void validate() {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new ValidationException("Gaze sample has non-finite coordinates: (%s, %s)".formatted(x, y));
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new ValidationException("Gaze sample confidence must be within [0,1], got " + confidence);
        }
        if (timestampMs < 0) {
            throw new ValidationException("Gaze sample timestamp must not be negative, got " + timestampMs);
        }
    }

    double distanceTo(double otherX, double otherY) {
        return Math.hypot(x - otherX, y - otherY);
    }
}
