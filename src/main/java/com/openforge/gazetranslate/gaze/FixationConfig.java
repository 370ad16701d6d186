package com.openforge.gazetranslate.gaze;

import com.openforge.gazetranslate.error.ValidationException;

/**
 * Per-session calibration of the fixation detector.
 *
 * @param stabilityRadiusPx max distance from the anchor that still counts as the same fixation
 * @param minDurationMs     how long the gaze must stay inside the radius before a trigger
 * @param minConfidence     samples below this confidence are ignored
 */
public record FixationConfig(double stabilityRadiusPx, long minDurationMs, double minConfidence) {

    public void validate() {
        if (!Double.isFinite(stabilityRadiusPx) || stabilityRadiusPx <= 0) {
            throw new ValidationException("stabilityRadiusPx must be a positive number, got " + stabilityRadiusPx);
        }
        if (minDurationMs <= 0) {
            throw new ValidationException("minDurationMs must be positive, got " + minDurationMs);
        }
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
            throw new ValidationException("minConfidence must be within [0,1], got " + minConfidence);
        }
    }
}
