package com.openforge.gazetranslate.gaze;

/**
 * A candidate fixation being accumulated. The anchor is the first sample of
 * the window and never moves; slow drift inside the radius keeps the timer.
 */
public record FixationWindow(double anchorX, double anchorY, long startedAt, int sampleCount) {

    static FixationWindow openAt(GazeSample sample) {
        return new FixationWindow(sample.x(), sample.y(), sample.timestampMs(), 1);
    }

    FixationWindow withSample() {
        return new FixationWindow(anchorX, anchorY, startedAt, sampleCount + 1);
    }
}
