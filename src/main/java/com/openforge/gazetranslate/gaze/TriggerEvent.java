package com.openforge.gazetranslate.gaze;

/**
 * Emitted once per qualifying fixation. Coordinates are the window anchor;
 * confidence and timestamp come from the sample that completed the fixation.
 */
public record TriggerEvent(double x, double y, double confidence, long timestamp) {
}
