package com.openforge.gazetranslate.domain;

/** What made the client capture the text. */
public enum CaptureTrigger {
    GAZE,
    MANUAL,
    VOICE,
    GESTURE
}
