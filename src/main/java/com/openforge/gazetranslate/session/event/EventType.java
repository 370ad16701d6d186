package com.openforge.gazetranslate.session.event;

/**
 * Classifies every event pushed to a gaze session's topic.
 *
 * Flow: REQUEST_SCREENSHOT → (client sends screenshot) → STATUS → TRANSLATION_RESULT | NO_TEXT | ERROR.
 */
public enum EventType {

    /** A fixation completed; the client should capture around payload {x, y}. */
    REQUEST_SCREENSHOT,

    /** Progress note. content = message. */
    STATUS,

    /** payload = TranslationOutcome. */
    TRANSLATION_RESULT,

    /** The screenshot held no recognisable text. */
    NO_TEXT,

    /** Calibration applied. payload = FixationConfig. */
    CONFIG_UPDATED,

    /** Recoverable failure. payload = {code, message}. */
    ERROR
}
