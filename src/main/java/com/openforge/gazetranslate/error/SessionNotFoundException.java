package com.openforge.gazetranslate.error;

public class SessionNotFoundException extends GazeTranslateException {

    public SessionNotFoundException(String sessionId) {
        super(ErrorCode.NOT_FOUND, "Gaze session not found: " + sessionId);
    }
}
