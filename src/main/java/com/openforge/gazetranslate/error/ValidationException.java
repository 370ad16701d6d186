package com.openforge.gazetranslate.error;

/** Malformed input (gaze sample, config, request field). Never mutates state. */
public class ValidationException extends GazeTranslateException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
