package com.openforge.gazetranslate.error;

/**
 * Root of the service's unchecked exceptions. Every subclass carries an
 * {@link ErrorCode} so transports can render it without instanceof chains.
 */
public abstract class GazeTranslateException extends RuntimeException {

    private final ErrorCode code;

    protected GazeTranslateException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected GazeTranslateException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
