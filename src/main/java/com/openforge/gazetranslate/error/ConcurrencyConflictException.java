package com.openforge.gazetranslate.error;

/**
 * Raised when a write on a fragment still conflicts after one retry.
 * Per-owner serialisation makes this rare; it mostly signals a second node.
 */
public class ConcurrencyConflictException extends GazeTranslateException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(ErrorCode.CONCURRENCY_CONFLICT, message, cause);
    }
}
