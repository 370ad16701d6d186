package com.openforge.gazetranslate.error;

/**
 * Failure of an external collaborator (OCR or machine translation), including
 * timeouts. {@code retryable} tells the collaborator-level retry whether a
 * second attempt can help (network errors, 429, 5xx).
 */
public class ExternalServiceException extends GazeTranslateException {

    private final boolean retryable;

    public ExternalServiceException(ErrorCode code, String message, boolean retryable) {
        super(code, message);
        this.retryable = retryable;
    }

    public ExternalServiceException(ErrorCode code, String message, boolean retryable, Throwable cause) {
        super(code, message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static ExternalServiceException ocr(String message, Throwable cause) {
        return new ExternalServiceException(ErrorCode.OCR_ERROR, message, false, cause);
    }

    public static ExternalServiceException translation(String message, boolean retryable) {
        return new ExternalServiceException(ErrorCode.TRANSLATION_ERROR, message, retryable);
    }

    public static ExternalServiceException timeout(String message, Throwable cause) {
        return new ExternalServiceException(ErrorCode.TIMEOUT, message, false, cause);
    }
}
