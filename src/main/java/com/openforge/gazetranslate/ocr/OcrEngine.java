package com.openforge.gazetranslate.ocr;

/**
 * Text recognition backend. Implementations throw
 * {@link com.openforge.gazetranslate.error.ExternalServiceException} on failure
 * and return an empty string when the image holds no text.
 */
public interface OcrEngine {

    String name();

    String recognize(byte[] image);
}
