package com.openforge.gazetranslate.ocr;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * OCR backend selection and limits.
 *
 * application.yml:
 *
 * app:
 *   ocr:
 *     engine: mock            # mock | http
 *     base-url: http://localhost:8868
 *     api-key: ${OCR_API_KEY:}
 *     timeout-seconds: 15
 *     max-image-bytes: 10485760
 *     mock-text: "This is a mock OCR result from the server."
 */
@ConfigurationProperties(prefix = "app.ocr")
public record OcrProperties(
        @DefaultValue("mock")     String engine,
        @DefaultValue("http://localhost:8868") String baseUrl,
        @DefaultValue("")         String apiKey,
        @DefaultValue("15")       int    timeoutSeconds,
        @DefaultValue("10485760") int    maxImageBytes,
        @DefaultValue("This is a mock OCR result from the server.") String mockText
) {}
