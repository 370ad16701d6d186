package com.openforge.gazetranslate.translation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Translation backend selection.
 *
 * application.yml:
 *
 * app:
 *   translation:
 *     engine: mock            # mock | deepl
 *     base-url: https://api-free.deepl.com
 *     api-key: ${DEEPL_API_KEY:}
 *     timeout-seconds: 10
 *     max-text-length: 5000
 */
@ConfigurationProperties(prefix = "app.translation")
public record TranslationProperties(
        @DefaultValue("mock")                       String engine,
        @DefaultValue("https://api-free.deepl.com") String baseUrl,
        @DefaultValue("")                           String apiKey,
        @DefaultValue("10")                         int    timeoutSeconds,
        @DefaultValue("5000")                       int    maxTextLength
) {}
