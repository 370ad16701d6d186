package com.openforge.gazetranslate.translation;

import com.openforge.gazetranslate.error.ErrorCode;
import com.openforge.gazetranslate.error.ExternalServiceException;
import com.openforge.gazetranslate.error.GazeTranslateException;
import com.openforge.gazetranslate.error.ValidationException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * {@code translateText(text, src, dst) -> text} behind the "translation"
 * circuit breaker and retry. Only failures flagged retryable (network, 429,
 * 5xx) are retried.
 *
 * No caching here: whether a translation is needed is the memory's call.
 */
@Slf4j
@Service
@EnableConfigurationProperties(TranslationProperties.class)
public class TranslationService {

    private final TranslationEngine     engine;
    private final CircuitBreaker        circuitBreaker;
    private final Retry                 retry;
    private final TranslationProperties props;

    public TranslationService(TranslationEngine engine,
                              CircuitBreaker translationCircuitBreaker,
                              Retry translationRetry,
                              TranslationProperties props) {
        this.engine         = engine;
        this.circuitBreaker = translationCircuitBreaker;
        this.retry          = translationRetry;
        this.props          = props;
    }

    public String translateText(String text, String sourceLang, String targetLang) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Text to translate is empty");
        }
        if (text.length() > props.maxTextLength()) {
            throw new ValidationException("Text exceeds %d characters".formatted(props.maxTextLength()));
        }

        Supplier<String> decorated = CircuitBreaker.decorateSupplier(circuitBreaker,
                Retry.decorateSupplier(retry, () -> engine.translate(text, sourceLang, targetLang)));
        try {
            String translated = decorated.get();
            if (translated == null || translated.isBlank()) {
                throw ExternalServiceException.translation("Translation engine returned an empty result", false);
            }
            log.debug("[Translate] {} {}→{}: {} chars", engine.name(), sourceLang, targetLang, translated.length());
            return translated;
        } catch (CallNotPermittedException e) {
            throw ExternalServiceException.translation("Translation temporarily unavailable (circuit open)", false);
        } catch (GazeTranslateException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[Translate] {} engine failed unexpectedly: {}", engine.name(), e.getMessage(), e);
            throw new ExternalServiceException(ErrorCode.TRANSLATION_ERROR,
                    "Failed to translate text", false, e);
        }
    }

    public String engineName() {
        return engine.name();
    }
}
