package com.openforge.gazetranslate.ocr;

import com.openforge.gazetranslate.error.ExternalServiceException;
import com.openforge.gazetranslate.error.GazeTranslateException;
import com.openforge.gazetranslate.error.ValidationException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * {@code performOcr(image) -> text} behind the "ocr" circuit breaker.
 * Returns trimmed text; an empty string means the image held no text.
 */
@Slf4j
@Service
@EnableConfigurationProperties(OcrProperties.class)
public class OcrService {

    private final OcrEngine      engine;
    private final CircuitBreaker circuitBreaker;
    private final OcrProperties  props;

    public OcrService(OcrEngine engine, CircuitBreaker ocrCircuitBreaker, OcrProperties props) {
        this.engine         = engine;
        this.circuitBreaker = ocrCircuitBreaker;
        this.props          = props;
    }

    public String performOcr(byte[] image) {
        if (image == null || image.length == 0) {
            throw new ValidationException("Image is empty");
        }
        if (image.length > props.maxImageBytes()) {
            throw new ValidationException("Image exceeds %d bytes".formatted(props.maxImageBytes()));
        }

        Supplier<String> decorated = CircuitBreaker.decorateSupplier(circuitBreaker, () -> engine.recognize(image));
        try {
            String text = decorated.get();
            return text == null ? "" : text.strip();
        } catch (CallNotPermittedException e) {
            throw ExternalServiceException.ocr("OCR temporarily unavailable (circuit open)", e);
        } catch (GazeTranslateException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[OCR] {} engine failed unexpectedly: {}", engine.name(), e.getMessage(), e);
            throw ExternalServiceException.ocr("Failed to recognize text from image", e);
        }
    }

    public String engineName() {
        return engine.name();
    }
}
