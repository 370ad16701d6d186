package com.openforge.gazetranslate.orchestration;

import com.openforge.gazetranslate.error.ErrorCode;
import com.openforge.gazetranslate.error.ExternalServiceException;
import com.openforge.gazetranslate.error.GazeTranslateException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Bounds the blocking OCR and translation calls with the "ocr" and
 * "translation" time limiters. The call runs on the external-call pool; a
 * timeout becomes {@link ErrorCode#TIMEOUT}.
 */
@Component
public class ExternalCallGuard {

    private final TimeLimiter     ocrTimeLimiter;
    private final TimeLimiter     translationTimeLimiter;
    private final ExecutorService executor;

    public ExternalCallGuard(TimeLimiter ocrTimeLimiter,
                             TimeLimiter translationTimeLimiter,
                             @Qualifier("externalCallExecutor") ExecutorService executor) {
        this.ocrTimeLimiter         = ocrTimeLimiter;
        this.translationTimeLimiter = translationTimeLimiter;
        this.executor               = executor;
    }

    public <T> T ocr(Supplier<T> call) {
        return withTimeout(ocrTimeLimiter, "OCR", ErrorCode.OCR_ERROR, call);
    }

    public <T> T translation(Supplier<T> call) {
        return withTimeout(translationTimeLimiter, "Translation", ErrorCode.TRANSLATION_ERROR, call);
    }

    private <T> T withTimeout(TimeLimiter limiter, String label, ErrorCode code, Supplier<T> call) {
        try {
            return limiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, executor));
        } catch (TimeoutException e) {
            throw ExternalServiceException.timeout("%s timed out after %d ms".formatted(
                    label, limiter.getTimeLimiterConfig().getTimeoutDuration().toMillis()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException(code, label + " call interrupted", false, e);
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            if (cause instanceof GazeTranslateException gte) {
                throw gte;
            }
            throw new ExternalServiceException(code, "%s call failed: %s".formatted(label, cause.getMessage()),
                    false, cause);
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
