package com.openforge.gazetranslate.orchestration;

import com.openforge.gazetranslate.error.ErrorCode;
import com.openforge.gazetranslate.error.GazeTranslateException;
import com.openforge.gazetranslate.gaze.FixationDetector;
import com.openforge.gazetranslate.memory.CaptureContext;
import com.openforge.gazetranslate.memory.LanguagePair;
import com.openforge.gazetranslate.memory.MemoryCheck;
import com.openforge.gazetranslate.memory.MemoryFragment;
import com.openforge.gazetranslate.memory.MemoryStore;
import com.openforge.gazetranslate.ocr.OcrService;
import com.openforge.gazetranslate.translation.TranslationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Screenshot → OCR → memory check → (translate → remember) → outcome.
 *
 * A remembered fragment is answered from memory without calling the
 * translation service. Failures never write to memory; they come back as a
 * FAILED outcome instead of an exception so a session survives them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TranslationOrchestrator {

    private final OcrService         ocrService;
    private final TranslationService translationService;
    private final MemoryStore        memoryStore;
    private final ExternalCallGuard  guard;

    /**
     * Handles the screenshot requested by a fixation. The detector is reset on
     * every path so the user can re-fixate, including on the same spot.
     */
    public TranslationOutcome handleCapture(CaptureRequest request, FixationDetector detector) {
        try {
            return translateImage(request);
        } finally {
            detector.reset();
        }
    }

    public TranslationOutcome translateImage(CaptureRequest request) {
        long start = System.nanoTime();
        try {
            String text = guard.ocr(() -> ocrService.performOcr(request.image()));
            if (text.isBlank()) {
                log.info("[Orchestrator] No text recognised for owner {}", request.ownerId());
                return TranslationOutcome.noText(elapsedMs(start));
            }
            return translateRecognised(request.ownerId(), text, request.languages(), request.context(), start);
        } catch (RuntimeException e) {
            return failed(request.ownerId(), e, start);
        }
    }

    /** Same memory-gated path for text that did not come from OCR. */
    public TranslationOutcome translateText(String ownerId, String text, LanguagePair languages, CaptureContext context) {
        long start = System.nanoTime();
        try {
            return translateRecognised(ownerId, text, languages, context, start);
        } catch (RuntimeException e) {
            return failed(ownerId, e, start);
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private TranslationOutcome translateRecognised(String ownerId,
                                                   String text,
                                                   LanguagePair languages,
                                                   CaptureContext context,
                                                   long start) {
        MemoryCheck check = memoryStore.checkMemory(ownerId, text, languages);

        if (!check.shouldTranslate()) {
            Long fragmentId = check.fragment() != null ? check.fragment().id() : null;
            recordAccess(ownerId, text, check.cachedTranslation(), languages, context);
            log.info("[Orchestrator] Cache hit for owner {} fragment {}", ownerId, fragmentId);
            return TranslationOutcome.cacheHit(text, check.cachedTranslation(), fragmentId, elapsedMs(start));
        }

        String translated = guard.translation(() ->
                translationService.translateText(text, languages.sourceLang(), languages.targetLang()));

        MemoryFragment stored = memoryStore.recordTranslation(ownerId, text, translated, languages, context);
        log.info("[Orchestrator] Translated {} chars for owner {} ({}) in {} ms, fragment {}",
                text.length(), ownerId, languages, elapsedMs(start), stored.id());
        return TranslationOutcome.translated(text, translated, stored.id(), check.suggestions(), elapsedMs(start));
    }

    /** The cached answer stands even if bumping the access counters fails. */
    private void recordAccess(String ownerId, String text, String translation,
                              LanguagePair languages, CaptureContext context) {
        try {
            memoryStore.createOrTouch(ownerId, text, translation, languages, context);
        } catch (GazeTranslateException e) {
            log.warn("[Orchestrator] Could not record access for owner {}: {}", ownerId, e.getMessage());
        }
    }

    private TranslationOutcome failed(String ownerId, RuntimeException e, long start) {
        if (e instanceof GazeTranslateException gte) {
            log.warn("[Orchestrator] Translation failed for owner {} ({}): {}", ownerId, gte.code(), gte.getMessage());
            String message = gte.code() == ErrorCode.VALIDATION_ERROR
                    ? gte.getMessage()
                    : "Translation unavailable: " + gte.getMessage();
            return TranslationOutcome.failure(gte.code(), message, elapsedMs(start));
        }
        log.error("[Orchestrator] Unexpected error for owner {}: {}", ownerId, e.getMessage(), e);
        return TranslationOutcome.failure(ErrorCode.INTERNAL_ERROR,
                "Translation unavailable, please try again", elapsedMs(start));
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
