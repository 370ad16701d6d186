package com.openforge.gazetranslate.orchestration;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.gazetranslate.error.ErrorCode;
import com.openforge.gazetranslate.memory.FragmentSuggestion;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Result of one capture or text translation. Exactly one of the translation
 * fields or the error fields is set, depending on {@link #status()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranslationOutcome(
        Status                   status,
        @Nullable String         original,
        @Nullable String         translation,
        boolean                  fromCache,
        long                     processingTimeMs,
        @Nullable Long           fragmentId,
        List<FragmentSuggestion> suggestions,
        @Nullable ErrorCode      errorCode,
        @Nullable String         errorMessage
) {

    public enum Status { TRANSLATED, NO_TEXT, FAILED }

    static TranslationOutcome translated(String original, String translation, Long fragmentId,
                                         List<FragmentSuggestion> suggestions, long elapsedMs) {
        return new TranslationOutcome(Status.TRANSLATED, original, translation, false, elapsedMs,
                fragmentId, suggestions, null, null);
    }

    static TranslationOutcome cacheHit(String original, String translation, @Nullable Long fragmentId, long elapsedMs) {
        return new TranslationOutcome(Status.TRANSLATED, original, translation, true, elapsedMs,
                fragmentId, List.of(), null, null);
    }

    static TranslationOutcome noText(long elapsedMs) {
        return new TranslationOutcome(Status.NO_TEXT, null, null, false, elapsedMs, null, List.of(), null, null);
    }

    static TranslationOutcome failure(ErrorCode code, String message, long elapsedMs) {
        return new TranslationOutcome(Status.FAILED, null, null, false, elapsedMs, null, List.of(), code, message);
    }

    public boolean isSuccess() {
        return status == Status.TRANSLATED;
    }
}
