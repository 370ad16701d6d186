package com.openforge.gazetranslate.memory;

import com.openforge.gazetranslate.domain.FragmentType;
import com.openforge.gazetranslate.error.ValidationException;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Input of {@link MemoryStore#createOrTouch}. Only text, translation and
 * languages are required; the rest is used when the fragment is new.
 */
public record FragmentDraft(
        String                 sourceText,
        String                 translatedText,
        LanguagePair           languages,
        @Nullable FragmentType type,
        @Nullable Double       difficulty,
        @Nullable List<String> tags,
        @Nullable CaptureContext context
) {

    public static FragmentDraft of(String sourceText,
                                   String translatedText,
                                   LanguagePair languages,
                                   @Nullable CaptureContext context) {
        return new FragmentDraft(sourceText, translatedText, languages, null, null, null, context);
    }

    void validate() {
        if (sourceText == null || sourceText.isBlank()) {
            throw new ValidationException("sourceText is required");
        }
        if (translatedText == null || translatedText.isBlank()) {
            throw new ValidationException("translatedText is required");
        }
        if (languages == null) {
            throw new ValidationException("languages are required");
        }
    }

    List<String> tagsOrEmpty() {
        return tags == null ? List.of() : tags;
    }
}
