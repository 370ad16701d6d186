package com.openforge.gazetranslate.translation;

import java.util.ArrayList;
import java.util.List;

/**
 * Machine translation backend. Language codes arrive normalised (lower case,
 * source may be {@code auto}). Failures are thrown as
 * {@link com.openforge.gazetranslate.error.ExternalServiceException}.
 */
public interface TranslationEngine {

    String name();

    String translate(String text, String sourceLang, String targetLang);

    /** One call per text unless the backend supports batches. */
    default List<String> translateBatch(List<String> texts, String sourceLang, String targetLang) {
        List<String> results = new ArrayList<>(texts.size());
        for (String text : texts) {
            results.add(translate(text, sourceLang, targetLang));
        }
        return results;
    }
}
