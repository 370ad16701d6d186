package com.openforge.gazetranslate.memory;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Answer of {@link MemoryStore#checkMemory}.
 *
 * @param exists            an exact identity match was found
 * @param shouldTranslate   a fresh translation is needed
 * @param cachedTranslation stored translation, present iff {@code !shouldTranslate}
 * @param fragment          the exact match, if any
 * @param suggestions       fuzzy candidates when there is no exact match
 */
public record MemoryCheck(
        boolean                  exists,
        boolean                  shouldTranslate,
        @Nullable String         cachedTranslation,
        @Nullable MemoryFragment fragment,
        List<FragmentSuggestion> suggestions
) {

    static MemoryCheck found(MemoryFragment fragment, boolean shouldTranslate) {
        return new MemoryCheck(true, shouldTranslate,
                shouldTranslate ? null : fragment.translatedText(), fragment, List.of());
    }

    static MemoryCheck notFound(List<FragmentSuggestion> suggestions) {
        return new MemoryCheck(false, true, null, null, List.copyOf(suggestions));
    }
}
