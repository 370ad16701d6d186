package com.openforge.gazetranslate.memory;

import com.openforge.gazetranslate.error.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Source and target language codes, lower-cased. The source may be
 * {@code auto}; the target may not.
 */
public record LanguagePair(String sourceLang, String targetLang) {

    public static final String AUTO = "auto";

    private static final Pattern CODE = Pattern.compile("[a-z]{2,3}(-[a-z0-9]{2,4})?");

    /**
     * Normalises and validates both codes.
     *
     * @throws ValidationException for blank or malformed codes
     */
    public static LanguagePair of(String sourceLang, String targetLang) {
        String source = normalise(sourceLang, "sourceLang");
        String target = normalise(targetLang, "targetLang");
        if (!AUTO.equals(source) && !CODE.matcher(source).matches()) {
            throw new ValidationException("Invalid source language code: " + sourceLang);
        }
        if (!CODE.matcher(target).matches()) {
            throw new ValidationException("Invalid target language code: " + targetLang);
        }
        return new LanguagePair(source, target);
    }

    private static String normalise(String code, String field) {
        if (code == null || code.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return code.strip().replace('_', '-').toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return sourceLang + "→" + targetLang;
    }
}
