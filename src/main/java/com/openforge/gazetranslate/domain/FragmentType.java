package com.openforge.gazetranslate.domain;

/** Granularity of the recognised text. Inferred from token count unless the caller names one. */
public enum FragmentType {

    WORD,
    PHRASE,
    SENTENCE,
    PARAGRAPH,
    CUSTOM;

    public static FragmentType classify(String text) {
        String trimmed = text.strip();
        int tokens = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        if (tokens <= 1) return WORD;
        if (tokens <= 4 && !endsSentence(trimmed)) return PHRASE;
        if (tokens <= 40 && !trimmed.contains("\n")) return SENTENCE;
        return PARAGRAPH;
    }

    private static boolean endsSentence(String text) {
        char last = text.charAt(text.length() - 1);
        return last == '.' || last == '!' || last == '?' || last == '。' || last == '！' || last == '？';
    }
}
