package com.openforge.gazetranslate.translation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Development engine that tags the input instead of translating it. */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.translation", name = "engine", havingValue = "mock", matchIfMissing = true)
public class MockTranslationEngine implements TranslationEngine {

    @Override
    public String name() {
        return "mock";
    }

    @Override
    public String translate(String text, String sourceLang, String targetLang) {
        String result = "(Translated from %s to %s) %s".formatted(sourceLang, targetLang, text);
        log.debug("[Translate] Mock result: {}", result);
        return result;
    }
}
