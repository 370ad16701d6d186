package com.openforge.gazetranslate.memory;

import com.openforge.gazetranslate.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LanguagePairTest {

    @Test
    void normalisesCaseAndSeparator() {
        LanguagePair pair = LanguagePair.of(" EN_us ", "zh-CN");

        assertThat(pair.sourceLang()).isEqualTo("en-us");
        assertThat(pair.targetLang()).isEqualTo("zh-cn");
    }

    @Test
    void sourceMayBeAutoDetected() {
        assertThat(LanguagePair.of("AUTO", "fr").sourceLang()).isEqualTo(LanguagePair.AUTO);
    }

    @Test
    void targetMustBeConcrete() {
        assertThatThrownBy(() -> LanguagePair.of("en", "auto")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> LanguagePair.of("en", null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> LanguagePair.of("english", "fr")).isInstanceOf(ValidationException.class);
    }
}
