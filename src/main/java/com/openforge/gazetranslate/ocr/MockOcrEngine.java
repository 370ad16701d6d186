package com.openforge.gazetranslate.ocr;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Development engine: every image reads as {@code app.ocr.mock-text}. */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.ocr", name = "engine", havingValue = "mock", matchIfMissing = true)
public class MockOcrEngine implements OcrEngine {

    private final String text;

    public MockOcrEngine(OcrProperties props) {
        this.text = props.mockText();
    }

    @Override
    public String name() {
        return "mock";
    }

    @Override
    public String recognize(byte[] image) {
        log.debug("[OCR] Mock engine received {} bytes", image.length);
        return text;
    }
}
