package com.openforge.gazetranslate.ocr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.gazetranslate.error.ErrorCode;
import com.openforge.gazetranslate.error.ExternalServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;

/**
 * OCR over a JSON HTTP endpoint.
 *
 *   POST {base-url}/ocr   {"image": "<base64>"}   →   {"text": "..."}
 *
 * Raw HttpClient + Jackson, like the translation client.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.ocr", name = "engine", havingValue = "http")
public class HttpOcrEngine implements OcrEngine {

    private final HttpClient    httpClient;
    private final ObjectMapper  objectMapper;
    private final OcrProperties props;

    public HttpOcrEngine(HttpClient httpClient, ObjectMapper objectMapper, OcrProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public String recognize(byte[] image) {
        String body = serialize(new OcrRequest(Base64.getEncoder().encodeToString(image)));

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/ocr"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (!props.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + props.apiKey());
        }

        log.debug("[OCR] → POST /ocr bytes={}", image.length);
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExternalServiceException(ErrorCode.OCR_ERROR, "Network error calling OCR service", true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ExternalServiceException.ocr("Interrupted while calling OCR service", e);
        }
        return parse(response);
    }

    private String parse(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new ExternalServiceException(ErrorCode.OCR_ERROR,
                    "OCR service returned HTTP %d".formatted(status), true);
        }
        if (status < 200 || status >= 300) {
            throw new ExternalServiceException(ErrorCode.OCR_ERROR,
                    "OCR service returned HTTP %d: %s".formatted(status, response.body()), false);
        }
        try {
            OcrResponse parsed = objectMapper.readValue(response.body(), OcrResponse.class);
            String text = parsed.text() == null ? "" : parsed.text();
            log.debug("[OCR] ← {} chars", text.length());
            return text;
        } catch (JsonProcessingException e) {
            throw ExternalServiceException.ocr("Failed to parse OCR response", e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw ExternalServiceException.ocr("Failed to serialize OCR request", e);
        }
    }

    record OcrRequest(String image) {}

    record OcrResponse(String text) {}
}
