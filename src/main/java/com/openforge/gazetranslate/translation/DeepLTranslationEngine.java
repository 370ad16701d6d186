package com.openforge.gazetranslate.translation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.gazetranslate.error.ErrorCode;
import com.openforge.gazetranslate.error.ExternalServiceException;
import com.openforge.gazetranslate.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * DeepL REST v2 client, raw HttpClient + Jackson.
 *
 *   POST {base-url}/v2/translate
 *   Authorization: DeepL-Auth-Key {api-key}
 *   {"text": [...], "target_lang": "EN-US", "source_lang": "DE"}
 *
 * Source {@code auto} omits {@code source_lang} and lets DeepL detect it.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.translation", name = "engine", havingValue = "deepl")
public class DeepLTranslationEngine implements TranslationEngine {

    /** Our code → (DeepL source, DeepL target). */
    private static final Map<String, String[]> LANGUAGES = Map.ofEntries(
            Map.entry("zh",    new String[]{"ZH", "ZH"}),
            Map.entry("zh-cn", new String[]{"ZH", "ZH"}),
            Map.entry("en",    new String[]{"EN", "EN-US"}),
            Map.entry("en-gb", new String[]{"EN", "EN-GB"}),
            Map.entry("de",    new String[]{"DE", "DE"}),
            Map.entry("fr",    new String[]{"FR", "FR"}),
            Map.entry("it",    new String[]{"IT", "IT"}),
            Map.entry("ja",    new String[]{"JA", "JA"}),
            Map.entry("es",    new String[]{"ES", "ES"}),
            Map.entry("nl",    new String[]{"NL", "NL"}),
            Map.entry("pl",    new String[]{"PL", "PL"}),
            Map.entry("pt",    new String[]{"PT", "PT-PT"}),
            Map.entry("pt-br", new String[]{"PT", "PT-BR"}),
            Map.entry("ru",    new String[]{"RU", "RU"}),
            Map.entry("ko",    new String[]{"KO", "KO"}),
            Map.entry("sv",    new String[]{"SV", "SV"}),
            Map.entry("da",    new String[]{"DA", "DA"}),
            Map.entry("fi",    new String[]{"FI", "FI"}),
            Map.entry("cs",    new String[]{"CS", "CS"}),
            Map.entry("et",    new String[]{"ET", "ET"}),
            Map.entry("hu",    new String[]{"HU", "HU"}),
            Map.entry("lv",    new String[]{"LV", "LV"}),
            Map.entry("lt",    new String[]{"LT", "LT"}),
            Map.entry("sk",    new String[]{"SK", "SK"}),
            Map.entry("sl",    new String[]{"SL", "SL"}),
            Map.entry("bg",    new String[]{"BG", "BG"}),
            Map.entry("ro",    new String[]{"RO", "RO"}),
            Map.entry("el",    new String[]{"EL", "EL"})
    );

    private final HttpClient            httpClient;
    private final ObjectMapper          objectMapper;
    private final TranslationProperties props;

    public DeepLTranslationEngine(HttpClient httpClient, ObjectMapper objectMapper, TranslationProperties props) {
        if (props.apiKey() == null || props.apiKey().isBlank()) {
            throw new IllegalStateException("app.translation.api-key is required for the deepl engine");
        }
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    @Override
    public String name() {
        return "deepl";
    }

    @Override
    public String translate(String text, String sourceLang, String targetLang) {
        return translateBatch(List.of(text), sourceLang, targetLang).get(0);
    }

    @Override
    public List<String> translateBatch(List<String> texts, String sourceLang, String targetLang) {
        DeepLRequest request = new DeepLRequest(texts, toDeepL(sourceLang, true), toDeepL(targetLang, false));

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/v2/translate"))
                .header("Content-Type", "application/json")
                .header("Authorization", "DeepL-Auth-Key " + props.apiKey())
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(serialize(request)))
                .build();

        log.debug("[DeepL] → POST /v2/translate texts={} {}→{}",
                texts.size(), request.sourceLang() == null ? "auto" : request.sourceLang(), request.targetLang());

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExternalServiceException(ErrorCode.TRANSLATION_ERROR,
                    "Network error calling DeepL", true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException(ErrorCode.TRANSLATION_ERROR,
                    "Interrupted while calling DeepL", false, e);
        }
        return parse(response, texts.size());
    }

    /**
     * Maps a normalised code to DeepL's. {@code auto} maps to {@code null}
     * as a source and is rejected as a target.
     */
    @Nullable
    static String toDeepL(String code, boolean source) {
        String key = code.toLowerCase(Locale.ROOT);
        if ("auto".equals(key)) {
            if (source) {
                return null;
            }
            throw new ValidationException("Target language cannot be auto");
        }
        String[] mapping = LANGUAGES.get(key);
        if (mapping == null) {
            throw new ValidationException("Language not supported by DeepL: " + code);
        }
        return source ? mapping[0] : mapping[1];
    }

    private List<String> parse(HttpResponse<String> response, int expected) {
        int status = response.statusCode();
        switch (status) {
            case 403 -> throw ExternalServiceException.translation("DeepL authentication failed, check the API key", false);
            case 456 -> throw ExternalServiceException.translation("DeepL quota exceeded", false);
            case 429 -> throw ExternalServiceException.translation("DeepL rate-limited", true);
            default -> { }
        }
        if (status >= 500) {
            throw ExternalServiceException.translation("DeepL returned HTTP %d".formatted(status), true);
        }
        if (status < 200 || status >= 300) {
            throw ExternalServiceException.translation(
                    "DeepL returned HTTP %d: %s".formatted(status, response.body()), false);
        }

        try {
            DeepLResponse parsed = objectMapper.readValue(response.body(), DeepLResponse.class);
            if (parsed.translations() == null || parsed.translations().size() != expected) {
                throw ExternalServiceException.translation("DeepL returned an unexpected number of translations", false);
            }
            log.debug("[DeepL] ← {} translations", parsed.translations().size());
            return parsed.translations().stream().map(DeepLTranslation::text).toList();
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException(ErrorCode.TRANSLATION_ERROR,
                    "Failed to parse DeepL response", false, e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException(ErrorCode.TRANSLATION_ERROR,
                    "Failed to serialize DeepL request", false, e);
        }
    }

    // snake_case naming comes from the shared ObjectMapper.

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record DeepLRequest(List<String> text, String sourceLang, String targetLang) {}

    record DeepLResponse(List<DeepLTranslation> translations) {}

    record DeepLTranslation(String detectedSourceLanguage, String text) {}
}
