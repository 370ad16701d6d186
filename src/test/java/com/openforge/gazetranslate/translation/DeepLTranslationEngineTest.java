package com.openforge.gazetranslate.translation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.openforge.gazetranslate.error.ExternalServiceException;
import com.openforge.gazetranslate.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeepLTranslationEngineTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private DeepLTranslationEngine engine;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        engine = new DeepLTranslationEngine(httpClient, mapper,
                new TranslationProperties("deepl", "https://api-free.deepl.com", "secret-key", 10, 5000));
    }

    @Test
    void mapsLanguageCodes() {
        assertThat(DeepLTranslationEngine.toDeepL("auto", true)).isNull();
        assertThat(DeepLTranslationEngine.toDeepL("en", true)).isEqualTo("EN");
        assertThat(DeepLTranslationEngine.toDeepL("en", false)).isEqualTo("EN-US");
        assertThat(DeepLTranslationEngine.toDeepL("pt-br", false)).isEqualTo("PT-BR");
        assertThat(DeepLTranslationEngine.toDeepL("ZH-CN", false)).isEqualTo("ZH");
    }

    @Test
    void rejectsUnsupportedOrAutoTarget() {
        assertThatThrownBy(() -> DeepLTranslationEngine.toDeepL("auto", false)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> DeepLTranslationEngine.toDeepL("xx", true)).isInstanceOf(ValidationException.class);
    }

    @Test
    void requiresApiKey() {
        assertThatThrownBy(() -> new DeepLTranslationEngine(httpClient, new ObjectMapper(),
                new TranslationProperties("deepl", "https://api-free.deepl.com", " ", 10, 5000)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void translatesThroughRestApi() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("""
                {"translations": [{"detected_source_language": "EN", "text": "你好"}]}
                """);
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenReturn(response);

        assertThat(engine.translate("Hello", "auto", "zh")).isEqualTo("你好");

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
        assertThat(request.getValue().uri().toString()).isEqualTo("https://api-free.deepl.com/v2/translate");
        assertThat(request.getValue().headers().firstValue("Authorization")).contains("DeepL-Auth-Key secret-key");
    }

    @Test
    void batchKeepsInputOrder() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("""
                {"translations": [{"text": "Bonjour"}, {"text": "Au revoir"}]}
                """);
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenReturn(response);

        assertThat(engine.translateBatch(List.of("Hello", "Goodbye"), "en", "fr"))
                .containsExactly("Bonjour", "Au revoir");
    }

    @Test
    void rateLimitIsRetryableButQuotaIsNot() throws Exception {
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenReturn(response);

        when(response.statusCode()).thenReturn(429);
        assertThatThrownBy(() -> engine.translate("Hello", "en", "zh"))
                .isInstanceOfSatisfying(ExternalServiceException.class, e -> assertThat(e.isRetryable()).isTrue());

        when(response.statusCode()).thenReturn(456);
        assertThatThrownBy(() -> engine.translate("Hello", "en", "zh"))
                .isInstanceOfSatisfying(ExternalServiceException.class, e -> assertThat(e.isRetryable()).isFalse());
    }

    @Test
    void networkErrorIsRetryable() throws Exception {
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenThrow(new IOException("connection reset"));

        assertThatThrownBy(() -> engine.translate("Hello", "en", "zh"))
                .isInstanceOfSatisfying(ExternalServiceException.class, e -> assertThat(e.isRetryable()).isTrue());
    }
}
