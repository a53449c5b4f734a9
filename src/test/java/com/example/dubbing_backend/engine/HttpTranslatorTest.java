package com.example.dubbing_backend.engine;

import com.example.dubbing_backend.config.TranslatorProperties;
import com.example.dubbing_backend.exception.UnsupportedInputException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpTranslatorTest {

    private TranslatorProperties props;
    private final AtomicInteger calls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        props = new TranslatorProperties();
        props.setMaxRetries(2);
        props.setRetryBackoffMs(1);
        props.setTimeoutSeconds(5);
    }

    private HttpTranslator translatorReplying(HttpStatus status, String body) {
        ExchangeFunction exchangeFunction = request -> {
            calls.incrementAndGet();
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        };
        return new HttpTranslator(WebClient.builder().exchangeFunction(exchangeFunction).build(), props);
    }

    @Test
    void returnsTranslatedText() throws Exception {
        HttpTranslator translator = translatorReplying(HttpStatus.OK, "{\"success\":true,\"data\":{\"translated_text\":\"xin chào\"}}");

        assertThat(translator.translate("你好", "zh", "vi")).isEqualTo("xin chào");
        assertThat(calls).hasValue(1);
    }

    @Test
    void sameLanguageSkipsTheService() throws Exception {
        HttpTranslator translator = translatorReplying(HttpStatus.OK, "{}");

        assertThat(translator.translate("xin chào", "vi", "VI")).isEqualTo("xin chào");
        assertThat(translator.translate("  ", "zh", "vi")).isEmpty();
        assertThat(calls).hasValue(0);
    }

    @Test
    void clientErrorIsNotRetried() {
        HttpTranslator translator = translatorReplying(HttpStatus.BAD_REQUEST, "{\"error\":\"unsupported language pair\"}");

        assertThatThrownBy(() -> translator.translate("你好", "zh", "xx"))
                .isInstanceOf(UnsupportedInputException.class)
                .hasMessageContaining("unsupported language pair");
        assertThat(calls).hasValue(1);
    }

    @Test
    void serverErrorIsRetriedThenSurfaced() {
        HttpTranslator translator = translatorReplying(HttpStatus.SERVICE_UNAVAILABLE, "busy");

        assertThatThrownBy(() -> translator.translate("你好", "zh", "vi"))
                .isInstanceOf(HttpTranslator.TranslatorUnavailableException.class)
                .hasMessageContaining("503");
        assertThat(calls).hasValue(3);
    }

    @Test
    void rateLimitIsRetryable() {
        HttpTranslator translator = translatorReplying(HttpStatus.TOO_MANY_REQUESTS, "slow down");

        assertThatThrownBy(() -> translator.translate("你好", "zh", "vi"))
                .isInstanceOf(HttpTranslator.TranslatorUnavailableException.class);
        assertThat(calls).hasValue(3);
    }

    @Test
    void unsuccessfulPayloadIsReported() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertThatThrownBy(() -> HttpTranslator.extract(mapper.readTree("{\"success\":false,\"error\":\"quota exceeded\"}")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("quota exceeded");
        assertThatThrownBy(() -> HttpTranslator.extract(mapper.readTree("{\"success\":true,\"data\":{}}")))
                .isInstanceOf(IllegalStateException.class);
        assertThat(HttpTranslator.extract(mapper.readTree("{\"success\":true,\"data\":{\"translated_text\":\"ok\"}}"))).isEqualTo("ok");
    }
}
