package com.example.dubbing_backend.engine;

import com.example.dubbing_backend.config.TranslatorProperties;
import com.example.dubbing_backend.engine.Interfaces.Translator;
import com.example.dubbing_backend.exception.UnsupportedInputException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Map;

/**
 * Client of the shared (caching) translation service.
 * Request {@code {text, sourceLang, targetLang}}, response {@code {success, data: {translated_text}, error}}.
 */
public class HttpTranslator implements Translator {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpTranslator.class);

    private final WebClient client;
    private final TranslatorProperties props;

    public HttpTranslator(WebClient client, TranslatorProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public String translate(String text, String sourceLang, String targetLang) {
        if (text == null || text.isBlank()) {
            return "";
        }
        if (sourceLang != null && sourceLang.equalsIgnoreCase(targetLang)) {
            return text;
        }
        Mono<String> mono = client.post()
                .uri(props.getPath())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("text", text, "sourceLang", sourceLang, "targetLang", targetLang))
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                        .map(body -> isRetryableStatus(resp.statusCode().value())
                                ? new TranslatorUnavailableException("Translator returned %s: %s".formatted(resp.statusCode(), body))
                                : new UnsupportedInputException("Translator rejected request %s: %s".formatted(resp.statusCode(), body))))
                .onStatus(HttpStatusCode::is5xxServerError, resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                        .map(body -> new TranslatorUnavailableException("Translator returned %s: %s".formatted(resp.statusCode(), body))))
                .bodyToMono(JsonNode.class)
                .map(HttpTranslator::extract)
                .retryWhen(Retry.backoff(props.getMaxRetries(), Duration.ofMillis(props.getRetryBackoffMs()))
                        .filter(HttpTranslator::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn("Translator retry attempt={} message={}",
                                signal.totalRetriesInARow() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));

        Duration blockTimeout = Duration.ofSeconds(props.getTimeoutSeconds() * (props.getMaxRetries() + 1L) + 5);
        String translated = mono.block(blockTimeout);
        if (translated == null) {
            throw new IllegalStateException("Empty response from translator");
        }
        return translated;
    }

    static String extract(JsonNode root) {
        if (root == null || !root.path("success").asBoolean(false)) {
            String error = root == null ? "empty body" : root.path("error").asText("Translation failed");
            throw new IllegalStateException("Translator error: " + error);
        }
        JsonNode value = root.path("data").path("translated_text");
        if (value.isMissingNode() || value.isNull()) {
            throw new IllegalStateException("Translator response has no translated_text");
        }
        return value.asText();
    }

    static boolean isRetryable(Throwable throwable) {
        return throwable instanceof WebClientRequestException
                || throwable instanceof TranslatorUnavailableException;
    }

    private static boolean isRetryableStatus(int status) {
        return status == 408 || status == 429;
    }

    static class TranslatorUnavailableException extends RuntimeException {
        TranslatorUnavailableException(String message) {
            super(message);
        }
    }
}
