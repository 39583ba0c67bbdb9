package com.example.placescout_backend.engine;

import com.example.placescout_backend.LanguageModelException;
import com.example.placescout_backend.config.ExtractionProperties;
import com.example.placescout_backend.engine.Interfaces.LanguageModelEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Talks to an Ollama server's {@code /api/generate} endpoint with streaming disabled.
 */
@Service
public class OllamaLanguageModelEngine implements LanguageModelEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OllamaLanguageModelEngine.class);
    private static final int ERROR_SNIPPET = 500;

    private final WebClient client;
    private final ExtractionProperties props;
    private final ObjectMapper om;

    public OllamaLanguageModelEngine(@Qualifier("ollamaWebClient") WebClient client,
                                     ExtractionProperties props,
                                     ObjectMapper om) {
        this.client = client;
        this.props = props;
        this.om = om;
    }

    @Override
    public ModelCompletion generate(String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getModelName());
        body.put("prompt", prompt);
        body.put("stream", false);

        long t0 = System.nanoTime();
        Mono<ModelCompletion> mono = client.post()
                .uri("/api/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(text -> new LanguageModelException(
                                        "Ollama error %s: %s".formatted(resp.statusCode(), truncate(text)),
                                        resp.statusCode().is5xxServerError())))
                .bodyToMono(String.class)
                .switchIfEmpty(Mono.error(() -> new LanguageModelException("Empty response from Ollama", true)))
                .map(this::readEnvelope)
                .timeout(props.getReadTimeout())
                .retryWhen(linearBackoff());

        try {
            ModelCompletion completion = mono.block(overallTimeout());
            if (completion == null) {
                throw new LanguageModelException("Empty response from Ollama", true);
            }
            LOGGER.info("Ollama generate model={} promptChars={} outputChars={} error={} in={}ms",
                    props.getModelName(), prompt == null ? 0 : prompt.length(), completion.text().length(),
                    completion.hasError(), (System.nanoTime() - t0) / 1_000_000);
            return completion;
        } catch (LanguageModelException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            Throwable root = rootCause(ex);
            throw new LanguageModelException("Ollama call failed: " + root.getClass().getSimpleName()
                    + (root.getMessage() == null ? "" : " " + root.getMessage()), ex, isRetryable(ex));
        }
    }

    private ModelCompletion readEnvelope(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new LanguageModelException("Empty response from Ollama", true);
        }
        JsonNode root;
        try {
            root = om.readTree(payload);
        } catch (JsonProcessingException e) {
            // a received body that is not an envelope is handed on as model text
            LOGGER.warn("Ollama response is not a JSON envelope length={}", payload.length());
            return new ModelCompletion(payload, null);
        }
        if (root == null || !root.isObject()) {
            return new ModelCompletion(payload, null);
        }
        String text = root.path("response").isTextual() ? root.get("response").asText() : "";
        String error = null;
        JsonNode err = root.get("error");
        if (err != null && !err.isNull()) {
            error = err.isTextual() ? err.asText() : err.toString();
        }
        return new ModelCompletion(text, error);
    }

    private Retry linearBackoff() {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long attempt = signal.totalRetries() + 1;
            if (attempt > props.getMaxRetries() || !isRetryable(failure)) {
                return Mono.<Long>error(failure);
            }
            Duration delay = props.backoffFor(attempt);
            Throwable root = rootCause(failure);
            LOGGER.warn("Ollama retry attempt={} delay={}ms type={} rootCause={} message={}",
                    attempt, delay.toMillis(),
                    failure == null ? "unknown" : failure.getClass().getSimpleName(),
                    root == null ? "unknown" : root.getClass().getSimpleName(),
                    root == null ? "" : root.getMessage());
            return Mono.delay(delay).thenReturn(attempt);
        }));
    }

    boolean isRetryable(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (cursor instanceof LanguageModelException lme) {
                return lme.isRetryable();
            }
            if (cursor instanceof TimeoutException
                    || cursor instanceof WebClientRequestException
                    || cursor instanceof PrematureCloseException
                    || cursor instanceof IOException) {
                return true;
            }
            cursor = cursor.getCause();
        }
        return false;
    }

    private Duration overallTimeout() {
        long attempts = Math.max(0, props.getMaxRetries()) + 1L;
        Duration total = props.getReadTimeout().plus(props.getConnectTimeout()).multipliedBy(attempts);
        for (long i = 1; i < attempts; i++) {
            total = total.plus(props.backoffFor(i));
        }
        return total.plusSeconds(5);
    }

    private static Throwable rootCause(Throwable throwable) {
        if (throwable == null) {
            return null;
        }
        Throwable cursor = throwable;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    private static String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= ERROR_SNIPPET ? value : value.substring(0, ERROR_SNIPPET) + "...";
    }
}
