package com.example.placescout_backend.engine;

import com.example.placescout_backend.LanguageModelException;
import com.example.placescout_backend.config.ExtractionProperties;
import com.example.placescout_backend.engine.Interfaces.LanguageModelEngine.ModelCompletion;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OllamaLanguageModelEngineRetryTest {

    private final ObjectMapper om = new ObjectMapper();
    private ExtractionProperties props;

    @BeforeEach
    void setup() {
        props = new ExtractionProperties();
        props.setBackoffSeconds(0);
        props.setMaxRetries(2);
    }

    @Test
    void retriesOn5xxThenReturnsResponseText() {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            if (attempts.incrementAndGet() < 3) {
                return Mono.just(json(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"busy\"}"));
            }
            return Mono.just(json(HttpStatus.OK, "{\"model\":\"m\",\"response\":\"{\\\"candidates\\\":[]}\",\"done\":true}"));
        };

        ModelCompletion completion = engine(exchange).generate("prompt");

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(completion.text()).isEqualTo("{\"candidates\":[]}");
        assertThat(completion.hasError()).isFalse();
    }

    @Test
    void retriesOnPrematureCloseException() {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            if (attempts.incrementAndGet() < 2) {
                return Mono.error(PrematureCloseException.TEST_EXCEPTION);
            }
            return Mono.just(json(HttpStatus.OK, "{\"response\":\"ok\"}"));
        };

        ModelCompletion completion = engine(exchange).generate("prompt");

        assertThat(attempts.get()).isEqualTo(2);
        assertThat(completion.text()).isEqualTo("ok");
    }

    @Test
    void doesNotRetryOn4xxErrors() {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            attempts.incrementAndGet();
            return Mono.just(json(HttpStatus.NOT_FOUND, "{\"error\":\"model not found\"}"));
        };

        LanguageModelException ex = assertThrows(LanguageModelException.class, () -> engine(exchange).generate("prompt"));

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(ex.isRetryable()).isFalse();
        assertThat(ex.getMessage()).contains("model not found");
    }

    @Test
    void emptyBodyIsRetriedUntilExhausted() {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            attempts.incrementAndGet();
            return Mono.just(ClientResponse.create(HttpStatus.OK).build());
        };

        assertThrows(LanguageModelException.class, () -> engine(exchange).generate("prompt"));

        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void envelopeErrorOn200IsReportedWithoutRetry() {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            attempts.incrementAndGet();
            return Mono.just(json(HttpStatus.OK, "{\"error\":\"context length exceeded\"}"));
        };

        ModelCompletion completion = engine(exchange).generate("prompt");

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(completion.hasError()).isTrue();
        assertThat(completion.error()).isEqualTo("context length exceeded");
        assertThat(completion.text()).isEmpty();
    }

    @Test
    void nonJsonBodyIsPassedOnAsText() {
        ExchangeFunction exchange = request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE)
                .body("candidates: none")
                .build());

        ModelCompletion completion = engine(exchange).generate("prompt");

        assertThat(completion.text()).isEqualTo("candidates: none");
        assertThat(completion.hasError()).isFalse();
    }

    @Test
    void postsModelPromptAndDisablesStreaming() throws Exception {
        props.setModelName("llama3:8b");
        ExchangeStrategies strategies = ExchangeStrategies.withDefaults();
        AtomicReference<String> sent = new AtomicReference<>();
        AtomicReference<String> path = new AtomicReference<>();
        ExchangeFunction exchange = request -> {
            path.set(request.url().getPath());
            sent.set(bodyOf(request, strategies));
            return Mono.just(json(HttpStatus.OK, "{\"response\":\"[]\"}"));
        };

        engine(exchange).generate("find places");

        JsonNode body = om.readTree(sent.get());
        assertThat(path.get()).isEqualTo("/api/generate");
        assertThat(body.get("model").asText()).isEqualTo("llama3:8b");
        assertThat(body.get("prompt").asText()).isEqualTo("find places");
        assertThat(body.get("stream").asBoolean()).isFalse();
    }

    private OllamaLanguageModelEngine engine(ExchangeFunction exchange) {
        WebClient client = WebClient.builder()
                .baseUrl("http://ollama.test")
                .exchangeFunction(exchange)
                .build();
        return new OllamaLanguageModelEngine(client, props, om);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    private static String bodyOf(ClientRequest request, ExchangeStrategies strategies) {
        MockClientHttpRequest mockRequest = new MockClientHttpRequest(request.method(), request.url());
        request.body().insert(mockRequest, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return strategies.messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return mockRequest.getBodyAsString().block();
    }
}
