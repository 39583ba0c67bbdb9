package com.example.placescout_backend.service;

import com.example.placescout_backend.TranscriptionException;
import com.example.placescout_backend.config.FwProperties;
import com.example.placescout_backend.dto.FwVerboseResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Duration;

@Component
public class FasterWhisperClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(FasterWhisperClient.class);

    private final WebClient client;
    private final FwProperties props;
    private final Duration timeout;

    public FasterWhisperClient(@Qualifier("fwWebClient") WebClient client, FwProperties props) {
        this.client = client;
        this.props = props;
        this.timeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
    }

    public FwVerboseResponse transcribeFile(Path file) {
        var mb = new LinkedMultiValueMap<String, Object>();
        mb.add("file", new FileSystemResource(file));
        if (props.getModel() != null && !props.getModel().isBlank()) {
            mb.add("model", props.getModel());
        }
        if (props.getLanguage() != null && !props.getLanguage().isBlank()) {
            mb.add("language", props.getLanguage());
        }
        mb.add("response_format", "verbose_json");
        mb.add("timestamp_granularities[]", "segment");

        long start = System.currentTimeMillis();
        return client.post()
                .uri("/v1/audio/transcriptions")
                .body(BodyInserters.fromMultipartData(mb))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> new TranscriptionException("FasterWhisper error " + resp.statusCode() + ": " + body)))
                .bodyToMono(FwVerboseResponse.class)
                .timeout(timeout)
                .doOnSuccess(r -> LOGGER.debug("FW {} processed in {} ms",
                        file.getFileName(), System.currentTimeMillis() - start))
                .block();
    }
}
