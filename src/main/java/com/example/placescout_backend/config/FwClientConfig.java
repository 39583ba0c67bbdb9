package com.example.placescout_backend.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Client for the faster-whisper server. One request uploads a whole travel video, so the
 * transcription timeout also bounds the write side.
 */
@Configuration
@EnableConfigurationProperties(FwProperties.class)
public class FwClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(FwClientConfig.class);

    @Bean("fwWebClient")
    public WebClient fwWebClient(FwProperties props) {
        Duration transcribeTimeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        int connectMillis = (int) (Math.max(1, props.getConnectTimeoutSeconds()) * 1000);

        HttpClient http = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectMillis)
                .responseTimeout(transcribeTimeout)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(transcribeTimeout.toSeconds(), TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(transcribeTimeout.toSeconds(), TimeUnit.SECONDS)));

        // verbose_json of an hour-long vlog runs to several MB
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
                .build();

        LOGGER.info("Configuring faster-whisper WebClient baseUrl={} model={} connect={}ms timeout={}s",
                props.getBaseUrl(), props.getModel(), connectMillis, transcribeTimeout.toSeconds());

        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
