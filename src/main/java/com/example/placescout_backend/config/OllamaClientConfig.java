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

import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
public class OllamaClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(OllamaClientConfig.class);

    @Bean("ollamaWebClient")
    public WebClient ollamaWebClient(ExtractionProperties props) {
        int connectMillis = (int) Math.max(1, props.getConnectTimeout().toMillis());
        long readSeconds = Math.max(1, props.getReadTimeout().toSeconds());

        HttpClient http = HttpClient.create()
                .responseTimeout(props.getReadTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectMillis)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(readSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(readSeconds, TimeUnit.SECONDS)));

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();

        LOGGER.info("Configuring Ollama WebClient baseUrl={} model={} connect={}ms read={}s retries={} enabled={}",
                props.getBaseUrl(), props.getModelName(), connectMillis, readSeconds,
                props.getMaxRetries(), props.isLanguageModelEnabled());

        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
