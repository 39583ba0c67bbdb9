package com.example.placescout_backend.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator ollamaHealth(@Qualifier("ollamaWebClient") WebClient ollama, ExtractionProperties props) {
        return () -> {
            if (!props.isLanguageModelEnabled()) {
                return Health.up().withDetail("ollama", "disabled").build();
            }
            try {
                // lists local models, cheap enough for a health check
                ollama.get().uri("/api/tags")
                        .retrieve()
                        .toBodilessEntity()
                        .block(Duration.ofSeconds(2));
                return Health.up().withDetail("ollama", "ok").withDetail("model", props.getModelName()).build();
            } catch (Exception e) {
                return Health.down(e).withDetail("ollama", "unreachable").build();
            }
        };
    }

    @Bean
    public HealthIndicator fasterWhisperHealth(@Qualifier("fwWebClient") WebClient fw) {
        return () -> {
            try {
                fw.head().uri("/")
                        .retrieve()
                        .toBodilessEntity()
                        .block(Duration.ofSeconds(2));
                return Health.up().withDetail("fasterWhisper", "ok").build();
            } catch (Exception e) {
                return Health.down(e).withDetail("fasterWhisper", "unreachable").build();
            }
        };
    }
}
