package com.example.placescout_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for candidate extraction, including the language-model path.
 */
@ConfigurationProperties(prefix = "extraction")
public class ExtractionProperties {

    /**
     * What to do when the model envelope or the parsed payload reports an error next to usable
     * candidates.
     */
    public enum PartialResultPolicy {
        /** Treat the response as failed and mine heuristically. */
        FALLBACK,
        /** Keep the model candidates and record the error as metadata. */
        KEEP_MODEL
    }

    private String modelName = "qwen2.5:7b-instruct";
    private String baseUrl = "http://localhost:11434";
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(45);
    private int maxRetries = 2;
    private double backoffSeconds = 1.0;
    private int maxInputChars = 60_000;
    private int maxPromptChars = 80_000;
    private boolean languageModelEnabled = false;

    private int maxSegments = 120;
    private int maxCandidates = 15;
    private PartialResultPolicy partialResultPolicy = PartialResultPolicy.FALLBACK;

    public String getModelName() {
        return modelName;
    }

    public void setModelName(String modelName) {
        this.modelName = modelName;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public double getBackoffSeconds() {
        return backoffSeconds;
    }

    public void setBackoffSeconds(double backoffSeconds) {
        this.backoffSeconds = backoffSeconds;
    }

    public int getMaxInputChars() {
        return maxInputChars;
    }

    public void setMaxInputChars(int maxInputChars) {
        this.maxInputChars = maxInputChars;
    }

    public int getMaxPromptChars() {
        return maxPromptChars;
    }

    public void setMaxPromptChars(int maxPromptChars) {
        this.maxPromptChars = maxPromptChars;
    }

    public boolean isLanguageModelEnabled() {
        return languageModelEnabled;
    }

    public void setLanguageModelEnabled(boolean languageModelEnabled) {
        this.languageModelEnabled = languageModelEnabled;
    }

    public int getMaxSegments() {
        return maxSegments;
    }

    public void setMaxSegments(int maxSegments) {
        this.maxSegments = maxSegments;
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }

    public void setMaxCandidates(int maxCandidates) {
        this.maxCandidates = maxCandidates;
    }

    public PartialResultPolicy getPartialResultPolicy() {
        return partialResultPolicy;
    }

    public void setPartialResultPolicy(PartialResultPolicy partialResultPolicy) {
        this.partialResultPolicy = partialResultPolicy;
    }

    /**
     * Linear backoff before retry number {@code attempt} (1-based).
     */
    public Duration backoffFor(long attempt) {
        long millis = Math.round(Math.max(0.0, backoffSeconds) * 1000.0 * Math.max(1L, attempt));
        return Duration.ofMillis(millis);
    }
}
