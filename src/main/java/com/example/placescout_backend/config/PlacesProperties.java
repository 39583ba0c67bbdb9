package com.example.placescout_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "places")
public class PlacesProperties {

    private String baseUrl = "https://maps.googleapis.com";
    private String apiKey;
    private long timeoutSeconds = 20;
    private int biasRadiusMeters = 50_000;
    private int maxConcurrency = 4;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getBiasRadiusMeters() {
        return biasRadiusMeters;
    }

    public void setBiasRadiusMeters(int biasRadiusMeters) {
        this.biasRadiusMeters = biasRadiusMeters;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }
}
