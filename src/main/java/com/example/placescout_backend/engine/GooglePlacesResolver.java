package com.example.placescout_backend.engine;

import com.example.placescout_backend.PlaceLookupException;
import com.example.placescout_backend.config.PlacesProperties;
import com.example.placescout_backend.engine.Interfaces.PlaceResolver;
import com.example.placescout_backend.model.GeoPoint;
import com.example.placescout_backend.model.PlaceMatch;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Google Geocoding and Places Text Search. A lookup only counts when the HTTP status is 2xx
 * and the provider status is {@code OK}.
 */
@Component
public class GooglePlacesResolver implements PlaceResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(GooglePlacesResolver.class);

    static final String GEOCODE_PATH = "/maps/api/geocode/json";
    static final String TEXT_SEARCH_PATH = "/maps/api/place/textsearch/json";
    private static final String STATUS_OK = "OK";

    private final WebClient client;
    private final PlacesProperties props;
    private final ObjectMapper om;

    public GooglePlacesResolver(@Qualifier("placesWebClient") WebClient client, PlacesProperties props, ObjectMapper om) {
        this.client = client;
        this.props = props;
        this.om = om;
    }

    private record ProviderResponse(int statusCode, JsonNode body) {
        boolean ok() {
            return statusCode >= 200 && statusCode < 300 && STATUS_OK.equals(body.path("status").asText());
        }

        JsonNode firstResult() {
            JsonNode results = body.path("results");
            return results.isArray() && !results.isEmpty() ? results.get(0) : null;
        }
    }

    @Override
    public boolean hasCredentials() {
        return props.hasApiKey();
    }

    @Override
    public Optional<GeoPoint> geocode(String hint) {
        if (!hasCredentials()) {
            LOGGER.warn("geocode skipped, no api key configured");
            return Optional.empty();
        }
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        ProviderResponse response;
        try {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("address", hint);
            params.put("key", props.getApiKey());
            response = get(GEOCODE_PATH, params);
        } catch (RuntimeException ex) {
            LOGGER.warn("geocode request failed address={} error={}", hint, ex.toString());
            return Optional.empty();
        }

        LOGGER.info("geocode http address={} statusCode={} status={} errorMessage={} results={}",
                hint, response.statusCode(), response.body().path("status").asText(null),
                response.body().path("error_message").asText(null), response.body().path("results").size());

        if (!response.ok()) {
            return Optional.empty();
        }
        JsonNode result = response.firstResult();
        if (result == null) {
            return Optional.empty();
        }
        JsonNode location = result.path("geometry").path("location");
        if (!location.path("lat").isNumber() || !location.path("lng").isNumber()) {
            return Optional.empty();
        }
        return Optional.of(new GeoPoint(location.get("lat").asDouble(), location.get("lng").asDouble()));
    }

    @Override
    public Optional<PlaceMatch> search(String name, GeoPoint bias) {
        if (!hasCredentials() || name == null || name.isBlank()) {
            return Optional.empty();
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", name);
        params.put("key", props.getApiKey());
        if (bias != null) {
            params.put("location", bias.asQueryParam());
            params.put("radius", String.valueOf(props.getBiasRadiusMeters()));
        }

        ProviderResponse response = get(TEXT_SEARCH_PATH, params);
        LOGGER.info("places http query={} statusCode={} status={} errorMessage={} results={} usedBias={}",
                name, response.statusCode(), response.body().path("status").asText(null),
                response.body().path("error_message").asText(null), response.body().path("results").size(),
                bias != null);

        if (!response.ok()) {
            return Optional.empty();
        }
        JsonNode result = response.firstResult();
        if (result == null) {
            return Optional.empty();
        }
        JsonNode location = result.path("geometry").path("location");
        Map<String, Object> raw = om.convertValue(response.body(), new TypeReference<Map<String, Object>>() {
        });
        return Optional.of(new PlaceMatch(
                textOrNull(result, "name"),
                textOrNull(result, "place_id"),
                textOrNull(result, "formatted_address"),
                location.path("lat").isNumber() ? location.get("lat").asDouble() : null,
                location.path("lng").isNumber() ? location.get("lng").asDouble() : null,
                raw
        ));
    }

    private ProviderResponse get(String path, Map<String, String> params) {
        String payload;
        int status;
        try {
            var entity = client.get()
                    .uri(builder -> {
                        builder.path(path);
                        params.keySet().forEach(k -> builder.queryParam(k, "{" + k + "}"));
                        return builder.build(params);
                    })
                    .exchangeToMono(resp -> resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> Map.entry(resp.statusCode().value(), body)))
                    .block(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));
            if (entity == null) {
                throw new PlaceLookupException("empty places response for " + path, null);
            }
            status = entity.getKey();
            payload = entity.getValue();
        } catch (PlaceLookupException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new PlaceLookupException("places request failed for " + path, ex);
        }

        try {
            JsonNode body = payload.isBlank() ? om.createObjectNode() : om.readTree(payload);
            return new ProviderResponse(status, body == null ? om.createObjectNode() : body);
        } catch (JsonProcessingException ex) {
            throw new PlaceLookupException("places response is not JSON for " + path, ex);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        String value = node.get(field).asText();
        return value != null && !value.isBlank() ? value : null;
    }
}
