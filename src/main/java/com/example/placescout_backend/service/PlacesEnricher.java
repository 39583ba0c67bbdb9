package com.example.placescout_backend.service;

import com.example.placescout_backend.config.PlacesProperties;
import com.example.placescout_backend.engine.Interfaces.PlaceResolver;
import com.example.placescout_backend.extraction.ExtractionDeadline;
import com.example.placescout_backend.model.Candidate;
import com.example.placescout_backend.model.GeoPoint;
import com.example.placescout_backend.model.PlaceMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;

/**
 * Resolves candidates against the place provider. Failures are recorded on the candidate and
 * never abort the batch.
 */
@Service
public class PlacesEnricher {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlacesEnricher.class);

    static final String MISSING_CREDENTIALS = "missing_api_key";
    static final String BLANK_NAME = "blank_name";
    static final String NO_MATCH = "no_match";
    static final String NO_COORDINATES = "missing_coordinates";
    static final String CANCELLED = "cancelled";

    private final PlaceResolver resolver;
    private final PlacesProperties props;

    public PlacesEnricher(PlaceResolver resolver, PlacesProperties props) {
        this.resolver = resolver;
        this.props = props;
    }

    public List<Candidate> enrich(List<Candidate> candidates, String locationHint) {
        return enrich(candidates, locationHint, ExtractionDeadline.none());
    }

    public List<Candidate> enrich(List<Candidate> candidates, String locationHint, ExtractionDeadline deadline) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        if (!resolver.hasCredentials()) {
            LOGGER.warn("places enrichment skipped, no api key count={}", candidates.size());
            candidates.forEach(c -> {
                c.setPlacesQuery(c.getName());
                c.markResolutionFailed(MISSING_CREDENTIALS);
            });
            return candidates;
        }

        GeoPoint bias = geocodeBias(locationHint);
        int concurrency = Math.max(1, props.getMaxConcurrency());
        if (concurrency == 1) {
            candidates.forEach(c -> resolveOne(c, bias, deadline));
        } else {
            // results come back in candidate order, not completion order
            Flux.fromIterable(candidates)
                    .flatMapSequential(c -> Mono.fromRunnable(() -> resolveOne(c, bias, deadline))
                            .subscribeOn(Schedulers.boundedElastic()), concurrency)
                    .then()
                    .block();
        }

        long failed = candidates.stream().filter(Candidate::isResolutionFailed).count();
        LOGGER.info("places enrichment done count={} failed={} usedBias={}", candidates.size(), failed, bias != null);
        return candidates;
    }

    private GeoPoint geocodeBias(String locationHint) {
        if (locationHint == null || locationHint.isBlank()) {
            return null;
        }
        try {
            return resolver.geocode(locationHint.trim()).orElse(null);
        } catch (RuntimeException ex) {
            LOGGER.warn("geocode bias failed hint={} error={}", locationHint, ex.toString());
            return null;
        }
    }

    void resolveOne(Candidate candidate, GeoPoint bias, ExtractionDeadline deadline) {
        String query = candidate.getName().trim();
        candidate.setPlacesQuery(query);
        if (query.isEmpty()) {
            candidate.markResolutionFailed(BLANK_NAME);
            return;
        }
        if (deadline.isExpired()) {
            candidate.markResolutionFailed(CANCELLED);
            return;
        }
        try {
            Optional<PlaceMatch> match = resolver.search(query, bias);
            if (match == null || match.isEmpty()) {
                LOGGER.debug("places no match name={}", query);
                candidate.markResolutionFailed(NO_MATCH);
                return;
            }
            PlaceMatch m = match.get();
            candidate.applyMatch(m);
            if (!m.hasCoordinates()) {
                candidate.markResolutionFailed(NO_COORDINATES);
                return;
            }
            LOGGER.debug("places result name={} placeId={}", query, m.placeId());
        } catch (RuntimeException ex) {
            LOGGER.warn("places lookup failed name={} error={}", query, ex.toString());
            candidate.markResolutionFailed(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }
}
