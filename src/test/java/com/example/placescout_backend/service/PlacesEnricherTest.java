package com.example.placescout_backend.service;

import com.example.placescout_backend.PlaceLookupException;
import com.example.placescout_backend.config.PlacesProperties;
import com.example.placescout_backend.engine.Interfaces.PlaceResolver;
import com.example.placescout_backend.extraction.ExtractionDeadline;
import com.example.placescout_backend.model.Candidate;
import com.example.placescout_backend.model.ExtractionMethod;
import com.example.placescout_backend.model.GeoPoint;
import com.example.placescout_backend.model.PlaceMatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlacesEnricherTest {

    @Mock
    private PlaceResolver resolver;

    private PlacesProperties props;
    private PlacesEnricher enricher;

    @BeforeEach
    void setUp() {
        props = new PlacesProperties();
        props.setMaxConcurrency(1);
        enricher = new PlacesEnricher(resolver, props);
    }

    @Test
    void missingCredentialsFailsEveryCandidateWithoutSearching() {
        when(resolver.hasCredentials()).thenReturn(false);
        List<Candidate> candidates = List.of(candidate("Time Out Market"), candidate("Alfama"));

        enricher.enrich(candidates, "Lisbon");

        assertThat(candidates).allSatisfy(c -> {
            assertThat(c.isResolutionFailed()).isTrue();
            assertThat(c.getPlacesQuery()).isEqualTo(c.getName());
        });
        verify(resolver, never()).geocode(anyString());
        verify(resolver, never()).search(anyString(), any());
    }

    @Test
    void resolvesCandidatesWithGeocodedBias() {
        GeoPoint bias = new GeoPoint(38.72, -9.14);
        when(resolver.hasCredentials()).thenReturn(true);
        when(resolver.geocode("Lisbon")).thenReturn(Optional.of(bias));
        when(resolver.search("Time Out Market", bias)).thenReturn(Optional.of(
                new PlaceMatch("Time Out Market Lisboa", "abc", "Av. 24 de Julho", 38.70, -9.14, Map.of("status", "OK"))));
        Candidate c = candidate("Time Out Market");

        enricher.enrich(List.of(c), " Lisbon ");

        assertThat(c.isResolutionFailed()).isFalse();
        assertThat(c.getResolvedName()).isEqualTo("Time Out Market Lisboa");
        assertThat(c.getPlaceId()).isEqualTo("abc");
        assertThat(c.getLatitude()).isEqualTo(38.70);
        assertThat(c.getPlacesQuery()).isEqualTo("Time Out Market");
        assertThat(c.getResolutionError()).isNull();
    }

    @Test
    void failuresAreIsolatedPerCandidate() {
        when(resolver.hasCredentials()).thenReturn(true);
        when(resolver.search(eq("Boom"), isNull())).thenThrow(new PlaceLookupException("timeout", null));
        when(resolver.search(eq("Nothing"), isNull())).thenReturn(Optional.empty());
        when(resolver.search(eq("NoGeo"), isNull())).thenReturn(Optional.of(
                new PlaceMatch("NoGeo", "p1", null, null, null, Map.of())));
        when(resolver.search(eq("Fine"), isNull())).thenReturn(Optional.of(
                new PlaceMatch("Fine", "p2", "addr", 1.0, 2.0, Map.of())));
        List<Candidate> candidates = List.of(candidate("Boom"), candidate("Nothing"), candidate("NoGeo"), candidate("Fine"));

        enricher.enrich(candidates, null);

        assertThat(candidates.get(0).isResolutionFailed()).isTrue();
        assertThat(candidates.get(0).getResolutionError()).isEqualTo("timeout");
        assertThat(candidates.get(1).getResolutionError()).isEqualTo(PlacesEnricher.NO_MATCH);
        assertThat(candidates.get(2).isResolutionFailed()).isTrue();
        assertThat(candidates.get(2).getPlaceId()).isEqualTo("p1");
        assertThat(candidates.get(3).isResolutionFailed()).isFalse();
        verify(resolver, never()).geocode(anyString());
    }

    @Test
    void geocodeFailureMeansNoBias() {
        when(resolver.hasCredentials()).thenReturn(true);
        when(resolver.geocode("Atlantis")).thenThrow(new IllegalStateException("boom"));
        when(resolver.search("Fine", null)).thenReturn(Optional.of(
                new PlaceMatch("Fine", "p2", "addr", 1.0, 2.0, Map.of())));
        Candidate c = candidate("Fine");

        enricher.enrich(List.of(c), "Atlantis");

        assertThat(c.isResolutionFailed()).isFalse();
    }

    @Test
    void expiredDeadlineMarksRemainingCandidatesCancelled() {
        when(resolver.hasCredentials()).thenReturn(true);
        ExtractionDeadline deadline = ExtractionDeadline.after(Duration.ofHours(1), Clock.systemUTC());
        deadline.cancel();
        List<Candidate> candidates = List.of(candidate("A place"), candidate("Another place"));

        enricher.enrich(candidates, null, deadline);

        assertThat(candidates).allSatisfy(c ->
                assertThat(c.getResolutionError()).isEqualTo(PlacesEnricher.CANCELLED));
        verify(resolver, never()).search(anyString(), any());
    }

    @Test
    void concurrentResolutionKeepsCandidateOrder() {
        props.setMaxConcurrency(4);
        when(resolver.hasCredentials()).thenReturn(true);
        when(resolver.search(anyString(), isNull())).thenAnswer(inv -> {
            String name = inv.getArgument(0);
            Thread.sleep(name.length() % 3 * 10L);
            return Optional.of(new PlaceMatch(name + " resolved", name, null, 1.0, 1.0, Map.of()));
        });
        List<Candidate> candidates = List.of(candidate("a"), candidate("bb"), candidate("ccc"), candidate("dddd"),
                candidate("eeeee"), candidate("ffffff"));

        List<Candidate> out = enricher.enrich(candidates, null);

        assertThat(out).extracting(Candidate::getResolvedName)
                .containsExactly("a resolved", "bb resolved", "ccc resolved", "dddd resolved",
                        "eeeee resolved", "ffffff resolved");
    }

    @Test
    void emptyInputReturnsEmptyList() {
        assertThat(enricher.enrich(List.of(), "Lisbon")).isEmpty();
        assertThat(enricher.enrich(null, "Lisbon")).isEmpty();
    }

    private static Candidate candidate(String name) {
        return new Candidate(name, ExtractionMethod.HEURISTIC);
    }
}
