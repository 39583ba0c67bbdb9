package com.example.placescout_backend.engine.Interfaces;

import com.example.placescout_backend.model.GeoPoint;
import com.example.placescout_backend.model.PlaceMatch;

import java.util.Optional;

/**
 * Geographic lookup used to enrich candidates.
 */
public interface PlaceResolver {

    /**
     * Whether credentials are configured. Without them no lookups are made at all.
     */
    boolean hasCredentials();

    /**
     * Resolves a free-text location hint to a bias point. Never throws; every failure is "no bias".
     */
    Optional<GeoPoint> geocode(String hint);

    /**
     * Best match for {@code name}, preferring results near {@code bias} when given.
     *
     * @throws com.example.placescout_backend.PlaceLookupException on transport failure.
     */
    Optional<PlaceMatch> search(String name, GeoPoint bias);
}
