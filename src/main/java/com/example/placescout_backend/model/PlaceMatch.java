package com.example.placescout_backend.model;

import java.util.Map;

/**
 * Best matching real-world place returned by a {@code PlaceResolver}.
 *
 * @param name             provider display name.
 * @param placeId          provider place identifier.
 * @param formattedAddress provider formatted address.
 * @param latitude         may be {@code null} when the provider omitted geometry.
 * @param longitude        may be {@code null} when the provider omitted geometry.
 * @param raw              provider payload kept for auditing.
 */
public record PlaceMatch(
        String name,
        String placeId,
        String formattedAddress,
        Double latitude,
        Double longitude,
        Map<String, Object> raw
) {
    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
