package com.example.placescout_backend.model;

import com.example.placescout_backend.util.Confidence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A proposed real-world place. Name and extraction method are fixed at creation; evidence only
 * grows; the enrichment fields stay empty until the places stage has run.
 */
public class Candidate {

    private final String name;
    private final ExtractionMethod extractionMethod;
    private final List<Evidence> evidence = new ArrayList<>();
    private final Map<String, Double> scoreBreakdown = new LinkedHashMap<>();
    private final Map<String, Object> extras = new LinkedHashMap<>();

    private PlaceCategory category = PlaceCategory.OTHER;
    private double confidence = Confidence.FLOOR;
    private String addressHint;
    private Long startMs;
    private Long endMs;
    private String llmPrompt;
    private String llmOutput;

    private String placesQuery;
    private String resolvedName;
    private String placeId;
    private String formattedAddress;
    private Double latitude;
    private Double longitude;
    private Map<String, Object> placesRaw;
    private String resolutionError;
    private boolean resolutionFailed;

    public Candidate(String name, ExtractionMethod extractionMethod) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("candidate name must not be blank");
        }
        this.name = trimmed;
        this.extractionMethod = Objects.requireNonNull(extractionMethod, "extractionMethod");
    }

    /**
     * Case-insensitive identity used for de-duplication.
     */
    public static String keyOf(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    public String key() {
        return keyOf(name);
    }

    public void addEvidence(Evidence item) {
        Objects.requireNonNull(item, "evidence");
        if (evidence.isEmpty()) {
            startMs = item.startMs();
            endMs = item.endMs();
        }
        evidence.add(item);
    }

    public boolean hasTranscriptEvidence() {
        return evidence.stream().anyMatch(Evidence.Transcript.class::isInstance);
    }

    public boolean hasOcrEvidence() {
        return evidence.stream().anyMatch(Evidence.Ocr.class::isInstance);
    }

    /**
     * Stores a score. The breakdown terms must add up to the unclamped score; {@code final}
     * is recorded next to them.
     */
    public void applyScore(Map<String, Double> terms) {
        scoreBreakdown.clear();
        scoreBreakdown.putAll(terms);
        double raw = rawScore();
        confidence = Confidence.clamp(raw);
        scoreBreakdown.put(Confidence.FINAL_TERM, confidence);
    }

    /**
     * Sum of every breakdown term except {@code final}.
     */
    public double rawScore() {
        double sum = 0;
        for (Map.Entry<String, Double> e : scoreBreakdown.entrySet()) {
            if (!Confidence.FINAL_TERM.equals(e.getKey())) {
                sum += e.getValue();
            }
        }
        return sum;
    }

    public void applyMatch(PlaceMatch match) {
        this.resolvedName = match.name();
        this.placeId = match.placeId();
        this.formattedAddress = match.formattedAddress();
        this.latitude = match.latitude();
        this.longitude = match.longitude();
        this.placesRaw = match.raw();
        this.resolutionFailed = !match.hasCoordinates();
    }

    public void markResolutionFailed(String error) {
        this.resolutionFailed = true;
        this.resolutionError = error;
    }

    public String getName() {
        return name;
    }

    public ExtractionMethod getExtractionMethod() {
        return extractionMethod;
    }

    public List<Evidence> getEvidence() {
        return Collections.unmodifiableList(evidence);
    }

    public Map<String, Double> getScoreBreakdown() {
        return Collections.unmodifiableMap(scoreBreakdown);
    }

    public Map<String, Object> getExtras() {
        return extras;
    }

    public PlaceCategory getCategory() {
        return category;
    }

    public void setCategory(PlaceCategory category) {
        this.category = category == null ? PlaceCategory.OTHER : category;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getAddressHint() {
        return addressHint;
    }

    public void setAddressHint(String addressHint) {
        this.addressHint = addressHint;
    }

    public Long getStartMs() {
        return startMs;
    }

    public Long getEndMs() {
        return endMs;
    }

    public String getLlmPrompt() {
        return llmPrompt;
    }

    public void setLlmPrompt(String llmPrompt) {
        this.llmPrompt = llmPrompt;
    }

    public String getLlmOutput() {
        return llmOutput;
    }

    public void setLlmOutput(String llmOutput) {
        this.llmOutput = llmOutput;
    }

    public String getPlacesQuery() {
        return placesQuery;
    }

    public void setPlacesQuery(String placesQuery) {
        this.placesQuery = placesQuery;
    }

    public String getResolvedName() {
        return resolvedName;
    }

    public String getPlaceId() {
        return placeId;
    }

    public String getFormattedAddress() {
        return formattedAddress;
    }

    public Double getLatitude() {
        return latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public Map<String, Object> getPlacesRaw() {
        return placesRaw;
    }

    public String getResolutionError() {
        return resolutionError;
    }

    /**
     * True whenever coordinates are missing, including before resolution was attempted.
     */
    public boolean isResolutionFailed() {
        return resolutionFailed || latitude == null || longitude == null;
    }

    @Override
    public String toString() {
        return "Candidate{" +
                "name='" + name + '\'' +
                ", method=" + extractionMethod +
                ", confidence=" + confidence +
                ", evidence=" + evidence.size() +
                '}';
    }
}
