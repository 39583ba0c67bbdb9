package com.example.placescout_backend.dto.web;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record ExtractionResponse(
        @JsonProperty("extraction_method") String extractionMethod,
        @JsonProperty("fallback_reason") String fallbackReason,
        @JsonProperty("model_used") boolean modelUsed,
        @JsonProperty("segment_count") int segmentCount,
        List<Map<String, Object>> candidates
) {
}
