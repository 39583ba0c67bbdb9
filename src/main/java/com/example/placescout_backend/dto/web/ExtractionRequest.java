package com.example.placescout_backend.dto.web;

import com.example.placescout_backend.model.OcrLine;
import com.example.placescout_backend.model.Segment;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record ExtractionRequest(
        @Size(max = 20_000) List<Segment> segments,
        @JsonProperty("ocr_lines") @Size(max = 20_000) List<OcrLine> ocrLines,
        @JsonProperty("location_hint") @Size(max = 512) String locationHint,
        Boolean enrich
) {

    public boolean enrichRequested() {
        return Boolean.TRUE.equals(enrich);
    }
}
