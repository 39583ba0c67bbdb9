package com.example.placescout_backend.controller;

import com.example.placescout_backend.dto.web.ExtractionRequest;
import com.example.placescout_backend.dto.web.ExtractionResponse;
import com.example.placescout_backend.extraction.ExtractionOrchestrator;
import com.example.placescout_backend.extraction.ExtractionResult;
import com.example.placescout_backend.model.Candidate;
import com.example.placescout_backend.service.CandidateSanitizer;
import com.example.placescout_backend.service.PlacesEnricher;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/extractions")
public class ExtractionController {
    private final ExtractionOrchestrator orchestrator;
    private final PlacesEnricher enricher;
    private final CandidateSanitizer sanitizer;

    public ExtractionController(ExtractionOrchestrator orchestrator, PlacesEnricher enricher, CandidateSanitizer sanitizer) {
        this.orchestrator = orchestrator;
        this.enricher = enricher;
        this.sanitizer = sanitizer;
    }

    @PostMapping
    public ExtractionResponse extract(@Valid @RequestBody ExtractionRequest req) {
        ExtractionResult result = orchestrator.extract(req.segments(), req.ocrLines(), req.locationHint());
        List<Candidate> candidates = result.candidates();
        if (req.enrichRequested()) {
            candidates = enricher.enrich(candidates, req.locationHint());
        }
        return new ExtractionResponse(
                result.method().wireName(),
                result.fallbackReason(),
                result.model().used(),
                result.model().segmentCount(),
                sanitizer.sanitize(candidates)
        );
    }
}
