package com.example.placescout_backend.extraction;

import com.example.placescout_backend.ExtractionCancelledException;
import com.example.placescout_backend.LanguageModelException;
import com.example.placescout_backend.config.ExtractionProperties;
import com.example.placescout_backend.config.ExtractionProperties.PartialResultPolicy;
import com.example.placescout_backend.engine.Interfaces.LanguageModelEngine;
import com.example.placescout_backend.engine.Interfaces.LanguageModelEngine.ModelCompletion;
import com.example.placescout_backend.extraction.parse.ModelResponseParser;
import com.example.placescout_backend.extraction.parse.ParseOutcome;
import com.example.placescout_backend.model.Candidate;
import com.example.placescout_backend.model.ExtractionMethod;
import com.example.placescout_backend.model.OcrLine;
import com.example.placescout_backend.model.Segment;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Chooses between the language-model path and the heuristic path for one run. The model path
 * never throws to the caller; any failure there ends in heuristic mining.
 */
@Service
public class ExtractionOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionOrchestrator.class);

    private final ExtractionProperties props;
    private final LanguageModelEngine engine;
    private final ObjectMapper om;
    private final PromptBuilder promptBuilder;
    private final ModelResponseParser parser;
    private final ModelCandidateMapper mapper;
    private final HeuristicMiner miner = new HeuristicMiner();
    private final CandidateAggregator aggregator = new CandidateAggregator();

    public ExtractionOrchestrator(ExtractionProperties props, LanguageModelEngine engine, ObjectMapper om) {
        this.props = props;
        this.engine = engine;
        this.om = om;
        this.promptBuilder = new PromptBuilder(props, om);
        this.parser = new ModelResponseParser(om);
        this.mapper = new ModelCandidateMapper(om);
    }

    public ExtractionResult extract(List<Segment> segments, List<OcrLine> ocrLines, String locationHint) {
        return extract(segments, ocrLines, locationHint, ExtractionDeadline.none());
    }

    public ExtractionResult extract(List<Segment> segments, List<OcrLine> ocrLines, String locationHint,
                                    ExtractionDeadline deadline) {
        List<Segment> transcript = segments == null ? List.of() : segments;
        List<OcrLine> frames = ocrLines == null ? List.of() : ocrLines;

        ModelAttempt attempt = props.isLanguageModelEnabled()
                ? attemptModel(transcript, locationHint, deadline)
                : ModelAttempt.disabled();

        if (attempt.succeeded()) {
            LOGGER.info("extraction done method=model candidates={} strategy={} segments={}",
                    attempt.candidates().size(), attempt.parseStrategy(), attempt.segmentCount());
            return new ExtractionResult(attempt.candidates(), ExtractionMethod.MODEL, attempt);
        }
        if (attempt.used()) {
            LOGGER.warn("model path fell back reason={} error={}", attempt.fallbackReason(), attempt.error());
        }

        List<Candidate> ranked = aggregator.rank(miner.mine(transcript, frames), locationHint, props.getMaxCandidates());
        LOGGER.info("extraction done method=heuristic candidates={} segments={} ocrLines={} reason={}",
                ranked.size(), transcript.size(), frames.size(), attempt.fallbackReason());
        return new ExtractionResult(ranked, ExtractionMethod.HEURISTIC, attempt);
    }

    ModelAttempt attemptModel(List<Segment> segments, String locationHint, ExtractionDeadline deadline) {
        List<Segment> filtered = SegmentFilter.filter(segments, props.getMaxSegments());
        PromptBuilder.ModelRequest request = promptBuilder.build(locationHint, filtered);
        Attempt a = new Attempt(request);

        try {
            deadline.check("model_call");
        } catch (ExtractionCancelledException ex) {
            return a.failed(ModelAttempt.CANCELLED, ex.getMessage(), null, null);
        }

        ModelCompletion completion;
        try {
            completion = engine.generate(request.text());
        } catch (LanguageModelException ex) {
            return a.failed(ModelAttempt.CALL_FAILED, ex.getMessage(), null, null);
        } catch (RuntimeException ex) {
            LOGGER.warn("model engine failed unexpectedly type={} error={}", ex.getClass().getSimpleName(), ex.getMessage());
            return a.failed(ModelAttempt.CALL_FAILED, ex.getMessage(), null, null);
        }

        String raw = completion.text();
        if (completion.hasError() && (props.getPartialResultPolicy() == PartialResultPolicy.FALLBACK || raw.isBlank())) {
            return a.failed(ModelAttempt.CALL_FAILED, completion.error(), raw, null);
        }

        ParseOutcome outcome = parser.parse(raw, failed -> {
            deadline.check("repair_call");
            ModelCompletion repaired = engine.generate(promptBuilder.repairPrompt(failed));
            if (repaired.hasError()) {
                throw new LanguageModelException("repair failed: " + repaired.error(), false);
            }
            return repaired.text();
        });

        if (!outcome.isParsed()) {
            String reason = deadline.isExpired() ? ModelAttempt.CANCELLED : ModelAttempt.JSON_PARSE_FAILED;
            return a.failed(reason, outcome.error(), raw, null);
        }

        String modelError = completion.error();
        JsonNode payloadError = outcome.json().isObject() ? outcome.json().get("error") : null;
        if (payloadError != null && !payloadError.isNull()) {
            String detail = payloadError.isTextual() ? payloadError.asText() : payloadError.toString();
            if (props.getPartialResultPolicy() == PartialResultPolicy.FALLBACK) {
                return a.failed(ModelAttempt.CALL_FAILED, detail, raw, outcome.json());
            }
            modelError = modelError == null ? detail : modelError + "; " + detail;
        }

        List<Candidate> candidates = mapper.map(outcome.candidates(), locationHint, request.text(), raw, props.getMaxCandidates());
        if (candidates.isEmpty()) {
            ObjectNode empty = om.createObjectNode();
            empty.putArray("candidates");
            return a.failed(ModelAttempt.EMPTY_CANDIDATES, modelError, raw, empty);
        }

        ObjectNode safeOutput = om.createObjectNode();
        ArrayNode items = safeOutput.putArray("candidates");
        outcome.candidates().forEach(items::add);
        return new ModelAttempt(true, candidates, request.text(), request.input(), raw, safeOutput,
                modelError, null, outcome.strategy(), request.segmentCount());
    }

    private record Attempt(PromptBuilder.ModelRequest request) {
        ModelAttempt failed(String reason, String error, String raw, JsonNode outputJson) {
            Map<String, Object> input = request.input();
            return new ModelAttempt(true, List.of(), request.text(), input, raw == null ? "" : raw, outputJson,
                    error, reason, null, request.segmentCount());
        }
    }
}
