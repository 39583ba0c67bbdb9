package com.example.placescout_backend.extraction;

import com.example.placescout_backend.model.Candidate;
import com.example.placescout_backend.model.ExtractionMethod;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one extraction run: the candidate list (never {@code null}, at most the configured
 * cap) and the audit trail of the model path.
 */
public record ExtractionResult(List<Candidate> candidates, ExtractionMethod method, ModelAttempt model) {

    public ExtractionResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public String fallbackReason() {
        return method == ExtractionMethod.MODEL ? null : model.fallbackReason();
    }

    /**
     * Flat job metadata in the column layout the job store expects.
     */
    public Map<String, Object> toMeta() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("extraction_method", method.wireName());
        m.put("ollama_used", model.used());
        m.put("ollama_fallback_reason", fallbackReason());
        m.put("ollama_error", model.error());
        m.put("ollama_prompt", model.prompt());
        m.put("ollama_input", model.input());
        m.put("ollama_output_raw", model.outputRaw());
        m.put("ollama_output_json", model.outputJson());
        m.put("ollama_parse_strategy", model.parseStrategy());
        m.put("ollama_segment_count", model.segmentCount());
        m.put("candidate_count", candidates.size());
        return m;
    }
}
