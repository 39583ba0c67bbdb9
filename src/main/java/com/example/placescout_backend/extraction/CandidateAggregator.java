package com.example.placescout_backend.extraction;

import com.example.placescout_backend.model.Candidate;
import com.example.placescout_backend.util.Confidence;
import com.example.placescout_backend.util.PlaceLexicon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores mined candidates with a small additive model and keeps the best ones.
 */
public class CandidateAggregator {
    private static final Logger LOGGER = LoggerFactory.getLogger(CandidateAggregator.class);

    public static final int DEFAULT_TOP_N = 15;

    /**
     * @param confidence clamped score.
     * @param terms      unclamped terms in application order; they sum to the pre-clamp score.
     */
    public record Score(double confidence, Map<String, Double> terms) {
        public Map<String, Double> breakdown() {
            Map<String, Double> m = new LinkedHashMap<>(terms);
            m.put(Confidence.FINAL_TERM, confidence);
            return m;
        }
    }

    static final double BASE = 0.2;
    static final double OCR_BONUS = 0.4;
    static final double TRANSCRIPT_BONUS = 0.3;
    static final double KEYWORD_BONUS = 0.1;
    static final double GENERIC_PENALTY = -0.4;

    /**
     * Additive score for one candidate.
     *
     * @param name          candidate name.
     * @param hasOcr        whether any frame text supports it.
     * @param hasTranscript whether any transcript mention supports it.
     * @return the clamped confidence with every applied term.
     */
    public Score score(String name, boolean hasOcr, boolean hasTranscript) {
        Map<String, Double> terms = new LinkedHashMap<>();
        terms.put("base", BASE);
        if (hasOcr) {
            terms.put("ocr", OCR_BONUS);
        }
        if (hasTranscript) {
            terms.put("transcript", TRANSCRIPT_BONUS);
        }
        String lowered = name == null ? "" : name.toLowerCase(Locale.ROOT);
        if (PlaceLexicon.containsPlaceKeyword(lowered)) {
            terms.put("keyword", KEYWORD_BONUS);
        }
        if (PlaceLexicon.isGenericPhrase(lowered)) {
            terms.put("generic_penalty", GENERIC_PENALTY);
        }
        double sum = 0;
        for (double v : terms.values()) {
            sum += v;
        }
        return new Score(Confidence.clamp(sum), terms);
    }

    /**
     * Scores every candidate, stamps the address hint and returns the {@code topN} best.
     * Equal scores keep the map's insertion order.
     */
    public List<Candidate> rank(Map<String, Candidate> mined, String locationHint, int topN) {
        String addressHint = locationHint == null || locationHint.isBlank() ? null : locationHint.strip();
        List<Candidate> ranked = new ArrayList<>(mined.values());
        for (Candidate candidate : ranked) {
            candidate.applyScore(score(candidate.getName(), candidate.hasOcrEvidence(), candidate.hasTranscriptEvidence()).terms());
            candidate.setAddressHint(addressHint);
        }
        // List.sort is stable
        ranked.sort(Comparator.comparingDouble(Candidate::getConfidence).reversed());
        int limit = Math.max(0, topN);
        if (ranked.size() > limit) {
            ranked = new ArrayList<>(ranked.subList(0, limit));
        }
        LOGGER.debug("aggregator candidates={} kept={} top={}", mined.size(), ranked.size(),
                ranked.isEmpty() ? "-" : String.format(Locale.ROOT, "%.3f", ranked.get(0).getConfidence()));
        return ranked;
    }
}
