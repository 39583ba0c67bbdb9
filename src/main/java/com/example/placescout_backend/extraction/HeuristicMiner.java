package com.example.placescout_backend.extraction;

import com.example.placescout_backend.model.Candidate;
import com.example.placescout_backend.model.Evidence;
import com.example.placescout_backend.model.ExtractionMethod;
import com.example.placescout_backend.model.OcrLine;
import com.example.placescout_backend.model.PlaceCategory;
import com.example.placescout_backend.model.Segment;
import com.example.placescout_backend.util.PlaceLexicon;
import com.example.placescout_backend.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexicon and pattern based place detector. Needs no network and always produces a result,
 * which makes it the fallback for the model path.
 */
public class HeuristicMiner {
    private static final Logger LOGGER = LoggerFactory.getLogger(HeuristicMiner.class);

    private static final String NAME_CHARS = "([A-Za-z0-9&@\\-'.\\s]+)";
    private static final List<Pattern> MENTION_PATTERNS = List.of(
            Pattern.compile("we(?:'re| are) at " + NAME_CHARS, Pattern.CASE_INSENSITIVE),
            Pattern.compile("we(?:'re| are) in " + NAME_CHARS, Pattern.CASE_INSENSITIVE),
            Pattern.compile("go to " + NAME_CHARS, Pattern.CASE_INSENSITIVE),
            Pattern.compile("going to " + NAME_CHARS, Pattern.CASE_INSENSITIVE),
            Pattern.compile("next stop is " + NAME_CHARS, Pattern.CASE_INSENSITIVE),
            Pattern.compile("this is " + NAME_CHARS, Pattern.CASE_INSENSITIVE)
    );

    static final int MIN_OCR_NAME = 3;
    static final int MAX_OCR_NAME = 80;

    /**
     * Mines both sources into one insertion-ordered map keyed by lower-cased name. Transcript
     * mentions are visited first, then frame text.
     */
    public Map<String, Candidate> mine(List<Segment> segments, List<OcrLine> ocrLines) {
        Map<String, Candidate> found = new LinkedHashMap<>();
        int mentions = 0;
        int accepted = 0;

        if (segments != null) {
            for (Segment segment : segments) {
                String text = TextNormalizer.normalize(segment.text());
                for (String mention : extractMentions(text)) {
                    candidateFor(found, mention)
                            .addEvidence(new Evidence.Transcript(segment.text(), segment.startMs(), segment.endMs()));
                    mentions++;
                }
            }
        }

        if (ocrLines != null) {
            for (OcrLine line : ocrLines) {
                String text = TextNormalizer.normalize(line.text());
                if (!looksLikePlaceName(text)) {
                    continue;
                }
                candidateFor(found, text).addEvidence(new Evidence.Ocr(line.text(), line.timestampMs()));
                accepted++;
            }
        }

        LOGGER.debug("heuristic mine segments={} ocrLines={} mentions={} ocrAccepted={} candidates={}",
                segments == null ? 0 : segments.size(), ocrLines == null ? 0 : ocrLines.size(),
                mentions, accepted, found.size());
        return found;
    }

    /**
     * Every match of every phrase pattern, in pattern order, normalised.
     */
    static List<String> extractMentions(String text) {
        List<String> mentions = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return mentions;
        }
        for (Pattern pattern : MENTION_PATTERNS) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                String mention = TextNormalizer.normalize(m.group(1));
                if (!mention.isEmpty()) {
                    mentions.add(mention);
                }
            }
        }
        return mentions;
    }

    static boolean looksLikePlaceName(String text) {
        if (text == null || text.length() < MIN_OCR_NAME || text.length() > MAX_OCR_NAME) {
            return false;
        }
        if (PlaceLexicon.isGenericPhrase(text)) {
            return false;
        }
        if (PlaceLexicon.containsPlaceKeyword(text)) {
            return true;
        }
        if (TextNormalizer.countUpperCase(text) >= 2) {
            return true;
        }
        return TextNormalizer.isTitleCase(text);
    }

    private static Candidate candidateFor(Map<String, Candidate> found, String name) {
        return found.computeIfAbsent(Candidate.keyOf(name), k -> {
            Candidate c = new Candidate(name, ExtractionMethod.HEURISTIC);
            c.setCategory(PlaceCategory.infer(name));
            return c;
        });
    }
}
