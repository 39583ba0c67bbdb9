package com.example.placescout_backend.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A fragment of raw text supporting a candidate. Either spoken ({@link Transcript}) or read
 * from a frame ({@link Ocr}).
 */
public sealed interface Evidence permits Evidence.Transcript, Evidence.Ocr {

    long startMs();

    long endMs();

    Map<String, Object> toMeta();

    record Transcript(String quote, long startMs, long endMs) implements Evidence {
        @Override
        public Map<String, Object> toMeta() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("quote", quote);
            m.put("start_ms", startMs);
            m.put("end_ms", endMs);
            return m;
        }
    }

    record Ocr(String text, long timestampMs) implements Evidence {
        @Override
        public long startMs() {
            return timestampMs;
        }

        @Override
        public long endMs() {
            return timestampMs;
        }

        @Override
        public Map<String, Object> toMeta() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("text", text);
            m.put("timestamp_ms", timestampMs);
            return m;
        }
    }
}
