package com.example.placescout_backend.engine;

import com.example.placescout_backend.dto.FwVerboseResponse;
import com.example.placescout_backend.engine.Interfaces.TranscriptionEngine;
import com.example.placescout_backend.model.Segment;
import com.example.placescout_backend.service.FasterWhisperClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class FasterWhisperTranscriptionEngine implements TranscriptionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(FasterWhisperTranscriptionEngine.class);

    private final FasterWhisperClient client;

    public FasterWhisperTranscriptionEngine(FasterWhisperClient client) {
        this.client = client;
    }

    @Override
    public List<Segment> transcribe(Path video) {
        if (!Files.exists(video)) throw new IllegalArgumentException("input not found: " + video);

        FwVerboseResponse resp = client.transcribeFile(video);
        List<Segment> segments = toSegments(resp);
        LOGGER.info("transcribe done video={} segments={} language={}",
                video.getFileName(), segments.size(), resp == null ? null : resp.language());
        return segments;
    }

    static List<Segment> toSegments(FwVerboseResponse resp) {
        List<Segment> out = new ArrayList<>();
        if (resp == null || resp.segments() == null) {
            return out;
        }
        for (var seg : resp.segments()) {
            String text = seg.text() == null ? "" : seg.text().strip();
            if (text.isEmpty()) continue;
            long s = seg.start() == null ? 0L : Math.round(seg.start() * 1000);
            long e = seg.end() == null ? s : Math.round(seg.end() * 1000);
            out.add(new Segment(s, e, text));
        }
        out.sort(Comparator.comparingLong(Segment::startMs));
        return out;
    }
}
