package com.example.placescout_backend.service;

import com.example.placescout_backend.config.WorkerExecutorProperties;
import com.example.placescout_backend.engine.Interfaces.FrameTextEngine;
import com.example.placescout_backend.engine.Interfaces.TranscriptionEngine;
import com.example.placescout_backend.extraction.ExtractionDeadline;
import com.example.placescout_backend.extraction.ExtractionOrchestrator;
import com.example.placescout_backend.extraction.ExtractionResult;
import com.example.placescout_backend.model.OcrLine;
import com.example.placescout_backend.model.Segment;
import com.example.placescout_backend.model.VideoJob;
import com.example.placescout_backend.service.Interfaces.VideoJobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one video job end to end: transcript, frame text, extraction, enrichment, sanitizing.
 */
@Service
public class VideoJobProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(VideoJobProcessor.class);

    private final VideoJobQueue queue;
    private final TranscriptionEngine transcription;
    private final FrameTextEngine frameText;
    private final ExtractionOrchestrator orchestrator;
    private final PlacesEnricher enricher;
    private final CandidateSanitizer sanitizer;
    private final WorkerExecutorProperties workerProperties;
    private final Clock clock;

    public VideoJobProcessor(VideoJobQueue queue, TranscriptionEngine transcription, FrameTextEngine frameText,
                             ExtractionOrchestrator orchestrator, PlacesEnricher enricher,
                             CandidateSanitizer sanitizer, WorkerExecutorProperties workerProperties, Clock clock) {
        this.queue = queue;
        this.transcription = transcription;
        this.frameText = frameText;
        this.orchestrator = orchestrator;
        this.enricher = enricher;
        this.sanitizer = sanitizer;
        this.workerProperties = workerProperties;
        this.clock = clock;
    }

    /**
     * @throws Exception for fatal job errors; the caller marks the job failed.
     */
    public void process(VideoJob job) throws Exception {
        Path video = job.getVideoPath();
        if (video == null || !Files.exists(video)) {
            throw new FileNotFoundException("video file not found: " + video);
        }
        ExtractionDeadline deadline = workerProperties.getJobTimeoutSeconds() > 0
                ? ExtractionDeadline.after(Duration.ofSeconds(workerProperties.getJobTimeoutSeconds()), clock)
                : ExtractionDeadline.none();

        queue.markProgress(job.getId(), 10);
        List<Segment> segments = transcription.transcribe(video);
        List<OcrLine> ocrLines = frameText.readFrames(video);
        LOGGER.info("JOB signals jobId={} segments={} ocrLines={}", job.getId(), segments.size(), ocrLines.size());

        ExtractionResult result = orchestrator.extract(segments, ocrLines, job.getLocationHint(), deadline);
        Map<String, Object> meta = new LinkedHashMap<>(result.toMeta());
        meta.put("segment_total", segments.size());
        meta.put("ocr_line_count", ocrLines.size());
        queue.markProgress(job.getId(), 60);

        var enriched = enricher.enrich(result.candidates(), job.getLocationHint(), deadline);
        queue.markProgress(job.getId(), 80);

        List<Map<String, Object>> rows = sanitizer.sanitize(enriched);
        queue.markDone(job.getId(), sanitizer.jsonSafeMap(meta), rows);
        LOGGER.info("JOB result jobId={} method={} candidates={} reason={}",
                job.getId(), result.method().wireName(), rows.size(), result.fallbackReason());
    }
}
