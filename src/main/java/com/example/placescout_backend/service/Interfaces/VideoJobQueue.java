package com.example.placescout_backend.service.Interfaces;

import com.example.placescout_backend.model.VideoJob;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public interface VideoJobQueue {

    UUID enqueue(Path videoPath, String locationHint);

    Optional<VideoJob> find(UUID id);

    /**
     * Moves up to {@code maxBatchSize} queued jobs to PROCESSING, oldest first.
     */
    List<VideoJob> claimQueuedBatch(int maxBatchSize);

    void markProgress(UUID id, int progress);

    void markDone(UUID id, Map<String, Object> meta, List<Map<String, Object>> candidates);

    void markFailed(UUID id, String message, Map<String, Object> meta);
}
