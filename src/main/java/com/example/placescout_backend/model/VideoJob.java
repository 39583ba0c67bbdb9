package com.example.placescout_backend.model;

import com.example.placescout_backend.util.JobStatus;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One queued video. Instances are owned by the {@code VideoJobQueue}; callers get snapshots.
 */
public class VideoJob {
    private final UUID id;
    private final Path videoPath;
    private final String locationHint;
    private final Instant createdAt;

    private JobStatus status = JobStatus.QUEUED;
    private int progress;
    private String error;
    private Map<String, Object> meta = Map.of();
    private List<Map<String, Object>> candidates = List.of();
    private Instant updatedAt;

    public VideoJob(UUID id, Path videoPath, String locationHint, Instant createdAt) {
        this.id = id;
        this.videoPath = videoPath;
        this.locationHint = locationHint;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public VideoJob copy() {
        VideoJob c = new VideoJob(id, videoPath, locationHint, createdAt);
        c.status = status;
        c.progress = progress;
        c.error = error;
        c.meta = meta;
        c.candidates = candidates;
        c.updatedAt = updatedAt;
        return c;
    }

    public UUID getId() {
        return id;
    }

    public Path getVideoPath() {
        return videoPath;
    }

    public String getLocationHint() {
        return locationHint;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public int getProgress() {
        return progress;
    }

    public void setProgress(int progress) {
        this.progress = Math.max(0, Math.min(100, progress));
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Map<String, Object> getMeta() {
        return meta;
    }

    public void setMeta(Map<String, Object> meta) {
        this.meta = meta == null ? Map.of() : meta;
    }

    public List<Map<String, Object>> getCandidates() {
        return candidates;
    }

    public void setCandidates(List<Map<String, Object>> candidates) {
        this.candidates = candidates == null ? List.of() : candidates;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
