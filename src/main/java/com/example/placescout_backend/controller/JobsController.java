package com.example.placescout_backend.controller;

import com.example.placescout_backend.dto.web.VideoJobCreateRequest;
import com.example.placescout_backend.service.Interfaces.VideoJobQueue;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/v1/jobs")
public class JobsController {
    private final VideoJobQueue queue;

    public JobsController(VideoJobQueue queue) {
        this.queue = queue;
    }

    public record EnqueueRes(UUID jobId, String status) {}
    public record JobRes(
            UUID id,
            String videoPath,
            String locationHint,
            String status,
            int progress,
            String error,
            Map<String, Object> meta,
            List<Map<String, Object>> candidates,
            Instant createdAt,
            Instant updatedAt
    ) {}

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public EnqueueRes enqueue(@Valid @RequestBody VideoJobCreateRequest req) {
        Path path;
        try {
            path = Path.of(req.videoPath().trim());
        } catch (InvalidPathException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_REQUEST");
        }
        String hint = req.locationHint() == null || req.locationHint().isBlank() ? null : req.locationHint().trim();
        UUID id = queue.enqueue(path, hint);
        return new EnqueueRes(id, "QUEUED");
    }

    @GetMapping("/{id}")
    public JobRes get(@PathVariable UUID id) {
        var j = queue.find(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
        return new JobRes(
                j.getId(),
                String.valueOf(j.getVideoPath()),
                j.getLocationHint(),
                j.getStatus().name(),
                j.getProgress(),
                j.getError(),
                j.getMeta(),
                j.getCandidates(),
                j.getCreatedAt(),
                j.getUpdatedAt()
        );
    }
}
