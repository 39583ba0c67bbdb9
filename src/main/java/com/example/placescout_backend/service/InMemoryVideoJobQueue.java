package com.example.placescout_backend.service;

import com.example.placescout_backend.config.WorkerExecutorProperties;
import com.example.placescout_backend.model.VideoJob;
import com.example.placescout_backend.service.Interfaces.VideoJobQueue;
import com.example.placescout_backend.util.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Process-local job store. Finished jobs are evicted by age and by count so results stay readable
 * for a while without the map growing for the life of the process.
 */
@Service
public class InMemoryVideoJobQueue implements VideoJobQueue {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryVideoJobQueue.class);

    private final Map<UUID, VideoJob> jobs = new LinkedHashMap<>();
    private final Clock clock;
    private final WorkerExecutorProperties props;

    public InMemoryVideoJobQueue(Clock clock, WorkerExecutorProperties props) {
        this.clock = clock;
        this.props = props;
    }

    @Override
    public synchronized UUID enqueue(Path videoPath, String locationHint) {
        UUID id = UUID.randomUUID();
        jobs.put(id, new VideoJob(id, videoPath, locationHint, clock.instant()));
        LOGGER.info("job enqueued jobId={} video={}", id, videoPath);
        return id;
    }

    @Override
    public synchronized Optional<VideoJob> find(UUID id) {
        return Optional.ofNullable(jobs.get(id)).map(VideoJob::copy);
    }

    @Override
    public synchronized List<VideoJob> claimQueuedBatch(int maxBatchSize) {
        evictFinished();
        if (maxBatchSize <= 0) {
            return List.of();
        }
        List<VideoJob> claimed = new ArrayList<>();
        jobs.values().stream()
                .filter(j -> j.getStatus() == JobStatus.QUEUED)
                .sorted(Comparator.comparing(VideoJob::getCreatedAt))
                .limit(maxBatchSize)
                .forEach(j -> {
                    j.setStatus(JobStatus.PROCESSING);
                    j.setProgress(0);
                    j.setUpdatedAt(clock.instant());
                    claimed.add(j.copy());
                });
        return claimed;
    }

    @Override
    public synchronized void markProgress(UUID id, int progress) {
        VideoJob job = require(id);
        job.setProgress(progress);
        job.setUpdatedAt(clock.instant());
    }

    @Override
    public synchronized void markDone(UUID id, Map<String, Object> meta, List<Map<String, Object>> candidates) {
        VideoJob job = require(id);
        job.setStatus(JobStatus.DONE);
        job.setProgress(100);
        job.setMeta(meta);
        job.setCandidates(candidates);
        job.setError(null);
        job.setUpdatedAt(clock.instant());
        evictFinished();
    }

    @Override
    public synchronized void markFailed(UUID id, String message, Map<String, Object> meta) {
        VideoJob job = require(id);
        job.setStatus(JobStatus.FAILED);
        job.setProgress(100);
        job.setError(message == null ? "unknown" : message);
        if (meta != null && !meta.isEmpty()) {
            job.setMeta(meta);
        }
        job.setUpdatedAt(clock.instant());
        evictFinished();
    }

    synchronized int size() {
        return jobs.size();
    }

    private void evictFinished() {
        int evicted = 0;
        Duration ttl = props.getFinishedJobTtl();
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            Instant cutoff = clock.instant().minus(ttl);
            Iterator<VideoJob> it = jobs.values().iterator();
            while (it.hasNext()) {
                VideoJob j = it.next();
                if (isFinished(j) && !j.getUpdatedAt().isAfter(cutoff)) {
                    it.remove();
                    evicted++;
                }
            }
        }

        int limit = props.getFinishedJobLimit();
        if (limit > 0) {
            List<VideoJob> finished = jobs.values().stream()
                    .filter(InMemoryVideoJobQueue::isFinished)
                    .sorted(Comparator.comparing(VideoJob::getUpdatedAt))
                    .toList();
            for (int i = 0; i < finished.size() - limit; i++) {
                jobs.remove(finished.get(i).getId());
                evicted++;
            }
        }
        if (evicted > 0) {
            LOGGER.debug("evicted finished jobs count={} remaining={}", evicted, jobs.size());
        }
    }

    private static boolean isFinished(VideoJob job) {
        return job.getStatus() == JobStatus.DONE || job.getStatus() == JobStatus.FAILED;
    }

    private VideoJob require(UUID id) {
        VideoJob job = jobs.get(id);
        if (job == null) {
            throw new IllegalArgumentException("unknown job " + id);
        }
        return job;
    }
}
