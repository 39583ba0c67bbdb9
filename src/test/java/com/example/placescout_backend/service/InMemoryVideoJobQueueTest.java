package com.example.placescout_backend.service;

import com.example.placescout_backend.config.WorkerExecutorProperties;
import com.example.placescout_backend.model.VideoJob;
import com.example.placescout_backend.util.JobStatus;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryVideoJobQueueTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final WorkerExecutorProperties props = new WorkerExecutorProperties();
    private final InMemoryVideoJobQueue queue = new InMemoryVideoJobQueue(clock, props);

    @Test
    void claimMovesQueuedJobsToProcessingOnce() {
        UUID a = queue.enqueue(Path.of("a.mp4"), null);
        UUID b = queue.enqueue(Path.of("b.mp4"), "Rome");

        List<VideoJob> first = queue.claimQueuedBatch(5);
        List<VideoJob> second = queue.claimQueuedBatch(5);

        assertThat(first).extracting(VideoJob::getId).containsExactly(a, b);
        assertThat(first).allSatisfy(j -> assertThat(j.getStatus()).isEqualTo(JobStatus.PROCESSING));
        assertThat(second).isEmpty();
    }

    @Test
    void batchSizeIsRespected() {
        queue.enqueue(Path.of("a.mp4"), null);
        queue.enqueue(Path.of("b.mp4"), null);

        assertThat(queue.claimQueuedBatch(1)).hasSize(1);
        assertThat(queue.claimQueuedBatch(0)).isEmpty();
        assertThat(queue.claimQueuedBatch(1)).hasSize(1);
    }

    @Test
    void findReturnsSnapshot() {
        UUID id = queue.enqueue(Path.of("a.mp4"), null);

        VideoJob snapshot = queue.find(id).orElseThrow();
        snapshot.setStatus(JobStatus.DONE);

        assertThat(queue.find(id).orElseThrow().getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(queue.find(UUID.randomUUID())).isEmpty();
    }

    @Test
    void failedJobKeepsMessageAndFullProgress() {
        UUID id = queue.enqueue(Path.of("a.mp4"), null);
        queue.claimQueuedBatch(1);

        queue.markProgress(id, 60);
        queue.markFailed(id, "video file not found: a.mp4", Map.of("stack", "x"));

        VideoJob job = queue.find(id).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getError()).contains("not found");
        assertThat(job.getMeta()).containsEntry("stack", "x");
    }

    @Test
    void unknownJobIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> queue.markProgress(UUID.randomUUID(), 10));
    }

    @Test
    void oldestFinishedJobsAreEvictedPastLimit() {
        props.setFinishedJobLimit(2);
        UUID first = queue.enqueue(Path.of("a.mp4"), null);
        UUID second = queue.enqueue(Path.of("b.mp4"), null);
        UUID third = queue.enqueue(Path.of("c.mp4"), null);
        UUID pending = queue.enqueue(Path.of("d.mp4"), null);
        queue.claimQueuedBatch(3);

        queue.markDone(first, Map.of(), List.of());
        clock.advance(Duration.ofSeconds(1));
        queue.markFailed(second, "boom", Map.of());
        clock.advance(Duration.ofSeconds(1));
        queue.markDone(third, Map.of(), List.of(Map.of("name", "Rossio")));

        assertThat(queue.find(first)).isEmpty();
        assertThat(queue.find(second)).isPresent();
        assertThat(queue.find(third).orElseThrow().getCandidates()).hasSize(1);
        assertThat(queue.find(pending).orElseThrow().getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(queue.size()).isEqualTo(3);
    }

    @Test
    void expiredFinishedJobsAreEvictedOnNextClaim() {
        props.setFinishedJobTtl(Duration.ofHours(1));
        UUID done = queue.enqueue(Path.of("a.mp4"), null);
        UUID running = queue.enqueue(Path.of("b.mp4"), null);
        queue.claimQueuedBatch(2);
        queue.markDone(done, Map.of(), List.of());

        clock.advance(Duration.ofHours(2));
        queue.claimQueuedBatch(5);

        assertThat(queue.find(done)).isEmpty();
        assertThat(queue.find(running).orElseThrow().getStatus()).isEqualTo(JobStatus.PROCESSING);
    }

    @Test
    void zeroLimitAndTtlKeepEverything() {
        props.setFinishedJobLimit(0);
        props.setFinishedJobTtl(Duration.ZERO);
        UUID a = queue.enqueue(Path.of("a.mp4"), null);
        queue.claimQueuedBatch(1);
        queue.markDone(a, Map.of(), List.of());

        clock.advance(Duration.ofDays(30));
        queue.claimQueuedBatch(1);

        assertThat(queue.find(a)).isPresent();
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
