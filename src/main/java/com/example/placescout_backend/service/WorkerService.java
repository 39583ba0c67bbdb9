package com.example.placescout_backend.service;

import com.example.placescout_backend.config.WorkerExecutorProperties;
import com.example.placescout_backend.model.VideoJob;
import com.example.placescout_backend.service.Interfaces.VideoJobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.stream.Collectors;

@Service
public class WorkerService {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerService.class);

    private final VideoJobQueue queue;
    private final VideoJobProcessor processor;
    private final Executor workerExecutor;
    private final WorkerExecutorProperties workerProperties;
    private final Semaphore jobSemaphore;

    public WorkerService(VideoJobQueue queue, VideoJobProcessor processor,
                         @Qualifier("workerTaskExecutor") Executor workerExecutor,
                         WorkerExecutorProperties workerProperties) {
        this.queue = queue;
        this.processor = processor;
        this.workerExecutor = workerExecutor;
        this.workerProperties = workerProperties;
        this.jobSemaphore = new Semaphore(Math.max(1, workerProperties.getMaxConcurrency()));
    }

    @Scheduled(fixedDelayString = "${worker.poll-delay-ms:3000}")
    public void poll() {
        if (!workerProperties.isEnabled()) {
            return;
        }
        List<VideoJob> jobs;
        try {
            jobs = queue.claimQueuedBatch(workerProperties.getPollBatchSize());
        } catch (RuntimeException e) {
            LOGGER.error("Worker poll failed: {}", e.toString(), e);
            return;
        }
        if (jobs.isEmpty()) {
            LOGGER.debug("Worker poll tick, no jobs claimed");
            return;
        }

        LOGGER.info("Worker claimed jobs count={} ids={}", jobs.size(), jobs.stream().map(VideoJob::getId).collect(Collectors.toList()));
        jobs.forEach(this::submitJob);
    }

    private void submitJob(VideoJob job) {
        try {
            workerExecutor.execute(() -> runJobWithSemaphore(job));
        } catch (RuntimeException e) {
            LOGGER.error("Job {} rejected by executor: {}", job.getId(), e.toString());
            queue.markFailed(job.getId(), "EXECUTOR_REJECTED", Map.of());
        }
    }

    void runJobWithSemaphore(VideoJob job) {
        boolean acquired = false;
        long t0 = System.nanoTime();
        try {
            jobSemaphore.acquire();
            acquired = true;
            LOGGER.info("JOB START jobId={} video={} hint={}", job.getId(), job.getVideoPath(), job.getLocationHint());
            processor.process(job);
            LOGGER.info("JOB DONE jobId={} in={}ms", job.getId(), (System.nanoTime() - t0) / 1_000_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            queue.markFailed(job.getId(), "interrupted", Map.of());
        } catch (Exception e) {
            LOGGER.error("Job {} failed: {}", job.getId(), e.toString(), e);
            queue.markFailed(job.getId(), e.getMessage() != null ? e.getMessage() : e.toString(),
                    Map.of("stack", stackTop(e)));
        } finally {
            if (acquired) {
                jobSemaphore.release();
            }
        }
    }

    private static String stackTop(Throwable e) {
        StackTraceElement[] trace = e.getStackTrace();
        return trace.length == 0 ? e.getClass().getName() : e.getClass().getName() + " at " + trace[0];
    }
}
