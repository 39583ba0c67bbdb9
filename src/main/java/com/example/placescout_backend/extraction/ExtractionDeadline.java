package com.example.placescout_backend.extraction;

import com.example.placescout_backend.ExtractionCancelledException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned cancellation signal, checked before each network round-trip of a run.
 */
public final class ExtractionDeadline {

    private final Instant expiresAt;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private ExtractionDeadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static ExtractionDeadline none() {
        return new ExtractionDeadline(null, Clock.systemUTC());
    }

    public static ExtractionDeadline after(Duration budget, Clock clock) {
        return new ExtractionDeadline(clock.instant().plus(budget), clock);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isExpired() {
        if (cancelled.get()) {
            return true;
        }
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    /**
     * @throws ExtractionCancelledException once cancelled or past the deadline.
     */
    public void check(String stage) {
        if (isExpired()) {
            throw new ExtractionCancelledException(stage);
        }
    }
}
