package com.example.placescout_backend.extraction;

import com.example.placescout_backend.ExtractionCancelledException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExtractionDeadlineTest {

    @Test
    void expiresOnceClockPassesBudget() {
        AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2024-05-01T10:00:00Z"));
        Clock clock = new Clock() {
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
                return now.get();
            }
        };
        ExtractionDeadline deadline = ExtractionDeadline.after(Duration.ofSeconds(30), clock);

        assertThat(deadline.isExpired()).isFalse();
        now.set(now.get().plusSeconds(30));
        assertThat(deadline.isExpired()).isTrue();
    }

    @Test
    void cancelTripsCheck() {
        ExtractionDeadline deadline = ExtractionDeadline.none();
        deadline.check("model_call");

        deadline.cancel();

        ExtractionCancelledException ex = assertThrows(ExtractionCancelledException.class, () -> deadline.check("repair_call"));
        assertThat(ex.getMessage()).contains("repair_call");
    }
}
