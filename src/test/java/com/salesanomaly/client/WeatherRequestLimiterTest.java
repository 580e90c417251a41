package com.salesanomaly.client;

import com.salesanomaly.exception.WeatherProviderUnavailableException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class WeatherRequestLimiterTest {

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
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

    @Test
    void tryAcquire_enforcesBudgetPerWindow() {
        MutableClock clock = new MutableClock(Instant.parse("2025-05-18T00:00:00Z"));
        WeatherRequestLimiter limiter = new WeatherRequestLimiter(3, Duration.ofSeconds(60), clock);

        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isFalse();

        clock.advance(Duration.ofSeconds(59));
        assertThat(limiter.tryAcquire()).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(limiter.tryAcquire()).isTrue();
    }

    @Test
    void millisUntilNextWindow_countsDownWithinWindow() {
        MutableClock clock = new MutableClock(Instant.parse("2025-05-18T00:00:00Z"));
        WeatherRequestLimiter limiter = new WeatherRequestLimiter(1, Duration.ofSeconds(60), clock);

        assertThat(limiter.millisUntilNextWindow()).isEqualTo(60_000);
        clock.advance(Duration.ofSeconds(45));
        assertThat(limiter.millisUntilNextWindow()).isEqualTo(15_000);
    }

    @Test
    void acquire_blocksUntilNextWindow() {
        WeatherRequestLimiter limiter = new WeatherRequestLimiter(1, Duration.ofMillis(200), Clock.systemUTC());
        limiter.acquire();

        long started = System.nanoTime();
        limiter.acquire();
        long waitedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertThat(waitedMs).isLessThanOrEqualTo(400);
    }

    @Test
    void acquire_interrupted_failsAsProviderUnavailable() {
        WeatherRequestLimiter limiter = new WeatherRequestLimiter(1, Duration.ofSeconds(30), Clock.systemUTC());
        limiter.acquire();
        Thread.currentThread().interrupt();

        try {
            assertThatThrownBy(limiter::acquire)
                .isInstanceOf(WeatherProviderUnavailableException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void constructor_rejectsNonPositiveBudget() {
        assertThatThrownBy(() -> new WeatherRequestLimiter(0, Duration.ofSeconds(1), Clock.systemUTC()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
