package com.salesanomaly.client;

import com.salesanomaly.exception.WeatherProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Fixed-window request budget for the weather provider. {@link #acquire()} blocks the calling
 * worker until the next window once the current window's budget is spent.
 */
@Slf4j
@Component
public class WeatherRequestLimiter {

    private final int requestsPerWindow;
    private final long windowMillis;
    private final Clock clock;

    private long currentWindow = Long.MIN_VALUE;
    private int count;

    @Autowired
    public WeatherRequestLimiter(
            @Value("${weather.api.rate-limit.requests:500}") int requestsPerWindow,
            @Value("${weather.api.rate-limit.window-seconds:60}") long windowSeconds) {
        this(requestsPerWindow, Duration.ofSeconds(windowSeconds), Clock.systemUTC());
    }

    WeatherRequestLimiter(int requestsPerWindow, Duration window, Clock clock) {
        if (requestsPerWindow < 1 || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Rate limit needs a positive budget and window");
        }
        this.requestsPerWindow = requestsPerWindow;
        this.windowMillis = window.toMillis();
        this.clock = clock;
    }

    public synchronized boolean tryAcquire() {
        long window = clock.millis() / windowMillis;
        if (window != currentWindow) {
            currentWindow = window;
            count = 0;
        }
        if (count >= requestsPerWindow) {
            return false;
        }
        count++;
        return true;
    }

    public void acquire() {
        while (!tryAcquire()) {
            long waitMs = millisUntilNextWindow();
            log.debug("Weather rate limit reached | budget={} | waitMs={}", requestsPerWindow, waitMs);
            try {
                Thread.sleep(Math.max(1L, waitMs));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new WeatherProviderUnavailableException("Interrupted while waiting for a weather request permit");
            }
        }
    }

    long millisUntilNextWindow() {
        long now = clock.millis();
        return windowMillis - (now % windowMillis);
    }
}
