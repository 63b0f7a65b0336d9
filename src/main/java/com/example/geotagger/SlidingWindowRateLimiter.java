package com.example.geotagger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;

/**
 * Caps the number of actions in any trailing window and spaces actions out with random jitter.
 */
public class SlidingWindowRateLimiter {
    private static final Logger LOGGER = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);
    private static final Duration MIN_WAIT = Duration.ofSeconds(1);

    private final int maxPerWindow;
    private final Duration window;
    private final Duration baseSleep;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Random random;
    private final Deque<Instant> timestamps = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxPerWindow, Duration window, Duration baseSleep,
                                    Clock clock, Sleeper sleeper, Random random) {
        if (maxPerWindow <= 0) {
            throw new IllegalArgumentException("maxPerWindow must be > 0");
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (baseSleep.isNegative()) {
            throw new IllegalArgumentException("baseSleep must not be negative");
        }
        this.maxPerWindow = maxPerWindow;
        this.window = window;
        this.baseSleep = baseSleep;
        this.clock = clock;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * Blocks until another action fits in the window, then records it.
     */
    public void acquire() throws InterruptedException {
        evictExpired(clock.instant());
        while (timestamps.size() >= maxPerWindow) {
            Duration elapsed = Duration.between(timestamps.peekFirst(), clock.instant());
            Duration wait = window.minus(elapsed);
            if (wait.compareTo(MIN_WAIT) < 0) {
                wait = MIN_WAIT;
            }
            LOGGER.info("Rate limit of {} per {}s reached, waiting {} ms", maxPerWindow, window.toSeconds(), wait.toMillis());
            sleeper.sleep(wait);
            evictExpired(clock.instant());
        }
        timestamps.addLast(clock.instant());
    }

    /**
     * Sleeps a random duration in [0.5, 1.5] times the base sleep.
     */
    public void pause() throws InterruptedException {
        if (baseSleep.isZero()) {
            return;
        }
        long baseNanos = baseSleep.toNanos();
        long jitter = (long) (baseNanos * (0.5 + random.nextDouble()));
        sleeper.sleep(Duration.ofNanos(jitter));
    }

    int inWindow() {
        evictExpired(clock.instant());
        return timestamps.size();
    }

    private void evictExpired(Instant now) {
        while (!timestamps.isEmpty() && Duration.between(timestamps.peekFirst(), now).compareTo(window) >= 0) {
            timestamps.removeFirst();
        }
    }
}
