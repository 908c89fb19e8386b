package com.leadharvest.scrape.provider;

import com.leadharvest.config.HarvestProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Semaphore;

/**
 * Process-wide budget for provider requests, shared by every running job. Caps
 * in-flight requests and spaces request starts by a minimum interval. A rate
 * limit response pushes the next allowed start out by a cooldown.
 */
@Component
public class SearchRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(SearchRateLimiter.class);

    private final Semaphore permits;
    private final Object lock = new Object();
    private final long minIntervalMs;
    private Instant nextAllowed = Instant.EPOCH;

    public SearchRateLimiter(HarvestProperties properties) {
        this.permits = new Semaphore(properties.getProvider().getMaxConcurrentRequests());
        this.minIntervalMs = properties.getProvider().getMinIntervalMs();
    }

    public void acquire() throws InterruptedException {
        permits.acquire();
        try {
            awaitSlot();
        } catch (InterruptedException e) {
            permits.release();
            throw e;
        }
    }

    public void release() {
        permits.release();
    }

    public void extendBackoff(Duration duration) {
        synchronized (lock) {
            Instant until = Instant.now().plus(duration);
            if (until.isAfter(nextAllowed)) {
                nextAllowed = until;
                log.warn("Provider rate limited; pausing requests until {}", until);
            }
        }
    }

    public Instant nextAllowedAt() {
        synchronized (lock) {
            return nextAllowed;
        }
    }

    private void awaitSlot() throws InterruptedException {
        while (true) {
            long waitMs;
            synchronized (lock) {
                Instant now = Instant.now();
                if (!now.isBefore(nextAllowed)) {
                    nextAllowed = now.plusMillis(minIntervalMs);
                    return;
                }
                waitMs = Duration.between(now, nextAllowed).toMillis();
            }
            Thread.sleep(Math.max(1L, waitMs));
        }
    }
}
