package com.europeanalysis.stats.service;

import com.europeanalysis.stats.config.StatsCrawlerProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * At most one request per host per minimum interval, shared by every worker thread.
 *
 * Key design notes:
 * - Each host has a next-allowed slot (nanoTime). A caller reserves the slot
 *   with a CAS, pushes it forward by one interval and sleeps until its turn,
 *   so two permits for the same host are never closer than the interval,
 *   whatever the limiter's refresh cycles look like.
 * - The Resilience4j limiter stays behind the slot as the per-host permit
 *   source; once calls are spaced by a full interval it never has to wait.
 * - A caller whose slot lies further out than the acquire timeout reserves
 *   nothing and gets {@link RequestNotPermitted}.
 */
@Component
@Slf4j
public class HostRateLimiters {

    private final RateLimiterRegistry registry;
    private final Map<String, AtomicLong> nextSlots = new ConcurrentHashMap<>();
    private final long intervalNanos;
    private final long timeoutNanos;

    public HostRateLimiters(StatsCrawlerProperties properties) {
        StatsCrawlerProperties.RateLimit rateLimit = properties.getRateLimit();
        Duration interval = rateLimit.getMinInterval().compareTo(Duration.ofMillis(1)) < 0
                ? Duration.ofMillis(1)
                : rateLimit.getMinInterval();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(interval)
                .timeoutDuration(rateLimit.getAcquireTimeout())
                .build();
        this.registry = RateLimiterRegistry.of(config);
        this.intervalNanos = interval.toNanos();
        this.timeoutNanos = rateLimit.getAcquireTimeout().toNanos();
    }

    /**
     * Blocks until this host may be called again.
     *
     * @throws RequestNotPermitted if the wait would exceed the acquire timeout or the thread is interrupted
     */
    public void acquire(String host) {
        RateLimiter limiter = registry.rateLimiter(host);
        long waitNanos = reserve(host, limiter);
        if (waitNanos > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw RequestNotPermitted.createRequestNotPermitted(limiter);
            }
        }
        RateLimiter.waitForPermission(limiter);
        log.trace("Permit granted for {} after {} ms", host, TimeUnit.NANOSECONDS.toMillis(waitNanos));
    }

    private long reserve(String host, RateLimiter limiter) {
        AtomicLong next = nextSlots.computeIfAbsent(host, h -> new AtomicLong(System.nanoTime()));
        while (true) {
            long now = System.nanoTime();
            long current = next.get();
            long slot = current - now > 0 ? current : now;
            long waitNanos = slot - now;
            if (waitNanos > timeoutNanos) {
                throw RequestNotPermitted.createRequestNotPermitted(limiter);
            }
            if (next.compareAndSet(current, slot + intervalNanos)) {
                return waitNanos;
            }
        }
    }
}
