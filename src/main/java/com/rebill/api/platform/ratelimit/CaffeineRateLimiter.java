package com.rebill.api.platform.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.NonNull;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * A {@link RateLimiter} that keeps a fixed window counter per identity in a bounded Caffeine
 * cache. Windows start with an identity's first request and expire from the cache once they are
 * over.
 */
@Component
class CaffeineRateLimiter implements RateLimiter {

    private final Cache<String, Window> windows;
    private final Clock clock;
    private final int maxRequests;
    private final Duration windowLength;

    @Autowired
    CaffeineRateLimiter(@NonNull RateLimitConfiguration config, @NonNull Clock clock) {
        this(config.getMaxRequests(), config.getWindow(), config.getMaxTrackedIdentities(), clock);
    }

    CaffeineRateLimiter(int maxRequests, @NonNull Duration windowLength, long maxTrackedIdentities, @NonNull Clock clock) {
        this.clock = clock;
        this.maxRequests = maxRequests;
        this.windowLength = windowLength;
        this.windows = Caffeine.newBuilder()
            .expireAfterWrite(windowLength)
            .maximumSize(maxTrackedIdentities)
            .build();
    }

    @Override
    public boolean isAllowed(@NonNull String identity) {
        val now = clock.instant();
        val allowed = new boolean[1];
        windows.asMap().compute(identity, (k, window) -> {
            if (window == null || window.isOver(now)) {
                window = new Window(now.plus(windowLength), 0);
            }

            allowed[0] = window.count < maxRequests;
            return allowed[0] ? new Window(window.resetAt, window.count + 1) : window;
        });

        return allowed[0];
    }

    @NonNull
    @Override
    public RateLimitUsage currentUsage(@NonNull String identity) {
        val now = clock.instant();
        val window = windows.getIfPresent(identity);
        if (window == null || window.isOver(now)) {
            return new RateLimitUsage(0, maxRequests, maxRequests, now.plus(windowLength));
        }

        return new RateLimitUsage(window.count, maxRequests, Math.max(0, maxRequests - window.count), window.resetAt);
    }

    @Override
    public void reset(@NonNull String identity) {
        windows.invalidate(identity);
    }

    private static class Window {

        final Instant resetAt;
        final int count;

        Window(@NonNull Instant resetAt, int count) {
            this.resetAt = resetAt;
            this.count = count;
        }

        boolean isOver(@NonNull Instant now) {
            return !now.isBefore(resetAt);
        }
    }
}
