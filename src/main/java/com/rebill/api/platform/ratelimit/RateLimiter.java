package com.rebill.api.platform.ratelimit;

import lombok.NonNull;

/**
 * Fixed window request counter keyed by an opaque client identity. It is only applied at the
 * HTTP boundary; the billing services never consult it.
 */
public interface RateLimiter {

    /**
     * Counts a request for the given identity if its current window still has capacity.
     *
     * @param identity a not {@literal null} client identity, e.g. a hash of the client address.
     * @return {@literal false} if the identity exhausted its window. Rejected requests are not
     * counted.
     */
    boolean isAllowed(@NonNull String identity);

    /**
     * @return a not {@literal null} snapshot of the identity's current window. An identity
     * without requests reports a fresh window.
     */
    @NonNull
    RateLimitUsage currentUsage(@NonNull String identity);

    /**
     * Discards the identity's current window.
     */
    void reset(@NonNull String identity);
}
