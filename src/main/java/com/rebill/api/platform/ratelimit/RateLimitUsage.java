package com.rebill.api.platform.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

import java.time.Instant;

@Data
@AllArgsConstructor
public class RateLimitUsage {

    private final int count;
    private final int limit;
    private final int remaining;

    @NonNull
    private final Instant resetAt;
}
