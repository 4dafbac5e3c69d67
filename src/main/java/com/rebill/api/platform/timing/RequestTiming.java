package com.rebill.api.platform.timing;

import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.time.Duration;
import java.time.Instant;

/**
 * Timing of a single HTTP request, built by {@link RequestTimingFilter} once the response is
 * complete.
 */
@Data
@Builder
public class RequestTiming {

    @NonNull
    private final String method;

    @NonNull
    private final String path;

    private final int status;

    @NonNull
    private final Instant startedAt;

    @NonNull
    private final Duration duration;
}
