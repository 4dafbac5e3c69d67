package com.rebill.api.platform.timing;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Logs request timings and records them with a Micrometer {@link Timer}. Requests slower than
 * the configured threshold are logged as warnings.
 */
@Slf4j
@Component
public class RequestTimingRecorder {

    static final String TIMER_NAME = "rebill.http.requests";

    private final MeterRegistry meterRegistry;
    private final Duration slowRequestThreshold;

    @Autowired
    RequestTimingRecorder(
        @NonNull MeterRegistry meterRegistry,
        @NonNull @Value("${app.request-timing.slow-threshold}") Duration slowRequestThreshold
    ) {
        this.meterRegistry = meterRegistry;
        this.slowRequestThreshold = slowRequestThreshold;
    }

    public void record(@NonNull RequestTiming timing) {
        Timer.builder(TIMER_NAME)
            .tag("method", timing.getMethod())
            .tag("status", String.valueOf(timing.getStatus()))
            .register(meterRegistry)
            .record(timing.getDuration());

        if (timing.getDuration().compareTo(slowRequestThreshold) > 0) {
            log.warn("slow request: {} {} took {} ms with status {}", timing.getMethod(), timing.getPath(),
                timing.getDuration().toMillis(), timing.getStatus());
        } else {
            log.debug("{} {} took {} ms with status {}", timing.getMethod(), timing.getPath(),
                timing.getDuration().toMillis(), timing.getStatus());
        }
    }
}
