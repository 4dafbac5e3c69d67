package com.rebill.api.platform.timing;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Measures the time spent handling each request and hands a {@link RequestTiming} to
 * {@link RequestTimingRecorder}. The finished timing is also exposed as the
 * {@link #TIMING_ATTRIBUTE} request attribute.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
class RequestTimingFilter extends OncePerRequestFilter {

    static final String TIMING_ATTRIBUTE = RequestTiming.class.getName();

    private final RequestTimingRecorder recorder;
    private final Clock clock;

    @Autowired
    RequestTimingFilter(@NonNull RequestTimingRecorder recorder, @NonNull Clock clock) {
        this.recorder = recorder;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        val startedAt = clock.instant();
        val startNanos = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            val timing = RequestTiming.builder()
                .method(request.getMethod())
                .path(request.getRequestURI())
                .status(response.getStatus())
                .startedAt(startedAt)
                .duration(Duration.ofNanos(System.nanoTime() - startNanos))
                .build();

            request.setAttribute(TIMING_ATTRIBUTE, timing);
            recorder.record(timing);
        }
    }
}
