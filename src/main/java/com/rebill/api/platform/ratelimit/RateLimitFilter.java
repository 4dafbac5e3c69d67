package com.rebill.api.platform.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebill.api.platform.payload.ErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;

import static java.util.Objects.requireNonNullElse;

/**
 * {@link RateLimitFilter} is a {@link OncePerRequestFilter OncePerRequest} filter that applies
 * the {@link RateLimiter} to the versioned API routes. A client is identified by the SHA-256 hash
 * of its address and {@code User-Agent} header. Requests over the limit end with
 * {@literal HTTP 429}.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
class RateLimitFilter extends OncePerRequestFilter {

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RESET_HEADER = "X-RateLimit-Reset";
    static final String RETRY_AFTER_HEADER = "Retry-After";
    static final String ERROR_CODE = "RATE_LIMIT_EXCEEDED";

    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    RateLimitFilter(@NonNull RateLimiter rateLimiter, @NonNull ObjectMapper objectMapper, @NonNull Clock clock) {
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/v1/");
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        val identity = identityOf(request);
        val allowed = rateLimiter.isAllowed(identity);
        val usage = rateLimiter.currentUsage(identity);
        response.setHeader(LIMIT_HEADER, String.valueOf(usage.getLimit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(usage.getRemaining()));
        response.setHeader(RESET_HEADER, String.valueOf(usage.getResetAt().getEpochSecond()));
        if (allowed) {
            filterChain.doFilter(request, response);
            return;
        }

        log.warn("rate limit exceeded: {} requests of {} on {} {}", usage.getCount(), usage.getLimit(),
            request.getMethod(), request.getRequestURI());

        // whole seconds until the window resets, never negative.
        val retryAfter = Math.max(0, Duration.between(clock.instant(), usage.getResetAt()).toSeconds());
        response.setHeader(RETRY_AFTER_HEADER, String.valueOf(retryAfter));
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), new ErrorResponse(
            ERROR_CODE, "too many requests, retry after the current window resets", null));
    }

    @NonNull
    static String identityOf(@NonNull HttpServletRequest request) {
        val address = requireNonNullElse(request.getRemoteAddr(), "unknown");
        val userAgent = requireNonNullElse(request.getHeader("User-Agent"), "unknown");
        try {
            val digest = MessageDigest.getInstance("SHA-256")
                .digest((address + "|" + userAgent).getBytes(StandardCharsets.UTF_8));

            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to support SHA-256.
            throw new IllegalStateException(e);
        }
    }
}
