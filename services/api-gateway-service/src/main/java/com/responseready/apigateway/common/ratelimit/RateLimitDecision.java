package com.responseready.apigateway.common.ratelimit;

import java.time.Instant;

/**
 * Outcome of one rate-limit check.
 *
 * @param remaining requests left in the current window, 0 once denied
 * @param resetAt end of the current window
 */
public record RateLimitDecision(boolean allowed, int remaining, int limit, Instant resetAt) {}
