package com.responseready.apigateway.common.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable rate-limit tier: at most {@code maxRequests} per {@code window}. The name scopes the
 * counter, so two tiers never share quota for the same client.
 */
public record RateLimitPolicy(String name, int maxRequests, Duration window) {

  public RateLimitPolicy {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(window, "window");
    if (maxRequests < 1) {
      throw new IllegalArgumentException("maxRequests must be positive: " + maxRequests);
    }
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be positive: " + window);
    }
  }
}
