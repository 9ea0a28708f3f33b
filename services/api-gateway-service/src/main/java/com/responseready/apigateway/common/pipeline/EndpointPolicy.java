package com.responseready.apigateway.common.pipeline;

import com.responseready.apigateway.common.ratelimit.RateLimitPolicy;

/**
 * What the pipeline enforces before a handler runs.
 *
 * @param rateLimit tier to charge, {@code null} for none
 * @param requireAuth a valid access token is required
 * @param requireAdmin the caller must be an admin; implies {@code requireAuth}
 * @param errorContext label used when logging unexpected failures
 */
public record EndpointPolicy(
    RateLimitPolicy rateLimit, boolean requireAuth, boolean requireAdmin, String errorContext) {

  public EndpointPolicy {
    if (requireAdmin) {
      requireAuth = true;
    }
    if (errorContext == null || errorContext.isBlank()) {
      errorContext = "API error";
    }
  }

  public static EndpointPolicy open(RateLimitPolicy rateLimit, String errorContext) {
    return new EndpointPolicy(rateLimit, false, false, errorContext);
  }

  public static EndpointPolicy authenticated(RateLimitPolicy rateLimit, String errorContext) {
    return new EndpointPolicy(rateLimit, true, false, errorContext);
  }

  public static EndpointPolicy admin(RateLimitPolicy rateLimit, String errorContext) {
    return new EndpointPolicy(rateLimit, true, true, errorContext);
  }
}
