package com.responseready.apigateway.common.ratelimit;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Named rate-limit presets, bound from {@code rate-limits.*}. */
@ConfigurationProperties(prefix = "rate-limits")
public record RateLimitProperties(Tier auth, Tier api, Tier read) {

  public RateLimitProperties {
    auth = auth == null ? new Tier(5, Duration.ofMinutes(15)) : auth;
    api = api == null ? new Tier(100, Duration.ofMinutes(1)) : api;
    read = read == null ? new Tier(200, Duration.ofMinutes(1)) : read;
  }

  /** Strict tier for credential endpoints. */
  public RateLimitPolicy authPolicy() {
    return auth.toPolicy("auth");
  }

  public RateLimitPolicy apiPolicy() {
    return api.toPolicy("api");
  }

  /** Lenient tier for read-only endpoints. */
  public RateLimitPolicy readPolicy() {
    return read.toPolicy("read");
  }

  public record Tier(int maxRequests, Duration window) {
    RateLimitPolicy toPolicy(String name) {
      return new RateLimitPolicy(name, maxRequests, window);
    }
  }
}
