package com.responseready.apigateway.common.ratelimit;

import com.responseready.apigateway.common.store.CounterStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fixed-window rate limiting on top of {@link CounterStore}.
 *
 * <p>The window opens with the first request for a key and closes when the counter's TTL runs
 * out; the next request then starts a fresh window. Denied requests still count.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RateLimitService {

  private static final String KEY_PREFIX = "rl:";

  private final CounterStore counters;

  public RateLimitDecision checkRateLimit(String identifier, RateLimitPolicy policy) {
    String key = KEY_PREFIX + policy.name() + ":" + identifier;
    CounterStore.Counter counter = counters.increment(key, policy.window());

    if (counter.count() > policy.maxRequests()) {
      log.warn(
          "Rate limit exceeded for {} on tier {} ({} requests)",
          identifier,
          policy.name(),
          counter.count());
      return new RateLimitDecision(false, 0, policy.maxRequests(), counter.expiresAt());
    }

    int remaining = (int) (policy.maxRequests() - counter.count());
    return new RateLimitDecision(true, remaining, policy.maxRequests(), counter.expiresAt());
  }
}
