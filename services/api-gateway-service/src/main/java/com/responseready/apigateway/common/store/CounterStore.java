package com.responseready.apigateway.common.store;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Key to (count, expiry) table with per-key TTL, shared by the rate limiter and the lockout
 * tracker.
 *
 * <p>Operations on a single key are linearizable. An entry whose TTL has elapsed reads as absent
 * even before it is physically evicted.
 */
public interface CounterStore {

  /**
   * Increments the counter for {@code key}. An absent or expired key starts over at 1 with
   * {@code ttl}; a live key keeps its expiry.
   */
  Counter increment(String key, Duration ttl);

  Optional<Counter> get(String key);

  void setWithTtl(String key, long value, Duration ttl);

  /**
   * @return false if the key is absent or already expired.
   */
  boolean expire(String key, Duration ttl);

  void delete(String key);

  record Counter(long count, Instant expiresAt) {}
}
