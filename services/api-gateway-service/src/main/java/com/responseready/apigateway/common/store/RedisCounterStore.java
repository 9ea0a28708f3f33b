package com.responseready.apigateway.common.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Counter store backed by Redis. Expiry is handled by Redis itself, so there is nothing to sweep.
 *
 * <p>Enable with {@code counter-store.type=redis}.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "counter-store.type", havingValue = "redis")
public class RedisCounterStore implements CounterStore {

  private final StringRedisTemplate redis;
  private final Clock clock;

  public RedisCounterStore(StringRedisTemplate redis, Clock clock) {
    this.redis = redis;
    this.clock = clock;
  }

  @Override
  public Counter increment(String key, Duration ttl) {
    Long val = redis.opsForValue().increment(key);
    long count = val == null ? 0L : val;
    if (count == 1L) {
      redis.expire(key, ttl);
      return new Counter(count, clock.instant().plus(ttl));
    }
    Long ttlMs = redis.getExpire(key, TimeUnit.MILLISECONDS);
    if (ttlMs == null || ttlMs < 0) {
      // key lost its TTL (e.g. the EXPIRE after the first INCR never ran)
      log.warn("Counter {} had no TTL, restoring it", key);
      redis.expire(key, ttl);
      ttlMs = ttl.toMillis();
    }
    return new Counter(count, clock.instant().plusMillis(ttlMs));
  }

  @Override
  public Optional<Counter> get(String key) {
    String raw = redis.opsForValue().get(key);
    if (raw == null) {
      return Optional.empty();
    }
    Long ttlMs = redis.getExpire(key, TimeUnit.MILLISECONDS);
    Instant expiresAt =
        ttlMs == null || ttlMs < 0 ? Instant.MAX : clock.instant().plusMillis(ttlMs);
    try {
      return Optional.of(new Counter(Long.parseLong(raw), expiresAt));
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Counter " + key + " holds a non-numeric value", e);
    }
  }

  @Override
  public void setWithTtl(String key, long value, Duration ttl) {
    redis.opsForValue().set(key, Long.toString(value), ttl);
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    return Boolean.TRUE.equals(redis.expire(key, ttl));
  }

  @Override
  public void delete(String key) {
    redis.delete(key);
  }
}
