package com.responseready.apigateway.common.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Single-process counter store.
 *
 * <p>Every mutation of a key goes through {@link ConcurrentMap#compute}, so concurrent requests
 * for the same key never lose an increment. Expired entries are dropped lazily on access and by
 * the periodic {@link #sweepExpired()}.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "counter-store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryCounterStore implements CounterStore {

  private final ConcurrentMap<String, CounterEntry> map = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryCounterStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Counter increment(String key, Duration ttl) {
    Instant now = clock.instant();
    CounterEntry entry =
        map.compute(
            key,
            (k, old) -> {
              if (old == null || old.isExpired(now)) {
                return new CounterEntry(k, 1, now, now.plus(ttl));
              }
              return new CounterEntry(k, old.count() + 1, old.windowStart(), old.expiresAt());
            });
    return entry.toCounter();
  }

  @Override
  public Optional<Counter> get(String key) {
    Instant now = clock.instant();
    CounterEntry entry = map.computeIfPresent(key, (k, e) -> e.isExpired(now) ? null : e);
    return Optional.ofNullable(entry).map(CounterEntry::toCounter);
  }

  @Override
  public void setWithTtl(String key, long value, Duration ttl) {
    if (value < 0) {
      throw new IllegalArgumentException("Counter value must not be negative: " + value);
    }
    Instant now = clock.instant();
    map.put(key, new CounterEntry(key, value, now, now.plus(ttl)));
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    Instant now = clock.instant();
    AtomicBoolean updated = new AtomicBoolean(false);
    map.computeIfPresent(
        key,
        (k, e) -> {
          if (e.isExpired(now)) {
            return null;
          }
          updated.set(true);
          return new CounterEntry(k, e.count(), e.windowStart(), now.plus(ttl));
        });
    return updated.get();
  }

  @Override
  public void delete(String key) {
    map.remove(key);
  }

  /**
   * Evicts every expired entry.
   *
   * @return number of evicted entries
   */
  @Scheduled(
      fixedDelayString = "${counter-store.sweep-interval:PT5M}",
      initialDelayString = "${counter-store.sweep-interval:PT5M}")
  public int sweepExpired() {
    Instant now = clock.instant();
    AtomicInteger evicted = new AtomicInteger();
    for (String key : map.keySet()) {
      map.computeIfPresent(
          key,
          (k, e) -> {
            if (e.isExpired(now)) {
              evicted.incrementAndGet();
              return null;
            }
            return e;
          });
    }
    if (evicted.get() > 0) {
      log.debug("Counter sweep evicted {} entries, {} remain", evicted.get(), map.size());
    }
    return evicted.get();
  }

  int size() {
    return map.size();
  }

  /** Expired once {@code now} is past {@code expiresAt}. */
  private record CounterEntry(String key, long count, Instant windowStart, Instant expiresAt) {

    boolean isExpired(Instant now) {
      return now.isAfter(expiresAt);
    }

    Counter toCounter() {
      return new Counter(count, expiresAt);
    }
  }
}
