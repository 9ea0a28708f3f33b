package com.responseready.apigateway.auth.lockout;

import com.responseready.apigateway.common.store.CounterStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Tracks failed logins per identifier and locks it once the threshold is reached.
 *
 * <p>Callers record failures for unknown identifiers exactly like failures for real accounts;
 * the tracker never looks at account existence. Failures while locked move the lock end forward.
 */
@Service
@Slf4j
public class AccountLockoutService {

  private static final String ATTEMPTS_PREFIX = "lockout:attempts:";
  private static final String LOCK_PREFIX = "lockout:until:";

  private final CounterStore counters;
  private final LockoutProperties properties;
  private final Clock clock;

  public AccountLockoutService(CounterStore counters, LockoutProperties properties, Clock clock) {
    this.counters = counters;
    this.properties = properties;
    this.clock = clock;
  }

  public LockoutStatus isAccountLocked(String identifier) {
    String id = normalize(identifier);
    Optional<Instant> lockedUntil = activeLock(id);
    if (lockedUntil.isPresent()) {
      return LockoutStatus.lockedUntil(lockedUntil.get());
    }
    resetIfLockElapsed(id);
    return LockoutStatus.unlocked(remaining(id));
  }

  public LockoutStatus recordFailedAttempt(String identifier) {
    String id = normalize(identifier);
    String attemptsKey = ATTEMPTS_PREFIX + id;
    if (activeLock(id).isEmpty()) {
      resetIfLockElapsed(id);
    }

    long attempts = counters.increment(attemptsKey, properties.resetWindow()).count();
    // the reset window runs from the latest failure, not the first one
    counters.expire(attemptsKey, properties.resetWindow());

    if (attempts >= properties.maxFailedAttempts()) {
      Instant lockedUntil = clock.instant().plus(properties.lockDuration());
      counters.setWithTtl(
          LOCK_PREFIX + id, lockedUntil.toEpochMilli(), properties.lockDuration());
      log.warn("Identifier {} locked until {}", id, lockedUntil);
      return LockoutStatus.lockedUntil(lockedUntil);
    }

    log.debug("Failed login for {}", id);
    return LockoutStatus.unlocked((int) (properties.maxFailedAttempts() - attempts));
  }

  public void clearFailedAttempts(String identifier) {
    String id = normalize(identifier);
    counters.delete(ATTEMPTS_PREFIX + id);
    counters.delete(LOCK_PREFIX + id);
  }

  public int getRemainingAttempts(String identifier) {
    String id = normalize(identifier);
    if (activeLock(id).isPresent()) {
      return 0;
    }
    resetIfLockElapsed(id);
    return remaining(id);
  }

  private Optional<Instant> activeLock(String id) {
    Instant now = clock.instant();
    return counters
        .get(LOCK_PREFIX + id)
        .map(c -> Instant.ofEpochMilli(c.count()))
        .filter(now::isBefore);
  }

  /** A count at the threshold without a live lock means the lock ran out: start over. */
  private void resetIfLockElapsed(String id) {
    if (remaining(id) == 0) {
      log.debug("Lock for {} elapsed, resetting failed attempts", id);
      counters.delete(ATTEMPTS_PREFIX + id);
    }
  }

  private int remaining(String id) {
    long attempts = counters.get(ATTEMPTS_PREFIX + id).map(CounterStore.Counter::count).orElse(0L);
    return (int) Math.max(0, properties.maxFailedAttempts() - attempts);
  }

  static String normalize(String identifier) {
    return identifier == null ? "" : identifier.trim().toLowerCase(Locale.ROOT);
  }
}
