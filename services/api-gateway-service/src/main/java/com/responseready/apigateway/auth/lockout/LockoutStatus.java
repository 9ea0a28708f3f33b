package com.responseready.apigateway.auth.lockout;

import java.time.Duration;
import java.time.Instant;

/**
 * Lock state of one identifier.
 *
 * @param lockedUntil end of the lock, {@code null} when not locked
 * @param remainingAttempts failures left before a lock, 0 while locked
 */
public record LockoutStatus(boolean locked, Instant lockedUntil, int remainingAttempts) {

  static LockoutStatus unlocked(int remainingAttempts) {
    return new LockoutStatus(false, null, remainingAttempts);
  }

  static LockoutStatus lockedUntil(Instant lockedUntil) {
    return new LockoutStatus(true, lockedUntil, 0);
  }

  /** Whole minutes until the lock ends, rounded up, never below 1 while locked. */
  public long minutesRemaining(Instant now) {
    if (!locked) {
      return 0;
    }
    long millis = Duration.between(now, lockedUntil).toMillis();
    return Math.max(1, (millis + 59_999) / 60_000);
  }
}
