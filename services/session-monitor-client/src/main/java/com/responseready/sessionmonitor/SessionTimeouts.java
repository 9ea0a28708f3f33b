package com.responseready.sessionmonitor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Timeout rules as pure functions of the last activity, the session start and the current time.
 * A limit is reached once the elapsed time equals it.
 */
public final class SessionTimeouts {

  private SessionTimeouts() {}

  public static boolean isIdle(Instant lastActivityAt, Instant now, SessionTimeoutPolicy policy) {
    return !isPositive(remaining(lastActivityAt, policy.idleTimeout(), now));
  }

  public static boolean isSessionExpired(
      Instant sessionStartedAt, Instant now, SessionTimeoutPolicy policy) {
    return !isPositive(remaining(sessionStartedAt, policy.maxSession(), now));
  }

  /** The warning due now, if any. The idle limit is checked before the absolute one. */
  public static Optional<SessionWarning> pendingWarning(
      Instant lastActivityAt, Instant sessionStartedAt, Instant now, SessionTimeoutPolicy policy) {
    return pendingWarnings(lastActivityAt, sessionStartedAt, now, policy).stream().findFirst();
  }

  /** Every limit currently inside its warning period, idle first. */
  public static List<SessionWarning> pendingWarnings(
      Instant lastActivityAt, Instant sessionStartedAt, Instant now, SessionTimeoutPolicy policy) {
    List<SessionWarning> warnings = new ArrayList<>(2);
    Duration untilIdle = remaining(lastActivityAt, policy.idleTimeout(), now);
    if (inWarningPeriod(untilIdle, policy)) {
      warnings.add(new SessionWarning(TimeoutReason.IDLE, minutesRemaining(untilIdle)));
    }
    Duration untilMax = remaining(sessionStartedAt, policy.maxSession(), now);
    if (inWarningPeriod(untilMax, policy)) {
      warnings.add(new SessionWarning(TimeoutReason.SESSION_MAX, minutesRemaining(untilMax)));
    }
    return warnings;
  }

  public static SessionState classify(
      Instant lastActivityAt, Instant sessionStartedAt, Instant now, SessionTimeoutPolicy policy) {
    if (isIdle(lastActivityAt, now, policy) || isSessionExpired(sessionStartedAt, now, policy)) {
      return SessionState.EXPIRED;
    }
    return pendingWarning(lastActivityAt, sessionStartedAt, now, policy)
        .map(
            w ->
                w.reason() == TimeoutReason.IDLE
                    ? SessionState.WARNING_IDLE
                    : SessionState.WARNING_SESSION_MAX)
        .orElse(SessionState.ACTIVE);
  }

  /** Which limit has been reached, idle first; empty while neither has. */
  public static Optional<TimeoutReason> expiredBy(
      Instant lastActivityAt, Instant sessionStartedAt, Instant now, SessionTimeoutPolicy policy) {
    if (isIdle(lastActivityAt, now, policy)) {
      return Optional.of(TimeoutReason.IDLE);
    }
    if (isSessionExpired(sessionStartedAt, now, policy)) {
      return Optional.of(TimeoutReason.SESSION_MAX);
    }
    return Optional.empty();
  }

  static long minutesRemaining(Duration remaining) {
    long millis = remaining.toMillis();
    return Math.max(1, (millis + 59_999) / 60_000);
  }

  private static boolean inWarningPeriod(Duration remaining, SessionTimeoutPolicy policy) {
    return isPositive(remaining) && remaining.compareTo(policy.warningBeforeTimeout()) <= 0;
  }

  private static boolean isPositive(Duration d) {
    return d.compareTo(Duration.ZERO) > 0;
  }

  private static Duration remaining(Instant since, Duration limit, Instant now) {
    return limit.minus(Duration.between(since, now));
  }
}
