package com.responseready.sessionmonitor;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Idle and absolute session limits.
 *
 * @param idleTimeout logout after this long without activity
 * @param maxSession logout this long after login, whatever the activity
 * @param warningBeforeTimeout warn this long before either limit
 */
public record SessionTimeoutPolicy(
    Duration idleTimeout, Duration maxSession, Duration warningBeforeTimeout) {

  public static final SessionTimeoutPolicy DEFAULT =
      new SessionTimeoutPolicy(Duration.ofMinutes(30), Duration.ofHours(8), Duration.ofMinutes(5));

  public SessionTimeoutPolicy {
    Objects.requireNonNull(idleTimeout, "idleTimeout");
    Objects.requireNonNull(maxSession, "maxSession");
    Objects.requireNonNull(warningBeforeTimeout, "warningBeforeTimeout");
    if (idleTimeout.isNegative() || idleTimeout.isZero()) {
      throw new IllegalArgumentException("idleTimeout must be positive: " + idleTimeout);
    }
    if (maxSession.isNegative() || maxSession.isZero()) {
      throw new IllegalArgumentException("maxSession must be positive: " + maxSession);
    }
    if (warningBeforeTimeout.isNegative()) {
      throw new IllegalArgumentException(
          "warningBeforeTimeout must not be negative: " + warningBeforeTimeout);
    }
  }

  public static SessionTimeoutPolicy fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Defaults overridden by {@code IDLE_TIMEOUT_MINUTES}, {@code MAX_SESSION_HOURS} and {@code
   * WARNING_BEFORE_TIMEOUT_MINUTES}. Values that do not parse are ignored.
   */
  public static SessionTimeoutPolicy fromEnvironment(Map<String, String> env) {
    return PolicyEnvironment.read(env, DEFAULT);
  }
}
