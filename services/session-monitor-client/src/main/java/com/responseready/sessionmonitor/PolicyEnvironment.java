package com.responseready.sessionmonitor;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

@Slf4j
final class PolicyEnvironment {

  static final String IDLE_TIMEOUT_MINUTES = "IDLE_TIMEOUT_MINUTES";
  static final String MAX_SESSION_HOURS = "MAX_SESSION_HOURS";
  static final String WARNING_BEFORE_TIMEOUT_MINUTES = "WARNING_BEFORE_TIMEOUT_MINUTES";

  private PolicyEnvironment() {}

  static SessionTimeoutPolicy read(Map<String, String> env, SessionTimeoutPolicy defaults) {
    Duration idle =
        number(env, IDLE_TIMEOUT_MINUTES, 1)
            .map(Duration::ofMinutes)
            .orElse(defaults.idleTimeout());
    Duration max =
        number(env, MAX_SESSION_HOURS, 1).map(Duration::ofHours).orElse(defaults.maxSession());
    Duration warning =
        number(env, WARNING_BEFORE_TIMEOUT_MINUTES, 0)
            .map(Duration::ofMinutes)
            .orElse(defaults.warningBeforeTimeout());
    return new SessionTimeoutPolicy(idle, max, warning);
  }

  private static Optional<Long> number(Map<String, String> env, String name, long min) {
    String raw = env.get(name);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      long value = Long.parseLong(raw.trim());
      if (value < min) {
        log.warn("Ignoring {}={}: must be at least {}", name, raw, min);
        return Optional.empty();
      }
      return Optional.of(value);
    } catch (NumberFormatException e) {
      log.warn("Ignoring {}={}: not a whole number", name, raw);
      return Optional.empty();
    }
  }
}
