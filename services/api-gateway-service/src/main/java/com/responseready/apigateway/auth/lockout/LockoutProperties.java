package com.responseready.apigateway.auth.lockout;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Brute-force lockout policy.
 *
 * @param maxFailedAttempts failures that lock the identifier
 * @param lockDuration how long a lock lasts, counted from the failure that set it
 * @param resetWindow failures are forgotten after this long without a new failure
 */
@ConfigurationProperties(prefix = "security.lockout")
public record LockoutProperties(
    Integer maxFailedAttempts, Duration lockDuration, Duration resetWindow) {

  public LockoutProperties {
    maxFailedAttempts = maxFailedAttempts == null ? 5 : maxFailedAttempts;
    lockDuration = lockDuration == null ? Duration.ofMinutes(15) : lockDuration;
    resetWindow = resetWindow == null ? Duration.ofHours(1) : resetWindow;
    if (maxFailedAttempts < 1) {
      throw new IllegalArgumentException("security.lockout.max-failed-attempts must be positive");
    }
  }
}
