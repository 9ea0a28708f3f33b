package com.responseready.sessionmonitor;

public enum SessionState {
  ACTIVE,
  /** Inside the warning period before the idle timeout. */
  WARNING_IDLE,
  /** Inside the warning period before the absolute session limit. */
  WARNING_SESSION_MAX,
  EXPIRED
}
