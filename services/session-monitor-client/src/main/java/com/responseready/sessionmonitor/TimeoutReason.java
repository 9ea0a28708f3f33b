package com.responseready.sessionmonitor;

/** Which limit a warning or a forced logout refers to. */
public enum TimeoutReason {
  IDLE,
  SESSION_MAX
}
