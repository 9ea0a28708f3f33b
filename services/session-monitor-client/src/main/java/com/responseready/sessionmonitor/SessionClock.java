package com.responseready.sessionmonitor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/** Last activity, session start and the limits whose warning was already shown. */
final class SessionClock {

  private Instant lastActivityAt;
  private Instant sessionStartedAt;
  private final Set<TimeoutReason> warned = EnumSet.noneOf(TimeoutReason.class);

  SessionClock(Instant now) {
    reset(now);
  }

  void reset(Instant now) {
    lastActivityAt = now;
    sessionStartedAt = now;
    warned.clear();
  }

  /** Activity only moves the idle limit, so only the idle warning re-arms. */
  void touch(Instant now) {
    lastActivityAt = now;
    warned.remove(TimeoutReason.IDLE);
  }

  Instant lastActivityAt() {
    return lastActivityAt;
  }

  Instant sessionStartedAt() {
    return sessionStartedAt;
  }

  /** Marks the warning as shown; false if it already was. */
  boolean markWarned(TimeoutReason reason) {
    return warned.add(reason);
  }

  /** Forgets warnings for limits that have left their warning period. */
  void retainWarned(Set<TimeoutReason> stillPending) {
    warned.retainAll(stillPending);
  }
}
