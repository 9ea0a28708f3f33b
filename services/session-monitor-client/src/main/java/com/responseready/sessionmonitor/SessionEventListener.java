package com.responseready.sessionmonitor;

/**
 * Callbacks from {@link SessionActivityMonitor}. They run on the monitor's scheduler thread or on
 * the thread that reported the change, never while the monitor holds its lock.
 */
public interface SessionEventListener {

  /** A limit is near; the user may answer with {@link SessionActivityMonitor#extendSession()}. */
  default void onWarning(SessionWarning warning) {}

  /** Credentials were cleared because a limit was reached. */
  default void onForcedLogout(TimeoutReason reason) {}

  /** Another tab removed the credentials. */
  default void onExternalLogout() {}

  /** Another tab signed in. */
  default void onExternalLogin() {}
}
