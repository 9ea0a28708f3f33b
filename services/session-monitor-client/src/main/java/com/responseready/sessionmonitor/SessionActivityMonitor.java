package com.responseready.sessionmonitor;

import com.responseready.sessionmonitor.storage.CredentialStorage;
import com.responseready.sessionmonitor.storage.StorageKeys;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Client-side session timeout state machine.
 *
 * <p>{@code ACTIVE -> WARNING_IDLE | WARNING_SESSION_MAX -> ACTIVE} (activity or an extension) or
 * {@code -> EXPIRED} (forced logout). One recurring {@link #tick()} drives the transitions; it is
 * scheduled by {@link #start()} and cancelled on stop, close or logout.
 */
@Slf4j
public class SessionActivityMonitor implements AutoCloseable {

  public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(10);

  private final SessionTimeoutPolicy policy;
  private final CredentialStorage storage;
  private final SessionEventListener listener;
  private final Clock clock;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final Duration checkInterval;

  private final SessionClock sessionClock;
  private ScheduledFuture<?> task;

  public SessionActivityMonitor(
      SessionTimeoutPolicy policy,
      CredentialStorage storage,
      SessionEventListener listener,
      Clock clock,
      ScheduledExecutorService scheduler,
      Duration checkInterval) {
    this(policy, storage, listener, clock, scheduler, checkInterval, false);
  }

  private SessionActivityMonitor(
      SessionTimeoutPolicy policy,
      CredentialStorage storage,
      SessionEventListener listener,
      Clock clock,
      ScheduledExecutorService scheduler,
      Duration checkInterval,
      boolean ownsScheduler) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.checkInterval = Objects.requireNonNull(checkInterval, "checkInterval");
    this.ownsScheduler = ownsScheduler;
    this.sessionClock = new SessionClock(clock.instant());
  }

  /** Monitor with its own daemon scheduler thread, checking every 10 seconds. */
  public static SessionActivityMonitor create(
      SessionTimeoutPolicy policy, CredentialStorage storage, SessionEventListener listener) {
    ScheduledExecutorService scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "session-activity-monitor");
              t.setDaemon(true);
              return t;
            });
    return new SessionActivityMonitor(
        policy, storage, listener, Clock.systemUTC(), scheduler, DEFAULT_CHECK_INTERVAL, true);
  }

  /** Starts a fresh session clock. Calling it while running only resets the clock. */
  public synchronized void start() {
    sessionClock.reset(clock.instant());
    if (task != null) {
      return;
    }
    long period = checkInterval.toMillis();
    task = scheduler.scheduleAtFixedRate(this::safeTick, period, period, TimeUnit.MILLISECONDS);
    log.debug("Session monitor started, checking every {}", checkInterval);
  }

  public synchronized void stop() {
    if (task != null) {
      task.cancel(false);
      task = null;
      log.debug("Session monitor stopped");
    }
  }

  public synchronized boolean isRunning() {
    return task != null;
  }

  @Override
  public void close() {
    stop();
    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
  }

  /** Tracked interaction: resets the idle time and re-arms the warning. */
  public synchronized void recordActivity(ActivityEvent event) {
    log.trace("Activity: {}", event.eventName());
    sessionClock.touch(clock.instant());
  }

  /** The user's answer to a warning: both limits start over. */
  public synchronized void extendSession() {
    sessionClock.reset(clock.instant());
    log.debug("Session extended");
  }

  public synchronized SessionState state() {
    return SessionTimeouts.classify(
        sessionClock.lastActivityAt(), sessionClock.sessionStartedAt(), clock.instant(), policy);
  }

  /** One step of the state machine; the scheduler calls it every check interval. */
  public void tick() {
    Optional<TimeoutReason> expired;
    List<SessionWarning> warnings = new ArrayList<>(2);
    synchronized (this) {
      if (task == null) {
        return;
      }
      expired =
          SessionTimeouts.expiredBy(
              sessionClock.lastActivityAt(),
              sessionClock.sessionStartedAt(),
              clock.instant(),
              policy);
      if (expired.isPresent()) {
        stop();
        storage.removeAll(StorageKeys.CREDENTIALS);
      } else {
        List<SessionWarning> pending =
            SessionTimeouts.pendingWarnings(
                sessionClock.lastActivityAt(),
                sessionClock.sessionStartedAt(),
                clock.instant(),
                policy);
        Set<TimeoutReason> reasons = EnumSet.noneOf(TimeoutReason.class);
        pending.forEach(w -> reasons.add(w.reason()));
        sessionClock.retainWarned(reasons);
        for (SessionWarning w : pending) {
          if (sessionClock.markWarned(w.reason())) {
            warnings.add(w);
          }
        }
      }
    }

    if (expired.isPresent()) {
      log.info("Session ended by {} timeout, credentials cleared", expired.get());
      listener.onForcedLogout(expired.get());
    }
    for (SessionWarning w : warnings) {
      log.debug("Session warning: {} in {} minute(s)", w.reason(), w.minutesRemaining());
      listener.onWarning(w);
    }
  }

  /**
   * Mirrors a credential change made by another tab. A removed token ends the session here too;
   * a new one starts a fresh session clock.
   */
  public void onStorageChanged(String key, String newValue) {
    if (!StorageKeys.isSessionKey(key)) {
      return;
    }
    if (newValue == null) {
      stop();
      listener.onExternalLogout();
    } else {
      start();
      listener.onExternalLogin();
    }
  }

  private void safeTick() {
    try {
      tick();
    } catch (RuntimeException e) {
      // an exception would cancel the periodic task for good
      log.error("Session check failed", e);
    }
  }
}
