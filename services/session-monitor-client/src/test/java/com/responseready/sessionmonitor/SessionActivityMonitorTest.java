package com.responseready.sessionmonitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.responseready.sessionmonitor.storage.InMemoryCredentialStorage;
import com.responseready.sessionmonitor.storage.StorageKeys;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionActivityMonitorTest {

  private MutableClock clock;
  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> future;
  private InMemoryCredentialStorage storage;
  private SessionEventListener listener;
  private SessionActivityMonitor monitor;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-06-01T09:00:00Z"));
    scheduler = mock(ScheduledExecutorService.class);
    future = mock(ScheduledFuture.class);
    doReturn(future)
        .when(scheduler)
        .scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
    storage = new InMemoryCredentialStorage();
    StorageKeys.CREDENTIALS.forEach(k -> storage.put(k, "value-of-" + k));
    storage.put("theme", "dark");
    listener = mock(SessionEventListener.class);
    monitor =
        new SessionActivityMonitor(
            SessionTimeoutPolicy.DEFAULT,
            storage,
            listener,
            clock,
            scheduler,
            SessionActivityMonitor.DEFAULT_CHECK_INTERVAL);
  }

  @Test
  void startSchedulesExactlyOneTimer() {
    monitor.start();
    monitor.start();

    verify(scheduler, times(1))
        .scheduleAtFixedRate(
            any(Runnable.class), eq(10_000L), eq(10_000L), eq(TimeUnit.MILLISECONDS));
    assertThat(monitor.isRunning()).isTrue();
  }

  @Test
  void warnsOncePerWarningPeriod() {
    monitor.start();
    clock.advance(Duration.ofMinutes(25));

    monitor.tick();
    clock.advance(Duration.ofSeconds(10));
    monitor.tick();

    verify(listener, times(1)).onWarning(new SessionWarning(TimeoutReason.IDLE, 5));
    assertThat(monitor.state()).isEqualTo(SessionState.WARNING_IDLE);
  }

  @Test
  void activityRearmsTheWarning() {
    monitor.start();
    clock.advance(Duration.ofMinutes(26));
    monitor.tick();

    monitor.recordActivity(ActivityEvent.KEYPRESS);
    assertThat(monitor.state()).isEqualTo(SessionState.ACTIVE);
    clock.advance(Duration.ofMinutes(26));
    monitor.tick();

    verify(listener, times(2)).onWarning(new SessionWarning(TimeoutReason.IDLE, 4));
  }

  @Test
  void sessionMaxWarningStillFiresWhileIdleWarningIsShown() {
    monitor.start();
    for (int i = 0; i < 14; i++) {
      clock.advance(Duration.ofMinutes(30));
      monitor.recordActivity(ActivityEvent.CLICK);
    }
    clock.advance(Duration.ofMinutes(28));
    monitor.recordActivity(ActivityEvent.CLICK);

    clock.advance(Duration.ofMinutes(25));
    monitor.tick();
    clock.advance(Duration.ofMinutes(2));
    monitor.tick();
    clock.advance(Duration.ofSeconds(10));
    monitor.tick();

    verify(listener).onWarning(new SessionWarning(TimeoutReason.IDLE, 5));
    verify(listener).onWarning(new SessionWarning(TimeoutReason.SESSION_MAX, 5));
    verify(listener, times(2)).onWarning(any());
  }

  @Test
  void activityDoesNotRepeatSessionMaxWarning() {
    monitor.start();
    for (int i = 0; i < 15; i++) {
      clock.advance(Duration.ofMinutes(30));
      monitor.recordActivity(ActivityEvent.CLICK);
    }
    clock.advance(Duration.ofMinutes(26));
    monitor.recordActivity(ActivityEvent.SCROLL);
    monitor.tick();
    clock.advance(Duration.ofSeconds(10));
    monitor.recordActivity(ActivityEvent.KEYPRESS);
    monitor.tick();

    verify(listener).onWarning(new SessionWarning(TimeoutReason.SESSION_MAX, 4));
    verify(listener, times(1)).onWarning(any());
  }

  @Test
  void idleTimeoutForcesLogoutAndClearsCredentials() {
    monitor.start();
    clock.advance(Duration.ofMinutes(30));

    monitor.tick();

    verify(listener).onForcedLogout(TimeoutReason.IDLE);
    verify(future).cancel(false);
    assertThat(monitor.isRunning()).isFalse();
    assertThat(monitor.state()).isEqualTo(SessionState.EXPIRED);
    StorageKeys.CREDENTIALS.forEach(k -> assertThat(storage.get(k)).isEmpty());
    assertThat(storage.get("theme")).contains("dark");
  }

  @Test
  void absoluteLimitEndsActiveSession() {
    monitor.start();
    for (int i = 0; i < 16; i++) {
      clock.advance(Duration.ofMinutes(30));
      monitor.recordActivity(ActivityEvent.MOUSEMOVE);
    }

    monitor.tick();

    verify(listener).onForcedLogout(TimeoutReason.SESSION_MAX);
  }

  @Test
  void extendSessionRestartsBothLimits() {
    monitor.start();
    for (int i = 0; i < 15; i++) {
      clock.advance(Duration.ofMinutes(30));
      monitor.recordActivity(ActivityEvent.CLICK);
    }
    clock.advance(Duration.ofMinutes(27));
    monitor.recordActivity(ActivityEvent.SCROLL);
    monitor.tick();
    verify(listener).onWarning(new SessionWarning(TimeoutReason.SESSION_MAX, 3));

    monitor.extendSession();
    clock.advance(Duration.ofMinutes(10));
    monitor.tick();

    assertThat(monitor.state()).isEqualTo(SessionState.ACTIVE);
    verify(listener, never()).onForcedLogout(any());
  }

  @Test
  void tickIsIgnoredWhenStopped() {
    clock.advance(Duration.ofHours(9));

    monitor.tick();

    verifyNoInteractions(listener);
    assertThat(storage.get(StorageKeys.AUTH_TOKEN)).isPresent();
  }

  @Test
  void otherTabLogoutStopsMonitor() {
    monitor.start();

    monitor.onStorageChanged("theme", null);
    assertThat(monitor.isRunning()).isTrue();

    monitor.onStorageChanged(StorageKeys.AUTH_TOKEN, null);

    assertThat(monitor.isRunning()).isFalse();
    verify(listener).onExternalLogout();
  }

  @Test
  void otherTabLoginStartsFreshSession() {
    clock.advance(Duration.ofHours(2));

    monitor.onStorageChanged(StorageKeys.CURRENT_USER_ID, "42");

    assertThat(monitor.isRunning()).isTrue();
    assertThat(monitor.state()).isEqualTo(SessionState.ACTIVE);
    verify(listener).onExternalLogin();
  }

  @Test
  void closeCancelsTimerButLeavesInjectedScheduler() {
    monitor.start();

    monitor.close();

    verify(future).cancel(false);
    verify(scheduler, never()).shutdownNow();
  }

  @Test
  void activityEventNamesMapToTrackedEvents() {
    assertThat(ActivityEvent.fromEventName("touchstart")).contains(ActivityEvent.TOUCHSTART);
    assertThat(ActivityEvent.fromEventName("resize")).isEmpty();
  }
}
