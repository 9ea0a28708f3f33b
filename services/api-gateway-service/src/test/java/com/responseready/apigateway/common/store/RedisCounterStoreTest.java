package com.responseready.apigateway.common.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.responseready.apigateway.common.time.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisCounterStoreTest {

  private static final Duration TTL = Duration.ofMinutes(15);

  @Mock StringRedisTemplate redis;
  @Mock ValueOperations<String, String> ops;

  private MutableClock clock;
  private RedisCounterStore store;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    store = new RedisCounterStore(redis, clock);
  }

  @Test
  void firstIncrementSetsTtl() {
    when(redis.opsForValue()).thenReturn(ops);
    when(ops.increment("k")).thenReturn(1L);

    CounterStore.Counter counter = store.increment("k", TTL);

    assertThat(counter.count()).isEqualTo(1);
    assertThat(counter.expiresAt()).isEqualTo(Instant.parse("2024-01-01T00:15:00Z"));
    verify(redis).expire("k", TTL);
  }

  @Test
  void laterIncrementReadsRemainingTtl() {
    when(redis.opsForValue()).thenReturn(ops);
    when(ops.increment("k")).thenReturn(3L);
    when(redis.getExpire("k", TimeUnit.MILLISECONDS)).thenReturn(60_000L);

    CounterStore.Counter counter = store.increment("k", TTL);

    assertThat(counter.count()).isEqualTo(3);
    assertThat(counter.expiresAt()).isEqualTo(Instant.parse("2024-01-01T00:01:00Z"));
    verify(redis, never()).expire("k", TTL);
  }

  @Test
  void missingTtlIsRestored() {
    when(redis.opsForValue()).thenReturn(ops);
    when(ops.increment("k")).thenReturn(2L);
    when(redis.getExpire("k", TimeUnit.MILLISECONDS)).thenReturn(-1L);

    CounterStore.Counter counter = store.increment("k", TTL);

    assertThat(counter.expiresAt()).isEqualTo(clock.instant().plus(TTL));
    verify(redis).expire("k", TTL);
  }

  @Test
  void getReturnsEmptyForMissingKey() {
    when(redis.opsForValue()).thenReturn(ops);
    when(ops.get("k")).thenReturn(null);

    assertThat(store.get("k")).isEmpty();
  }

  @Test
  void getParsesValueAndTtl() {
    when(redis.opsForValue()).thenReturn(ops);
    when(ops.get("k")).thenReturn("7");
    when(redis.getExpire("k", TimeUnit.MILLISECONDS)).thenReturn(5_000L);

    assertThat(store.get("k"))
        .contains(new CounterStore.Counter(7, Instant.parse("2024-01-01T00:00:05Z")));
  }

  @Test
  void setWithTtlWritesValueAndTtlTogether() {
    when(redis.opsForValue()).thenReturn(ops);

    store.setWithTtl("k", 12, TTL);

    verify(ops).set("k", "12", TTL);
  }

  @Test
  void expireAndDeleteDelegate() {
    when(redis.expire("k", TTL)).thenReturn(true);

    assertThat(store.expire("k", TTL)).isTrue();
    store.delete("k");

    verify(redis).delete("k");
  }
}
