package com.example.userhub.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class CallContextTest {

  private static final Instant NOW = Instant.parse("2026-02-26T04:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  void withTimeoutSetsDeadlineFromClock() {
    final CallContext context = CallContext.withTimeout(CLOCK, Duration.ofSeconds(3));

    assertThat(context.deadline()).isEqualTo(NOW.plusSeconds(3));
    assertThat(context.isExpired(NOW.plusMillis(2999))).isFalse();
    assertThat(context.isExpired(NOW.plusSeconds(3))).isTrue();
    assertThat(context.remaining(NOW.plusSeconds(1))).contains(Duration.ofSeconds(2));
    assertThat(context.remaining(NOW.plusSeconds(5))).contains(Duration.ZERO);
  }

  @Test
  void nonPositiveTimeoutNeverExpires() {
    final CallContext context = CallContext.withTimeout(CLOCK, Duration.ZERO);

    assertThat(context.deadline()).isNull();
    assertThat(context.isExpired(Instant.MAX)).isFalse();
    assertThat(context.remaining(NOW)).isEmpty();
    assertThat(CallContext.withTimeout(CLOCK, null)).isEqualTo(CallContext.none());
  }
}
