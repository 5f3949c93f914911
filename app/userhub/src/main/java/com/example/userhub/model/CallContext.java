package com.example.userhub.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Request-scoped cancellation state threaded through every upstream call.
 *
 * <p>A context without a deadline never expires. Upstream adapters fail fast once the deadline has
 * passed instead of issuing the network call.
 */
public record CallContext(Instant deadline) {

  private static final CallContext NONE = new CallContext(null);

  public static CallContext none() {
    return NONE;
  }

  public static CallContext withTimeout(Clock clock, Duration timeout) {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      return NONE;
    }
    return new CallContext(clock.instant().plus(timeout));
  }

  public boolean isExpired(Instant now) {
    return deadline != null && !now.isBefore(deadline);
  }

  /** Remaining budget before the deadline, empty when the context has no deadline. */
  public Optional<Duration> remaining(Instant now) {
    if (deadline == null) {
      return Optional.empty();
    }
    final Duration remaining = Duration.between(now, deadline);
    return Optional.of(remaining.isNegative() ? Duration.ZERO : remaining);
  }
}
