package org.waabox.auditsync;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines how many consecutive failed exchanges a peer may accumulate before
 * the caller must back off, and how long that backoff is.
 *
 * <p>Below {@link #maxRetries()} failures no backoff applies. From there on
 * the backoff doubles with every additional failure, starting at
 * {@link #backoff()}, and never exceeds the cap given by the caller.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** The default number of retries. */
  private static final int DEFAULT_MAX_RETRIES = 3;

  /** The default backoff duration. */
  private static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(2);

  /** Exponent ceiling, keeps the shift below overflow. */
  private static final int MAX_EXPONENT = 30;

  /** The number of failures tolerated before backing off. */
  private final int maxRetries;

  /** The first backoff applied once the retries are exhausted. */
  private final Duration backoff;

  /**
   * Creates a new retry policy.
   *
   * @param maxRetries the maximum number of retries, must be greater
   *                   than zero
   * @param backoff    the base backoff, never null
   */
  private RetryPolicy(final int maxRetries, final Duration backoff) {
    this.maxRetries = maxRetries;
    this.backoff = backoff;
  }

  /**
   * Creates a retry policy with the given parameters.
   *
   * @param maxRetries the number of failures tolerated before backing off,
   *                   must be greater than zero
   * @param backoff    the base backoff duration, must be positive
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if maxRetries is not positive or the
   *                                  backoff is zero or negative
   * @throws NullPointerException if backoff is null
   */
  public static RetryPolicy of(final int maxRetries, final Duration backoff) {
    if (maxRetries <= 0) {
      throw new IllegalArgumentException(
          "maxRetries must be greater than 0, got: " + maxRetries);
    }
    Objects.requireNonNull(backoff, "backoff must not be null");
    if (backoff.isZero() || backoff.isNegative()) {
      throw new IllegalArgumentException(
          "backoff must be positive, got: " + backoff);
    }
    return new RetryPolicy(maxRetries, backoff);
  }

  /**
   * Creates a retry policy with 3 retries and a 2-second base backoff.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BACKOFF);
  }

  /**
   * Checks whether the given number of consecutive failures exhausted the
   * retries.
   *
   * @param failedAttempts the consecutive failures of a peer
   * @return true if the caller must back off before the next attempt
   */
  public boolean isExhausted(final int failedAttempts) {
    return failedAttempts >= maxRetries;
  }

  /**
   * Computes the delay to wait before the next attempt.
   *
   * @param failedAttempts the consecutive failures of a peer
   * @param cap            the largest delay allowed, never null
   * @return {@link Duration#ZERO} while retries remain, otherwise the
   *         exponential backoff capped at {@code cap}, never null
   */
  public Duration backoffFor(final int failedAttempts, final Duration cap) {
    Objects.requireNonNull(cap, "cap must not be null");
    if (!isExhausted(failedAttempts)) {
      return Duration.ZERO;
    }
    final int exponent = Math.min(failedAttempts - maxRetries, MAX_EXPONENT);
    final Duration delay = backoff.multipliedBy(1L << exponent);
    return delay.compareTo(cap) > 0 ? cap : delay;
  }

  /**
   * Returns the number of failures tolerated before backing off.
   *
   * @return the maximum number of retries, always greater than zero
   */
  public int maxRetries() {
    return maxRetries;
  }

  /**
   * Returns the base backoff duration.
   *
   * @return the backoff duration, never null
   */
  public Duration backoff() {
    return backoff;
  }
}
