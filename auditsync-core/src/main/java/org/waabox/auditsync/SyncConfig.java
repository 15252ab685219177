package org.waabox.auditsync;

import java.time.Duration;
import java.util.Objects;

/**
 * Static tunables of the synchronization protocol.
 *
 * <p>The defaults are: {@link SyncStrategy#HYBRID}, a 60-second sync
 * interval, batches of 100 records, 3 retries with a 2-second base backoff
 * and compression disabled.
 *
 * <p>Compression is only a flag carried for the transport; this library
 * never compresses payloads itself.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SyncConfig {

  /** The default interval after which a peer is considered stale. */
  private static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(60);

  /** The default number of records per response. */
  private static final int DEFAULT_BATCH_SIZE = 100;

  /** The strategy. */
  private final SyncStrategy strategy;

  /** The interval after which a peer is considered stale. */
  private final Duration syncInterval;

  /** The maximum number of records in a single response. */
  private final int batchSize;

  /** The retry policy for failed exchanges. */
  private final RetryPolicy retryPolicy;

  /** Whether the transport should compress payloads. */
  private final boolean enableCompression;

  /**
   * Creates a new configuration.
   *
   * @param builder the builder holding the values, never null
   */
  private SyncConfig(final Builder builder) {
    this.strategy = builder.strategy;
    this.syncInterval = builder.syncInterval;
    this.batchSize = builder.batchSize;
    this.retryPolicy = RetryPolicy.of(builder.maxRetries,
        builder.retryBackoff);
    this.enableCompression = builder.enableCompression;
  }

  /**
   * Returns the default configuration.
   *
   * @return the default configuration, never null
   */
  public static SyncConfig defaults() {
    return builder().build();
  }

  /**
   * Creates a new builder initialized with the defaults.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the synchronization strategy.
   *
   * @return the strategy, never null
   */
  public SyncStrategy strategy() {
    return strategy;
  }

  /**
   * Returns the interval after which a peer needs synchronization again.
   *
   * @return the sync interval, never null
   */
  public Duration syncInterval() {
    return syncInterval;
  }

  /**
   * Returns the maximum number of records sent in a single response.
   *
   * @return the batch size, always greater than zero
   */
  public int batchSize() {
    return batchSize;
  }

  /**
   * Returns the number of failed exchanges tolerated before backing off.
   *
   * @return the maximum retries, always greater than zero
   */
  public int maxRetries() {
    return retryPolicy.maxRetries();
  }

  /**
   * Returns the retry policy derived from the max retries and the backoff.
   *
   * @return the retry policy, never null
   */
  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  /**
   * Returns whether the transport should compress payloads.
   *
   * @return true if compression is enabled
   */
  public boolean enableCompression() {
    return enableCompression;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "SyncConfig{strategy=" + strategy
        + ", syncInterval=" + syncInterval
        + ", batchSize=" + batchSize
        + ", maxRetries=" + retryPolicy.maxRetries()
        + ", retryBackoff=" + retryPolicy.backoff()
        + ", enableCompression=" + enableCompression + "}";
  }

  /** Fluent builder for {@link SyncConfig}. */
  public static final class Builder {

    /** The strategy, defaults to hybrid. */
    private SyncStrategy strategy = SyncStrategy.HYBRID;

    /** The sync interval. */
    private Duration syncInterval = DEFAULT_INTERVAL;

    /** The batch size. */
    private int batchSize = DEFAULT_BATCH_SIZE;

    /** The max retries. */
    private int maxRetries = RetryPolicy.defaultPolicy().maxRetries();

    /** The base retry backoff. */
    private Duration retryBackoff = RetryPolicy.defaultPolicy().backoff();

    /** The compression flag. */
    private boolean enableCompression = false;

    /** Creates a builder with the defaults, use {@link #builder()}. */
    private Builder() {
    }

    /**
     * Sets the synchronization strategy.
     *
     * @param theStrategy the strategy, never null
     * @return this builder, never null
     */
    public Builder strategy(final SyncStrategy theStrategy) {
      strategy = Objects.requireNonNull(theStrategy,
          "strategy must not be null");
      return this;
    }

    /**
     * Sets the interval after which a peer is considered stale.
     *
     * @param theInterval the interval, must be positive
     * @return this builder, never null
     */
    public Builder syncInterval(final Duration theInterval) {
      Objects.requireNonNull(theInterval, "syncInterval must not be null");
      if (theInterval.isZero() || theInterval.isNegative()) {
        throw new IllegalArgumentException(
            "syncInterval must be positive, got: " + theInterval);
      }
      syncInterval = theInterval;
      return this;
    }

    /**
     * Sets the interval in seconds.
     *
     * @param seconds the interval in seconds, must be positive
     * @return this builder, never null
     */
    public Builder syncIntervalSecs(final long seconds) {
      return syncInterval(Duration.ofSeconds(seconds));
    }

    /**
     * Sets the maximum number of records per response.
     *
     * @param theBatchSize the batch size, must be greater than zero
     * @return this builder, never null
     */
    public Builder batchSize(final int theBatchSize) {
      if (theBatchSize <= 0) {
        throw new IllegalArgumentException(
            "batchSize must be greater than 0, got: " + theBatchSize);
      }
      batchSize = theBatchSize;
      return this;
    }

    /**
     * Sets the number of failed exchanges tolerated before backing off.
     *
     * @param theMaxRetries the max retries, must be greater than zero
     * @return this builder, never null
     */
    public Builder maxRetries(final int theMaxRetries) {
      if (theMaxRetries <= 0) {
        throw new IllegalArgumentException(
            "maxRetries must be greater than 0, got: " + theMaxRetries);
      }
      maxRetries = theMaxRetries;
      return this;
    }

    /**
     * Sets the base backoff applied once the retries are exhausted.
     *
     * @param theBackoff the backoff, must be positive
     * @return this builder, never null
     */
    public Builder retryBackoff(final Duration theBackoff) {
      Objects.requireNonNull(theBackoff, "retryBackoff must not be null");
      if (theBackoff.isZero() || theBackoff.isNegative()) {
        throw new IllegalArgumentException(
            "retryBackoff must be positive, got: " + theBackoff);
      }
      retryBackoff = theBackoff;
      return this;
    }

    /**
     * Enables or disables payload compression on the transport.
     *
     * @param enabled true to request compression
     * @return this builder, never null
     */
    public Builder enableCompression(final boolean enabled) {
      enableCompression = enabled;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return a new configuration, never null
     */
    public SyncConfig build() {
      return new SyncConfig(this);
    }
  }
}
