package org.waabox.auditsync.metrics;

import org.waabox.auditsync.NodeId;

/**
 * A no-operation implementation of {@link SyncMetrics}.
 *
 * <p>All methods in this class are intentionally empty.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopSyncMetrics implements SyncMetrics {

  /** {@inheritDoc} */
  @Override
  public void recordsSent(final NodeId peer, final int count,
      final boolean hasMore) {
  }

  /** {@inheritDoc} */
  @Override
  public void recordsAcknowledged(final NodeId peer, final int count) {
  }

  /** {@inheritDoc} */
  @Override
  public void recordsReceived(final NodeId peer, final int count,
      final boolean hasMore) {
  }

  /** {@inheritDoc} */
  @Override
  public void syncFailed(final NodeId peer, final int failedAttempts,
      final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void divergenceDetected(final NodeId peer) {
  }

  /** {@inheritDoc} */
  @Override
  public void antiEntropyTriggered(final NodeId peer, final long remoteCount,
      final long localCount) {
  }
}
