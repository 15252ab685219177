package org.waabox.auditsync.metrics;

import org.waabox.auditsync.NodeId;

/**
 * An abstraction for recording operational metrics of audit log
 * synchronization.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopSyncMetrics} when
 * metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SyncMetrics {

  /**
   * Records a batch of records sent to a peer.
   *
   * @param peer    the receiving peer, never null
   * @param count   the number of records in the batch
   * @param hasMore whether records were left out of the batch
   */
  void recordsSent(NodeId peer, int count, boolean hasMore);

  /**
   * Records records a peer acknowledged.
   *
   * @param peer  the acknowledging peer, never null
   * @param count the number of acknowledged record ids
   */
  void recordsAcknowledged(NodeId peer, int count);

  /**
   * Records records accepted from a peer's response.
   *
   * @param peer    the responding peer, never null
   * @param count   the number of records received
   * @param hasMore whether the peer left records behind
   */
  void recordsReceived(NodeId peer, int count, boolean hasMore);

  /**
   * Records a failed exchange with a peer.
   *
   * @param peer           the peer, never null
   * @param failedAttempts the consecutive failures including this one
   * @param cause          the throwable that caused the failure, never null
   */
  void syncFailed(NodeId peer, int failedAttempts, Throwable cause);

  /**
   * Records a peer whose log has the same size as ours but a different
   * last hash.
   *
   * @param peer the peer, never null
   */
  void divergenceDetected(NodeId peer);

  /**
   * Records a pull triggered by a heartbeat from a peer that is ahead.
   *
   * @param peer        the peer, never null
   * @param remoteCount the record count the peer reported
   * @param localCount  the local record count
   */
  void antiEntropyTriggered(NodeId peer, long remoteCount, long localCount);
}
