package org.waabox.auditsync.sync;

import java.util.Objects;
import java.util.Optional;

import org.waabox.auditsync.NodeId;
import org.waabox.auditsync.VectorClock;

/**
 * Summarizes a node's log so that peers can detect they are behind.
 *
 * @param fromNode    the sending node, never null
 * @param vectorClock the sender's clock, never null
 * @param recordCount the number of records in the sender's log
 * @param lastHash    the hash of the sender's last record, null when the
 *                    sender's log is empty
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Heartbeat(
    NodeId fromNode,
    VectorClock vectorClock,
    long recordCount,
    String lastHash
) implements SyncMessage {

  /** Validates the fields. */
  public Heartbeat {
    Objects.requireNonNull(fromNode, "fromNode must not be null");
    Objects.requireNonNull(vectorClock, "vectorClock must not be null");
    if (recordCount < 0) {
      throw new IllegalArgumentException(
          "recordCount must not be negative, got: " + recordCount);
    }
  }

  /**
   * Returns the last hash as an optional.
   *
   * @return the hash of the sender's last record, or empty
   */
  public Optional<String> lastHashValue() {
    return Optional.ofNullable(lastHash);
  }

  /** {@inheritDoc} */
  @Override
  public MessageType type() {
    return MessageType.HEARTBEAT;
  }
}
