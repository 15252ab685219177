package org.waabox.auditsync.sync;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

import org.waabox.auditsync.NodeId;
import org.waabox.auditsync.VectorClock;

/**
 * Acknowledges the records a node accepted from a response.
 *
 * @param fromNode    the acknowledging node, never null
 * @param recordIds   the ids of the accepted records, never null
 * @param vectorClock the acknowledging node's clock, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SyncAck(
    NodeId fromNode,
    List<UUID> recordIds,
    VectorClock vectorClock
) implements SyncMessage {

  /** Validates the fields and copies the ids. */
  public SyncAck {
    Objects.requireNonNull(fromNode, "fromNode must not be null");
    Objects.requireNonNull(vectorClock, "vectorClock must not be null");
    recordIds = List.copyOf(Objects.requireNonNull(recordIds,
        "recordIds must not be null"));
  }

  /** {@inheritDoc} */
  @Override
  public MessageType type() {
    return MessageType.ACK;
  }
}
