package org.waabox.auditsync.sync;

import java.util.List;
import java.util.Objects;

import org.waabox.auditsync.NodeId;
import org.waabox.auditsync.VectorClock;

/**
 * Carries a batch of records from one node to another.
 *
 * <p>{@code hasMore} is true when the sender had more matching records than
 * fit in the batch. Records are ordered by timestamp, so the requester can
 * continue from the newest record it received.
 *
 * @param fromNode    the responding node, never null
 * @param records     the records of this batch, never null
 * @param vectorClock the responder's clock, never null
 * @param hasMore     whether records beyond this batch exist
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SyncResponse(
    NodeId fromNode,
    List<DistributedRecord> records,
    VectorClock vectorClock,
    boolean hasMore
) implements SyncMessage {

  /** Validates the fields and copies the records. */
  public SyncResponse {
    Objects.requireNonNull(fromNode, "fromNode must not be null");
    Objects.requireNonNull(vectorClock, "vectorClock must not be null");
    records = List.copyOf(Objects.requireNonNull(records,
        "records must not be null"));
  }

  /** {@inheritDoc} */
  @Override
  public MessageType type() {
    return MessageType.RESPONSE;
  }
}
