package org.waabox.auditsync.sync;

import java.util.Objects;

import org.waabox.auditsync.NodeId;
import org.waabox.auditsync.VectorClock;
import org.waabox.auditsync.audit.AuditRecord;

/**
 * An audit record prepared for transmission to a peer.
 *
 * <p>Created once, when the record is selected for a response, and never
 * modified afterward.
 *
 * @param record      the audit record, never null
 * @param originNode  the node that sent the record, never null
 * @param vectorClock the sender's clock when the record was prepared,
 *                    never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DistributedRecord(
    AuditRecord record,
    NodeId originNode,
    VectorClock vectorClock
) {

  /** Validates the fields. */
  public DistributedRecord {
    Objects.requireNonNull(record, "record must not be null");
    Objects.requireNonNull(originNode, "originNode must not be null");
    Objects.requireNonNull(vectorClock, "vectorClock must not be null");
  }
}
