package org.waabox.auditsync.audit;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An immutable entry of an append-only audit log.
 *
 * <p>Records form a hash chain: {@code recordHash} covers the record content
 * plus {@code previousHash}, so modifying one record invalidates the hash of
 * every later record of the same node. The chain is built and verified by
 * the logging layer; synchronization only carries records as opaque
 * payload.
 *
 * @param id           the unique identifier of the record, never null
 * @param timestamp    the instant the decision was recorded, never null
 * @param eventType    the kind of decision, never null
 * @param actor        who or what triggered the decision, never null
 * @param statuteId    the statute that was applied, never null
 * @param subjectId    the entity the decision was about, never null
 * @param previousHash the hash of the previous record in the chain, null
 *                     for the first record
 * @param recordHash   the hash of this record, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record AuditRecord(
    UUID id,
    Instant timestamp,
    EventType eventType,
    String actor,
    String statuteId,
    UUID subjectId,
    String previousHash,
    String recordHash
) {

  /** Validates the mandatory fields. */
  public AuditRecord {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    Objects.requireNonNull(eventType, "eventType must not be null");
    Objects.requireNonNull(actor, "actor must not be null");
    Objects.requireNonNull(statuteId, "statuteId must not be null");
    Objects.requireNonNull(subjectId, "subjectId must not be null");
    Objects.requireNonNull(recordHash, "recordHash must not be null");
  }
}
