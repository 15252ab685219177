package org.waabox.auditsync.sync;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.waabox.auditsync.NodeId;
import org.waabox.auditsync.VectorClock;

/**
 * Asks a peer for every record stamped at or after {@code since}.
 *
 * <p>A request continuing a truncated response also carries the id of the
 * last record received. Records are then taken strictly after the
 * {@code (since, afterId)} position in timestamp then id order, so records
 * sharing the watermark timestamp are not sent again.
 *
 * @param fromNode    the requesting node, never null
 * @param since       the watermark, never null
 * @param vectorClock the requester's clock, never null
 * @param afterId     the last record received at {@code since}, or null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SyncRequest(
    NodeId fromNode,
    Instant since,
    VectorClock vectorClock,
    UUID afterId
) implements SyncMessage {

  /** Validates the fields. */
  public SyncRequest {
    Objects.requireNonNull(fromNode, "fromNode must not be null");
    Objects.requireNonNull(since, "since must not be null");
    Objects.requireNonNull(vectorClock, "vectorClock must not be null");
  }

  /**
   * Creates a request for every record stamped at or after {@code since}.
   *
   * @param fromNode    the requesting node, never null
   * @param since       the watermark, never null
   * @param vectorClock the requester's clock, never null
   */
  public SyncRequest(final NodeId fromNode, final Instant since,
      final VectorClock vectorClock) {
    this(fromNode, since, vectorClock, null);
  }

  /**
   * Returns the continuation cursor.
   *
   * @return the last record received at {@code since}, empty for a request
   *         that starts at {@code since} inclusive
   */
  public Optional<UUID> afterIdValue() {
    return Optional.ofNullable(afterId);
  }

  /** {@inheritDoc} */
  @Override
  public MessageType type() {
    return MessageType.REQUEST;
  }
}
