package org.waabox.auditsync;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.waabox.auditsync.sync.DistributedRecord;

/**
 * Bookkeeping of the synchronization with one peer.
 *
 * <p>A state is created the first time a peer is referenced and lives as
 * long as the owning {@link SyncManager}. It tracks:
 * <ul>
 *   <li>{@code lastSync}: the last time the peer was in contact with us
 *       through a response, an ack or a heartbeat.</li>
 *   <li>{@code watermark}: the instant from which the next pull request
 *       starts; it only moves when records are received. After a truncated
 *       response it comes with the id of the last record received, so the
 *       next request continues strictly after it.</li>
 *   <li>The ids of the records known to be on both sides.</li>
 *   <li>The records sent to the peer and not yet acknowledged, with the
 *       instant each one was last sent.</li>
 *   <li>The number of consecutive failed exchanges and when the last one
 *       happened.</li>
 * </ul>
 *
 * <p>A record id that is synced never appears among the pending records.
 *
 * <p>Only {@link SyncManager} mutates a state; callers get a read-only
 * view. This class is not thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SyncState {

  /** The peer this state belongs to. */
  private final NodeId peer;

  /** The ids of the records present on both sides. */
  private final Set<UUID> syncedRecords = new HashSet<>();

  /** The records sent but not acknowledged, in send order. */
  private final Map<UUID, DistributedRecord> pendingRecords =
      new LinkedHashMap<>();

  /** The last contact with the peer, null until the first one. */
  private Instant lastSync;

  /** When each pending record was last sent, keyed by record id. */
  private final Map<UUID, Instant> pendingSentAt = new HashMap<>();

  /** The start of the next pull request, null until records arrive. */
  private Instant watermark;

  /** The last record received at the watermark, null if none. */
  private UUID watermarkId;

  /** Whether a pull was issued to close a record count gap. */
  private boolean repairing;

  /** Whether the last response from the peer left records behind. */
  private boolean moreAvailable;

  /** Whether the last heartbeat revealed a different history. */
  private boolean divergenceDetected;

  /** The number of consecutive failed exchanges. */
  private int failedAttempts;

  /** When the last failed exchange happened, null if none. */
  private Instant lastFailure;

  /**
   * Creates the state of a peer never synchronized before.
   *
   * @param thePeer the peer, never null
   */
  SyncState(final NodeId thePeer) {
    peer = Objects.requireNonNull(thePeer, "peer must not be null");
  }

  /**
   * Returns the peer this state belongs to.
   *
   * @return the peer, never null
   */
  public NodeId peer() {
    return peer;
  }

  /**
   * Returns the last time the peer was in contact with us.
   *
   * @return the last sync instant, or empty if the peer was never heard of
   */
  public Optional<Instant> lastSync() {
    return Optional.ofNullable(lastSync);
  }

  /**
   * Returns the instant from which the next pull request starts.
   *
   * @return the watermark, or empty if no record was received yet
   */
  public Optional<Instant> watermark() {
    return Optional.ofNullable(watermark);
  }

  /**
   * Returns the last record received at the watermark.
   *
   * @return the id to continue after, empty when the next request starts at
   *         the watermark inclusive
   */
  public Optional<UUID> watermarkId() {
    return Optional.ofNullable(watermarkId);
  }

  /**
   * Checks whether the record is known to be on both sides.
   *
   * @param recordId the record id, never null
   * @return true if the record is synced
   */
  public boolean isSynced(final UUID recordId) {
    return syncedRecords.contains(recordId);
  }

  /**
   * Returns how many records are known to be on both sides.
   *
   * @return the synced record count
   */
  public int syncedCount() {
    return syncedRecords.size();
  }

  /**
   * Returns the records sent to the peer and not acknowledged yet.
   *
   * @return an immutable copy of the pending records, in send order
   */
  public List<DistributedRecord> pendingRecords() {
    return List.copyOf(pendingRecords.values());
  }

  /**
   * Checks whether records are waiting for an acknowledgement.
   *
   * @return true if at least one record is pending
   */
  public boolean hasPending() {
    return !pendingRecords.isEmpty();
  }

  /**
   * Checks whether the last response from the peer was truncated.
   *
   * @return true if the peer reported more records than it sent
   */
  public boolean moreAvailable() {
    return moreAvailable;
  }

  /**
   * Checks whether a pull was issued to close a record count gap reported
   * by the peer's heartbeat, and the gap was not seen closed yet.
   *
   * @return true while a count gap is being repaired
   */
  public boolean repairing() {
    return repairing;
  }

  /**
   * Checks whether the peer's log has the same size as ours but a different
   * last record.
   *
   * @return true if the last heartbeat revealed a divergent history
   */
  public boolean divergenceDetected() {
    return divergenceDetected;
  }

  /**
   * Returns the number of consecutive failed exchanges.
   *
   * @return the failed attempts, zero after a successful acknowledgement
   */
  public int failedAttempts() {
    return failedAttempts;
  }

  /**
   * Returns when the last consecutive failure happened.
   *
   * @return the instant of the last failure, empty after a success
   */
  public Optional<Instant> lastFailure() {
    return Optional.ofNullable(lastFailure);
  }

  /**
   * Adds a record to the pending records.
   *
   * <p>No-op if the record is already synced. A record already pending is
   * replaced by the new copy and its send instant is refreshed.
   *
   * @param record the record sent to the peer, never null
   * @param sentAt when the record was sent, never null
   * @return true if the record became pending
   */
  boolean addPending(final DistributedRecord record, final Instant sentAt) {
    final UUID id = record.record().id();
    if (isSynced(id)) {
      return false;
    }
    pendingSentAt.put(id, sentAt);
    return pendingRecords.put(id, record) == null;
  }

  /**
   * Returns the ids of the pending records.
   *
   * @return the pending ids, never null
   */
  Set<UUID> pendingIds() {
    return Set.copyOf(pendingRecords.keySet());
  }

  /**
   * Returns the ids of the pending records last sent at or before the given
   * instant.
   *
   * @param cutoff the latest send instant to include, never null
   * @return the ids of the overdue pending records, never null
   */
  Set<UUID> pendingSentBefore(final Instant cutoff) {
    final Set<UUID> overdue = new HashSet<>();
    pendingSentAt.forEach((id, sentAt) -> {
      if (!sentAt.isAfter(cutoff)) {
        overdue.add(id);
      }
    });
    return overdue;
  }

  /**
   * Marks a record as present on both sides, removing it from pending.
   *
   * @param recordId the record id, never null
   */
  void markSynced(final UUID recordId) {
    syncedRecords.add(recordId);
    pendingRecords.remove(recordId);
    pendingSentAt.remove(recordId);
  }

  /**
   * Records a contact with the peer.
   *
   * @param now the contact instant, never null
   */
  void touch(final Instant now) {
    lastSync = now;
  }

  /**
   * Moves the watermark after receiving records.
   *
   * @param theWatermark the start of the next pull request, never null
   * @param afterId      the last record received at the watermark, null
   *                     when the next request starts at it inclusive
   * @param more         whether the peer left records behind
   */
  void advanceWatermark(final Instant theWatermark, final UUID afterId,
      final boolean more) {
    watermark = theWatermark;
    watermarkId = afterId;
    moreAvailable = more;
  }

  /**
   * Sets or clears the count gap repair flag.
   *
   * @param gap true while a count gap is being repaired
   */
  void repairing(final boolean gap) {
    repairing = gap;
  }

  /**
   * Sets or clears the divergence flag.
   *
   * @param divergent true if the histories diverge
   */
  void divergence(final boolean divergent) {
    divergenceDetected = divergent;
  }

  /**
   * Counts one more failed exchange.
   *
   * @param at when the exchange failed, never null
   * @return the consecutive failures, including this one
   */
  int incrementFailures(final Instant at) {
    failedAttempts++;
    lastFailure = at;
    return failedAttempts;
  }

  /** Clears the consecutive failures after a successful exchange. */
  void resetFailures() {
    failedAttempts = 0;
    lastFailure = null;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "SyncState{peer=" + peer
        + ", lastSync=" + lastSync
        + ", watermark=" + watermark
        + ", watermarkId=" + watermarkId
        + ", synced=" + syncedRecords.size()
        + ", pending=" + pendingRecords.size()
        + ", failedAttempts=" + failedAttempts + "}";
  }
}
