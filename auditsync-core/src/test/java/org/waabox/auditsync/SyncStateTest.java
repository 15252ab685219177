package org.waabox.auditsync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.waabox.auditsync.audit.AuditRecord;
import org.waabox.auditsync.sync.DistributedRecord;

/**
 * Tests for {@link SyncState}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SyncStateTest {

  private static final NodeId PEER = NodeId.of("peer");

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private static DistributedRecord distributed(final AuditRecord record) {
    return new DistributedRecord(record, NodeId.of("self"),
        VectorClock.empty().increment(NodeId.of("self")));
  }

  @Test
  void whenCreated_shouldBeEmpty() {
    final SyncState state = new SyncState(PEER);

    assertEquals(PEER, state.peer());
    assertTrue(state.lastSync().isEmpty());
    assertTrue(state.watermark().isEmpty());
    assertFalse(state.hasPending());
    assertEquals(0, state.failedAttempts());
  }

  @Test
  void whenAddingPending_givenSyncedRecord_shouldIgnoreIt() {
    final SyncState state = new SyncState(PEER);
    final AuditRecord record = TestRecords.record(Instant.now(), null);

    state.markSynced(record.id());

    assertFalse(state.addPending(distributed(record), NOW));
    assertTrue(state.pendingRecords().isEmpty());
  }

  @Test
  void whenAddingPending_givenSameRecordTwice_shouldKeepOneEntry() {
    final SyncState state = new SyncState(PEER);
    final DistributedRecord record = distributed(
        TestRecords.record(Instant.now(), null));

    assertTrue(state.addPending(record, NOW));
    assertFalse(state.addPending(record, NOW));

    assertEquals(1, state.pendingRecords().size());
  }

  @Test
  void whenResending_givenPendingRecord_shouldRefreshSendInstant() {
    final SyncState state = new SyncState(PEER);
    final DistributedRecord record = distributed(
        TestRecords.record(NOW, null));
    final UUID id = record.record().id();

    state.addPending(record, NOW);
    assertEquals(Set.of(id), state.pendingSentBefore(NOW));

    state.addPending(record, NOW.plusSeconds(30));
    assertTrue(state.pendingSentBefore(NOW.plusSeconds(29)).isEmpty());
    assertEquals(Set.of(id), state.pendingSentBefore(NOW.plusSeconds(30)));

    state.markSynced(id);
    assertTrue(state.pendingSentBefore(NOW.plusSeconds(60)).isEmpty());
  }

  @Test
  void whenAdvancingWatermark_shouldKeepContinuationId() {
    final SyncState state = new SyncState(PEER);
    final UUID last = UUID.randomUUID();

    state.advanceWatermark(NOW, last, true);
    assertEquals(Optional.of(NOW), state.watermark());
    assertEquals(Optional.of(last), state.watermarkId());
    assertTrue(state.moreAvailable());

    state.advanceWatermark(NOW.plusSeconds(10), null, false);
    assertTrue(state.watermarkId().isEmpty());
    assertFalse(state.moreAvailable());
  }

  @Test
  void whenMarkingSynced_givenPendingRecord_shouldRemoveItFromPending() {
    final SyncState state = new SyncState(PEER);
    final DistributedRecord record = distributed(
        TestRecords.record(Instant.now(), null));
    state.addPending(record, NOW);

    state.markSynced(record.record().id());

    assertTrue(state.isSynced(record.record().id()));
    assertFalse(state.hasPending());
    assertFalse(state.addPending(record, NOW));
  }

  @Test
  void whenCountingFailures_shouldIncrementAndReset() {
    final SyncState state = new SyncState(PEER);

    final Instant first = Instant.parse("2026-03-01T12:00:00Z");

    assertEquals(1, state.incrementFailures(first));
    assertEquals(2, state.incrementFailures(first.plusSeconds(5)));
    assertEquals(Optional.of(first.plusSeconds(5)), state.lastFailure());

    state.resetFailures();
    assertEquals(0, state.failedAttempts());
    assertEquals(Optional.empty(), state.lastFailure());
  }
}
