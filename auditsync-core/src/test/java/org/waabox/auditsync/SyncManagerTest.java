package org.waabox.auditsync;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.auditsync.audit.AuditRecord;
import org.waabox.auditsync.audit.AuditStorage;
import org.waabox.auditsync.audit.InMemoryAuditStorage;
import org.waabox.auditsync.metrics.SyncMetrics;
import org.waabox.auditsync.sync.DistributedRecord;
import org.waabox.auditsync.sync.Heartbeat;
import org.waabox.auditsync.sync.MessageType;
import org.waabox.auditsync.sync.SyncAck;
import org.waabox.auditsync.sync.SyncRequest;
import org.waabox.auditsync.sync.SyncResponse;

/**
 * Tests for {@link SyncManager}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SyncManagerTest {

  private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

  private static final NodeId A = NodeId.of("node-a");
  private static final NodeId B = NodeId.of("node-b");

  private MutableClock clock;
  private InMemoryAuditStorage storageA;
  private InMemoryAuditStorage storageB;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    storageA = new InMemoryAuditStorage();
    storageB = new InMemoryAuditStorage();
  }

  private SyncManager manager(final NodeId node,
      final AuditStorage storage) {
    return manager(node, storage, SyncConfig.defaults());
  }

  private SyncManager manager(final NodeId node, final AuditStorage storage,
      final SyncConfig config) {
    return SyncManager.builder()
        .nodeId(node)
        .storage(storage)
        .config(config)
        .clock(clock)
        .build();
  }

  private static List<UUID> ids(final SyncResponse response) {
    return response.records().stream()
        .map(record -> record.record().id())
        .collect(Collectors.toList());
  }

  @Test
  void whenCreatingRequest_givenUnknownPeer_shouldStartTwentyFourHoursAgo() {
    final SyncManager a = manager(A, storageA);

    final SyncRequest request = a.createSyncRequest(B, VectorClock.empty());

    assertEquals(A, request.fromNode());
    assertEquals(START.minus(Duration.ofHours(24)), request.since());
    assertEquals(VectorClock.empty(), request.vectorClock());
    assertTrue(a.knownPeers().contains(B));
  }

  @Test
  void whenCreatingRequest_givenSystemClock_shouldStartAboutADayAgo() {
    final SyncManager a = SyncManager.builder()
        .nodeId(A)
        .storage(storageA)
        .build();

    final Instant before = Instant.now();
    final SyncRequest request = a.createSyncRequest(B);
    final Instant after = Instant.now();

    assertFalse(request.since().isBefore(before.minus(Duration.ofHours(24))));
    assertFalse(request.since().isAfter(after.minus(Duration.ofHours(24))));
    assertEquals(1L, request.vectorClock().get(A));
  }

  @Test
  void whenCheckingNeedsSync_givenUnknownPeer_shouldReturnTrue() {
    final SyncManager a = manager(A, storageA);

    assertTrue(a.needsSync(B));
    assertTrue(a.needsSync(NodeId.of("never-seen")));
  }

  @Test
  void whenCheckingNeedsSync_givenRecentAck_shouldWaitForTheInterval() {
    final SyncManager a = manager(A, storageA);
    a.processSyncAck(new SyncAck(B, List.of(), VectorClock.empty()));

    assertFalse(a.needsSync(B));

    clock.advance(Duration.ofSeconds(60));
    assertFalse(a.needsSync(B));

    clock.advance(Duration.ofSeconds(1));
    assertTrue(a.needsSync(B));
  }

  @Test
  void whenProcessingRequest_shouldReturnMatchingRecordsOldestFirst() {
    final List<AuditRecord> chain = TestRecords.chain(
        START.minus(Duration.ofHours(1)), 5);
    storageA.appendAll(chain);
    final SyncManager a = manager(A, storageA);

    final SyncResponse response = a.processSyncRequest(new SyncRequest(B,
        START.minus(Duration.ofHours(2)), VectorClock.empty().increment(B)));

    assertEquals(A, response.fromNode());
    assertFalse(response.hasMore());
    assertEquals(chain.stream().map(AuditRecord::id)
        .collect(Collectors.toList()), ids(response));

    long previous = 0;
    for (final DistributedRecord record : response.records()) {
      assertEquals(A, record.originNode());
      assertTrue(record.vectorClock().get(A) > previous);
      assertEquals(1L, record.vectorClock().get(B));
      previous = record.vectorClock().get(A);
    }
    assertEquals(5, a.syncState(B).orElseThrow().pendingRecords().size());
    assertTrue(a.needsSync(B));
  }

  @Test
  void whenProcessingRequest_givenRecordsBeforeSince_shouldSkipThem() {
    final List<AuditRecord> chain = TestRecords.chain(START, 4);
    storageA.appendAll(chain);
    final SyncManager a = manager(A, storageA);

    final SyncResponse response = a.processSyncRequest(new SyncRequest(B,
        chain.get(2).timestamp(), VectorClock.empty()));

    assertEquals(List.of(chain.get(2).id(), chain.get(3).id()),
        ids(response));
  }

  @Test
  void whenProcessingRequest_givenMoreRecordsThanBatch_shouldSignalHasMore() {
    final List<AuditRecord> chain = TestRecords.chain(START, 5);
    storageA.appendAll(chain);
    final SyncManager a = manager(A, storageA,
        SyncConfig.builder().batchSize(3).build());

    final SyncResponse response = a.processSyncRequest(new SyncRequest(B,
        START.minus(Duration.ofHours(1)), VectorClock.empty()));

    assertTrue(response.hasMore());
    assertEquals(List.of(chain.get(0).id(), chain.get(1).id(),
        chain.get(2).id()), ids(response));
  }

  @Test
  void whenProcessingRequest_givenExactlyBatchSize_shouldNotSignalHasMore() {
    storageA.appendAll(TestRecords.chain(START, 3));
    final SyncManager a = manager(A, storageA,
        SyncConfig.builder().batchSize(3).build());

    final SyncResponse response = a.processSyncRequest(new SyncRequest(B,
        START.minus(Duration.ofHours(1)), VectorClock.empty()));

    assertEquals(3, response.records().size());
    assertFalse(response.hasMore());
  }

  @Test
  void whenProcessingRequest_givenWrongMessage_shouldThrowAndKeepState() {
    final SyncManager a = manager(A, storageA);

    final ProtocolViolationException ex = assertThrows(
        ProtocolViolationException.class, () -> a.processSyncRequest(
            new SyncAck(B, List.of(), VectorClock.empty())));

    assertEquals(MessageType.REQUEST, ex.expected());
    assertEquals(MessageType.ACK, ex.actual());
    assertTrue(a.knownPeers().isEmpty());
  }

  @Test
  void whenProcessingRequest_givenStorageFailure_shouldWrapAndKeepState() {
    final AuditStorage storage = createMock(AuditStorage.class);
    final IllegalStateException failure = new IllegalStateException("disk");
    expect(storage.getAll()).andThrow(failure);
    replay(storage);

    final SyncManager a = manager(A, storage);
    final VectorClock before = a.currentClock();

    final StorageFailureException ex = assertThrows(
        StorageFailureException.class, () -> a.processSyncRequest(
            new SyncRequest(B, START, VectorClock.empty())));

    assertSame(failure, ex.getCause());
    assertTrue(a.knownPeers().isEmpty());
    assertEquals(before, a.currentClock());
    verify(storage);
  }

  @Test
  void whenProcessingResponse_shouldMarkRecordsSyncedAndAcknowledge() {
    final List<AuditRecord> chain = TestRecords.chain(START, 3);
    storageA.appendAll(chain);
    final SyncManager a = manager(A, storageA);
    final SyncManager b = manager(B, storageB);

    final SyncResponse response = a.processSyncRequest(
        b.createSyncRequest(A));
    clock.advance(Duration.ofMinutes(5));

    final SyncAck ack = b.processSyncResponse(response);

    assertEquals(B, ack.fromNode());
    assertEquals(ids(response), ack.recordIds());
    final SyncState state = b.syncState(A).orElseThrow();
    for (final AuditRecord record : chain) {
      assertTrue(state.isSynced(record.id()));
    }
    assertEquals(Optional.of(START.plus(Duration.ofMinutes(5))),
        state.lastSync());
    assertEquals(Optional.of(START.plus(Duration.ofMinutes(5))),
        state.watermark());
    assertFalse(b.needsSync(A));
    assertTrue(ack.vectorClock().get(A) >= response.vectorClock().get(A));
    assertEquals(0L, storageB.count(), "responses are not persisted");
  }

  @Test
  void whenProcessingResponse_givenHasMore_shouldResumeFromNewestRecord() {
    final List<AuditRecord> chain = TestRecords.chain(START, 5);
    storageA.appendAll(chain);
    final SyncConfig small = SyncConfig.builder().batchSize(2).build();
    final SyncManager a = manager(A, storageA, small);
    final SyncManager b = manager(B, storageB, small);

    final SyncResponse first = a.processSyncRequest(b.createSyncRequest(A));
    a.processSyncAck(b.processSyncResponse(first));

    assertTrue(b.syncState(A).orElseThrow().moreAvailable());
    assertTrue(b.needsSync(A));

    final SyncRequest next = b.createSyncRequest(A);
    assertEquals(chain.get(1).timestamp(), next.since());
    assertEquals(chain.get(1).id(), next.afterId());

    final SyncResponse second = a.processSyncRequest(next);
    assertEquals(List.of(chain.get(2).id(), chain.get(3).id()),
        ids(second));
  }

  @Test
  void whenPaging_givenMoreRecordsAtOneTimestampThanBatch_shouldFetchAll() {
    final AuditRecord first = TestRecords.record(START, null);
    final AuditRecord second = TestRecords.record(START, first.recordHash());
    final AuditRecord third = TestRecords.record(START, second.recordHash());
    storageA.appendAll(List.of(first, second, third));
    final SyncConfig small = SyncConfig.builder().batchSize(2).build();
    final SyncManager a = manager(A, storageA, small);
    final SyncManager b = manager(B, storageB, small);

    int rounds = 0;
    do {
      final SyncResponse response = a.processSyncRequest(
          b.createSyncRequest(A));
      storageB.appendAll(response.records().stream()
          .map(DistributedRecord::record)
          .collect(Collectors.toList()));
      a.processSyncAck(b.processSyncResponse(response));
      rounds++;
    } while (b.syncState(A).orElseThrow().moreAvailable() && rounds < 5);

    assertEquals(2, rounds);
    assertEquals(3L, storageB.count());
    assertFalse(b.syncState(A).orElseThrow().moreAvailable());
    assertFalse(a.syncState(B).orElseThrow().hasPending());
  }

  @Test
  void whenPaging_givenUnacknowledgedBatch_shouldSendItAgain() {
    final List<AuditRecord> chain = TestRecords.chain(START, 4);
    storageA.appendAll(chain);
    final SyncConfig small = SyncConfig.builder().batchSize(2).build();
    final SyncManager a = manager(A, storageA, small);
    final SyncManager b = manager(B, storageB, small);

    final SyncResponse first = a.processSyncRequest(b.createSyncRequest(A));
    b.processSyncResponse(first);

    final SyncResponse again = a.processSyncRequest(b.createSyncRequest(A));

    assertEquals(ids(first), ids(again));
    assertTrue(again.hasMore());
  }

  @Test
  void whenPulling_givenResponseLostAndPushReceived_shouldRecoverRecord() {
    final AuditRecord lost = TestRecords.record(START, null);
    storageA.append(lost);
    final SyncManager a = manager(A, storageA);
    final SyncManager b = manager(B, storageB);

    a.processSyncRequest(b.createSyncRequest(A));

    clock.advance(Duration.ofSeconds(5));
    final AuditRecord later = TestRecords.record(clock.instant(),
        lost.recordHash());
    storageA.append(later);
    final SyncResponse push = a.createPush(B);
    assertEquals(List.of(later.id()), ids(push));
    storageB.append(later);
    a.processSyncAck(b.processSyncResponse(push));

    clock.advance(Duration.ofSeconds(5));
    final SyncResponse pulled = a.processSyncRequest(b.createSyncRequest(A));
    assertEquals(List.of(lost.id()), ids(pulled));
    storageB.append(lost);
    a.processSyncAck(b.processSyncResponse(pulled));

    assertTrue(storageB.contains(lost.id()));
    assertFalse(a.syncState(B).orElseThrow().hasPending());
  }

  @Test
  void whenProcessingResponse_shouldReportReceivedRecords() {
    storageA.appendAll(TestRecords.chain(START, 3));
    final SyncMetrics metrics = createMock(SyncMetrics.class);
    metrics.recordsReceived(A, 3, false);
    replay(metrics);

    final SyncManager a = manager(A, storageA);
    final SyncManager b = SyncManager.builder()
        .nodeId(B)
        .storage(storageB)
        .metrics(metrics)
        .clock(clock)
        .build();

    b.processSyncResponse(a.processSyncRequest(b.createSyncRequest(A)));

    verify(metrics);
  }

  @Test
  void whenProcessingAck_givenFailedAttempts_shouldResetAndMarkSynced() {
    final SyncManager a = manager(A, storageA);
    for (int i = 0; i < 5; i++) {
      a.recordFailure(B, new IllegalStateException("timeout"));
    }
    assertEquals(5, a.syncState(B).orElseThrow().failedAttempts());

    final UUID x = UUID.randomUUID();
    final UUID y = UUID.randomUUID();
    final UUID z = UUID.randomUUID();
    a.processSyncAck(new SyncAck(B, List.of(x, y, z), VectorClock.empty()));

    final SyncState state = a.syncState(B).orElseThrow();
    assertEquals(0, state.failedAttempts());
    assertTrue(state.isSynced(x));
    assertTrue(state.isSynced(y));
    assertTrue(state.isSynced(z));
    assertEquals(Optional.of(START), state.lastSync());
  }

  @Test
  void whenProcessingAck_givenSameAckTwice_shouldBeIdempotent() {
    storageA.appendAll(TestRecords.chain(START, 3));
    final SyncManager a = manager(A, storageA);
    final SyncResponse response = a.processSyncRequest(
        new SyncRequest(B, START, VectorClock.empty()));
    final SyncAck ack = new SyncAck(B, ids(response),
        VectorClock.empty().increment(B));

    a.processSyncAck(ack);
    final String stateAfterFirst = a.syncState(B).orElseThrow().toString();
    final VectorClock clockAfterFirst = a.currentClock();

    a.processSyncAck(ack);

    assertEquals(stateAfterFirst, a.syncState(B).orElseThrow().toString());
    assertEquals(clockAfterFirst, a.currentClock());
    assertFalse(a.syncState(B).orElseThrow().hasPending());
  }

  @Test
  void whenProcessingRequest_givenAlreadyAckedRecords_shouldNotPendThemAgain() {
    storageA.appendAll(TestRecords.chain(START, 3));
    final SyncManager a = manager(A, storageA);
    final SyncRequest request = new SyncRequest(B, START,
        VectorClock.empty());

    final SyncResponse response = a.processSyncRequest(request);
    a.processSyncRequest(request);
    assertEquals(3, a.syncState(B).orElseThrow().pendingRecords().size());

    a.processSyncAck(new SyncAck(B, ids(response), VectorClock.empty()));
    a.processSyncRequest(request);

    assertTrue(a.syncState(B).orElseThrow().pendingRecords().isEmpty());
  }

  @Test
  void whenCreatingHeartbeat_shouldSummarizeStorage() {
    final List<AuditRecord> chain = TestRecords.chain(START, 4);
    storageA.appendAll(chain);
    final SyncManager a = manager(A, storageA);

    final Heartbeat heartbeat = a.createHeartbeat();

    assertEquals(A, heartbeat.fromNode());
    assertEquals(4L, heartbeat.recordCount());
    assertEquals(chain.get(3).recordHash(), heartbeat.lastHash());
    assertEquals(1L, heartbeat.vectorClock().get(A));
  }

  @Test
  void whenCreatingHeartbeat_givenEmptyStorage_shouldHaveNoHash() {
    final Heartbeat heartbeat = manager(A, storageA).createHeartbeat();

    assertEquals(0L, heartbeat.recordCount());
    assertNull(heartbeat.lastHash());
  }

  @Test
  void whenProcessingHeartbeat_givenPeerAhead_shouldRequestLastDay() {
    final SyncManager a = manager(A, storageA);

    final Optional<SyncRequest> request = a.processHeartbeat(
        new Heartbeat(B, VectorClock.empty().increment(B), 10, "hash-10"));

    assertTrue(request.isPresent());
    assertEquals(A, request.get().fromNode());
    assertEquals(START.minus(Duration.ofHours(24)), request.get().since());
    assertEquals(Optional.of(START), a.syncState(B).orElseThrow().lastSync());
    assertEquals(1L, a.currentClock().get(B));
  }

  @Test
  void whenProcessingHeartbeat_givenRecordOlderThanWatermark_shouldFetchIt() {
    final SyncManager a = manager(A, storageA);
    final SyncManager b = manager(B, storageB);

    a.processSyncResponse(b.processSyncRequest(a.createSyncRequest(B)));
    assertEquals(Optional.of(START), a.syncState(B).orElseThrow().watermark());

    final AuditRecord relayed = TestRecords.record(
        START.minus(Duration.ofSeconds(60)), null);
    storageB.append(relayed);
    clock.advance(Duration.ofMinutes(1));

    final SyncRequest request = a.processHeartbeat(b.createHeartbeat())
        .orElseThrow();
    assertEquals(clock.instant().minus(Duration.ofHours(24)),
        request.since());

    final SyncResponse response = b.processSyncRequest(request);
    assertEquals(List.of(relayed.id()), ids(response));
  }

  @Test
  void whenProcessingHeartbeat_givenGapPersists_shouldPullWholeLog() {
    final SyncManager a = manager(A, storageA);
    final SyncManager b = manager(B, storageB);
    final AuditRecord ancient = TestRecords.record(
        START.minus(Duration.ofDays(30)), null);
    storageB.append(ancient);

    final SyncRequest first = a.processHeartbeat(b.createHeartbeat())
        .orElseThrow();
    final SyncResponse empty = b.processSyncRequest(first);
    assertTrue(empty.records().isEmpty());
    a.processSyncResponse(empty);
    assertTrue(a.syncState(B).orElseThrow().repairing());

    final SyncRequest second = a.processHeartbeat(b.createHeartbeat())
        .orElseThrow();
    assertEquals(Instant.EPOCH, second.since());
    final SyncResponse response = b.processSyncRequest(second);
    assertEquals(List.of(ancient.id()), ids(response));
    storageA.append(ancient);
    b.processSyncAck(a.processSyncResponse(response));

    assertTrue(a.processHeartbeat(b.createHeartbeat()).isEmpty());
    assertFalse(a.syncState(B).orElseThrow().repairing());
  }

  @Test
  void whenProcessingHeartbeat_givenPeerNotAhead_shouldReturnEmpty() {
    final List<AuditRecord> chain = TestRecords.chain(START, 3);
    storageA.appendAll(chain);
    final SyncManager a = manager(A, storageA);

    assertTrue(a.processHeartbeat(new Heartbeat(B, VectorClock.empty(), 2,
        "other")).isEmpty());
    assertTrue(a.processHeartbeat(new Heartbeat(B, VectorClock.empty(), 3,
        chain.get(2).recordHash())).isEmpty());
    assertTrue(a.processHeartbeat(new Heartbeat(B, VectorClock.empty(), 4,
        "ahead")).isPresent());
  }

  @Test
  void whenProcessingHeartbeat_givenPushStrategy_shouldNeverPull() {
    final SyncManager a = manager(A, storageA,
        SyncConfig.builder().strategy(SyncStrategy.PUSH).build());

    assertTrue(a.processHeartbeat(new Heartbeat(B, VectorClock.empty(), 10,
        "hash-10")).isEmpty());
  }

  @Test
  void whenProcessingHeartbeat_givenSameCountDifferentHash_shouldFlag() {
    storageA.appendAll(TestRecords.chain(START, 2));
    final SyncMetrics metrics = createMock(SyncMetrics.class);
    metrics.divergenceDetected(B);
    replay(metrics);

    final SyncManager a = SyncManager.builder()
        .nodeId(A)
        .storage(storageA)
        .metrics(metrics)
        .clock(clock)
        .build();

    assertTrue(a.processHeartbeat(new Heartbeat(B, VectorClock.empty(), 2,
        "forged")).isEmpty());
    assertTrue(a.syncState(B).orElseThrow().divergenceDetected());

    a.processHeartbeat(new Heartbeat(B, VectorClock.empty(), 2,
        storageA.getLastHash().orElseThrow()));
    assertFalse(a.syncState(B).orElseThrow().divergenceDetected());

    verify(metrics);
  }

  @Test
  void whenProcessingHeartbeat_givenWrongMessage_shouldThrow() {
    final SyncManager a = manager(A, storageA);

    assertThrows(ProtocolViolationException.class, () ->
        a.processHeartbeat(new SyncRequest(B, START, VectorClock.empty())));
    assertThrows(ProtocolViolationException.class, () ->
        a.processSyncResponse(new SyncRequest(B, START, VectorClock.empty())));
    assertThrows(ProtocolViolationException.class, () ->
        a.processSyncAck(new SyncRequest(B, START, VectorClock.empty())));
  }

  @Test
  void whenRecordingFailures_givenRetriesExhausted_shouldBackOff() {
    final SyncManager a = manager(A, storageA,
        SyncConfig.builder()
            .maxRetries(3)
            .retryBackoff(Duration.ofSeconds(2))
            .syncIntervalSecs(10)
            .build());

    assertEquals(Duration.ZERO, a.backoffFor(B));

    a.recordFailure(B, new IllegalStateException("refused"));
    a.recordFailure(B, new IllegalStateException("refused"));
    assertFalse(a.isBackingOff(B));
    assertEquals(Duration.ZERO, a.backoffFor(B));

    assertEquals(3, a.recordFailure(B, new IllegalStateException("refused")));
    assertTrue(a.isBackingOff(B));
    assertEquals(Duration.ofSeconds(2), a.backoffFor(B));

    a.recordFailure(B, new IllegalStateException("refused"));
    a.recordFailure(B, new IllegalStateException("refused"));
    a.recordFailure(B, new IllegalStateException("refused"));
    assertEquals(Duration.ofSeconds(10), a.backoffFor(B));

    clock.advance(Duration.ofSeconds(11));
    assertFalse(a.isBackingOff(B));

    a.recordFailure(B, new IllegalStateException("refused"));
    assertTrue(a.isBackingOff(B));

    a.processSyncAck(new SyncAck(B, List.of(), VectorClock.empty()));
    assertFalse(a.isBackingOff(B));
  }

  @Test
  void whenPushing_givenHybridStrategy_shouldSendUnacknowledgedRecords() {
    final List<AuditRecord> chain = TestRecords.chain(START, 3);
    storageA.appendAll(chain);
    final SyncManager a = manager(A, storageA);

    final SyncResponse push = a.createPush(B);
    assertEquals(3, push.records().size());
    assertFalse(push.hasMore());

    assertTrue(a.createPush(B).records().isEmpty(),
        "pending records are not pushed twice");

    clock.advance(SyncConfig.defaults().syncInterval());
    final SyncResponse retry = a.createPush(B);
    assertEquals(ids(push), ids(retry));
    assertEquals(3, a.syncState(B).orElseThrow().pendingRecords().size());

    a.processSyncAck(new SyncAck(B, ids(push), VectorClock.empty()));
    assertTrue(a.createPush(B).records().isEmpty());
  }

  @Test
  void whenPushing_givenPullStrategy_shouldThrow() {
    final SyncManager a = manager(A, storageA,
        SyncConfig.builder().strategy(SyncStrategy.PULL).build());

    assertThrows(IllegalStateException.class, () -> a.createPush(B));
  }

  @Test
  void whenRunningRoundTrip_givenPeerAhead_shouldConverge() {
    storageA.appendAll(TestRecords.chain(START, 3));
    final SyncManager a = manager(A, storageA);
    final SyncManager b = manager(B, storageB);

    final SyncRequest request = b.processHeartbeat(a.createHeartbeat())
        .orElseThrow();
    final SyncResponse response = a.processSyncRequest(request);
    storageB.appendAll(response.records().stream()
        .map(DistributedRecord::record)
        .collect(Collectors.toList()));
    final SyncAck ack = b.processSyncResponse(response);
    a.processSyncAck(ack);

    assertEquals(storageA.count(), storageB.count());
    assertEquals(storageA.getLastHash(), storageB.getLastHash());
    assertFalse(a.syncState(B).orElseThrow().hasPending());
    assertFalse(a.needsSync(B));
    assertFalse(b.needsSync(A));
    assertTrue(b.processHeartbeat(a.createHeartbeat()).isEmpty());
  }

  @Test
  void whenBuilding_givenMissingStorage_shouldThrow() {
    assertThrows(IllegalStateException.class, () ->
        SyncManager.builder().nodeId(A).build());
    assertThrows(IllegalStateException.class, () ->
        SyncManager.builder().storage(storageA).build());
  }
}
