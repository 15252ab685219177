package org.waabox.auditsync;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.auditsync.audit.AuditRecord;
import org.waabox.auditsync.audit.AuditStorage;
import org.waabox.auditsync.metrics.NoopSyncMetrics;
import org.waabox.auditsync.metrics.SyncMetrics;
import org.waabox.auditsync.sync.DistributedRecord;
import org.waabox.auditsync.sync.Heartbeat;
import org.waabox.auditsync.sync.MessageType;
import org.waabox.auditsync.sync.SyncAck;
import org.waabox.auditsync.sync.SyncMessage;
import org.waabox.auditsync.sync.SyncRequest;
import org.waabox.auditsync.sync.SyncResponse;

/**
 * Orchestrates the synchronization of a node's audit log with its peers.
 *
 * <p>The manager builds and interprets the four protocol messages and keeps
 * a {@link SyncState} per peer. A round trip looks like this:
 * <ol>
 *   <li>The requester calls {@link #createSyncRequest(NodeId)} when
 *       {@link #needsSync(NodeId)} says so, or gets a request back from
 *       {@link #processHeartbeat(SyncMessage)} when a peer is ahead.</li>
 *   <li>The responder turns it into a {@link SyncResponse} with
 *       {@link #processSyncRequest(SyncMessage)}.</li>
 *   <li>The requester persists the records, then turns the response into a
 *       {@link SyncAck} with {@link #processSyncResponse(SyncMessage)}.</li>
 *   <li>The responder applies the ack with
 *       {@link #processSyncAck(SyncMessage)}.</li>
 * </ol>
 *
 * <p>The manager never writes to the audit log and never retries. When an
 * exchange fails the caller reports it through
 * {@link #recordFailure(NodeId, Throwable)} and consults
 * {@link #backoffFor(NodeId)} before trying again.
 *
 * <p>Every operation either applies all of its state changes or throws a
 * {@link SyncException} leaving the state untouched.
 *
 * <p>This class is NOT thread-safe. Callers driving it from several threads
 * must serialize access, see {@link SyncDispatcher}.
 *
 * <p>Usage example:
 * <pre>{@code
 * SyncManager manager = SyncManager.builder()
 *     .nodeId(NodeId.of("node-1"))
 *     .storage(auditStorage)
 *     .config(SyncConfig.builder().batchSize(500).build())
 *     .build();
 *
 * if (manager.needsSync(peer)) {
 *   transport.send(peer, manager.createSyncRequest(peer));
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SyncManager {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(SyncManager.class);

  /** How far back the first request to a peer reaches. */
  static final Duration DEFAULT_LOOKBACK = Duration.ofHours(24);

  /** Where a repair pull starts once the default window did not help. */
  static final Instant FULL_WINDOW = Instant.EPOCH;

  /** Orders records by timestamp, then id. */
  private static final Comparator<AuditRecord> RECORD_ORDER =
      Comparator.comparing(AuditRecord::timestamp)
          .thenComparing(AuditRecord::id);

  /** The identity of this node. */
  private final NodeId nodeId;

  /** The protocol tunables. */
  private final SyncConfig config;

  /** The local audit log, read only. */
  private final AuditStorage storage;

  /** The metrics reporter. */
  private final SyncMetrics metrics;

  /** The wall clock, used for sync times and watermarks. */
  private final Clock clock;

  /** The per-peer states, keyed by peer id. */
  private final Map<NodeId, SyncState> syncStates = new HashMap<>();

  /** The local vector clock. */
  private VectorClock vectorClock = VectorClock.empty();

  /**
   * Creates a new manager.
   *
   * @param builder the builder holding the collaborators, never null
   */
  private SyncManager(final Builder builder) {
    nodeId = builder.nodeId;
    config = builder.config;
    storage = builder.storage;
    metrics = builder.metrics;
    clock = builder.clock;
  }

  /**
   * Creates a new builder for constructing a manager.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a pull request for the given peer, stamped with the given clock.
   *
   * <p>The request starts at the peer's watermark, strictly after the last
   * record received there when the previous response was truncated. A
   * peer that never sent us records is asked for the last 24 hours.
   *
   * @param target the peer to pull from, never null
   * @param stamp  the vector clock to send, never null
   * @return the request, never null
   */
  public SyncRequest createSyncRequest(final NodeId target,
      final VectorClock stamp) {
    Objects.requireNonNull(target, "target must not be null");
    Objects.requireNonNull(stamp, "stamp must not be null");

    final SyncState state = stateFor(target);
    final Optional<Instant> watermark = state.watermark();
    if (watermark.isEmpty()) {
      final Instant since = clock.instant().minus(DEFAULT_LOOKBACK);
      log.debug("Requesting records since {} from {}", since, target);
      return new SyncRequest(nodeId, since, stamp);
    }

    final UUID afterId = state.watermarkId().orElse(null);
    log.debug("Requesting records since {} after {} from {}",
        watermark.get(), afterId, target);
    return new SyncRequest(nodeId, watermark.get(), stamp, afterId);
  }

  /**
   * Builds a pull request for the given peer, stamped with this node's
   * clock after advancing it.
   *
   * @param target the peer to pull from, never null
   * @return the request, never null
   */
  public SyncRequest createSyncRequest(final NodeId target) {
    Objects.requireNonNull(target, "target must not be null");
    vectorClock = vectorClock.increment(nodeId);
    return createSyncRequest(target, vectorClock);
  }

  /**
   * Answers a pull request with the local records stamped at or after the
   * request's watermark.
   *
   * <p>A request carrying a continuation id only matches records strictly
   * after {@code (since, afterId)} in timestamp then id order. Records the
   * requester already acknowledged are left out, and records sent to it
   * earlier but never acknowledged are sent again whatever their
   * timestamp.
   *
   * <p>At most {@link SyncConfig#batchSize()} records are returned, oldest
   * first; {@link SyncResponse#hasMore()} tells whether more matched. Every
   * returned record is stamped with a freshly incremented local clock and
   * becomes pending for the requester until acknowledged.
   *
   * @param message the request, never null
   * @return the response, never null
   *
   * @throws ProtocolViolationException if the message is not a request
   * @throws StorageFailureException    if reading the local log fails
   */
  public SyncResponse processSyncRequest(final SyncMessage message) {
    final SyncRequest request = expect(message, MessageType.REQUEST,
        SyncRequest.class);

    final List<AuditRecord> all = read("getAll", storage::getAll);
    final SyncState state = syncStates.get(request.fromNode());
    final Set<UUID> pending = state == null ? Set.of() : state.pendingIds();
    final List<AuditRecord> matching = select(all, record ->
        (state == null || !state.isSynced(record.id()))
            && (pending.contains(record.id()) || follows(record, request)));

    final SyncResponse response = respond(request.fromNode(), matching,
        request.vectorClock());

    log.debug("Answered request from {} with {} of {} records",
        request.fromNode(), response.records().size(), matching.size());
    return response;
  }

  /**
   * Accepts the records of a response and acknowledges them.
   *
   * <p>Each record is marked synced for the responding peer. Records are
   * NOT persisted here: the caller appends them to its own log. The ack
   * lists every record of the response, including records accepted before.
   *
   * <p>The peer's watermark moves to now, or to the newest received record
   * when the response was truncated, so the next request continues right
   * after it.
   * A response is a successful exchange: the failed attempts are reset.
   *
   * @param message the response, never null
   * @return the acknowledgement to send back, never null
   *
   * @throws ProtocolViolationException if the message is not a response
   */
  public SyncAck processSyncResponse(final SyncMessage message) {
    final SyncResponse response = expect(message, MessageType.RESPONSE,
        SyncResponse.class);

    final Instant now = clock.instant();
    final SyncState state = stateFor(response.fromNode());

    final List<UUID> accepted = new ArrayList<>(response.records().size());
    AuditRecord newest = null;
    for (final DistributedRecord record : response.records()) {
      final AuditRecord audit = record.record();
      state.markSynced(audit.id());
      accepted.add(audit.id());
      if (newest == null || RECORD_ORDER.compare(audit, newest) > 0) {
        newest = audit;
      }
    }

    state.touch(now);
    state.resetFailures();
    if (response.hasMore() && newest != null) {
      state.advanceWatermark(newest.timestamp(), newest.id(), true);
    } else {
      state.advanceWatermark(now, null, false);
    }

    vectorClock = vectorClock.merge(response.vectorClock()).increment(nodeId);
    metrics.recordsReceived(response.fromNode(), accepted.size(),
        response.hasMore());

    log.debug("Accepted {} records from {}, more available: {}",
        accepted.size(), response.fromNode(), response.hasMore());
    return new SyncAck(nodeId, accepted, vectorClock);
  }

  /**
   * Applies an acknowledgement from a peer.
   *
   * <p>Every listed record is marked synced and leaves the pending records,
   * the last sync moves to now and the failed attempts are reset. Applying
   * the same ack twice has no further effect.
   *
   * @param message the acknowledgement, never null
   *
   * @throws ProtocolViolationException if the message is not an ack
   */
  public void processSyncAck(final SyncMessage message) {
    final SyncAck ack = expect(message, MessageType.ACK, SyncAck.class);

    final SyncState state = stateFor(ack.fromNode());
    for (final UUID id : ack.recordIds()) {
      state.markSynced(id);
    }
    state.touch(clock.instant());
    state.resetFailures();

    vectorClock = vectorClock.merge(ack.vectorClock());
    metrics.recordsAcknowledged(ack.fromNode(), ack.recordIds().size());

    log.debug("Peer {} acknowledged {} records", ack.fromNode(),
        ack.recordIds().size());
  }

  /**
   * Builds a heartbeat summarizing the local log.
   *
   * @return the heartbeat, never null
   *
   * @throws StorageFailureException if reading the local log fails
   */
  public Heartbeat createHeartbeat() {
    final long count = read("count", storage::count);
    final Optional<String> lastHash = read("getLastHash",
        storage::getLastHash);

    vectorClock = vectorClock.increment(nodeId);
    return new Heartbeat(nodeId, vectorClock, count, lastHash.orElse(null));
  }

  /**
   * Processes a heartbeat from a peer.
   *
   * <p>When the peer reports more records than the local log holds and the
   * strategy allows pulling, a request addressed to that peer is returned.
   * That request ignores the watermark: records relayed from a third node
   * keep their original timestamps and may sit behind it. The first pull
   * for a gap covers the last 24 hours; while the next heartbeats still
   * report a gap, the pulls cover the whole log. Records the peer knows we
   * hold are never sent back, so wide pulls only carry what is missing.
   *
   * <p>When both logs have the same size but different last hashes, the
   * histories diverge: the peer is flagged, a warning is logged and nothing
   * is pulled, resolving divergent histories is left to an operator. The
   * flag clears once a heartbeat shows matching hashes again.
   *
   * @param message the heartbeat, never null
   * @return a request to pull from the peer, or empty
   *
   * @throws ProtocolViolationException if the message is not a heartbeat
   * @throws StorageFailureException    if reading the local log fails
   */
  public Optional<SyncRequest> processHeartbeat(final SyncMessage message) {
    final Heartbeat heartbeat = expect(message, MessageType.HEARTBEAT,
        Heartbeat.class);
    final NodeId peer = heartbeat.fromNode();

    final long localCount = read("count", storage::count);
    Optional<String> localHash = Optional.empty();
    if (heartbeat.recordCount() == localCount) {
      localHash = read("getLastHash", storage::getLastHash);
    }

    final SyncState state = stateFor(peer);
    state.touch(clock.instant());
    vectorClock = vectorClock.merge(heartbeat.vectorClock());

    if (heartbeat.recordCount() <= localCount) {
      state.repairing(false);
    }

    if (heartbeat.recordCount() == localCount) {
      final boolean divergent = localHash.isPresent()
          && heartbeat.lastHash() != null
          && !localHash.get().equals(heartbeat.lastHash());
      if (divergent && !state.divergenceDetected()) {
        log.warn("Peer {} holds {} records like us but its last hash {}"
            + " differs from ours {}", peer, localCount,
            heartbeat.lastHash(), localHash.get());
        metrics.divergenceDetected(peer);
      }
      state.divergence(divergent);
      return Optional.empty();
    }

    if (heartbeat.recordCount() > localCount
        && config.strategy().allowsPull()) {
      final Instant since = state.repairing() ? FULL_WINDOW
          : clock.instant().minus(DEFAULT_LOOKBACK);
      state.repairing(true);
      log.info("Peer {} reports {} records, we hold {}: pulling since {}",
          peer, heartbeat.recordCount(), localCount, since);
      metrics.antiEntropyTriggered(peer, heartbeat.recordCount(), localCount);

      vectorClock = vectorClock.increment(nodeId);
      return Optional.of(new SyncRequest(nodeId, since, vectorClock));
    }
    return Optional.empty();
  }

  /**
   * Builds an unsolicited response pushing to the peer the local records it
   * has not acknowledged, and that were either never sent or sent longer
   * than {@link SyncConfig#syncInterval()} ago.
   *
   * @param target the peer to push to, never null
   * @return the response, never null
   *
   * @throws IllegalStateException   if the strategy does not allow pushing
   * @throws StorageFailureException if reading the local log fails
   */
  public SyncResponse createPush(final NodeId target) {
    Objects.requireNonNull(target, "target must not be null");
    if (!config.strategy().allowsPush()) {
      throw new IllegalStateException(
          "Strategy " + config.strategy() + " does not allow pushing");
    }

    final List<AuditRecord> all = read("getAll", storage::getAll);
    final SyncState state = syncStates.get(target);
    final Set<UUID> inFlight = new HashSet<>();
    if (state != null) {
      inFlight.addAll(state.pendingIds());
      inFlight.removeAll(state.pendingSentBefore(
          clock.instant().minus(config.syncInterval())));
    }
    final List<AuditRecord> unsent = select(all, record ->
        (state == null || !state.isSynced(record.id()))
            && !inFlight.contains(record.id()));

    return respond(target, unsent, VectorClock.empty());
  }

  /**
   * Checks whether the given peer should be synchronized.
   *
   * <p>True for a peer never seen before, for a peer not heard of within
   * {@link SyncConfig#syncInterval()}, for a peer with records waiting for
   * an acknowledgement, and for a peer whose last response was truncated.
   *
   * @param node the peer, never null
   * @return true if a synchronization round is due
   */
  public boolean needsSync(final NodeId node) {
    Objects.requireNonNull(node, "node must not be null");

    final SyncState state = syncStates.get(node);
    if (state == null || state.lastSync().isEmpty()) {
      return true;
    }
    final Duration elapsed = Duration.between(state.lastSync().get(),
        clock.instant());
    return elapsed.compareTo(config.syncInterval()) > 0
        || state.hasPending()
        || state.moreAvailable();
  }

  /**
   * Records a failed exchange with the given peer, such as a transport
   * error or a malformed message.
   *
   * @param node  the peer, never null
   * @param cause the failure, never null
   * @return the consecutive failed attempts, including this one
   */
  public int recordFailure(final NodeId node, final Throwable cause) {
    Objects.requireNonNull(node, "node must not be null");
    Objects.requireNonNull(cause, "cause must not be null");

    final int attempts = stateFor(node).incrementFailures(clock.instant());
    metrics.syncFailed(node, attempts, cause);

    if (config.retryPolicy().isExhausted(attempts)) {
      log.warn("Sync with {} failed {} times in a row, backing off {}",
          node, attempts, backoffFor(node), cause);
    } else {
      log.warn("Sync with {} failed (attempt {} of {}): {}", node, attempts,
          config.maxRetries(), cause.getMessage());
    }
    return attempts;
  }

  /**
   * Checks whether the peer exhausted its retries and the backoff since its
   * last failure has not elapsed yet.
   *
   * @param node the peer, never null
   * @return true if the next attempt must wait
   */
  public boolean isBackingOff(final NodeId node) {
    Objects.requireNonNull(node, "node must not be null");
    final SyncState state = syncStates.get(node);
    if (state == null
        || !config.retryPolicy().isExhausted(state.failedAttempts())) {
      return false;
    }
    return state.lastFailure()
        .map(failure -> clock.instant().isBefore(
            failure.plus(backoffFor(node))))
        .orElse(false);
  }

  /**
   * Returns how long the caller should wait before contacting the peer
   * again.
   *
   * @param node the peer, never null
   * @return zero while retries remain, otherwise an exponential backoff
   *         capped at the sync interval, never null
   */
  public Duration backoffFor(final NodeId node) {
    Objects.requireNonNull(node, "node must not be null");
    final SyncState state = syncStates.get(node);
    if (state == null) {
      return Duration.ZERO;
    }
    return config.retryPolicy().backoffFor(state.failedAttempts(),
        config.syncInterval());
  }

  /**
   * Returns the state of the given peer.
   *
   * @param node the peer, never null
   * @return the peer's state, or empty if the peer was never referenced
   */
  public Optional<SyncState> syncState(final NodeId node) {
    Objects.requireNonNull(node, "node must not be null");
    return Optional.ofNullable(syncStates.get(node));
  }

  /**
   * Returns the peers this manager holds a state for.
   *
   * @return an immutable copy of the known peers, never null
   */
  public Set<NodeId> knownPeers() {
    return Set.copyOf(syncStates.keySet());
  }

  /**
   * Returns the identity of this node.
   *
   * @return the node id, never null
   */
  public NodeId nodeId() {
    return nodeId;
  }

  /**
   * Returns the protocol tunables.
   *
   * @return the configuration, never null
   */
  public SyncConfig config() {
    return config;
  }

  /**
   * Returns the local vector clock.
   *
   * @return the current clock snapshot, never null
   */
  public VectorClock currentClock() {
    return vectorClock;
  }

  /**
   * Builds a response out of the given candidates, oldest first, and marks
   * the sent records pending for the peer.
   *
   * @param peer       the receiving peer, never null
   * @param candidates the records matching the request, sorted, never null
   * @param peerClock  the peer's clock to merge, never null
   * @return the response, never null
   */
  private SyncResponse respond(final NodeId peer,
      final List<AuditRecord> candidates, final VectorClock peerClock) {

    final int size = Math.min(candidates.size(), config.batchSize());
    final boolean hasMore = candidates.size() > size;

    VectorClock stamp = vectorClock.merge(peerClock);
    final List<DistributedRecord> batch = new ArrayList<>(size);
    for (final AuditRecord record : candidates.subList(0, size)) {
      stamp = stamp.increment(nodeId);
      batch.add(new DistributedRecord(record, nodeId, stamp));
    }
    if (batch.isEmpty()) {
      stamp = stamp.increment(nodeId);
    }

    vectorClock = stamp;
    final Instant now = clock.instant();
    final SyncState state = stateFor(peer);
    for (final DistributedRecord record : batch) {
      state.addPending(record, now);
    }
    metrics.recordsSent(peer, batch.size(), hasMore);

    return new SyncResponse(nodeId, batch, vectorClock, hasMore);
  }

  /**
   * Checks whether a record comes at or after the start of a request.
   *
   * @param record  the record, never null
   * @param request the request, never null
   * @return true if the record is stamped after {@code since}, or at
   *         {@code since} and, for a continuation, after {@code afterId}
   */
  private static boolean follows(final AuditRecord record,
      final SyncRequest request) {
    final int byTime = record.timestamp().compareTo(request.since());
    if (byTime != 0 || request.afterId() == null) {
      return byTime >= 0;
    }
    return record.id().compareTo(request.afterId()) > 0;
  }

  /**
   * Filters and sorts the given records.
   *
   * @param records the records to filter, never null
   * @param filter  the records to keep, never null
   * @return the matching records ordered by timestamp then id, never null
   */
  private static List<AuditRecord> select(final List<AuditRecord> records,
      final Predicate<AuditRecord> filter) {
    return records.stream()
        .filter(filter)
        .sorted(RECORD_ORDER)
        .collect(Collectors.toList());
  }

  /**
   * Returns the state of a peer, creating it on first reference.
   *
   * @param peer the peer, never null
   * @return the peer's state, never null
   */
  private SyncState stateFor(final NodeId peer) {
    return syncStates.computeIfAbsent(peer, SyncState::new);
  }

  /**
   * Checks the variant of a message and casts it.
   *
   * @param <T>      the expected message class
   * @param message  the message, never null
   * @param expected the expected variant, never null
   * @param type     the expected message class, never null
   * @return the message cast to the expected class, never null
   *
   * @throws ProtocolViolationException if the variant differs
   */
  private static <T extends SyncMessage> T expect(final SyncMessage message,
      final MessageType expected, final Class<T> type) {
    Objects.requireNonNull(message, "message must not be null");
    if (message.type() != expected || !type.isInstance(message)) {
      throw new ProtocolViolationException(expected, message.type());
    }
    return type.cast(message);
  }

  /**
   * Reads from the storage, wrapping its failures.
   *
   * @param <T>       the result type
   * @param operation the storage operation name, for error reporting
   * @param reader    the read to run, never null
   * @return the read result
   *
   * @throws StorageFailureException if the read fails
   */
  private static <T> T read(final String operation,
      final Supplier<T> reader) {
    try {
      return reader.get();
    } catch (final RuntimeException e) {
      throw new StorageFailureException(operation, e);
    }
  }

  /**
   * Builder for {@link SyncManager}.
   *
   * <p>{@link #nodeId(NodeId)} and {@link #storage(AuditStorage)} are
   * required. The configuration defaults to {@link SyncConfig#defaults()},
   * metrics to {@link NoopSyncMetrics} and the clock to the UTC system
   * clock.
   */
  public static final class Builder {

    /** The node identity. */
    private NodeId nodeId;

    /** The audit storage. */
    private AuditStorage storage;

    /** The configuration. */
    private SyncConfig config = SyncConfig.defaults();

    /** The metrics. */
    private SyncMetrics metrics = new NoopSyncMetrics();

    /** The clock. */
    private Clock clock = Clock.systemUTC();

    /** Creates a new builder, use {@link SyncManager#builder()}. */
    private Builder() {
    }

    /**
     * Sets the identity of this node.
     *
     * @param theNodeId the node id, never null
     * @return this builder, never null
     */
    public Builder nodeId(final NodeId theNodeId) {
      nodeId = Objects.requireNonNull(theNodeId, "nodeId must not be null");
      return this;
    }

    /**
     * Sets the local audit log.
     *
     * @param theStorage the storage, never null
     * @return this builder, never null
     */
    public Builder storage(final AuditStorage theStorage) {
      storage = Objects.requireNonNull(theStorage,
          "storage must not be null");
      return this;
    }

    /**
     * Sets the protocol tunables.
     *
     * @param theConfig the configuration, never null
     * @return this builder, never null
     */
    public Builder config(final SyncConfig theConfig) {
      config = Objects.requireNonNull(theConfig, "config must not be null");
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics, never null
     * @return this builder, never null
     */
    public Builder metrics(final SyncMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Sets the wall clock.
     *
     * @param theClock the clock, never null
     * @return this builder, never null
     */
    public Builder clock(final Clock theClock) {
      clock = Objects.requireNonNull(theClock, "clock must not be null");
      return this;
    }

    /**
     * Builds the manager.
     *
     * @return a new manager, never null
     *
     * @throws IllegalStateException if the node id or the storage is
     *                               missing
     */
    public SyncManager build() {
      if (nodeId == null) {
        throw new IllegalStateException("nodeId is required");
      }
      if (storage == null) {
        throw new IllegalStateException("storage is required");
      }
      return new SyncManager(this);
    }
  }
}
