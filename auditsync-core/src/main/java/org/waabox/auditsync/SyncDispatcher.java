package org.waabox.auditsync;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.auditsync.audit.AuditRecord;
import org.waabox.auditsync.sync.DistributedRecord;
import org.waabox.auditsync.sync.RecordSink;
import org.waabox.auditsync.sync.SyncAck;
import org.waabox.auditsync.sync.SyncMessage;
import org.waabox.auditsync.sync.SyncMessageListener;
import org.waabox.auditsync.sync.SyncRequest;
import org.waabox.auditsync.sync.SyncResponse;
import org.waabox.auditsync.sync.SyncTransport;

/**
 * Wires a {@link SyncManager} to a {@link SyncTransport}.
 *
 * <p>Inbound messages are routed to the matching manager operation and any
 * reply is sent back to the sender:
 * <ul>
 *   <li>a request is answered with a response;</li>
 *   <li>the records of a response are handed to the {@link RecordSink}
 *       and, once persisted, acknowledged;</li>
 *   <li>an ack is applied;</li>
 *   <li>a heartbeat from a peer that is ahead is answered with a
 *       request.</li>
 * </ul>
 *
 * <p>The outbound operations ({@link #sendHeartbeats(Collection)},
 * {@link #pullIfNeeded(NodeId)}, {@link #push(NodeId)}) are meant to be
 * called by the caller's scheduler.
 *
 * <p>Failures while handling a message or sending one are counted against
 * the peer through {@link SyncManager#recordFailure(NodeId, Throwable)} and
 * logged; they are never thrown back into the transport threads.
 *
 * <p>This class is thread-safe: every access to the manager is serialized
 * on an internal lock.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SyncDispatcher implements SyncMessageListener {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SyncDispatcher.class);

  /** The manager, guarded by lock. */
  private final SyncManager manager;

  /** The transport used for replies and outbound messages. */
  private final SyncTransport transport;

  /** Where received records are persisted. */
  private final RecordSink sink;

  /** Serializes the access to the manager. */
  private final Object lock = new Object();

  /**
   * Creates a new dispatcher.
   *
   * @param theManager   the manager, never null
   * @param theTransport the transport, never null
   * @param theSink      the sink for received records, never null
   */
  public SyncDispatcher(final SyncManager theManager,
      final SyncTransport theTransport, final RecordSink theSink) {
    manager = Objects.requireNonNull(theManager, "manager must not be null");
    transport = Objects.requireNonNull(theTransport,
        "transport must not be null");
    sink = Objects.requireNonNull(theSink, "sink must not be null");
  }

  /**
   * Subscribes this dispatcher to its transport.
   *
   * <p>Must be called before the transport is started.
   */
  public void attach() {
    transport.subscribe(this);
  }

  /** {@inheritDoc} */
  @Override
  public void onMessage(final SyncMessage message) {
    Objects.requireNonNull(message, "message must not be null");
    final NodeId peer = message.fromNode();

    try {
      final Optional<SyncMessage> reply = handle(message);
      reply.ifPresent(outbound -> transport.send(peer, outbound));
    } catch (final RuntimeException e) {
      log.warn("Failed to handle {} from {}", message.type(), peer, e);
      reportFailure(peer, e);
    }
  }

  /**
   * Counts a failed exchange against the peer.
   *
   * <p>Asynchronous transports call this when a message they accepted could
   * not be delivered.
   *
   * @param peer  the peer, never null
   * @param cause the failure, never null
   */
  public void reportFailure(final NodeId peer, final Throwable cause) {
    synchronized (lock) {
      manager.recordFailure(peer, cause);
    }
  }

  /**
   * Sends a heartbeat to each of the given peers.
   *
   * @param peers the peers to notify, never null
   */
  public void sendHeartbeats(final Collection<NodeId> peers) {
    Objects.requireNonNull(peers, "peers must not be null");

    final SyncMessage heartbeat;
    synchronized (lock) {
      heartbeat = manager.createHeartbeat();
    }
    for (final NodeId peer : peers) {
      send(peer, heartbeat);
    }
  }

  /**
   * Sends a pull request to the peer if a sync round is due and the peer is
   * not backing off.
   *
   * @param peer the peer, never null
   * @return true if a request was sent
   */
  public boolean pullIfNeeded(final NodeId peer) {
    Objects.requireNonNull(peer, "peer must not be null");

    final SyncRequest request;
    synchronized (lock) {
      if (!manager.needsSync(peer) || manager.isBackingOff(peer)) {
        return false;
      }
      request = manager.createSyncRequest(peer);
    }
    return send(peer, request);
  }

  /**
   * Pushes to the peer the local records it has not been sent yet.
   *
   * @param peer the peer, never null
   * @return true if a non empty batch was sent
   */
  public boolean push(final NodeId peer) {
    Objects.requireNonNull(peer, "peer must not be null");

    final SyncResponse response;
    synchronized (lock) {
      if (manager.isBackingOff(peer)) {
        return false;
      }
      response = manager.createPush(peer);
    }
    if (response.records().isEmpty()) {
      return false;
    }
    return send(peer, response);
  }

  /**
   * Routes a message to the manager.
   *
   * @param message the inbound message, never null
   * @return the reply to send to the sender, or empty
   */
  private Optional<SyncMessage> handle(final SyncMessage message) {
    synchronized (lock) {
      switch (message.type()) {
        case REQUEST:
          return Optional.of(manager.processSyncRequest(message));
        case RESPONSE:
          final SyncResponse response = (SyncResponse) message;
          final List<AuditRecord> records = response.records().stream()
              .map(DistributedRecord::record)
              .collect(Collectors.toList());
          if (!records.isEmpty()) {
            sink.persist(response.fromNode(), records);
          }
          final SyncAck ack = manager.processSyncResponse(response);
          return Optional.of(ack);
        case ACK:
          manager.processSyncAck(message);
          return Optional.empty();
        case HEARTBEAT:
          return manager.processHeartbeat(message).map(SyncMessage.class::cast);
        default:
          throw new IllegalArgumentException(
              "Unsupported message type: " + message.type());
      }
    }
  }

  /**
   * Sends a message, counting a transport failure against the peer.
   *
   * @param peer    the destination, never null
   * @param message the message, never null
   * @return true if the transport accepted the message
   */
  private boolean send(final NodeId peer, final SyncMessage message) {
    try {
      transport.send(peer, message);
      return true;
    } catch (final RuntimeException e) {
      reportFailure(peer, e);
      return false;
    }
  }
}
