package org.waabox.auditsync.sync;

import org.waabox.auditsync.NodeId;

/**
 * Carries {@link SyncMessage synchronization messages} between nodes.
 *
 * <p>Implementations define the wire (HTTP, a message broker, in-process
 * queues for tests) and manage its lifecycle. Delivery is best effort:
 * messages may be lost, duplicated or reordered.
 *
 * <p>Typical lifecycle:
 * <ol>
 *   <li>Register listeners via {@link #subscribe(SyncMessageListener)}</li>
 *   <li>Call {@link #start()} to begin receiving messages</li>
 *   <li>Send messages via {@link #send(NodeId, SyncMessage)}</li>
 *   <li>Call {@link #stop()} to shut down the transport</li>
 * </ol>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SyncTransport {

  /**
   * Sends a message to the given peer.
   *
   * @param target  the destination node, never null
   * @param message the message to deliver, never null
   */
  void send(NodeId target, SyncMessage message);

  /**
   * Registers a listener that will be notified of incoming messages.
   *
   * <p>Listeners must be registered before calling {@link #start()}.
   *
   * @param listener the listener to register, never null
   */
  void subscribe(SyncMessageListener listener);

  /** Starts the transport, enabling message reception. */
  void start();

  /** Stops the transport and releases associated resources. */
  void stop();
}
