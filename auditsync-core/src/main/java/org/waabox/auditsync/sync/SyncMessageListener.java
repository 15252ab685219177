package org.waabox.auditsync.sync;

/**
 * A listener notified when a synchronization message arrives from a peer.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface SyncMessageListener {

  /**
   * Called when a message is received from the transport.
   *
   * @param message the received message, never null
   */
  void onMessage(SyncMessage message);
}
