package org.waabox.auditsync.sync;

import org.waabox.auditsync.NodeId;
import org.waabox.auditsync.VectorClock;

/**
 * A message exchanged between nodes by the synchronization protocol.
 *
 * <p>Every message names its sender and carries the sender's vector clock
 * at the moment the message was built. Messages are immutable and may be
 * delivered out of order or more than once; receivers rely on idempotent
 * record bookkeeping rather than on delivery guarantees.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SyncMessage {

  /**
   * Returns the protocol variant of this message.
   *
   * @return the message type, never null
   */
  MessageType type();

  /**
   * Returns the node that built this message.
   *
   * @return the sender, never null
   */
  NodeId fromNode();

  /**
   * Returns the sender's vector clock snapshot.
   *
   * @return the vector clock, never null
   */
  VectorClock vectorClock();
}
