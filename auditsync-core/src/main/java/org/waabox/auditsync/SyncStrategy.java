package org.waabox.auditsync;

/**
 * The direction in which a node moves audit records to its peers.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SyncStrategy {

  /** The node only pushes its records to peers, heartbeats never pull. */
  PUSH,

  /** The node only pulls records from peers that report more records. */
  PULL,

  /** The node both pushes and pulls. */
  HYBRID;

  /**
   * Checks whether this strategy lets a node pull records from a peer.
   *
   * @return true for {@link #PULL} and {@link #HYBRID}
   */
  public boolean allowsPull() {
    return this != PUSH;
  }

  /**
   * Checks whether this strategy lets a node push records to a peer.
   *
   * @return true for {@link #PUSH} and {@link #HYBRID}
   */
  public boolean allowsPush() {
    return this != PULL;
  }
}
