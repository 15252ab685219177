package org.waabox.auditsync.sync;

/**
 * The four variants of the synchronization wire protocol.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum MessageType {

  /** A pull request for records newer than a watermark. */
  REQUEST,

  /** A batch of records answering a request, or pushed unsolicited. */
  RESPONSE,

  /** The acknowledgement of the records received in a response. */
  ACK,

  /** A periodic summary of a node's log. */
  HEARTBEAT
}
