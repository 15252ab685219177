package org.waabox.auditsync;

import java.util.Objects;

import org.waabox.auditsync.sync.MessageType;

/**
 * Thrown when a protocol handler receives a message variant it does not
 * handle, for example a {@code SyncAck} passed to
 * {@link SyncManager#processSyncRequest}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ProtocolViolationException extends SyncException {

  private static final long serialVersionUID = 1L;

  /** The message type the handler expects. */
  private final MessageType expected;

  /** The message type that was received. */
  private final MessageType actual;

  /**
   * Creates a new exception for an unexpected message type.
   *
   * @param expected the message type the handler expects, cannot be null.
   * @param actual   the message type received, cannot be null.
   */
  public ProtocolViolationException(final MessageType expected,
      final MessageType actual) {
    super("Expected a " + Objects.requireNonNull(expected, "expected")
        + " message but received a "
        + Objects.requireNonNull(actual, "actual"));
    this.expected = expected;
    this.actual = actual;
  }

  /**
   * Returns the message type the handler expects.
   *
   * @return the expected type, never null
   */
  public MessageType expected() {
    return expected;
  }

  /**
   * Returns the message type that was received.
   *
   * @return the actual type, never null
   */
  public MessageType actual() {
    return actual;
  }
}
