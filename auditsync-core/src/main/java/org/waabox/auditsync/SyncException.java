package org.waabox.auditsync;

/**
 * Base exception for all synchronization errors.
 *
 * <p>This is an unchecked exception. A {@link SyncManager} operation that
 * throws it leaves every peer's state exactly as it was before the call;
 * retrying is the caller's decision.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class SyncException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public SyncException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public SyncException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
