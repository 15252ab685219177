package org.waabox.auditsync;

/**
 * Thrown when a read against the audit storage fails while serving a
 * synchronization step.
 *
 * <p>The original storage error is kept as the cause.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StorageFailureException extends SyncException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception for the given storage operation.
   *
   * @param operation the storage operation that failed, cannot be null.
   * @param cause the error raised by the storage, cannot be null.
   */
  public StorageFailureException(final String operation,
      final Throwable cause) {
    super("Audit storage failed on " + operation + ": "
        + cause.getMessage(), cause);
  }
}
