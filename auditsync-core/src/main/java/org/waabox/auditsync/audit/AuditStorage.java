package org.waabox.auditsync.audit;

import java.util.List;
import java.util.Optional;

/**
 * Read access to a node's append-only audit log.
 *
 * <p>Implementations define where records live (memory, JSON lines file,
 * database). The synchronization layer only reads through this interface;
 * appending records received from peers is done by the caller against the
 * concrete storage.
 *
 * <p>Implementations shared between threads must be thread-safe. Any of
 * these calls may block on I/O and report failures as unchecked
 * exceptions.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface AuditStorage {

  /**
   * Returns the number of records stored.
   *
   * @return the record count, never negative
   */
  long count();

  /**
   * Returns the hash of the most recently appended record.
   *
   * @return the last hash, or empty if the log is empty
   */
  Optional<String> getLastHash();

  /**
   * Returns every stored record in append order.
   *
   * @return the records, never null
   */
  List<AuditRecord> getAll();
}
