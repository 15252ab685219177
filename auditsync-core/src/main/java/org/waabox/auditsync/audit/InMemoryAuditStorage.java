package org.waabox.auditsync.audit;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * An {@link AuditStorage} that keeps the log in memory.
 *
 * <p>The log is append-only: records can be added but never replaced or
 * removed. Appending is idempotent by record id, so records replicated from
 * a peer more than once are stored a single time.
 *
 * <p>This class is thread-safe; every operation synchronizes on the
 * instance.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryAuditStorage implements AuditStorage {

  /** The records in append order. */
  private final List<AuditRecord> records = new ArrayList<>();

  /** The ids of the stored records. */
  private final Set<UUID> ids = new HashSet<>();

  /** The hash of the last appended record, null while empty. */
  private String lastHash;

  /**
   * Appends a record to the log.
   *
   * @param record the record to append, never null
   * @return true if the record was appended, false if a record with the
   *         same id is already stored
   */
  public synchronized boolean append(final AuditRecord record) {
    Objects.requireNonNull(record, "record must not be null");
    if (!ids.add(record.id())) {
      return false;
    }
    records.add(record);
    lastHash = record.recordHash();
    return true;
  }

  /**
   * Appends every record of the given list, skipping duplicates.
   *
   * @param toAppend the records to append, never null
   * @return the number of records actually appended
   */
  public synchronized int appendAll(final List<AuditRecord> toAppend) {
    Objects.requireNonNull(toAppend, "toAppend must not be null");
    int appended = 0;
    for (final AuditRecord record : toAppend) {
      if (append(record)) {
        appended++;
      }
    }
    return appended;
  }

  /**
   * Checks whether a record with the given id is stored.
   *
   * @param id the record id, never null
   * @return true if the record is stored
   */
  public synchronized boolean contains(final UUID id) {
    return ids.contains(id);
  }

  /** {@inheritDoc} */
  @Override
  public synchronized long count() {
    return records.size();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized Optional<String> getLastHash() {
    return Optional.ofNullable(lastHash);
  }

  /** {@inheritDoc} */
  @Override
  public synchronized List<AuditRecord> getAll() {
    return List.copyOf(records);
  }
}
