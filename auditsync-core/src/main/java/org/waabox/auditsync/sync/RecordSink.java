package org.waabox.auditsync.sync;

import java.util.List;

import org.waabox.auditsync.NodeId;
import org.waabox.auditsync.audit.AuditRecord;

/**
 * Persists the records received from a peer into the local audit log.
 *
 * <p>Implementations must be idempotent: the same record may be delivered
 * more than once.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface RecordSink {

  /**
   * Persists the given records.
   *
   * @param origin  the peer the records came from, never null
   * @param records the records to persist, never null
   */
  void persist(NodeId origin, List<AuditRecord> records);
}
