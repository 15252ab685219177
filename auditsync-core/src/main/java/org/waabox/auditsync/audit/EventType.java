package org.waabox.auditsync.audit;

/**
 * The kind of decision an {@link AuditRecord} documents.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum EventType {

  /** A decision taken automatically by the system. */
  AUTOMATIC_DECISION,

  /** A decision that required human review. */
  DISCRETIONARY_REVIEW,

  /** A human override of an automatic decision. */
  HUMAN_OVERRIDE,

  /** An appeal or review request. */
  APPEAL,

  /** A statute was modified. */
  STATUTE_MODIFIED,

  /** A simulation run. */
  SIMULATION_RUN
}
