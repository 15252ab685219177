package org.waabox.auditsync;

/**
 * The causal relationship between two {@link VectorClock vector clocks}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum CausalOrder {

  /** Both clocks hold the same counters. */
  EQUAL,

  /** The left clock happened before the right one. */
  BEFORE,

  /** The left clock happened after the right one. */
  AFTER,

  /** Neither clock dominates the other. */
  CONCURRENT
}
