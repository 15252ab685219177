package org.waabox.auditsync;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * An immutable vector clock, mapping each {@link NodeId} to a counter.
 *
 * <p>Vector clocks stamp the causal moment at which a node produced a
 * message or prepared a record for transmission. Missing entries read as
 * zero, so a clock holding an explicit zero is equal to one without the
 * entry.
 *
 * <p>Counters never decrease: {@link #increment(NodeId)} and
 * {@link #merge(VectorClock)} always return a clock that is greater than or
 * equal to the receiver on every node.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class VectorClock {

  /** The shared empty clock. */
  private static final VectorClock EMPTY = new VectorClock(Map.of());

  /** The non-zero counters, keyed by node id. */
  private final Map<NodeId, Long> counters;

  /**
   * Creates a new clock from the given counters.
   *
   * @param counters the counters, zero entries are dropped, never null
   */
  private VectorClock(final Map<NodeId, Long> counters) {
    final Map<NodeId, Long> copy = new HashMap<>();
    counters.forEach((node, counter) -> {
      if (counter > 0) {
        copy.put(node, counter);
      }
    });
    this.counters = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns a clock with every counter at zero.
   *
   * @return the empty clock, never null
   */
  public static VectorClock empty() {
    return EMPTY;
  }

  /**
   * Creates a clock holding the given counters.
   *
   * @param counters the counters keyed by node id, never null
   * @return a new clock, never null
   *
   * @throws IllegalArgumentException if any counter is negative
   */
  public static VectorClock of(final Map<NodeId, Long> counters) {
    Objects.requireNonNull(counters, "counters must not be null");
    for (final Map.Entry<NodeId, Long> entry : counters.entrySet()) {
      Objects.requireNonNull(entry.getKey(), "node id must not be null");
      if (entry.getValue() == null || entry.getValue() < 0) {
        throw new IllegalArgumentException("Counter for " + entry.getKey()
            + " must be a non-negative number, got: " + entry.getValue());
      }
    }
    return new VectorClock(counters);
  }

  /**
   * Returns a clock where the given node's counter is one higher.
   *
   * <p>An absent node is treated as zero and becomes one.
   *
   * @param node the node whose counter advances, never null
   * @return the incremented clock, never null
   */
  public VectorClock increment(final NodeId node) {
    Objects.requireNonNull(node, "node must not be null");
    final Map<NodeId, Long> next = new HashMap<>(counters);
    next.merge(node, 1L, Long::sum);
    return new VectorClock(next);
  }

  /**
   * Returns the pointwise maximum of this clock and the given one.
   *
   * @param other the clock to merge with, never null
   * @return the merged clock, never null
   */
  public VectorClock merge(final VectorClock other) {
    Objects.requireNonNull(other, "other must not be null");
    final Map<NodeId, Long> next = new HashMap<>(counters);
    other.counters.forEach((node, counter) -> next.merge(node, counter,
        Math::max));
    return new VectorClock(next);
  }

  /**
   * Returns the counter recorded for the given node.
   *
   * @param node the node to look up, never null
   * @return the counter, zero if the node was never incremented
   */
  public long get(final NodeId node) {
    Objects.requireNonNull(node, "node must not be null");
    return counters.getOrDefault(node, 0L);
  }

  /**
   * Compares this clock against the given one under the vector clock
   * partial order.
   *
   * @param other the clock to compare with, never null
   * @return the causal relation of this clock to the other, never null
   */
  public CausalOrder compare(final VectorClock other) {
    Objects.requireNonNull(other, "other must not be null");

    boolean greater = false;
    boolean lower = false;

    final Set<NodeId> nodes = new HashSet<>(counters.keySet());
    nodes.addAll(other.counters.keySet());

    for (final NodeId node : nodes) {
      final long mine = get(node);
      final long theirs = other.get(node);
      if (mine > theirs) {
        greater = true;
      } else if (mine < theirs) {
        lower = true;
      }
      if (greater && lower) {
        return CausalOrder.CONCURRENT;
      }
    }

    if (greater) {
      return CausalOrder.AFTER;
    }
    return lower ? CausalOrder.BEFORE : CausalOrder.EQUAL;
  }

  /**
   * Checks whether this clock causally precedes the given one.
   *
   * @param other the clock to compare with, never null
   * @return true if this clock happened before the other one
   */
  public boolean happenedBefore(final VectorClock other) {
    return compare(other) == CausalOrder.BEFORE;
  }

  /**
   * Returns the non-zero counters of this clock.
   *
   * @return an unmodifiable view of the counters, never null
   */
  public Map<NodeId, Long> entries() {
    return counters;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof VectorClock that)) {
      return false;
    }
    return counters.equals(that.counters);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return counters.hashCode();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    final Map<String, Long> sorted = new TreeMap<>();
    counters.forEach((node, counter) -> sorted.put(node.value(), counter));
    return sorted.toString();
  }
}
