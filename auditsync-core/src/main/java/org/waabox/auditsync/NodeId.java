package org.waabox.auditsync;

import java.util.Objects;

/**
 * Identifies a single participant in the audit log replication cluster.
 *
 * <p>A node id is an opaque value compared by value. It is used as the key
 * for per-peer synchronization state and must never be shared by two
 * distinct node instances.
 *
 * @param value the textual identity of the node, never null nor blank
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record NodeId(String value) {

  /**
   * Creates a new node id.
   *
   * @param value the textual identity of the node, never null nor blank
   *
   * @throws NullPointerException     if value is null
   * @throws IllegalArgumentException if value is blank
   */
  public NodeId {
    Objects.requireNonNull(value, "value must not be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException("value must not be blank");
    }
  }

  /**
   * Creates a node id from the given string.
   *
   * @param value the textual identity of the node, never null nor blank
   * @return a new node id, never null
   */
  public static NodeId of(final String value) {
    return new NodeId(value);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return value;
  }
}
