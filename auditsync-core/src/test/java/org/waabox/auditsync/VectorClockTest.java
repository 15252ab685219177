package org.waabox.auditsync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link VectorClock}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class VectorClockTest {

  private static final NodeId A = NodeId.of("a");
  private static final NodeId B = NodeId.of("b");
  private static final NodeId C = NodeId.of("c");

  @Test
  void whenCreatingEmpty_shouldReadZeroForEveryNode() {
    final VectorClock clock = VectorClock.empty();

    assertEquals(0L, clock.get(A));
    assertTrue(clock.entries().isEmpty());
  }

  @Test
  void whenIncrementing_givenAbsentNode_shouldStartAtOne() {
    final VectorClock clock = VectorClock.empty().increment(A);

    assertEquals(1L, clock.get(A));
    assertEquals(0L, clock.get(B));
  }

  @Test
  void whenIncrementing_shouldNotModifyReceiver() {
    final VectorClock original = VectorClock.empty().increment(A);
    final VectorClock next = original.increment(A);

    assertEquals(1L, original.get(A));
    assertEquals(2L, next.get(A));
  }

  @Test
  void whenIncrementingRepeatedly_shouldBeStrictlyMonotonic() {
    VectorClock clock = VectorClock.empty();
    long previous = clock.get(A);
    for (int i = 0; i < 50; i++) {
      clock = clock.increment(A);
      assertEquals(previous + 1, clock.get(A));
      previous = clock.get(A);
    }
  }

  @Test
  void whenMerging_shouldTakePointwiseMaximum() {
    final VectorClock left = VectorClock.of(Map.of(A, 3L, B, 1L));
    final VectorClock right = VectorClock.of(Map.of(B, 4L, C, 2L));

    final VectorClock merged = left.merge(right);

    assertEquals(3L, merged.get(A));
    assertEquals(4L, merged.get(B));
    assertEquals(2L, merged.get(C));
    assertEquals(merged, right.merge(left));
  }

  @Test
  void whenMerging_givenOlderClock_shouldNotDecreaseCounters() {
    final VectorClock newer = VectorClock.of(Map.of(A, 5L));
    final VectorClock older = VectorClock.of(Map.of(A, 2L));

    assertEquals(5L, newer.merge(older).get(A));
  }

  @Test
  void whenComparing_givenExplicitZero_shouldEqualMissingEntry() {
    final VectorClock withZero = VectorClock.of(Map.of(A, 1L, B, 0L));
    final VectorClock without = VectorClock.of(Map.of(A, 1L));

    assertEquals(without, withZero);
    assertEquals(without.hashCode(), withZero.hashCode());
    assertEquals(CausalOrder.EQUAL, withZero.compare(without));
  }

  @Test
  void whenComparing_givenDominatedClock_shouldReportOrder() {
    final VectorClock before = VectorClock.of(Map.of(A, 1L));
    final VectorClock after = before.increment(B);

    assertEquals(CausalOrder.BEFORE, before.compare(after));
    assertEquals(CausalOrder.AFTER, after.compare(before));
    assertTrue(before.happenedBefore(after));
    assertFalse(after.happenedBefore(before));
  }

  @Test
  void whenComparing_givenIndependentIncrements_shouldBeConcurrent() {
    final VectorClock base = VectorClock.empty().increment(A);

    final VectorClock left = base.increment(A);
    final VectorClock right = base.increment(B);

    assertEquals(CausalOrder.CONCURRENT, left.compare(right));
    assertFalse(left.happenedBefore(right));
  }

  @Test
  void whenCreating_givenNegativeCounter_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        VectorClock.of(Map.of(A, -1L))
    );
  }
}
