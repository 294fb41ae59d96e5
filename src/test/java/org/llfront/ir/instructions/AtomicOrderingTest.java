package org.llfront.ir.instructions;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the partial order over atomic orderings.
 */
public class AtomicOrderingTest {

    @Test
    @Tag("unit")
    void testChainBelowAcquireAndRelease() {
        assertThat(AtomicOrdering.MONOTONIC.isStrongerThan(AtomicOrdering.UNORDERED)).isTrue();
        assertThat(AtomicOrdering.ACQUIRE.isStrongerThan(AtomicOrdering.MONOTONIC)).isTrue();
        assertThat(AtomicOrdering.ACQUIRE_RELEASE.isStrongerThan(AtomicOrdering.RELEASE)).isTrue();
        assertThat(AtomicOrdering.SEQUENTIALLY_CONSISTENT.isAtLeast(AtomicOrdering.ACQUIRE_RELEASE)).isTrue();
        assertThat(AtomicOrdering.UNORDERED.isStrongerThan(AtomicOrdering.UNORDERED)).isFalse();
        assertThat(AtomicOrdering.UNORDERED.isAtLeast(AtomicOrdering.UNORDERED)).isTrue();
    }

    /**
     * Acquire and release sit side by side in the lattice: neither is at least the other.
     */
    @Test
    @Tag("unit")
    void testAcquireAndReleaseAreIncomparable() {
        assertThat(AtomicOrdering.ACQUIRE.isStrongerThan(AtomicOrdering.RELEASE)).isFalse();
        assertThat(AtomicOrdering.RELEASE.isAtLeast(AtomicOrdering.ACQUIRE)).isFalse();
        assertThat(AtomicOrdering.ACQUIRE.isComparableTo(AtomicOrdering.RELEASE)).isFalse();
        assertThat(AtomicOrdering.ACQUIRE.isComparableTo(AtomicOrdering.SEQUENTIALLY_CONSISTENT)).isTrue();
    }

    @Test
    @Tag("unit")
    void testKeywords() {
        assertThat(AtomicOrdering.fromKeyword("acq_rel")).contains(AtomicOrdering.ACQUIRE_RELEASE);
        assertThat(AtomicOrdering.fromKeyword("relaxed")).isEmpty();
        assertThat(AtomicOrdering.SEQUENTIALLY_CONSISTENT.keyword()).isEqualTo("seq_cst");
    }
}
