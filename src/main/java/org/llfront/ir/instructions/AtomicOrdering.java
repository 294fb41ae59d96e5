package org.llfront.ir.instructions;

import java.util.Optional;

/**
 * The memory-visibility contract of an atomic operation.
 * <p>
 * Orderings form a lattice rather than a chain: {@code unordered < monotonic < acquire, release < acq_rel < seq_cst},
 * where {@link #ACQUIRE} and {@link #RELEASE} are incomparable.
 */
public enum AtomicOrdering {
    UNORDERED("unordered", 0),
    MONOTONIC("monotonic", 1),
    ACQUIRE("acquire", 2),
    RELEASE("release", 2),
    ACQUIRE_RELEASE("acq_rel", 3),
    SEQUENTIALLY_CONSISTENT("seq_cst", 4);

    private final String keyword;
    private final int rank;

    AtomicOrdering(String keyword, int rank) {
        this.keyword = keyword;
        this.rank = rank;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * @param other The ordering to compare with.
     * @return {@code true} if this ordering is strictly stronger than {@code other}.
     */
    public boolean isStrongerThan(AtomicOrdering other) {
        return rank > other.rank;
    }

    /**
     * @param other The ordering to compare with.
     * @return {@code true} if this ordering is equal to or stronger than {@code other}.
     */
    public boolean isAtLeast(AtomicOrdering other) {
        return this == other || isStrongerThan(other);
    }

    /**
     * @param other The ordering to compare with.
     * @return {@code false} only for the pair {@link #ACQUIRE} and {@link #RELEASE}.
     */
    public boolean isComparableTo(AtomicOrdering other) {
        return isAtLeast(other) || other.isAtLeast(this);
    }

    /**
     * @param keyword The ordering keyword, e.g. {@code seq_cst}.
     * @return The ordering, or empty if the keyword names none.
     */
    public static Optional<AtomicOrdering> fromKeyword(String keyword) {
        for (AtomicOrdering ordering : values()) {
            if (ordering.keyword.equals(keyword)) {
                return Optional.of(ordering);
            }
        }
        return Optional.empty();
    }
}
