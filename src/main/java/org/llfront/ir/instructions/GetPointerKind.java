package org.llfront.ir.instructions;

/**
 * How a {@code getelementptr} constrains its result.
 */
public sealed interface GetPointerKind {

    /** No constraint. */
    GetPointerKind REGULAR = new Regular();

    /** No constraint. */
    record Regular() implements GetPointerKind {}

    /** {@code inbounds}: the result stays within the allocated object. */
    record InBounds() implements GetPointerKind {}

    /**
     * {@code inrange(low, high)}: a byte range hint. No relation between the bounds is enforced.
     * @param low The low bound.
     * @param high The high bound.
     */
    record InRange(long low, long high) implements GetPointerKind {}
}
