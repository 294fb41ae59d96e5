package org.llfront.ir.types;

import java.util.List;
import java.util.Optional;

/**
 * Navigation into structure and array types by constant index paths,
 * as used by {@code extractvalue} and {@code insertvalue}.
 */
public final class AggregateTypes {

    private AggregateTypes() {}

    /**
     * Follows an index path into an aggregate type.
     *
     * @param aggregate The outermost type.
     * @param indices The index path; must not be empty.
     * @return The type found at the end of the path, or empty if the path leaves the aggregate
     *         (a non-aggregate is indexed, or an index is out of range).
     */
    public static Optional<Type> typeAt(Type aggregate, List<Long> indices) {
        if (indices.isEmpty()) {
            return Optional.empty();
        }
        Type current = aggregate;
        for (long index : indices) {
            if (index < 0) {
                return Optional.empty();
            }
            if (current instanceof Type.Structure structure) {
                if (index >= structure.types().size()) {
                    return Optional.empty();
                }
                current = structure.types().get((int) index);
            } else if (current instanceof Type.Array array) {
                if (index >= array.length()) {
                    return Optional.empty();
                }
                current = array.elementType();
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }
}
