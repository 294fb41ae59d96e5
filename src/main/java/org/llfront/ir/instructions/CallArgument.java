package org.llfront.ir.instructions;

import org.llfront.ir.types.ParameterAttribute;
import org.llfront.ir.values.Value;

import java.util.List;
import java.util.Objects;

/**
 * One argument of a call site together with the attributes written before it.
 *
 * @param value The argument value.
 * @param attributes The parameter attributes, in order.
 */
public record CallArgument(Value value, List<ParameterAttribute> attributes) {

    public CallArgument {
        Objects.requireNonNull(value, "value");
        attributes = List.copyOf(attributes);
    }

    /**
     * @param value The argument value.
     * @return An argument without attributes.
     */
    public static CallArgument of(Value value) {
        return new CallArgument(value, List.of());
    }
}
