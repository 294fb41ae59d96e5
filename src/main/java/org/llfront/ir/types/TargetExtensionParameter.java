package org.llfront.ir.types;

import java.util.Objects;

/**
 * A parameter of a {@link Type.TargetExtension} type: either a type or a non-negative integer.
 */
public sealed interface TargetExtensionParameter permits TargetExtensionParameter.OfType, TargetExtensionParameter.OfInteger {

    /**
     * A type parameter.
     * @param type The parameter type.
     */
    record OfType(Type type) implements TargetExtensionParameter {
        public OfType {
            Objects.requireNonNull(type, "type");
        }
    }

    /**
     * An integer parameter.
     * @param value The parameter value.
     */
    record OfInteger(long value) implements TargetExtensionParameter {
        public OfInteger {
            if (value < 0) {
                throw new IllegalArgumentException("Target extension integer parameters must not be negative: " + value);
            }
        }
    }
}
