package org.llfront.ir.function;

import org.llfront.ir.types.ParameterAttribute;
import org.llfront.ir.types.Type;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A formal parameter of a function definition.
 *
 * @param type The parameter type.
 * @param attributes The parameter attributes.
 * @param name The sigil-qualified name as written, e.g. {@code %argc}, or empty for an unnamed parameter.
 */
public record FunctionParameter(Type type, List<ParameterAttribute> attributes, Optional<String> name) {
    public FunctionParameter {
        Objects.requireNonNull(type, "type");
        attributes = List.copyOf(attributes);
        Objects.requireNonNull(name, "name");
    }
}
