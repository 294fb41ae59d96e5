package org.llfront.ir.instructions;

import org.llfront.ir.values.Value;

import java.util.Objects;

/**
 * One case of a {@code switch}.
 *
 * @param value The case value.
 * @param destination The label jumped to when the switch value equals {@code value}.
 */
public record SwitchCase(Value value, Value destination) {

    public SwitchCase {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(destination, "destination");
    }
}
