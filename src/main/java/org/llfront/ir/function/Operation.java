package org.llfront.ir.function;

import org.llfront.ir.instructions.Instruction;

import java.util.Objects;

/**
 * One step of a basic block: an instruction whose result is bound to a local name, or an
 * instruction executed only for its effect.
 */
public sealed interface Operation {

    Instruction instruction();

    /**
     * {@code %identifier = instruction}
     * @param identifier The sigil-qualified local name the result is bound to, e.g. {@code %x} or {@code %3}.
     * @param instruction The instruction.
     */
    record Assignment(String identifier, Instruction instruction) implements Operation {
        public Assignment {
            Objects.requireNonNull(identifier, "identifier");
            Objects.requireNonNull(instruction, "instruction");
            if (identifier.length() < 2 || identifier.charAt(0) != '%') {
                throw new IllegalArgumentException("Assignment target must be a local name: " + identifier);
            }
        }
    }

    /**
     * An instruction without a binding, e.g. a {@code store} or a call whose result is dropped.
     * @param instruction The instruction.
     */
    record Standalone(Instruction instruction) implements Operation {
        public Standalone {
            Objects.requireNonNull(instruction, "instruction");
        }
    }
}
