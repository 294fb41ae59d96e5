package org.llfront.ir.function;

import org.llfront.ir.instructions.Terminator;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A straight-line sequence of operations closed by exactly one terminator.
 *
 * @param name The label, without sigil or colon, if the block has one.
 * @param operations The operations in execution order.
 * @param terminator The terminator ending the block.
 */
public record BasicBlock(Optional<String> name, List<Operation> operations, Terminator terminator) {
    public BasicBlock {
        Objects.requireNonNull(name, "name");
        operations = List.copyOf(operations);
        Objects.requireNonNull(terminator, "terminator");
    }
}
