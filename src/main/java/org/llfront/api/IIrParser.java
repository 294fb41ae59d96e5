package org.llfront.api;

import org.llfront.ir.function.BasicBlock;
import org.llfront.ir.function.Function;
import org.llfront.ir.types.Type;

/**
 * Defines the public interface for reading textual IR. Each entry point reads one complete
 * construct; input left over after the construct is an error.
 */
public interface IIrParser {

    /**
     * Parses a type, e.g. {@code [2 x { i32, ptr }]}.
     *
     * @param source The text of the type.
     * @return The type.
     * @throws IrException if the text is not exactly one valid type.
     */
    Type parseType(String source) throws IrException;

    /**
     * Parses a basic block: an optional label, operations and a terminator. Local names are
     * not resolved, since the block is read without its function.
     *
     * @param source The text of the block.
     * @return The block.
     * @throws IrException if the text is not exactly one valid block.
     */
    BasicBlock parseBasicBlock(String source) throws IrException;

    /**
     * Parses a function definition and resolves its local names.
     *
     * @param source The text of the definition, starting with {@code define}.
     * @return The function.
     * @throws IrException if the text is not exactly one valid function definition.
     */
    Function parseFunction(String source) throws IrException;
}
