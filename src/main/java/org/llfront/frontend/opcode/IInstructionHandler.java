package org.llfront.frontend.opcode;

import org.llfront.api.IrException;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.Instruction;

/**
 * The base interface for the handlers of non-terminating instructions.
 * Each handler is responsible for the syntax of one opcode or a family of opcodes.
 */
public interface IInstructionHandler {

    /**
     * Parses an instruction. The current token of the context is the opcode
     * (or the tail call marker preceding {@code call}).
     *
     * @param context The context that provides access to the token stream and the shared grammar.
     * @return The parsed instruction.
     * @throws IrException if the text does not form a valid instruction.
     */
    Instruction parse(ParsingContext context) throws IrException;
}
