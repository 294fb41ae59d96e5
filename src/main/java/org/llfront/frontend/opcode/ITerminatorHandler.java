package org.llfront.frontend.opcode;

import org.llfront.api.IrException;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.Terminator;

/**
 * The base interface for the handlers of block terminators.
 */
public interface ITerminatorHandler {

    /**
     * Parses a terminator. The current token of the context is the opcode.
     *
     * @param context The context that provides access to the token stream and the shared grammar.
     * @return The parsed terminator.
     * @throws IrException if the text does not form a valid terminator.
     */
    Terminator parse(ParsingContext context) throws IrException;
}
