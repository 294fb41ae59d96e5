package org.llfront.frontend.parser.features.terminator;

import org.llfront.frontend.opcode.ITerminatorHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.Terminator;

/**
 * Handles {@code unreachable}.
 */
public final class UnreachableHandler implements ITerminatorHandler {

    @Override
    public Terminator parse(ParsingContext context) {
        context.advance(); // consume 'unreachable'
        return new Terminator.Unreachable();
    }
}
