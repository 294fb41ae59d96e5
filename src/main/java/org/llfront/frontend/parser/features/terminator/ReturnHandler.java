package org.llfront.frontend.parser.features.terminator;

import org.llfront.api.IrException;
import org.llfront.frontend.opcode.ITerminatorHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.Terminator;
import org.llfront.ir.types.Type;

/**
 * Handles {@code ret void} and {@code ret <type> <value>}.
 */
public final class ReturnHandler implements ITerminatorHandler {

    @Override
    public Terminator parse(ParsingContext context) throws IrException {
        context.advance(); // consume 'ret'
        Type type = context.parseType();
        if (type instanceof Type.Void) {
            return Terminator.Return.ofVoid();
        }
        return new Terminator.Return(context.parseValue(type));
    }
}
