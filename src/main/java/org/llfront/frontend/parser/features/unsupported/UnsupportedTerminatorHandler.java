package org.llfront.frontend.parser.features.unsupported;

import org.llfront.api.UnsupportedConstructException;
import org.llfront.frontend.opcode.ITerminatorHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.Terminator;

import java.util.List;

/**
 * Rejects the exception handling terminators. The model can represent them, but
 * their operands (landing pads, funclet tokens) cannot be parsed yet.
 */
public final class UnsupportedTerminatorHandler implements ITerminatorHandler {

    public static final List<String> OPCODES = List.of(
            "invoke", "callbr", "resume", "catchswitch", "catchret", "cleanupret");

    @Override
    public Terminator parse(ParsingContext context) throws UnsupportedConstructException {
        throw UnsupportedOpcodeHandler.unsupported(context.peek());
    }
}
