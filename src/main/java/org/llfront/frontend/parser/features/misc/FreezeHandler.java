package org.llfront.frontend.parser.features.misc;

import org.llfront.api.IrException;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.Instruction;

/**
 * Handles {@code freeze <ty> <val>}.
 */
public final class FreezeHandler implements IInstructionHandler {

    @Override
    public Instruction parse(ParsingContext context) throws IrException {
        context.advance(); // consume 'freeze'
        return new Instruction.Freeze(context.parseTypedValue());
    }
}
