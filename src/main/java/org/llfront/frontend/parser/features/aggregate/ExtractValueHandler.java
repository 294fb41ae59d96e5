package org.llfront.frontend.parser.features.aggregate;

import org.llfront.api.IrException;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.values.Value;

import java.util.List;

/**
 * Handles {@code extractvalue <aggregate type> <value>, <idx> (, <idx>)*}.
 */
public final class ExtractValueHandler implements IInstructionHandler {

    @Override
    public Instruction parse(ParsingContext context) throws IrException {
        Token opcode = context.advance();
        Value aggregate = context.parseTypedValue();
        List<Long> indices = AggregateIndices.parse(context);
        try {
            return new Instruction.ExtractValue(aggregate, indices);
        } catch (IllegalArgumentException e) {
            throw AggregateIndices.invalidPath(opcode, e);
        }
    }
}
