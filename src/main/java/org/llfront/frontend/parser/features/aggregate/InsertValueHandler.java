package org.llfront.frontend.parser.features.aggregate;

import org.llfront.api.IrException;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.values.Value;

import java.util.List;

/**
 * Handles {@code insertvalue <aggregate type> <value>, <element type> <element>, <idx> (, <idx>)*}.
 */
public final class InsertValueHandler implements IInstructionHandler {

    @Override
    public Instruction parse(ParsingContext context) throws IrException {
        Token opcode = context.advance();
        Value aggregate = context.parseTypedValue();
        context.consume(TokenType.COMMA, "',' before the inserted element");
        Value element = context.parseTypedValue();
        List<Long> indices = AggregateIndices.parse(context);
        try {
            return new Instruction.InsertValue(aggregate, element, indices);
        } catch (IllegalArgumentException e) {
            throw AggregateIndices.invalidPath(opcode, e);
        }
    }
}
