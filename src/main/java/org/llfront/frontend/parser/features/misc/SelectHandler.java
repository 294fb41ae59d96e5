package org.llfront.frontend.parser.features.misc;

import org.llfront.api.IrException;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.values.Value;

/**
 * Handles {@code select <selty> <cond>, <ty> <val1>, <ty> <val2>}.
 */
public final class SelectHandler implements IInstructionHandler {

    @Override
    public Instruction parse(ParsingContext context) throws IrException {
        context.advance(); // consume 'select'
        Value condition = context.parseTypedValue();
        context.consume(TokenType.COMMA, "',' after the condition");
        Value trueValue = context.parseTypedValue();
        context.consume(TokenType.COMMA, "',' between the selected values");
        Value falseValue = context.parseTypedValue();
        return new Instruction.Select(condition, trueValue, falseValue);
    }
}
