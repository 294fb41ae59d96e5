package org.llfront.frontend.parser.features.comparison;

import org.llfront.api.IrErrorCode;
import org.llfront.api.IrException;
import org.llfront.api.SyntaxErrorException;
import org.llfront.api.UnsupportedConstructException;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.instructions.IntegerComparison;
import org.llfront.ir.values.Value;

import java.util.Optional;

/**
 * Handles {@code icmp <cond> <ty> <op1>, <op2>}.
 */
public final class CompareIntegersHandler implements IInstructionHandler {

    @Override
    public Instruction parse(ParsingContext context) throws IrException {
        context.advance(); // consume 'icmp'
        Token conditionToken = context.peek();
        if (conditionToken.isWord("samesign")) {
            throw new UnsupportedConstructException("'samesign' flag", conditionToken.sourceInfo());
        }
        Optional<IntegerComparison> comparison = conditionToken.type() == TokenType.WORD
                ? IntegerComparison.fromKeyword(conditionToken.text())
                : Optional.empty();
        if (comparison.isEmpty()) {
            throw new SyntaxErrorException(IrErrorCode.UNEXPECTED_TOKEN, "an integer comparison predicate",
                    conditionToken.text(), conditionToken.sourceInfo());
        }
        context.advance();
        Value leftHandSide = context.parseTypedValue();
        context.consume(TokenType.COMMA, "',' between operands");
        Value rightHandSide = context.parseValue(leftHandSide.type());
        return new Instruction.CompareIntegers(comparison.get(), leftHandSide, rightHandSide);
    }
}
