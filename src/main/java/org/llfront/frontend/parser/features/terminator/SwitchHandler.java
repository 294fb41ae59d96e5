package org.llfront.frontend.parser.features.terminator;

import org.llfront.api.IrException;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.opcode.ITerminatorHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.SwitchCase;
import org.llfront.ir.instructions.Terminator;
import org.llfront.ir.values.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles {@code switch <intty> <value>, label <default> [ <intty> <val>, label <dest> ... ]}.
 * The cases inside the brackets are not separated by commas.
 */
public final class SwitchHandler implements ITerminatorHandler {

    @Override
    public Terminator parse(ParsingContext context) throws IrException {
        context.advance(); // consume 'switch'
        Value value = context.parseTypedValue();
        context.consume(TokenType.COMMA, "',' before the default destination");
        Value defaultDestination = context.parseLabel();
        context.consume(TokenType.LEFT_BRACKET, "'[' opening the case list");
        List<SwitchCase> cases = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACKET)) {
            if (context.isAtEnd()) {
                throw context.unexpected("']' closing the case list");
            }
            Value caseValue = context.parseTypedValue();
            context.consume(TokenType.COMMA, "',' before the case destination");
            cases.add(new SwitchCase(caseValue, context.parseLabel()));
        }
        context.advance(); // consume ']'
        return new Terminator.Switch(value, defaultDestination, cases);
    }
}
