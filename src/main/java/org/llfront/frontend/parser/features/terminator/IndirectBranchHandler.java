package org.llfront.frontend.parser.features.terminator;

import org.llfront.api.IrException;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.opcode.ITerminatorHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.Terminator;
import org.llfront.ir.values.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles {@code indirectbr ptr <address>, [ label <dest1>, label <dest2>, ... ]}.
 */
public final class IndirectBranchHandler implements ITerminatorHandler {

    @Override
    public Terminator parse(ParsingContext context) throws IrException {
        context.advance(); // consume 'indirectbr'
        Value address = context.parseTypedValue();
        context.consume(TokenType.COMMA, "',' before the destination list");
        context.consume(TokenType.LEFT_BRACKET, "'[' opening the destination list");
        List<Value> destinations = new ArrayList<>();
        if (!context.check(TokenType.RIGHT_BRACKET)) {
            do {
                destinations.add(context.parseLabel());
            } while (context.match(TokenType.COMMA));
        }
        context.consume(TokenType.RIGHT_BRACKET, "']' closing the destination list");
        return new Terminator.IndirectBranch(address, destinations);
    }
}
