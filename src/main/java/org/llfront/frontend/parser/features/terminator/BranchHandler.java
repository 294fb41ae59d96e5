package org.llfront.frontend.parser.features.terminator;

import org.llfront.api.IrException;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.opcode.ITerminatorHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.Terminator;
import org.llfront.ir.values.Value;

/**
 * Handles the unconditional {@code br label <dest>} and the conditional
 * {@code br i1 <cond>, label <iftrue>, label <iffalse>}.
 */
public final class BranchHandler implements ITerminatorHandler {

    @Override
    public Terminator parse(ParsingContext context) throws IrException {
        context.advance(); // consume 'br'
        if (context.checkWord("label")) {
            return new Terminator.Branch(context.parseLabel());
        }
        Value condition = context.parseTypedValue();
        context.consume(TokenType.COMMA, "',' after the branch condition");
        Value ifTrue = context.parseLabel();
        context.consume(TokenType.COMMA, "',' between the branch destinations");
        Value ifFalse = context.parseLabel();
        return new Terminator.ConditionalBranch(condition, ifTrue, ifFalse);
    }
}
