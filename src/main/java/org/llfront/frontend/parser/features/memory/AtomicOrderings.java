package org.llfront.frontend.parser.features.memory;

import org.llfront.api.IrErrorCode;
import org.llfront.api.SyntaxErrorException;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.AtomicOrdering;

import java.util.Set;

/**
 * Parses an ordering and rejects the ones an instruction does not allow.
 */
final class AtomicOrderings {

    private AtomicOrderings() {}

    static AtomicOrdering parseAllowed(ParsingContext context, Set<AtomicOrdering> allowed, String instruction)
            throws SyntaxErrorException {
        Token token = context.peek();
        AtomicOrdering ordering = context.parseOrdering();
        if (!allowed.contains(ordering)) {
            throw new SyntaxErrorException(IrErrorCode.UNEXPECTED_TOKEN,
                    "an ordering valid for " + instruction, token.text(), token.sourceInfo());
        }
        return ordering;
    }
}
