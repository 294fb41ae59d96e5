package org.llfront.frontend.parser;

import org.llfront.api.IrErrorCode;
import org.llfront.api.SyntaxErrorException;
import org.llfront.frontend.lexer.Token;

/**
 * Bounds the nesting depth of recursive type and constant syntax, so that pathological
 * input fails with a syntax error instead of exhausting the stack.
 */
final class NestingGuard {

    private final int maxDepth;
    private int depth;

    NestingGuard(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Enters one nesting level.
     * @param opening The token opening the nested construct.
     * @throws SyntaxErrorException if the maximum depth is exceeded.
     */
    void enter(Token opening) throws SyntaxErrorException {
        if (depth >= maxDepth) {
            throw new SyntaxErrorException(IrErrorCode.NESTING_TOO_DEEP,
                    "Nesting deeper than " + maxDepth + " levels", opening.text(), opening.sourceInfo(), null);
        }
        depth++;
    }

    void exit() {
        depth--;
    }
}
