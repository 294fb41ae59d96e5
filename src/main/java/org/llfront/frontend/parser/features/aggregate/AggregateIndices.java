package org.llfront.frontend.parser.features.aggregate;

import org.llfront.api.IrErrorCode;
import org.llfront.api.SyntaxErrorException;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.parser.ParsingContext;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the constant index list of {@code extractvalue} and {@code insertvalue}.
 */
final class AggregateIndices {

    private AggregateIndices() {}

    /**
     * Parses {@code , idx (, idx)*}. At least one index is required.
     */
    static List<Long> parse(ParsingContext context) throws SyntaxErrorException {
        List<Long> indices = new ArrayList<>();
        do {
            context.consume(TokenType.COMMA, "',' before an index");
            Token token = context.consume(TokenType.INTEGER, "a constant index");
            BigInteger index = (BigInteger) token.value();
            if (index.signum() < 0 || index.bitLength() > 32) {
                throw new SyntaxErrorException(IrErrorCode.INVALID_INDICES, "an unsigned 32-bit index",
                        token.text(), token.sourceInfo());
            }
            indices.add(index.longValue());
        } while (context.check(TokenType.COMMA) && context.checkNext(TokenType.INTEGER));
        return indices;
    }

    static SyntaxErrorException invalidPath(Token at, IllegalArgumentException cause) {
        return new SyntaxErrorException(IrErrorCode.INVALID_INDICES, cause.getMessage(), at.text(), at.sourceInfo(), cause);
    }
}
