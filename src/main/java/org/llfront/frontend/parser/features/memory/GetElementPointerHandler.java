package org.llfront.frontend.parser.features.memory;

import org.llfront.api.IrErrorCode;
import org.llfront.api.IrException;
import org.llfront.api.SyntaxErrorException;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.GetPointerKind;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Value;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Handles {@code getelementptr [inbounds] [inrange(<lo>, <hi>)] <ty>, <ptr type> <base> (, <ty> <idx>)*}.
 * <p>
 * When both markers are written the result kind is {@link GetPointerKind.InRange}.
 */
public final class GetElementPointerHandler implements IInstructionHandler {

    @Override
    public Instruction parse(ParsingContext context) throws IrException {
        context.advance(); // consume 'getelementptr'
        GetPointerKind kind = GetPointerKind.REGULAR;
        if (context.matchWord("inbounds")) {
            kind = new GetPointerKind.InBounds();
        }
        if (context.matchWord("inrange")) {
            kind = parseRange(context);
        }

        Type sourceElementType = context.parseType();
        context.consume(TokenType.COMMA, "',' after the source element type");
        Value pointer = context.parseTypedValue();
        List<Value> indices = new ArrayList<>();
        while (context.check(TokenType.COMMA) && !context.checkNext(TokenType.METADATA)) {
            context.advance(); // consume ','
            indices.add(context.parseTypedValue());
        }
        return new Instruction.GetElementPointer(kind, sourceElementType, pointer, indices);
    }

    private static GetPointerKind parseRange(ParsingContext context) throws SyntaxErrorException {
        context.consume(TokenType.LEFT_PAREN, "'(' after 'inrange'");
        Token low = context.consume(TokenType.INTEGER, "the lower bound of the range");
        context.consume(TokenType.COMMA, "','");
        Token high = context.consume(TokenType.INTEGER, "the upper bound of the range");
        context.consume(TokenType.RIGHT_PAREN, "')'");
        return new GetPointerKind.InRange(toLong(low), toLong(high));
    }

    private static long toLong(Token token) throws SyntaxErrorException {
        BigInteger value = (BigInteger) token.value();
        if (value.bitLength() > 63) {
            throw new SyntaxErrorException(IrErrorCode.INVALID_NUMBER, "a 64-bit offset", token.text(), token.sourceInfo());
        }
        return value.longValue();
    }
}
