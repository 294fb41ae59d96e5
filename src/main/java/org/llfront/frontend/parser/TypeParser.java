package org.llfront.frontend.parser;

import org.llfront.api.IrErrorCode;
import org.llfront.api.IrException;
import org.llfront.api.SyntaxErrorException;
import org.llfront.api.UnsupportedConstructException;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.ir.types.AddressSpace;
import org.llfront.ir.types.FloatingPointKind;
import org.llfront.ir.types.TargetExtensionParameter;
import org.llfront.ir.types.Type;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses the type grammar.
 * <p>
 * A function type is written as its return type followed by a parenthesized parameter list,
 * so every type may be followed by any number of such suffixes: {@code i32 (i32) (ptr)} is a
 * function returning a function.
 */
final class TypeParser {

    private static final Pattern INTEGER_TYPE = Pattern.compile("i[0-9]+");

    private final ParsingContext context;
    private final NestingGuard nesting;

    TypeParser(ParsingContext context, NestingGuard nesting) {
        this.context = context;
        this.nesting = nesting;
    }

    Type parseType() throws IrException {
        Token first = context.peek();
        Type type = parseNonFunctionType();
        while (context.check(TokenType.LEFT_PAREN)) {
            type = parseFunctionSuffix(type);
        }
        if (context.check(TokenType.STAR)) {
            throw new UnsupportedConstructException("typed pointer", first.sourceInfo());
        }
        return type;
    }

    private Type parseFunctionSuffix(Type returnType) throws IrException {
        Token open = context.consume(TokenType.LEFT_PAREN, "'('");
        nesting.enter(open);
        List<Type> parameters = new ArrayList<>();
        boolean hasVarargs = false;
        if (!context.check(TokenType.RIGHT_PAREN)) {
            do {
                if (context.match(TokenType.ELLIPSIS)) {
                    hasVarargs = true;
                    break;
                }
                parameters.add(parseType());
            } while (context.match(TokenType.COMMA));
        }
        context.consume(TokenType.RIGHT_PAREN, "')'");
        nesting.exit();
        return new Type.Function(returnType, parameters, hasVarargs);
    }

    private Type parseNonFunctionType() throws IrException {
        Token token = context.peek();
        switch (token.type()) {
            case WORD:
                return parseKeywordType();
            case LEFT_BRACKET:
                return parseArray();
            case LEFT_BRACE:
                return parseStructure(false);
            case LESS:
                if (context.checkNext(TokenType.LEFT_BRACE)) {
                    Token open = context.advance();
                    Type structure = parseStructure(true);
                    context.consume(TokenType.GREATER, "'>' closing packed structure opened at " + open.sourceInfo());
                    return structure;
                }
                return parseVector();
            case LOCAL_ID:
                throw new UnsupportedConstructException("named type reference " + token.text(), token.sourceInfo());
            default:
                throw context.unexpected("a type");
        }
    }

    private Type parseKeywordType() throws IrException {
        Token token = context.advance();
        String keyword = token.text();
        if (INTEGER_TYPE.matcher(keyword).matches()) {
            BigInteger width = new BigInteger(keyword.substring(1));
            if (width.signum() == 0 || width.compareTo(BigInteger.valueOf(Type.MAX_INTEGER_BIT_WIDTH)) > 0) {
                throw invalidType("an integer width between 1 and " + Type.MAX_INTEGER_BIT_WIDTH, token);
            }
            return new Type.Integer(width.intValue());
        }
        Optional<FloatingPointKind> floatingPoint = FloatingPointKind.fromKeyword(keyword);
        if (floatingPoint.isPresent()) {
            return new Type.FloatingPoint(floatingPoint.get());
        }
        switch (keyword) {
            case "void": return new Type.Void();
            case "x86_amx": return new Type.Amx();
            case "x86_mmx": return new Type.Mmx();
            case "label": return new Type.Label();
            case "token": return new Type.Token();
            case "metadata": return new Type.Metadata();
            case "opaque": return new Type.OpaqueStructure();
            case "ptr":
                if (context.checkWord("addrspace")) {
                    return new Type.Pointer(context.parseAddressSpace());
                }
                return new Type.Pointer(AddressSpace.DEFAULT);
            case "target":
                return parseTargetExtension();
            default:
                throw new SyntaxErrorException(IrErrorCode.UNEXPECTED_TOKEN, "a type", keyword, token.sourceInfo());
        }
    }

    private Type parseTargetExtension() throws IrException {
        Token open = context.consume(TokenType.LEFT_PAREN, "'(' after 'target'");
        nesting.enter(open);
        String name = (String) context.consume(TokenType.STRING, "a target extension name").value();
        List<TargetExtensionParameter> parameters = new ArrayList<>();
        while (context.match(TokenType.COMMA)) {
            if (context.check(TokenType.INTEGER)) {
                Token integer = context.advance();
                BigInteger value = (BigInteger) integer.value();
                if (value.signum() < 0 || value.bitLength() > 63) {
                    throw invalidType("a non-negative target extension parameter", integer);
                }
                parameters.add(new TargetExtensionParameter.OfInteger(value.longValue()));
            } else {
                parameters.add(new TargetExtensionParameter.OfType(parseType()));
            }
        }
        context.consume(TokenType.RIGHT_PAREN, "')'");
        nesting.exit();
        return new Type.TargetExtension(name, parameters);
    }

    private Type parseArray() throws IrException {
        Token open = context.consume(TokenType.LEFT_BRACKET, "'['");
        nesting.enter(open);
        Token lengthToken = context.peek();
        long length = parseLength();
        context.consumeWord("x");
        Type elementType = parseType();
        context.consume(TokenType.RIGHT_BRACKET, "']'");
        nesting.exit();
        try {
            return new Type.Array(length, elementType);
        } catch (IllegalArgumentException e) {
            throw new SyntaxErrorException(IrErrorCode.INVALID_TYPE, e.getMessage(), lengthToken.text(), lengthToken.sourceInfo(), e);
        }
    }

    private Type parseVector() throws IrException {
        Token open = context.consume(TokenType.LESS, "'<'");
        nesting.enter(open);
        boolean isScalable = false;
        if (context.matchWord("vscale")) {
            context.consumeWord("x");
            isScalable = true;
        }
        long length = parseLength();
        context.consumeWord("x");
        Token elementToken = context.peek();
        Type elementType = parseType();
        context.consume(TokenType.GREATER, "'>'");
        nesting.exit();
        try {
            return new Type.Vector(length, elementType, isScalable);
        } catch (IllegalArgumentException e) {
            throw new SyntaxErrorException(IrErrorCode.INVALID_TYPE, e.getMessage(), elementToken.text(), elementToken.sourceInfo(), e);
        }
    }

    private Type parseStructure(boolean isPacked) throws IrException {
        Token open = context.consume(TokenType.LEFT_BRACE, "'{'");
        nesting.enter(open);
        List<Type> types = new ArrayList<>();
        if (!context.check(TokenType.RIGHT_BRACE)) {
            do {
                types.add(parseType());
            } while (context.match(TokenType.COMMA));
        }
        context.consume(TokenType.RIGHT_BRACE, "'}'");
        nesting.exit();
        return new Type.Structure(types, isPacked);
    }

    private long parseLength() throws SyntaxErrorException {
        Token token = context.consume(TokenType.INTEGER, "an element count");
        BigInteger value = (BigInteger) token.value();
        if (value.signum() <= 0 || value.bitLength() > 63) {
            throw invalidType("a positive element count", token);
        }
        return value.longValue();
    }

    private static SyntaxErrorException invalidType(String expected, Token token) {
        return new SyntaxErrorException(IrErrorCode.INVALID_TYPE, expected, token.text(), token.sourceInfo());
    }
}
