package org.llfront.frontend.parser;

import org.llfront.api.IrErrorCode;
import org.llfront.api.IrException;
import org.llfront.api.SyntaxErrorException;
import org.llfront.api.TypeMismatchException;
import org.llfront.api.UnsupportedConstructException;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.semantics.LocalReference;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Constant;
import org.llfront.ir.values.Value;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Parses operands: local and global names, literals and aggregate constants.
 * <p>
 * Constants are built through {@link Value#constant(Type, Constant)}; a literal that does not
 * fit its type is reported as a {@link TypeMismatchException} at the literal's position.
 * Every local name that is read is passed to the reference listener, so that it can be
 * resolved once the enclosing function is complete.
 */
final class ValueParser {

    private final ParsingContext context;
    private final NestingGuard nesting;
    private final Consumer<LocalReference> references;

    ValueParser(ParsingContext context, NestingGuard nesting, Consumer<LocalReference> references) {
        this.context = context;
        this.nesting = nesting;
        this.references = references;
    }

    Value parseValue(Type type) throws IrException {
        Token token = context.peek();
        switch (token.type()) {
            case LOCAL_ID:
                context.advance();
                if (type instanceof Type.Label) {
                    references.accept(new LocalReference(token.text(), true, token.sourceInfo()));
                    return new Value.FromLabel(token.text());
                }
                references.accept(new LocalReference(token.text(), false, token.sourceInfo()));
                return new Value.FromIdentifier(type, token.text());
            case GLOBAL_ID:
                context.advance();
                if (type instanceof Type.Pointer pointer) {
                    return new Value.FromGlobal(token.text(), pointer.addressSpace());
                }
                return new Value.FromIdentifier(type, token.text());
            case INTEGER:
                context.advance();
                return constant(type, new Constant.Integer((BigInteger) token.value()), token);
            case FLOAT:
                context.advance();
                return constant(type, new Constant.FloatingPoint(token.text()), token);
            case LEFT_BRACE:
                return parseAggregate(type, TokenType.RIGHT_BRACE, token);
            case LEFT_BRACKET:
                return parseAggregate(type, TokenType.RIGHT_BRACKET, token);
            case LESS:
                if (context.checkNext(TokenType.LEFT_BRACE)) {
                    context.advance();
                    Value structure = parseAggregate(type, TokenType.RIGHT_BRACE, token);
                    context.consume(TokenType.GREATER, "'>' closing packed structure constant");
                    return structure;
                }
                return parseAggregate(type, TokenType.GREATER, token);
            case METADATA:
                return parseMetadata(type);
            case WORD:
                return parseKeywordValue(type);
            default:
                throw context.unexpected("a value");
        }
    }

    Value parseTypedValue() throws IrException {
        Type type = context.parseType();
        return parseValue(type);
    }

    private Value parseKeywordValue(Type type) throws IrException {
        Token token = context.advance();
        switch (token.text()) {
            case "true": return constant(type, new Constant.Boolean(true), token);
            case "false": return constant(type, new Constant.Boolean(false), token);
            case "null": return constant(type, new Constant.NullPointer(), token);
            case "none": return constant(type, new Constant.NoneToken(), token);
            case "zeroinitializer": return constant(type, new Constant.Zero(), token);
            case "undef": return constant(type, new Constant.Undefined(), token);
            case "poison": return constant(type, new Constant.Poison(), token);
            case "c":
                if (context.check(TokenType.STRING)) {
                    throw new UnsupportedConstructException("character array constant", token.sourceInfo());
                }
                break;
            case "asm":
                throw new UnsupportedConstructException("inline assembly", token.sourceInfo());
            case "blockaddress":
            case "dso_local_equivalent":
            case "no_cfi":
                throw new UnsupportedConstructException(token.text() + " constant", token.sourceInfo());
            default:
                if (context.check(TokenType.LEFT_PAREN)) {
                    throw new UnsupportedConstructException("constant expression '" + token.text() + "'", token.sourceInfo());
                }
                break;
        }
        throw new SyntaxErrorException(IrErrorCode.UNEXPECTED_TOKEN, "a value", token.text(), token.sourceInfo());
    }

    private Value parseAggregate(Type type, TokenType closing, Token open) throws IrException {
        context.advance();
        nesting.enter(open);
        List<Value> elements = new ArrayList<>();
        if (!context.check(closing)) {
            do {
                elements.add(parseTypedValue());
            } while (context.match(TokenType.COMMA));
        }
        context.consume(closing, "'" + closingText(closing) + "'");
        nesting.exit();
        Constant constant;
        if (closing == TokenType.RIGHT_BRACE) {
            constant = new Constant.Structure(elements);
        } else if (closing == TokenType.RIGHT_BRACKET) {
            constant = new Constant.Array(elements);
        } else {
            constant = new Constant.Vector(elements);
        }
        return constant(type, constant, open);
    }

    private Value parseMetadata(Type type) throws IrException {
        Token token = context.advance();
        if (token.text().equals("!")) {
            if (!context.check(TokenType.LEFT_BRACE)) {
                throw new UnsupportedConstructException("metadata '" + context.peek().text() + "'", token.sourceInfo());
            }
            context.advance();
            if (!context.check(TokenType.RIGHT_BRACE)) {
                throw new UnsupportedConstructException("metadata node", token.sourceInfo());
            }
            context.advance();
        }
        return constant(type, new Constant.Metadata(), token);
    }

    private static Value constant(Type type, Constant constant, Token token) throws TypeMismatchException {
        try {
            return Value.constant(type, constant);
        } catch (TypeMismatchException e) {
            throw new TypeMismatchException(type, constant, token.sourceInfo());
        }
    }

    private static String closingText(TokenType closing) {
        switch (closing) {
            case RIGHT_BRACE: return "}";
            case RIGHT_BRACKET: return "]";
            default: return ">";
        }
    }
}
