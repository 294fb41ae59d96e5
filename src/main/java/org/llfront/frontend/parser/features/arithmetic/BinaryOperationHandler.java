package org.llfront.frontend.parser.features.arithmetic;

import org.llfront.api.IrException;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.AllowedWrapping;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.values.Value;

/**
 * Handles the integer binary operations, e.g. {@code add nuw i32 %a, 1}.
 * <p>
 * The syntax is {@code <opcode> [flags] <type> <lhs>, <rhs>}; the right hand side is written
 * without a type and takes the type of the left hand side. Which flags are accepted depends on
 * the opcode family the handler was created for.
 */
public final class BinaryOperationHandler implements IInstructionHandler {

    /** Builds an operation that takes {@code nuw}/{@code nsw}. */
    @FunctionalInterface
    public interface WrappingFactory {
        Instruction create(Value leftHandSide, Value rightHandSide, AllowedWrapping allowedWrapping);
    }

    /** Builds an operation that takes a single boolean flag ({@code exact} or {@code disjoint}). */
    @FunctionalInterface
    public interface FlagFactory {
        Instruction create(Value leftHandSide, Value rightHandSide, boolean flag);
    }

    /** Builds an operation without flags. */
    @FunctionalInterface
    public interface PlainFactory {
        Instruction create(Value leftHandSide, Value rightHandSide);
    }

    private enum Flags { WRAPPING, EXACT, DISJOINT, NONE }

    private final Flags flags;
    private final WrappingFactory wrapping;
    private final FlagFactory flagged;
    private final PlainFactory plain;

    private BinaryOperationHandler(Flags flags, WrappingFactory wrapping, FlagFactory flagged, PlainFactory plain) {
        this.flags = flags;
        this.wrapping = wrapping;
        this.flagged = flagged;
        this.plain = plain;
    }

    public static BinaryOperationHandler withWrapping(WrappingFactory factory) {
        return new BinaryOperationHandler(Flags.WRAPPING, factory, null, null);
    }

    public static BinaryOperationHandler withExact(FlagFactory factory) {
        return new BinaryOperationHandler(Flags.EXACT, null, factory, null);
    }

    public static BinaryOperationHandler withDisjoint(FlagFactory factory) {
        return new BinaryOperationHandler(Flags.DISJOINT, null, factory, null);
    }

    public static BinaryOperationHandler plain(PlainFactory factory) {
        return new BinaryOperationHandler(Flags.NONE, null, null, factory);
    }

    @Override
    public Instruction parse(ParsingContext context) throws IrException {
        context.advance(); // consume opcode
        boolean noUnsignedWrap = false;
        boolean noSignedWrap = false;
        boolean flag = false;
        switch (flags) {
            case WRAPPING:
                while (context.check(TokenType.WORD)) {
                    if (context.matchWord("nuw")) {
                        noUnsignedWrap = true;
                    } else if (context.matchWord("nsw")) {
                        noSignedWrap = true;
                    } else {
                        break;
                    }
                }
                break;
            case EXACT:
                flag = context.matchWord("exact");
                break;
            case DISJOINT:
                flag = context.matchWord("disjoint");
                break;
            default:
                break;
        }

        Value leftHandSide = context.parseTypedValue();
        context.consume(TokenType.COMMA, "',' between operands");
        Value rightHandSide = context.parseValue(leftHandSide.type());

        switch (flags) {
            case WRAPPING:
                return wrapping.create(leftHandSide, rightHandSide, AllowedWrapping.fromFlags(noUnsignedWrap, noSignedWrap));
            case EXACT:
            case DISJOINT:
                return flagged.create(leftHandSide, rightHandSide, flag);
            default:
                return plain.create(leftHandSide, rightHandSide);
        }
    }
}
