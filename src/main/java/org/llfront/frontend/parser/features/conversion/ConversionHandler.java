package org.llfront.frontend.parser.features.conversion;

import org.llfront.api.IrException;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.AllowedWrapping;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Value;

import java.util.List;

/**
 * Handles the conversion instructions, {@code <opcode> <ty> <value> to <ty2>}.
 * Only {@code trunc} accepts the {@code nuw} and {@code nsw} flags.
 */
public final class ConversionHandler implements IInstructionHandler {

    public static final List<String> OPCODES = List.of(
            "trunc", "zext", "sext", "ptrtoint", "inttoptr", "bitcast", "addrspacecast");

    @Override
    public Instruction parse(ParsingContext context) throws IrException {
        Token opcode = context.advance();
        boolean noUnsignedWrap = false;
        boolean noSignedWrap = false;
        if (opcode.text().equals("trunc")) {
            while (true) {
                if (context.matchWord("nuw")) {
                    noUnsignedWrap = true;
                } else if (context.matchWord("nsw")) {
                    noSignedWrap = true;
                } else {
                    break;
                }
            }
        }
        Value value = context.parseTypedValue();
        context.consumeWord("to");
        Type newType = context.parseType();

        switch (opcode.text()) {
            case "trunc":
                return new Instruction.Truncate(AllowedWrapping.fromFlags(noUnsignedWrap, noSignedWrap), value, newType);
            case "zext":
                return new Instruction.ZeroExtend(value, newType);
            case "sext":
                return new Instruction.SignExtend(value, newType);
            case "ptrtoint":
                return new Instruction.PointerToInteger(value, newType);
            case "inttoptr":
                return new Instruction.IntegerToPointer(value, newType);
            case "bitcast":
                return new Instruction.BitCast(value, newType);
            case "addrspacecast":
                return new Instruction.AddressSpaceCast(value, newType);
            default:
                throw new IllegalStateException("Not a conversion opcode: " + opcode.text());
        }
    }
}
