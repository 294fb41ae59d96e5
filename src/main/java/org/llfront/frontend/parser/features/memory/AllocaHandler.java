package org.llfront.frontend.parser.features.memory;

import org.llfront.api.IrException;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.types.AddressSpace;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Value;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Handles {@code alloca [inalloca] <type> [, <ty> <count>] [, align <n>] [, addrspace(<n>)]}.
 */
public final class AllocaHandler implements IInstructionHandler {

    @Override
    public Instruction parse(ParsingContext context) throws IrException {
        context.advance(); // consume 'alloca'
        boolean canReuse = context.matchWord("inalloca");
        Type allocatedType = context.parseType();

        Optional<Value> count = Optional.empty();
        OptionalLong alignment = OptionalLong.empty();
        Optional<AddressSpace> addressSpace = Optional.empty();
        while (context.check(TokenType.COMMA) && !context.checkNext(TokenType.METADATA)) {
            if (context.checkNextWord("align") && alignment.isEmpty()) {
                alignment = context.parseTrailingAlignment();
            } else if (context.checkNextWord("addrspace") && addressSpace.isEmpty()) {
                context.advance(); // consume ','
                addressSpace = Optional.of(context.parseAddressSpace());
            } else if (count.isEmpty() && alignment.isEmpty() && addressSpace.isEmpty()) {
                context.advance(); // consume ','
                count = Optional.of(context.parseTypedValue());
            } else {
                context.advance();
                throw context.unexpected("'align', 'addrspace' or metadata after ','");
            }
        }
        return new Instruction.StackAllocate(canReuse, allocatedType, count, alignment, addressSpace);
    }
}
