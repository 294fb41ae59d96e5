package org.llfront.frontend.parser.features.unsupported;

import org.llfront.api.UnsupportedConstructException;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.Instruction;

import java.util.List;

/**
 * Rejects opcodes that are valid IR but have no counterpart in the model, such as the
 * floating point arithmetic, vector element access, read-modify-write atomics and
 * exception handling pads. Registering them keeps them apart from plain typos, which
 * are reported as syntax errors.
 */
public final class UnsupportedOpcodeHandler implements IInstructionHandler {

    public static final List<String> OPCODES = List.of(
            "phi", "fneg", "fadd", "fsub", "fmul", "fdiv", "frem", "fcmp",
            "fptrunc", "fpext", "fptoui", "fptosi", "uitofp", "sitofp",
            "extractelement", "insertelement", "shufflevector",
            "atomicrmw", "cmpxchg", "va_arg",
            "landingpad", "catchpad", "cleanuppad");

    @Override
    public Instruction parse(ParsingContext context) throws UnsupportedConstructException {
        throw unsupported(context.peek());
    }

    static UnsupportedConstructException unsupported(Token opcode) {
        return new UnsupportedConstructException("instruction '" + opcode.text() + "'", opcode.sourceInfo());
    }
}
