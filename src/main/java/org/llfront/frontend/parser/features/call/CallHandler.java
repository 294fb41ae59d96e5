package org.llfront.frontend.parser.features.call;

import org.llfront.api.IrException;
import org.llfront.api.UnsupportedConstructException;
import org.llfront.frontend.lexer.Token;
import org.llfront.frontend.lexer.TokenType;
import org.llfront.frontend.opcode.IInstructionHandler;
import org.llfront.frontend.parser.ParsingContext;
import org.llfront.ir.instructions.CallArgument;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.instructions.TailCallHint;
import org.llfront.ir.types.AddressSpace;
import org.llfront.ir.types.ParameterAttribute;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Handles the {@code call} instruction together with its tail call markers.
 * <pre>
 * [tail | musttail | notail] call [cconv] [ret attrs] [addrspace(n)] &lt;ty&gt; | &lt;fnty&gt; &lt;callee&gt;(&lt;args&gt;) [fn attrs]
 * </pre>
 * When only the return type is written, the callee's type is derived from the argument types.
 * A variadic callee must be called with its full function type.
 */
public final class CallHandler implements IInstructionHandler {

    public static final List<String> OPCODES = List.of("call", "tail", "musttail", "notail");

    private static final Set<String> FAST_MATH_FLAGS = Set.of(
            "fast", "nnan", "ninf", "nsz", "arcp", "contract", "afn", "reassoc");

    @Override
    public Instruction parse(ParsingContext context) throws IrException {
        TailCallHint tailCallHint = parseTailCallHint(context);
        context.consumeWord("call");
        if (context.check(TokenType.WORD) && FAST_MATH_FLAGS.contains(context.peek().text())) {
            throw new UnsupportedConstructException("fast-math flag '" + context.peek().text() + "'",
                    context.peek().sourceInfo());
        }

        Optional<String> callingConvention = context.parseCallingConvention();
        List<ParameterAttribute> returnAttributes = context.parseParameterAttributes();
        Optional<AddressSpace> addressSpace = Optional.empty();
        if (context.checkWord("addrspace")) {
            addressSpace = Optional.of(context.parseAddressSpace());
        }
        Type writtenType = context.parseType();

        Token callee = context.peek();
        if (!context.check(TokenType.GLOBAL_ID) && !context.check(TokenType.LOCAL_ID)) {
            throw context.unexpected("a function name");
        }
        context.parseValue(Type.pointer());

        List<CallArgument> arguments = parseArguments(context);
        List<String> functionAttributes = context.parseFunctionAttributes();
        if (context.check(TokenType.LEFT_BRACKET)) {
            throw new UnsupportedConstructException("operand bundle", context.peek().sourceInfo());
        }

        Type.Function functionType;
        if (writtenType instanceof Type.Function written) {
            functionType = written;
        } else {
            List<Type> parameterTypes = new ArrayList<>(arguments.size());
            for (CallArgument argument : arguments) {
                parameterTypes.add(argument.value().type());
            }
            functionType = new Type.Function(writtenType, parameterTypes, false);
        }
        return new Instruction.Call(tailCallHint, callingConvention, returnAttributes, addressSpace, functionType,
                callee.text(), arguments, functionAttributes);
    }

    private static TailCallHint parseTailCallHint(ParsingContext context) {
        if (context.matchWord("tail")) {
            return TailCallHint.SHOULD_TAIL;
        }
        if (context.matchWord("musttail")) {
            return TailCallHint.MUST_TAIL;
        }
        if (context.matchWord("notail")) {
            return TailCallHint.NEVER_TAIL;
        }
        return TailCallHint.INDIFFERENT;
    }

    private static List<CallArgument> parseArguments(ParsingContext context) throws IrException {
        context.consume(TokenType.LEFT_PAREN, "'(' opening the argument list");
        List<CallArgument> arguments = new ArrayList<>();
        if (!context.check(TokenType.RIGHT_PAREN)) {
            do {
                Type type = context.parseType();
                List<ParameterAttribute> attributes = context.parseParameterAttributes();
                Value value = context.parseValue(type);
                arguments.add(new CallArgument(value, attributes));
            } while (context.match(TokenType.COMMA));
        }
        context.consume(TokenType.RIGHT_PAREN, "')' closing the argument list");
        return arguments;
    }
}
