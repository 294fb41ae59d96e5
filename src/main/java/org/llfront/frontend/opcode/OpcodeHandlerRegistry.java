package org.llfront.frontend.opcode;

import org.llfront.frontend.parser.features.aggregate.ExtractValueHandler;
import org.llfront.frontend.parser.features.aggregate.InsertValueHandler;
import org.llfront.frontend.parser.features.arithmetic.BinaryOperationHandler;
import org.llfront.frontend.parser.features.call.CallHandler;
import org.llfront.frontend.parser.features.comparison.CompareIntegersHandler;
import org.llfront.frontend.parser.features.conversion.ConversionHandler;
import org.llfront.frontend.parser.features.memory.AllocaHandler;
import org.llfront.frontend.parser.features.memory.FenceHandler;
import org.llfront.frontend.parser.features.memory.GetElementPointerHandler;
import org.llfront.frontend.parser.features.memory.LoadHandler;
import org.llfront.frontend.parser.features.memory.StoreHandler;
import org.llfront.frontend.parser.features.misc.FreezeHandler;
import org.llfront.frontend.parser.features.misc.SelectHandler;
import org.llfront.frontend.parser.features.terminator.BranchHandler;
import org.llfront.frontend.parser.features.terminator.IndirectBranchHandler;
import org.llfront.frontend.parser.features.terminator.ReturnHandler;
import org.llfront.frontend.parser.features.terminator.SwitchHandler;
import org.llfront.frontend.parser.features.terminator.UnreachableHandler;
import org.llfront.frontend.parser.features.unsupported.UnsupportedOpcodeHandler;
import org.llfront.frontend.parser.features.unsupported.UnsupportedTerminatorHandler;
import org.llfront.ir.instructions.Instruction;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for opcode handlers. This class holds a map of opcode keywords
 * to the handlers that parse the instruction or terminator starting with them.
 */
public class OpcodeHandlerRegistry {
    private final Map<String, IInstructionHandler> instructions = new HashMap<>();
    private final Map<String, ITerminatorHandler> terminators = new HashMap<>();

    /**
     * Registers a handler for an instruction opcode.
     * @param opcode The opcode keyword (e.g., "add").
     * @param handler The handler for the opcode.
     */
    public void registerInstruction(String opcode, IInstructionHandler handler) {
        instructions.put(opcode, handler);
    }

    /**
     * Registers a handler for a terminator opcode.
     * @param opcode The opcode keyword (e.g., "br").
     * @param handler The handler for the opcode.
     */
    public void registerTerminator(String opcode, ITerminatorHandler handler) {
        terminators.put(opcode, handler);
    }

    /**
     * Gets the instruction handler for a given opcode.
     * @param opcode The opcode keyword.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IInstructionHandler> getInstruction(String opcode) {
        return Optional.ofNullable(instructions.get(opcode));
    }

    /**
     * Gets the terminator handler for a given opcode.
     * @param opcode The opcode keyword.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<ITerminatorHandler> getTerminator(String opcode) {
        return Optional.ofNullable(terminators.get(opcode));
    }

    /**
     * @param opcode The opcode keyword.
     * @return true if the opcode ends a basic block.
     */
    public boolean isTerminator(String opcode) {
        return terminators.containsKey(opcode);
    }

    /**
     * Initializes the registry with all the built-in handlers.
     * @return A new instance of {@link OpcodeHandlerRegistry} with all handlers registered.
     */
    public static OpcodeHandlerRegistry initialize() {
        OpcodeHandlerRegistry registry = new OpcodeHandlerRegistry();

        // Binary operations
        registry.registerInstruction("add", BinaryOperationHandler.withWrapping(Instruction.Add::new));
        registry.registerInstruction("sub", BinaryOperationHandler.withWrapping(Instruction.Subtract::new));
        registry.registerInstruction("mul", BinaryOperationHandler.withWrapping(Instruction.Multiply::new));
        registry.registerInstruction("shl", BinaryOperationHandler.withWrapping(Instruction.ShiftLeft::new));
        registry.registerInstruction("udiv", BinaryOperationHandler.withExact(Instruction.UnsignedDivide::new));
        registry.registerInstruction("sdiv", BinaryOperationHandler.withExact(Instruction.SignedDivide::new));
        registry.registerInstruction("lshr", BinaryOperationHandler.withExact(Instruction.LogicalShiftRight::new));
        registry.registerInstruction("ashr", BinaryOperationHandler.withExact(Instruction.ArithmeticShiftRight::new));
        registry.registerInstruction("urem", BinaryOperationHandler.plain(Instruction.UnsignedRemainder::new));
        registry.registerInstruction("srem", BinaryOperationHandler.plain(Instruction.SignedRemainder::new));
        registry.registerInstruction("and", BinaryOperationHandler.plain(Instruction.And::new));
        registry.registerInstruction("xor", BinaryOperationHandler.plain(Instruction.ExclusiveOr::new));
        registry.registerInstruction("or", BinaryOperationHandler.withDisjoint(Instruction.Or::new));

        // Aggregates
        registry.registerInstruction("extractvalue", new ExtractValueHandler());
        registry.registerInstruction("insertvalue", new InsertValueHandler());

        // Memory
        registry.registerInstruction("alloca", new AllocaHandler());
        registry.registerInstruction("load", new LoadHandler());
        registry.registerInstruction("store", new StoreHandler());
        registry.registerInstruction("fence", new FenceHandler());
        registry.registerInstruction("getelementptr", new GetElementPointerHandler());

        // Conversions
        ConversionHandler conversions = new ConversionHandler();
        for (String opcode : ConversionHandler.OPCODES) {
            registry.registerInstruction(opcode, conversions);
        }

        // Other operations
        registry.registerInstruction("icmp", new CompareIntegersHandler());
        registry.registerInstruction("select", new SelectHandler());
        registry.registerInstruction("freeze", new FreezeHandler());
        CallHandler calls = new CallHandler();
        for (String opcode : CallHandler.OPCODES) {
            registry.registerInstruction(opcode, calls);
        }

        // Terminators
        registry.registerTerminator("ret", new ReturnHandler());
        registry.registerTerminator("br", new BranchHandler());
        registry.registerTerminator("switch", new SwitchHandler());
        registry.registerTerminator("indirectbr", new IndirectBranchHandler());
        registry.registerTerminator("unreachable", new UnreachableHandler());

        // Valid IR that is recognised but not modelled
        UnsupportedOpcodeHandler unsupportedInstruction = new UnsupportedOpcodeHandler();
        for (String opcode : UnsupportedOpcodeHandler.OPCODES) {
            registry.registerInstruction(opcode, unsupportedInstruction);
        }
        UnsupportedTerminatorHandler unsupportedTerminator = new UnsupportedTerminatorHandler();
        for (String opcode : UnsupportedTerminatorHandler.OPCODES) {
            registry.registerTerminator(opcode, unsupportedTerminator);
        }

        return registry;
    }
}
