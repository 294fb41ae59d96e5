package org.llfront.ir.print;

import org.llfront.ir.function.BasicBlock;
import org.llfront.ir.function.Function;
import org.llfront.ir.function.FunctionParameter;
import org.llfront.ir.function.LinkageType;
import org.llfront.ir.function.Operation;
import org.llfront.ir.function.PreemptionSpecifier;
import org.llfront.ir.function.UnnamedAddress;
import org.llfront.ir.function.Visibility;
import org.llfront.ir.instructions.AllowedWrapping;
import org.llfront.ir.instructions.CallArgument;
import org.llfront.ir.instructions.GetPointerKind;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.instructions.SwitchCase;
import org.llfront.ir.instructions.TailCallHint;
import org.llfront.ir.instructions.Terminator;
import org.llfront.ir.types.AddressSpace;
import org.llfront.ir.types.ParameterAttribute;
import org.llfront.ir.types.TargetExtensionParameter;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Constant;
import org.llfront.ir.values.Value;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Writes model nodes back as textual IR in a canonical form that the parser accepts again.
 * <p>
 * An operand wrapping an instruction ({@link Value.FromInstruction}) is printed by the name the
 * instruction's result is bound to in the printed block or function. Printing such an operand
 * on its own, or one whose instruction is not bound, fails with an {@link IllegalArgumentException}.
 */
public final class IrPrinter {

    private final Map<Instruction, String> boundNames = new IdentityHashMap<>();

    private IrPrinter() {}

    // region Public entry points

    public static String print(Type type) {
        StringBuilder sb = new StringBuilder();
        new IrPrinter().appendType(sb, type);
        return sb.toString();
    }

    /**
     * @param value The value.
     * @return The value with its type, e.g. {@code i32 0} or {@code label %exit}.
     */
    public static String print(Value value) {
        StringBuilder sb = new StringBuilder();
        new IrPrinter().appendTypedValue(sb, value);
        return sb.toString();
    }

    public static String print(Instruction instruction) {
        StringBuilder sb = new StringBuilder();
        new IrPrinter().appendInstruction(sb, instruction);
        return sb.toString();
    }

    public static String print(Terminator terminator) {
        StringBuilder sb = new StringBuilder();
        new IrPrinter().appendTerminator(sb, terminator);
        return sb.toString();
    }

    public static String print(BasicBlock block) {
        IrPrinter printer = new IrPrinter();
        printer.bind(block);
        StringBuilder sb = new StringBuilder();
        printer.appendBlock(sb, block);
        return sb.toString();
    }

    public static String print(Function function) {
        IrPrinter printer = new IrPrinter();
        for (BasicBlock block : function.basicBlocks()) {
            printer.bind(block);
        }
        StringBuilder sb = new StringBuilder();
        printer.appendFunction(sb, function);
        return sb.toString();
    }

    // endregion

    private void bind(BasicBlock block) {
        for (Operation operation : block.operations()) {
            if (operation instanceof Operation.Assignment assignment) {
                boundNames.put(assignment.instruction(), assignment.identifier());
            }
        }
    }

    // region Types

    private void appendType(StringBuilder sb, Type type) {
        if (type instanceof Type.Void) {
            sb.append("void");
        } else if (type instanceof Type.Integer integer) {
            sb.append('i').append(integer.bitWidth());
        } else if (type instanceof Type.FloatingPoint fp) {
            sb.append(fp.kind().keyword());
        } else if (type instanceof Type.Amx) {
            sb.append("x86_amx");
        } else if (type instanceof Type.Mmx) {
            sb.append("x86_mmx");
        } else if (type instanceof Type.Pointer pointer) {
            sb.append("ptr");
            if (!pointer.addressSpace().equals(AddressSpace.DEFAULT)) {
                sb.append(' ');
                appendAddressSpace(sb, pointer.addressSpace());
            }
        } else if (type instanceof Type.TargetExtension target) {
            sb.append("target(\"").append(target.name()).append('"');
            for (TargetExtensionParameter parameter : target.parameters()) {
                sb.append(", ");
                if (parameter instanceof TargetExtensionParameter.OfType ofType) {
                    appendType(sb, ofType.type());
                } else if (parameter instanceof TargetExtensionParameter.OfInteger ofInteger) {
                    sb.append(ofInteger.value());
                }
            }
            sb.append(')');
        } else if (type instanceof Type.Vector vector) {
            sb.append('<');
            if (vector.isScalable()) {
                sb.append("vscale x ");
            }
            sb.append(vector.length()).append(" x ");
            appendType(sb, vector.elementType());
            sb.append('>');
        } else if (type instanceof Type.Label) {
            sb.append("label");
        } else if (type instanceof Type.Token) {
            sb.append("token");
        } else if (type instanceof Type.Metadata) {
            sb.append("metadata");
        } else if (type instanceof Type.Array array) {
            sb.append('[').append(array.length()).append(" x ");
            appendType(sb, array.elementType());
            sb.append(']');
        } else if (type instanceof Type.Structure structure) {
            if (structure.isPacked()) sb.append('<');
            sb.append('{');
            for (int i = 0; i < structure.types().size(); i++) {
                sb.append(i == 0 ? " " : ", ");
                appendType(sb, structure.types().get(i));
            }
            sb.append(structure.types().isEmpty() ? "}" : " }");
            if (structure.isPacked()) sb.append('>');
        } else if (type instanceof Type.OpaqueStructure) {
            sb.append("opaque");
        } else if (type instanceof Type.Function function) {
            appendType(sb, function.returnType());
            sb.append(" (");
            for (int i = 0; i < function.parameters().size(); i++) {
                if (i > 0) sb.append(", ");
                appendType(sb, function.parameters().get(i));
            }
            if (function.hasVarargs()) {
                sb.append(function.parameters().isEmpty() ? "..." : ", ...");
            }
            sb.append(')');
        }
    }

    private static void appendAddressSpace(StringBuilder sb, AddressSpace addressSpace) {
        sb.append("addrspace(");
        if (addressSpace instanceof AddressSpace.Numbered numbered) {
            sb.append(numbered.number());
        } else if (addressSpace instanceof AddressSpace.Named named) {
            sb.append('"').append(named.name()).append('"');
        }
        sb.append(')');
    }

    // endregion

    // region Values

    private void appendTypedValue(StringBuilder sb, Value value) {
        appendType(sb, value.type());
        sb.append(' ');
        appendValue(sb, value);
    }

    private void appendValue(StringBuilder sb, Value value) {
        if (value instanceof Value.FromIdentifier identifier) {
            sb.append(identifier.name());
        } else if (value instanceof Value.FromGlobal global) {
            sb.append(global.name());
        } else if (value instanceof Value.FromFunction function) {
            sb.append(function.name());
        } else if (value instanceof Value.FromLabel label) {
            sb.append(label.name());
        } else if (value instanceof Value.FromConstant constant) {
            appendConstant(sb, constant.type(), constant.constant());
        } else if (value instanceof Value.FromInstruction fromInstruction) {
            String name = boundNames.get(fromInstruction.instruction());
            if (name == null) {
                throw new IllegalArgumentException("Instruction result is not bound to a name: "
                        + fromInstruction.instruction().opcode());
            }
            sb.append(name);
        }
    }

    private void appendConstant(StringBuilder sb, Type type, Constant constant) {
        if (constant instanceof Constant.Void) {
            sb.append("void");
        } else if (constant instanceof Constant.Boolean bool) {
            sb.append(bool.value());
        } else if (constant instanceof Constant.Integer integer) {
            sb.append(integer.value());
        } else if (constant instanceof Constant.FloatingPoint fp) {
            sb.append(fp.literal());
        } else if (constant instanceof Constant.NullPointer) {
            sb.append("null");
        } else if (constant instanceof Constant.NoneToken) {
            sb.append("none");
        } else if (constant instanceof Constant.Structure structure) {
            boolean packed = type instanceof Type.Structure s && s.isPacked();
            if (packed) sb.append('<');
            sb.append('{');
            appendElements(sb, structure.values());
            sb.append(structure.values().isEmpty() ? "}" : " }");
            if (packed) sb.append('>');
        } else if (constant instanceof Constant.Array array) {
            sb.append('[');
            appendElements(sb, array.values());
            sb.append(array.values().isEmpty() ? "]" : " ]");
        } else if (constant instanceof Constant.Vector vector) {
            sb.append('<');
            appendElements(sb, vector.values());
            sb.append(vector.values().isEmpty() ? ">" : " >");
        } else if (constant instanceof Constant.Zero) {
            sb.append("zeroinitializer");
        } else if (constant instanceof Constant.Metadata) {
            sb.append("!{}");
        } else if (constant instanceof Constant.Undefined) {
            sb.append("undef");
        } else if (constant instanceof Constant.Poison) {
            sb.append("poison");
        }
    }

    private void appendElements(StringBuilder sb, List<Value> values) {
        for (int i = 0; i < values.size(); i++) {
            sb.append(i == 0 ? " " : ", ");
            appendTypedValue(sb, values.get(i));
        }
    }

    private void appendAttributes(StringBuilder sb, List<ParameterAttribute> attributes) {
        for (ParameterAttribute attribute : attributes) {
            sb.append(' ').append(attribute.kind().keyword());
            if (attribute instanceof ParameterAttribute.WithType withType) {
                sb.append('(');
                appendType(sb, withType.type());
                sb.append(')');
            } else if (attribute instanceof ParameterAttribute.WithInteger withInteger) {
                if (attribute.kind() == ParameterAttribute.Kind.ALIGN) {
                    sb.append(' ').append(withInteger.value());
                } else {
                    sb.append('(').append(withInteger.value()).append(')');
                }
            }
        }
    }

    // endregion

    // region Instructions

    private void appendInstruction(StringBuilder sb, Instruction instruction) {
        if (instruction instanceof Instruction.Call call) {
            if (call.tailCallHint() != TailCallHint.INDIFFERENT) {
                sb.append(call.tailCallHint().keyword()).append(' ');
            }
            sb.append("call");
            appendCallee(sb, call.callingConvention(), call.returnAttributes(), call.addressSpace(),
                    call.functionType(), call.functionName(), call.arguments(), call.functionAttributes());
            return;
        }
        sb.append(instruction.opcode());
        if (instruction instanceof Instruction.BinaryOperation binary) {
            appendBinaryFlags(sb, binary);
            sb.append(' ');
            appendTypedValue(sb, binary.leftHandSide());
            sb.append(", ");
            appendValue(sb, binary.rightHandSide());
        } else if (instruction instanceof Instruction.ExtractValue extract) {
            sb.append(' ');
            appendTypedValue(sb, extract.aggregate());
            appendIndices(sb, extract.indices());
        } else if (instruction instanceof Instruction.InsertValue insert) {
            sb.append(' ');
            appendTypedValue(sb, insert.aggregate());
            sb.append(", ");
            appendTypedValue(sb, insert.element());
            appendIndices(sb, insert.indices());
        } else if (instruction instanceof Instruction.StackAllocate alloca) {
            if (alloca.canReuse()) sb.append(" inalloca");
            sb.append(' ');
            appendType(sb, alloca.allocatedType());
            alloca.count().ifPresent(count -> {
                sb.append(", ");
                appendTypedValue(sb, count);
            });
            appendAlignment(sb, alloca.alignment());
            alloca.addressSpace().ifPresent(space -> {
                sb.append(", ");
                appendAddressSpace(sb, space);
            });
        } else if (instruction instanceof Instruction.Load load) {
            if (load.isVolatile()) sb.append(" volatile");
            sb.append(' ');
            appendType(sb, load.resultType());
            sb.append(", ");
            appendTypedValue(sb, load.pointer());
            appendAlignment(sb, load.alignment());
        } else if (instruction instanceof Instruction.AtomicLoad load) {
            sb.append(" atomic");
            if (load.isVolatile()) sb.append(" volatile");
            sb.append(' ');
            appendType(sb, load.resultType());
            sb.append(", ");
            appendTypedValue(sb, load.pointer());
            appendSyncScope(sb, load.syncScope());
            sb.append(' ').append(load.ordering().keyword());
            sb.append(", align ").append(load.alignment());
        } else if (instruction instanceof Instruction.Store store) {
            if (store.isVolatile()) sb.append(" volatile");
            sb.append(' ');
            appendTypedValue(sb, store.value());
            sb.append(", ");
            appendTypedValue(sb, store.pointer());
            appendAlignment(sb, store.alignment());
        } else if (instruction instanceof Instruction.AtomicStore store) {
            sb.append(" atomic");
            if (store.isVolatile()) sb.append(" volatile");
            sb.append(' ');
            appendTypedValue(sb, store.value());
            sb.append(", ");
            appendTypedValue(sb, store.pointer());
            appendSyncScope(sb, store.syncScope());
            sb.append(' ').append(store.ordering().keyword());
            sb.append(", align ").append(store.alignment());
        } else if (instruction instanceof Instruction.Fence fence) {
            appendSyncScope(sb, fence.syncScope());
            sb.append(' ').append(fence.ordering().keyword());
        } else if (instruction instanceof Instruction.GetElementPointer gep) {
            GetPointerKind kind = gep.kind();
            if (kind instanceof GetPointerKind.InBounds) {
                sb.append(" inbounds");
            } else if (kind instanceof GetPointerKind.InRange range) {
                sb.append(" inrange(").append(range.low()).append(", ").append(range.high()).append(')');
            }
            sb.append(' ');
            appendType(sb, gep.sourceElementType());
            sb.append(", ");
            appendTypedValue(sb, gep.pointer());
            for (Value index : gep.indices()) {
                sb.append(", ");
                appendTypedValue(sb, index);
            }
        } else if (instruction instanceof Instruction.Conversion conversion) {
            if (conversion instanceof Instruction.Truncate truncate) {
                appendWrapping(sb, truncate.allowedWrapping());
            }
            sb.append(' ');
            appendTypedValue(sb, conversion.value());
            sb.append(" to ");
            appendType(sb, conversion.newType());
        } else if (instruction instanceof Instruction.CompareIntegers icmp) {
            sb.append(' ').append(icmp.comparison().keyword()).append(' ');
            appendTypedValue(sb, icmp.leftHandSide());
            sb.append(", ");
            appendValue(sb, icmp.rightHandSide());
        } else if (instruction instanceof Instruction.Select select) {
            sb.append(' ');
            appendTypedValue(sb, select.condition());
            sb.append(", ");
            appendTypedValue(sb, select.trueValue());
            sb.append(", ");
            appendTypedValue(sb, select.falseValue());
        } else if (instruction instanceof Instruction.Freeze freeze) {
            sb.append(' ');
            appendTypedValue(sb, freeze.value());
        }
    }

    private static void appendBinaryFlags(StringBuilder sb, Instruction.BinaryOperation binary) {
        if (binary instanceof Instruction.Add add) {
            appendWrapping(sb, add.allowedWrapping());
        } else if (binary instanceof Instruction.Subtract sub) {
            appendWrapping(sb, sub.allowedWrapping());
        } else if (binary instanceof Instruction.Multiply mul) {
            appendWrapping(sb, mul.allowedWrapping());
        } else if (binary instanceof Instruction.ShiftLeft shl) {
            appendWrapping(sb, shl.allowedWrapping());
        } else if (binary instanceof Instruction.UnsignedDivide udiv && udiv.isExact()) {
            sb.append(" exact");
        } else if (binary instanceof Instruction.SignedDivide sdiv && sdiv.isExact()) {
            sb.append(" exact");
        } else if (binary instanceof Instruction.LogicalShiftRight lshr && lshr.isExact()) {
            sb.append(" exact");
        } else if (binary instanceof Instruction.ArithmeticShiftRight ashr && ashr.isExact()) {
            sb.append(" exact");
        } else if (binary instanceof Instruction.Or or && or.isDisjoint()) {
            sb.append(" disjoint");
        }
    }

    private static void appendWrapping(StringBuilder sb, AllowedWrapping wrapping) {
        if (!wrapping.canWrapUnsigned()) sb.append(" nuw");
        if (!wrapping.canWrapSigned()) sb.append(" nsw");
    }

    private static void appendIndices(StringBuilder sb, List<Long> indices) {
        for (long index : indices) {
            sb.append(", ").append(index);
        }
    }

    private static void appendAlignment(StringBuilder sb, OptionalLong alignment) {
        if (alignment.isPresent()) {
            sb.append(", align ").append(alignment.getAsLong());
        }
    }

    private static void appendSyncScope(StringBuilder sb, Optional<String> syncScope) {
        syncScope.ifPresent(scope -> sb.append(" syncscope(\"").append(scope).append("\")"));
    }

    private void appendCallee(StringBuilder sb, Optional<String> callingConvention, List<ParameterAttribute> returnAttributes,
                              Optional<AddressSpace> addressSpace, Type.Function functionType, String functionName,
                              List<CallArgument> arguments, List<String> functionAttributes) {
        callingConvention.ifPresent(cc -> sb.append(' ').append(cc));
        appendAttributes(sb, returnAttributes);
        addressSpace.ifPresent(space -> {
            sb.append(' ');
            appendAddressSpace(sb, space);
        });
        sb.append(' ');
        List<Type> argumentTypes = new ArrayList<>(arguments.size());
        for (CallArgument argument : arguments) {
            argumentTypes.add(argument.value().type());
        }
        // The return type alone suffices when the signature follows from the arguments.
        if (functionType.equals(new Type.Function(functionType.returnType(), argumentTypes, false))) {
            appendType(sb, functionType.returnType());
        } else {
            appendType(sb, functionType);
        }
        sb.append(' ').append(functionName).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            CallArgument argument = arguments.get(i);
            appendType(sb, argument.value().type());
            appendAttributes(sb, argument.attributes());
            sb.append(' ');
            appendValue(sb, argument.value());
        }
        sb.append(')');
        for (String attribute : functionAttributes) {
            sb.append(' ').append(attribute);
        }
    }

    // endregion

    // region Terminators

    private void appendTerminator(StringBuilder sb, Terminator terminator) {
        sb.append(terminator.opcode());
        if (terminator instanceof Terminator.Return ret) {
            sb.append(' ');
            if (ret.isVoid()) {
                sb.append("void");
            } else {
                appendTypedValue(sb, ret.value());
            }
        } else if (terminator instanceof Terminator.ConditionalBranch br) {
            sb.append(' ');
            appendTypedValue(sb, br.condition());
            sb.append(", ");
            appendTypedValue(sb, br.ifTrue());
            sb.append(", ");
            appendTypedValue(sb, br.ifFalse());
        } else if (terminator instanceof Terminator.Branch br) {
            sb.append(' ');
            appendTypedValue(sb, br.destination());
        } else if (terminator instanceof Terminator.Switch sw) {
            sb.append(' ');
            appendTypedValue(sb, sw.value());
            sb.append(", ");
            appendTypedValue(sb, sw.defaultDestination());
            sb.append(" [");
            for (SwitchCase switchCase : sw.cases()) {
                sb.append(' ');
                appendTypedValue(sb, switchCase.value());
                sb.append(", ");
                appendTypedValue(sb, switchCase.destination());
            }
            sb.append(" ]");
        } else if (terminator instanceof Terminator.IndirectBranch indirect) {
            sb.append(' ');
            appendTypedValue(sb, indirect.address());
            sb.append(", ");
            appendLabelList(sb, indirect.validDestinations());
        } else if (terminator instanceof Terminator.Invoke invoke) {
            appendCallee(sb, invoke.callingConvention(), invoke.returnAttributes(), invoke.addressSpace(),
                    invoke.functionType(), invoke.functionName(), invoke.arguments(), invoke.functionAttributes());
            sb.append(" to ");
            appendTypedValue(sb, invoke.normalDestination());
            sb.append(" unwind ");
            appendTypedValue(sb, invoke.exceptionDestination());
        } else if (terminator instanceof Terminator.CallBranch callBranch) {
            appendCallee(sb, callBranch.callingConvention(), callBranch.returnAttributes(), callBranch.addressSpace(),
                    callBranch.functionType(), callBranch.functionName(), callBranch.arguments(),
                    callBranch.functionAttributes());
            sb.append(" to ");
            appendTypedValue(sb, callBranch.fallthroughDestination());
            sb.append(' ');
            appendLabelList(sb, callBranch.indirectDestinations());
        } else if (terminator instanceof Terminator.Resume resume) {
            sb.append(' ');
            appendTypedValue(sb, resume.exception());
        } else if (terminator instanceof Terminator.CatchSwitch catchSwitch) {
            sb.append(" within ");
            appendValue(sb, catchSwitch.parentPad());
            sb.append(' ');
            appendLabelList(sb, catchSwitch.handlers());
            appendUnwind(sb, catchSwitch.unwindDestination());
        } else if (terminator instanceof Terminator.CatchReturn catchReturn) {
            sb.append(" from ");
            appendValue(sb, catchReturn.fromPad());
            sb.append(" to ");
            appendTypedValue(sb, catchReturn.destination());
        } else if (terminator instanceof Terminator.CleanupReturn cleanupReturn) {
            sb.append(" from ");
            appendValue(sb, cleanupReturn.fromPad());
            appendUnwind(sb, cleanupReturn.unwindDestination());
        }
    }

    private void appendLabelList(StringBuilder sb, List<Value> labels) {
        sb.append('[');
        for (int i = 0; i < labels.size(); i++) {
            if (i > 0) sb.append(", ");
            appendTypedValue(sb, labels.get(i));
        }
        sb.append(']');
    }

    private void appendUnwind(StringBuilder sb, Optional<Value> unwindDestination) {
        if (unwindDestination.isPresent()) {
            sb.append(" unwind ");
            appendTypedValue(sb, unwindDestination.get());
        } else {
            sb.append(" unwind to caller");
        }
    }

    // endregion

    // region Blocks and functions

    private void appendBlock(StringBuilder sb, BasicBlock block) {
        block.name().ifPresent(name -> sb.append(name).append(":\n"));
        for (Operation operation : block.operations()) {
            sb.append("  ");
            if (operation instanceof Operation.Assignment assignment) {
                sb.append(assignment.identifier()).append(" = ");
            }
            appendInstruction(sb, operation.instruction());
            sb.append('\n');
        }
        sb.append("  ");
        appendTerminator(sb, block.terminator());
        sb.append('\n');
    }

    private void appendFunction(StringBuilder sb, Function function) {
        sb.append("define");
        if (function.linkage() != LinkageType.EXTERNAL) {
            sb.append(' ').append(function.linkage().keyword());
        }
        if (function.preemptionSpecifier() != PreemptionSpecifier.PREEMPTABLE) {
            sb.append(' ').append(function.preemptionSpecifier().keyword());
        }
        if (function.visibility() != Visibility.DEFAULT) {
            sb.append(' ').append(function.visibility().keyword());
        }
        function.callingConvention().ifPresent(cc -> sb.append(' ').append(cc));
        appendAttributes(sb, function.returnAttributes());
        sb.append(' ');
        appendType(sb, function.returnType());
        sb.append(' ').append(function.name()).append('(');
        List<FunctionParameter> parameters = function.parameters();
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) sb.append(", ");
            FunctionParameter parameter = parameters.get(i);
            appendType(sb, parameter.type());
            appendAttributes(sb, parameter.attributes());
            parameter.name().ifPresent(name -> sb.append(' ').append(name));
        }
        if (function.hasVarargs()) {
            sb.append(parameters.isEmpty() ? "..." : ", ...");
        }
        sb.append(')');
        if (function.unnamedAddress() != UnnamedAddress.NONE) {
            sb.append(' ').append(function.unnamedAddress().keyword());
        }
        function.addressSpace().ifPresent(space -> {
            sb.append(' ');
            appendAddressSpace(sb, space);
        });
        for (String attribute : function.functionAttributes()) {
            sb.append(' ').append(attribute);
        }
        function.section().ifPresent(section -> sb.append(" section \"").append(section).append('"'));
        function.partition().ifPresent(partition -> sb.append(" partition \"").append(partition).append('"'));
        function.alignment().ifPresent(alignment -> sb.append(" align ").append(alignment));
        function.garbageCollector().ifPresent(gc -> sb.append(" gc \"").append(gc).append('"'));
        sb.append(" {\n");
        List<BasicBlock> blocks = function.basicBlocks();
        for (int i = 0; i < blocks.size(); i++) {
            if (i > 0) sb.append('\n');
            appendBlock(sb, blocks.get(i));
        }
        sb.append("}\n");
    }

    // endregion
}
