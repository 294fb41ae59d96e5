package org.llfront.ir.instructions;

import org.llfront.ir.types.AddressSpace;
import org.llfront.ir.types.ParameterAttribute;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Constant;
import org.llfront.ir.values.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The control-transfer instruction that ends every basic block.
 * <p>
 * Destinations are {@link Value.FromLabel} values naming blocks of the enclosing function.
 */
public sealed interface Terminator {

    /**
     * @return The opcode mnemonic, e.g. {@code br}.
     */
    String opcode();

    /**
     * @return Every operand value, destinations included, in textual order.
     */
    List<Value> operands();

    /**
     * @return The destination labels control may continue at. Empty for terminators that leave the function.
     */
    List<Value> successors();

    /**
     * {@code ret}. A {@code ret void} carries the void constant.
     * @param value The returned value.
     */
    record Return(Value value) implements Terminator {
        public Return {
            Objects.requireNonNull(value, "value");
        }

        /**
         * @return A {@code ret void}.
         */
        public static Return ofVoid() {
            return new Return(new Value.FromConstant(new Type.Void(), new Constant.Void()));
        }

        public boolean isVoid() {
            return value.type() instanceof Type.Void;
        }

        @Override public String opcode() { return "ret"; }

        @Override
        public List<Value> operands() {
            return isVoid() ? List.of() : List.of(value);
        }

        @Override
        public List<Value> successors() {
            return List.of();
        }
    }

    /** {@code br i1 %c, label %t, label %f} */
    record ConditionalBranch(Value condition, Value ifTrue, Value ifFalse) implements Terminator {
        public ConditionalBranch {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(ifTrue, "ifTrue");
            Objects.requireNonNull(ifFalse, "ifFalse");
        }

        @Override public String opcode() { return "br"; }

        @Override
        public List<Value> operands() {
            return List.of(condition, ifTrue, ifFalse);
        }

        @Override
        public List<Value> successors() {
            return List.of(ifTrue, ifFalse);
        }
    }

    /** {@code br label %dest} */
    record Branch(Value destination) implements Terminator {
        public Branch {
            Objects.requireNonNull(destination, "destination");
        }

        @Override public String opcode() { return "br"; }

        @Override
        public List<Value> operands() {
            return List.of(destination);
        }

        @Override
        public List<Value> successors() {
            return List.of(destination);
        }
    }

    /**
     * {@code switch}
     * @param value The scrutinee.
     * @param defaultDestination Where control goes if no case matches.
     * @param cases The cases, in textual order.
     */
    record Switch(Value value, Value defaultDestination, List<SwitchCase> cases) implements Terminator {
        public Switch {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(defaultDestination, "defaultDestination");
            cases = List.copyOf(cases);
        }

        @Override public String opcode() { return "switch"; }

        @Override
        public List<Value> operands() {
            List<Value> all = new ArrayList<>();
            all.add(value);
            all.add(defaultDestination);
            for (SwitchCase switchCase : cases) {
                all.add(switchCase.value());
                all.add(switchCase.destination());
            }
            return List.copyOf(all);
        }

        @Override
        public List<Value> successors() {
            List<Value> all = new ArrayList<>();
            all.add(defaultDestination);
            for (SwitchCase switchCase : cases) {
                all.add(switchCase.destination());
            }
            return List.copyOf(all);
        }
    }

    /**
     * {@code indirectbr}
     * @param address The computed destination address.
     * @param validDestinations Every label the address may point to.
     */
    record IndirectBranch(Value address, List<Value> validDestinations) implements Terminator {
        public IndirectBranch {
            Objects.requireNonNull(address, "address");
            validDestinations = List.copyOf(validDestinations);
        }

        @Override public String opcode() { return "indirectbr"; }

        @Override
        public List<Value> operands() {
            List<Value> all = new ArrayList<>();
            all.add(address);
            all.addAll(validDestinations);
            return List.copyOf(all);
        }

        @Override
        public List<Value> successors() {
            return validDestinations;
        }
    }

    /**
     * {@code invoke}: a call that continues at one of two labels depending on whether the callee unwinds.
     */
    record Invoke(Optional<String> callingConvention, List<ParameterAttribute> returnAttributes,
                  Optional<AddressSpace> addressSpace, Type.Function functionType, String functionName,
                  List<CallArgument> arguments, Value normalDestination, Value exceptionDestination,
                  List<String> functionAttributes) implements Terminator {
        public Invoke {
            Objects.requireNonNull(callingConvention, "callingConvention");
            returnAttributes = List.copyOf(returnAttributes);
            Objects.requireNonNull(addressSpace, "addressSpace");
            Objects.requireNonNull(functionType, "functionType");
            Objects.requireNonNull(functionName, "functionName");
            arguments = List.copyOf(arguments);
            Objects.requireNonNull(normalDestination, "normalDestination");
            Objects.requireNonNull(exceptionDestination, "exceptionDestination");
            functionAttributes = List.copyOf(functionAttributes);
        }

        @Override public String opcode() { return "invoke"; }

        @Override
        public List<Value> operands() {
            List<Value> all = argumentValues(arguments);
            all.add(normalDestination);
            all.add(exceptionDestination);
            return List.copyOf(all);
        }

        @Override
        public List<Value> successors() {
            return List.of(normalDestination, exceptionDestination);
        }
    }

    /**
     * {@code callbr}: a call that may continue at its fallthrough label or at one of the indirect labels.
     */
    record CallBranch(Optional<String> callingConvention, List<ParameterAttribute> returnAttributes,
                      Optional<AddressSpace> addressSpace, Type.Function functionType, String functionName,
                      List<CallArgument> arguments, Value fallthroughDestination, List<Value> indirectDestinations,
                      List<String> functionAttributes) implements Terminator {
        public CallBranch {
            Objects.requireNonNull(callingConvention, "callingConvention");
            returnAttributes = List.copyOf(returnAttributes);
            Objects.requireNonNull(addressSpace, "addressSpace");
            Objects.requireNonNull(functionType, "functionType");
            Objects.requireNonNull(functionName, "functionName");
            arguments = List.copyOf(arguments);
            Objects.requireNonNull(fallthroughDestination, "fallthroughDestination");
            indirectDestinations = List.copyOf(indirectDestinations);
            functionAttributes = List.copyOf(functionAttributes);
        }

        @Override public String opcode() { return "callbr"; }

        @Override
        public List<Value> operands() {
            List<Value> all = argumentValues(arguments);
            all.add(fallthroughDestination);
            all.addAll(indirectDestinations);
            return List.copyOf(all);
        }

        @Override
        public List<Value> successors() {
            List<Value> all = new ArrayList<>();
            all.add(fallthroughDestination);
            all.addAll(indirectDestinations);
            return List.copyOf(all);
        }
    }

    /** {@code resume}: continues propagating an in-flight exception. */
    record Resume(Value exception) implements Terminator {
        public Resume {
            Objects.requireNonNull(exception, "exception");
        }

        @Override public String opcode() { return "resume"; }

        @Override
        public List<Value> operands() {
            return List.of(exception);
        }

        @Override
        public List<Value> successors() {
            return List.of();
        }
    }

    /**
     * {@code catchswitch}
     * @param parentPad The parent pad token, or the {@code none} token.
     * @param handlers The handler labels.
     * @param unwindDestination The unwind label; empty when unwinding to the caller.
     */
    record CatchSwitch(Value parentPad, List<Value> handlers, Optional<Value> unwindDestination) implements Terminator {
        public CatchSwitch {
            Objects.requireNonNull(parentPad, "parentPad");
            handlers = List.copyOf(handlers);
            Objects.requireNonNull(unwindDestination, "unwindDestination");
        }

        @Override public String opcode() { return "catchswitch"; }

        @Override
        public List<Value> operands() {
            List<Value> all = new ArrayList<>();
            all.add(parentPad);
            all.addAll(successors());
            return List.copyOf(all);
        }

        @Override
        public List<Value> successors() {
            List<Value> all = new ArrayList<>(handlers);
            unwindDestination.ifPresent(all::add);
            return List.copyOf(all);
        }
    }

    /** {@code catchret from %pad to label %dest} */
    record CatchReturn(Value fromPad, Value destination) implements Terminator {
        public CatchReturn {
            Objects.requireNonNull(fromPad, "fromPad");
            Objects.requireNonNull(destination, "destination");
        }

        @Override public String opcode() { return "catchret"; }

        @Override
        public List<Value> operands() {
            return List.of(fromPad, destination);
        }

        @Override
        public List<Value> successors() {
            return List.of(destination);
        }
    }

    /** {@code cleanupret from %pad unwind label %dest|to caller} */
    record CleanupReturn(Value fromPad, Optional<Value> unwindDestination) implements Terminator {
        public CleanupReturn {
            Objects.requireNonNull(fromPad, "fromPad");
            Objects.requireNonNull(unwindDestination, "unwindDestination");
        }

        @Override public String opcode() { return "cleanupret"; }

        @Override
        public List<Value> operands() {
            List<Value> all = new ArrayList<>();
            all.add(fromPad);
            unwindDestination.ifPresent(all::add);
            return List.copyOf(all);
        }

        @Override
        public List<Value> successors() {
            return unwindDestination.map(List::of).orElse(List.of());
        }
    }

    /** {@code unreachable} */
    record Unreachable() implements Terminator {
        @Override public String opcode() { return "unreachable"; }

        @Override
        public List<Value> operands() {
            return List.of();
        }

        @Override
        public List<Value> successors() {
            return List.of();
        }
    }

    private static List<Value> argumentValues(List<CallArgument> arguments) {
        List<Value> values = new ArrayList<>(arguments.size() + 2);
        for (CallArgument argument : arguments) {
            values.add(argument.value());
        }
        return values;
    }
}
