package org.llfront.ir.instructions;

import org.llfront.ir.types.AddressSpace;
import org.llfront.ir.types.AggregateTypes;
import org.llfront.ir.types.ParameterAttribute;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A non-terminating instruction. Constructing an instruction never executes it, and
 * operand types are not cross-checked here; that is the job of a verifier.
 * <p>
 * Every variant knows the type of the value it produces ({@link #resultType()}),
 * its operands in textual order ({@link #operands()}) and its opcode mnemonic.
 */
public sealed interface Instruction {

    /**
     * @return The opcode mnemonic as written in the textual IR, e.g. {@code add}.
     */
    String opcode();

    /**
     * @return The type of the value this instruction produces; {@code void} for instructions that produce none.
     */
    Type resultType();

    /**
     * @return The value operands in textual order.
     */
    List<Value> operands();

    // region Binary operations

    /**
     * An instruction with two operands of the same type whose result has that type as well.
     */
    sealed interface BinaryOperation extends Instruction {
        Value leftHandSide();

        Value rightHandSide();

        @Override
        default Type resultType() {
            return leftHandSide().type();
        }

        @Override
        default List<Value> operands() {
            return List.of(leftHandSide(), rightHandSide());
        }
    }

    /** {@code add [nuw] [nsw]} */
    record Add(Value leftHandSide, Value rightHandSide, AllowedWrapping allowedWrapping) implements BinaryOperation {
        public Add {
            requireOperands(leftHandSide, rightHandSide);
            Objects.requireNonNull(allowedWrapping, "allowedWrapping");
        }

        @Override public String opcode() { return "add"; }
    }

    /** {@code sub [nuw] [nsw]} */
    record Subtract(Value leftHandSide, Value rightHandSide, AllowedWrapping allowedWrapping) implements BinaryOperation {
        public Subtract {
            requireOperands(leftHandSide, rightHandSide);
            Objects.requireNonNull(allowedWrapping, "allowedWrapping");
        }

        @Override public String opcode() { return "sub"; }
    }

    /** {@code mul [nuw] [nsw]} */
    record Multiply(Value leftHandSide, Value rightHandSide, AllowedWrapping allowedWrapping) implements BinaryOperation {
        public Multiply {
            requireOperands(leftHandSide, rightHandSide);
            Objects.requireNonNull(allowedWrapping, "allowedWrapping");
        }

        @Override public String opcode() { return "mul"; }
    }

    /** {@code udiv [exact]} */
    record UnsignedDivide(Value leftHandSide, Value rightHandSide, boolean isExact) implements BinaryOperation {
        public UnsignedDivide {
            requireOperands(leftHandSide, rightHandSide);
        }

        @Override public String opcode() { return "udiv"; }
    }

    /** {@code sdiv [exact]} */
    record SignedDivide(Value leftHandSide, Value rightHandSide, boolean isExact) implements BinaryOperation {
        public SignedDivide {
            requireOperands(leftHandSide, rightHandSide);
        }

        @Override public String opcode() { return "sdiv"; }
    }

    /** {@code urem} */
    record UnsignedRemainder(Value leftHandSide, Value rightHandSide) implements BinaryOperation {
        public UnsignedRemainder {
            requireOperands(leftHandSide, rightHandSide);
        }

        @Override public String opcode() { return "urem"; }
    }

    /** {@code srem} */
    record SignedRemainder(Value leftHandSide, Value rightHandSide) implements BinaryOperation {
        public SignedRemainder {
            requireOperands(leftHandSide, rightHandSide);
        }

        @Override public String opcode() { return "srem"; }
    }

    /** {@code shl [nuw] [nsw]} */
    record ShiftLeft(Value leftHandSide, Value rightHandSide, AllowedWrapping allowedWrapping) implements BinaryOperation {
        public ShiftLeft {
            requireOperands(leftHandSide, rightHandSide);
            Objects.requireNonNull(allowedWrapping, "allowedWrapping");
        }

        @Override public String opcode() { return "shl"; }
    }

    /** {@code lshr [exact]} */
    record LogicalShiftRight(Value leftHandSide, Value rightHandSide, boolean isExact) implements BinaryOperation {
        public LogicalShiftRight {
            requireOperands(leftHandSide, rightHandSide);
        }

        @Override public String opcode() { return "lshr"; }
    }

    /** {@code ashr [exact]} */
    record ArithmeticShiftRight(Value leftHandSide, Value rightHandSide, boolean isExact) implements BinaryOperation {
        public ArithmeticShiftRight {
            requireOperands(leftHandSide, rightHandSide);
        }

        @Override public String opcode() { return "ashr"; }
    }

    /** {@code and} */
    record And(Value leftHandSide, Value rightHandSide) implements BinaryOperation {
        public And {
            requireOperands(leftHandSide, rightHandSide);
        }

        @Override public String opcode() { return "and"; }
    }

    /**
     * {@code or [disjoint]}. The disjoint flag asserts that the operands share no set bits;
     * the result is poison otherwise. It is an annotation, not a checked invariant.
     */
    record Or(Value leftHandSide, Value rightHandSide, boolean isDisjoint) implements BinaryOperation {
        public Or {
            requireOperands(leftHandSide, rightHandSide);
        }

        @Override public String opcode() { return "or"; }
    }

    /** {@code xor} */
    record ExclusiveOr(Value leftHandSide, Value rightHandSide) implements BinaryOperation {
        public ExclusiveOr {
            requireOperands(leftHandSide, rightHandSide);
        }

        @Override public String opcode() { return "xor"; }
    }

    // endregion

    // region Aggregate operations

    /**
     * {@code extractvalue}: reads a member of a structure or array value.
     * @param aggregate The aggregate value.
     * @param indices The constant index path into the aggregate; it must lead into the aggregate's type.
     */
    record ExtractValue(Value aggregate, List<Long> indices) implements Instruction {
        public ExtractValue {
            Objects.requireNonNull(aggregate, "aggregate");
            indices = List.copyOf(indices);
            requireValidPath(aggregate, indices);
        }

        @Override public String opcode() { return "extractvalue"; }

        @Override
        public Type resultType() {
            return AggregateTypes.typeAt(aggregate.type(), indices).orElseThrow();
        }

        @Override
        public List<Value> operands() {
            return List.of(aggregate);
        }
    }

    /**
     * {@code insertvalue}: produces a copy of an aggregate with one member replaced.
     * @param aggregate The aggregate value.
     * @param element The new member value.
     * @param indices The constant index path of the member; it must lead into the aggregate's type.
     */
    record InsertValue(Value aggregate, Value element, List<Long> indices) implements Instruction {
        public InsertValue {
            Objects.requireNonNull(aggregate, "aggregate");
            Objects.requireNonNull(element, "element");
            indices = List.copyOf(indices);
            requireValidPath(aggregate, indices);
        }

        @Override public String opcode() { return "insertvalue"; }

        @Override
        public Type resultType() {
            return aggregate.type();
        }

        @Override
        public List<Value> operands() {
            return List.of(aggregate, element);
        }
    }

    // endregion

    // region Memory operations

    /**
     * {@code alloca}: reserves stack memory in the current frame.
     * @param canReuse Whether the allocation carries the {@code inalloca} marker.
     * @param allocatedType The type of each allocated element.
     * @param count The number of elements, if written.
     * @param alignment The alignment in bytes, if written.
     * @param addressSpace The address space of the result, if written.
     */
    record StackAllocate(boolean canReuse, Type allocatedType, Optional<Value> count,
                         OptionalLong alignment, Optional<AddressSpace> addressSpace) implements Instruction {
        public StackAllocate {
            Objects.requireNonNull(allocatedType, "allocatedType");
            Objects.requireNonNull(count, "count");
            Objects.requireNonNull(alignment, "alignment");
            Objects.requireNonNull(addressSpace, "addressSpace");
        }

        @Override public String opcode() { return "alloca"; }

        @Override
        public Type resultType() {
            return new Type.Pointer(addressSpace.orElse(AddressSpace.DEFAULT));
        }

        @Override
        public List<Value> operands() {
            return count.map(List::of).orElse(List.of());
        }
    }

    /**
     * {@code load [volatile]}
     * @param isVolatile Whether the load is volatile.
     * @param resultType The loaded type.
     * @param pointer The address to load from.
     * @param alignment The alignment in bytes, if written.
     */
    record Load(boolean isVolatile, Type resultType, Value pointer, OptionalLong alignment) implements Instruction {
        public Load {
            Objects.requireNonNull(resultType, "resultType");
            Objects.requireNonNull(pointer, "pointer");
            Objects.requireNonNull(alignment, "alignment");
        }

        @Override public String opcode() { return "load"; }

        @Override
        public List<Value> operands() {
            return List.of(pointer);
        }
    }

    /**
     * {@code load atomic [volatile]}
     * @param isVolatile Whether the load is volatile.
     * @param resultType The loaded type.
     * @param pointer The address to load from.
     * @param ordering The memory ordering.
     * @param syncScope The synchronisation scope, if not the whole system.
     * @param alignment The alignment in bytes; mandatory for atomic loads.
     */
    record AtomicLoad(boolean isVolatile, Type resultType, Value pointer, AtomicOrdering ordering,
                      Optional<String> syncScope, long alignment) implements Instruction {
        public AtomicLoad {
            Objects.requireNonNull(resultType, "resultType");
            Objects.requireNonNull(pointer, "pointer");
            Objects.requireNonNull(ordering, "ordering");
            Objects.requireNonNull(syncScope, "syncScope");
        }

        @Override public String opcode() { return "load"; }

        @Override
        public List<Value> operands() {
            return List.of(pointer);
        }
    }

    /**
     * {@code store [volatile]}
     * @param isVolatile Whether the store is volatile.
     * @param value The stored value.
     * @param pointer The address to store to.
     * @param alignment The alignment in bytes, if written.
     */
    record Store(boolean isVolatile, Value value, Value pointer, OptionalLong alignment) implements Instruction {
        public Store {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(pointer, "pointer");
            Objects.requireNonNull(alignment, "alignment");
        }

        @Override public String opcode() { return "store"; }

        @Override
        public Type resultType() {
            return new Type.Void();
        }

        @Override
        public List<Value> operands() {
            return List.of(value, pointer);
        }
    }

    /**
     * {@code store atomic [volatile]}
     * @param isVolatile Whether the store is volatile.
     * @param value The stored value.
     * @param pointer The address to store to.
     * @param ordering The memory ordering.
     * @param syncScope The synchronisation scope, if not the whole system.
     * @param alignment The alignment in bytes; mandatory for atomic stores.
     */
    record AtomicStore(boolean isVolatile, Value value, Value pointer, AtomicOrdering ordering,
                       Optional<String> syncScope, long alignment) implements Instruction {
        public AtomicStore {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(pointer, "pointer");
            Objects.requireNonNull(ordering, "ordering");
            Objects.requireNonNull(syncScope, "syncScope");
        }

        @Override public String opcode() { return "store"; }

        @Override
        public Type resultType() {
            return new Type.Void();
        }

        @Override
        public List<Value> operands() {
            return List.of(value, pointer);
        }
    }

    /**
     * {@code fence}
     * @param ordering The memory ordering.
     * @param syncScope The synchronisation scope, if not the whole system.
     */
    record Fence(AtomicOrdering ordering, Optional<String> syncScope) implements Instruction {
        public Fence {
            Objects.requireNonNull(ordering, "ordering");
            Objects.requireNonNull(syncScope, "syncScope");
        }

        @Override public String opcode() { return "fence"; }

        @Override
        public Type resultType() {
            return new Type.Void();
        }

        @Override
        public List<Value> operands() {
            return List.of();
        }
    }

    /**
     * {@code getelementptr}: address computation into an aggregate.
     * @param kind The bounds constraint.
     * @param sourceElementType The type the base pointer is indexed as.
     * @param pointer The base pointer, or vector of pointers.
     * @param indices The indices.
     */
    record GetElementPointer(GetPointerKind kind, Type sourceElementType, Value pointer, List<Value> indices) implements Instruction {
        public GetElementPointer {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(sourceElementType, "sourceElementType");
            Objects.requireNonNull(pointer, "pointer");
            indices = List.copyOf(indices);
        }

        @Override public String opcode() { return "getelementptr"; }

        /**
         * A pointer in the base pointer's address space. If the base or any index is a vector
         * the result is a vector of such pointers of the same length.
         */
        @Override
        public Type resultType() {
            Type base = pointer.type();
            if (base instanceof Type.Vector vector) {
                return vector;
            }
            AddressSpace addressSpace = base instanceof Type.Pointer p ? p.addressSpace() : AddressSpace.DEFAULT;
            Type.Pointer result = new Type.Pointer(addressSpace);
            for (Value index : indices) {
                if (index.type() instanceof Type.Vector vector) {
                    return new Type.Vector(vector.length(), result, vector.isScalable());
                }
            }
            return result;
        }

        @Override
        public List<Value> operands() {
            List<Value> all = new ArrayList<>(indices.size() + 1);
            all.add(pointer);
            all.addAll(indices);
            return List.copyOf(all);
        }
    }

    // endregion

    // region Conversions

    /**
     * An instruction converting one value to a target type.
     */
    sealed interface Conversion extends Instruction {
        Value value();

        Type newType();

        @Override
        default Type resultType() {
            return newType();
        }

        @Override
        default List<Value> operands() {
            return List.of(value());
        }
    }

    /** {@code trunc [nuw] [nsw] .. to ..} */
    record Truncate(AllowedWrapping allowedWrapping, Value value, Type newType) implements Conversion {
        public Truncate {
            Objects.requireNonNull(allowedWrapping, "allowedWrapping");
            requireConversion(value, newType);
        }

        @Override public String opcode() { return "trunc"; }
    }

    /** {@code zext .. to ..} */
    record ZeroExtend(Value value, Type newType) implements Conversion {
        public ZeroExtend {
            requireConversion(value, newType);
        }

        @Override public String opcode() { return "zext"; }
    }

    /** {@code sext .. to ..} */
    record SignExtend(Value value, Type newType) implements Conversion {
        public SignExtend {
            requireConversion(value, newType);
        }

        @Override public String opcode() { return "sext"; }
    }

    /** {@code ptrtoint .. to ..} */
    record PointerToInteger(Value value, Type newType) implements Conversion {
        public PointerToInteger {
            requireConversion(value, newType);
        }

        @Override public String opcode() { return "ptrtoint"; }
    }

    /** {@code inttoptr .. to ..} */
    record IntegerToPointer(Value value, Type newType) implements Conversion {
        public IntegerToPointer {
            requireConversion(value, newType);
        }

        @Override public String opcode() { return "inttoptr"; }
    }

    /** {@code bitcast .. to ..} */
    record BitCast(Value value, Type newType) implements Conversion {
        public BitCast {
            requireConversion(value, newType);
        }

        @Override public String opcode() { return "bitcast"; }
    }

    /** {@code addrspacecast .. to ..} */
    record AddressSpaceCast(Value value, Type newType) implements Conversion {
        public AddressSpaceCast {
            requireConversion(value, newType);
        }

        @Override public String opcode() { return "addrspacecast"; }
    }

    // endregion

    // region Other operations

    /**
     * {@code icmp}. Yields {@code i1}, or a vector of {@code i1} of the operands' length and
     * scalability when the operands are vectors.
     */
    record CompareIntegers(IntegerComparison comparison, Value leftHandSide, Value rightHandSide) implements Instruction {
        public CompareIntegers {
            Objects.requireNonNull(comparison, "comparison");
            requireOperands(leftHandSide, rightHandSide);
        }

        @Override public String opcode() { return "icmp"; }

        @Override
        public Type resultType() {
            Type bool = Type.integer(1);
            if (leftHandSide.type() instanceof Type.Vector vector) {
                return new Type.Vector(vector.length(), bool, vector.isScalable());
            }
            return bool;
        }

        @Override
        public List<Value> operands() {
            return List.of(leftHandSide, rightHandSide);
        }
    }

    /** {@code select} */
    record Select(Value condition, Value trueValue, Value falseValue) implements Instruction {
        public Select {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(trueValue, "trueValue");
            Objects.requireNonNull(falseValue, "falseValue");
        }

        @Override public String opcode() { return "select"; }

        @Override
        public Type resultType() {
            return trueValue.type();
        }

        @Override
        public List<Value> operands() {
            return List.of(condition, trueValue, falseValue);
        }
    }

    /** {@code freeze} */
    record Freeze(Value value) implements Instruction {
        public Freeze {
            Objects.requireNonNull(value, "value");
        }

        @Override public String opcode() { return "freeze"; }

        @Override
        public Type resultType() {
            return value.type();
        }

        @Override
        public List<Value> operands() {
            return List.of(value);
        }
    }

    /**
     * {@code call}
     * @param tailCallHint The tail call marker.
     * @param callingConvention The calling convention keyword, if written (e.g. {@code fastcc} or {@code cc 10}).
     * @param returnAttributes Attributes of the return value.
     * @param addressSpace The program address space of the callee, if written.
     * @param functionType The signature of the callee.
     * @param functionName The sigil-qualified callee name, e.g. {@code @puts} or {@code %fptr}.
     * @param arguments The arguments, in order.
     * @param functionAttributes Function attributes and attribute group references written after the arguments.
     */
    record Call(TailCallHint tailCallHint, Optional<String> callingConvention, List<ParameterAttribute> returnAttributes,
                Optional<AddressSpace> addressSpace, Type.Function functionType, String functionName,
                List<CallArgument> arguments, List<String> functionAttributes) implements Instruction {
        public Call {
            Objects.requireNonNull(tailCallHint, "tailCallHint");
            Objects.requireNonNull(callingConvention, "callingConvention");
            returnAttributes = List.copyOf(returnAttributes);
            Objects.requireNonNull(addressSpace, "addressSpace");
            Objects.requireNonNull(functionType, "functionType");
            Objects.requireNonNull(functionName, "functionName");
            arguments = List.copyOf(arguments);
            functionAttributes = List.copyOf(functionAttributes);
        }

        @Override public String opcode() { return "call"; }

        @Override
        public Type resultType() {
            return functionType.returnType();
        }

        @Override
        public List<Value> operands() {
            List<Value> values = new ArrayList<>(arguments.size());
            for (CallArgument argument : arguments) {
                values.add(argument.value());
            }
            return List.copyOf(values);
        }
    }

    // endregion

    private static void requireOperands(Value leftHandSide, Value rightHandSide) {
        Objects.requireNonNull(leftHandSide, "leftHandSide");
        Objects.requireNonNull(rightHandSide, "rightHandSide");
    }

    private static void requireConversion(Value value, Type newType) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(newType, "newType");
    }

    private static void requireValidPath(Value aggregate, List<Long> indices) {
        if (AggregateTypes.typeAt(aggregate.type(), indices).isEmpty()) {
            throw new IllegalArgumentException("Index path " + indices + " does not lead into " + aggregate.type());
        }
    }
}
