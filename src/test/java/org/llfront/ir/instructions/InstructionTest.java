package org.llfront.ir.instructions;

import org.llfront.ir.types.AddressSpace;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Constant;
import org.llfront.ir.values.Value;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the result types and operand lists of instructions and terminators.
 */
@Tag("unit")
public class InstructionTest {

    private static final Value PTR = new Value.FromIdentifier(Type.pointer(), "%p");
    private static final Value I32_ONE = new Value.FromConstant(Type.integer(32), Constant.Integer.of(1));

    @Test
    void testMemoryInstructionResults() {
        // Arrange
        Instruction alloca = new Instruction.StackAllocate(false, Type.integer(8), Optional.empty(),
                OptionalLong.empty(), Optional.empty());
        Instruction load = new Instruction.Load(false, Type.integer(32), PTR, OptionalLong.empty());
        Instruction store = new Instruction.Store(false, I32_ONE, PTR, OptionalLong.of(4));
        Instruction fence = new Instruction.Fence(AtomicOrdering.ACQUIRE, Optional.empty());

        // Act & Assert
        assertThat(alloca.resultType()).isEqualTo(new Type.Pointer(AddressSpace.DEFAULT));
        assertThat(load.resultType()).isEqualTo(Type.integer(32));
        assertThat(load.operands()).containsExactly(PTR);
        assertThat(store.resultType()).isEqualTo(new Type.Void());
        assertThat(store.operands()).containsExactly(I32_ONE, PTR);
        assertThat(fence.operands()).isEmpty();
    }

    @Test
    void testAggregatePathsAreChecked() {
        // Arrange
        Value aggregate = new Value.FromIdentifier(new Type.Structure(List.of(Type.integer(8), Type.pointer()), false), "%s");

        // Act & Assert
        assertThat(new Instruction.ExtractValue(aggregate, List.of(1L)).resultType()).isEqualTo(Type.pointer());
        assertThat(new Instruction.InsertValue(aggregate, PTR, List.of(1L)).resultType()).isEqualTo(aggregate.type());
        assertThatThrownBy(() -> new Instruction.ExtractValue(aggregate, List.of(2L)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Instruction.ExtractValue(aggregate, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testGetElementPointerOverVectorOfPointers() {
        // Arrange
        Value pointers = new Value.FromIdentifier(new Type.Vector(2, Type.pointer(), true), "%ps");

        // Act
        Instruction gep = new Instruction.GetElementPointer(GetPointerKind.REGULAR, Type.integer(8), pointers,
                List.of(new Value.FromConstant(Type.integer(64), Constant.Integer.of(1))));

        // Assert
        assertThat(gep.resultType()).isEqualTo(new Type.Vector(2, Type.pointer(), true));
        assertThat(gep.operands()).hasSize(2);
    }

    @Test
    void testCallResultAndOperands() {
        // Arrange
        Instruction call = new Instruction.Call(TailCallHint.INDIFFERENT, Optional.empty(), List.of(), Optional.empty(),
                new Type.Function(new Type.Void(), List.of(Type.pointer()), false), "@free",
                List.of(CallArgument.of(PTR)), List.of());

        // Act & Assert
        assertThat(call.opcode()).isEqualTo("call");
        assertThat(call.resultType()).isEqualTo(new Type.Void());
        assertThat(call.operands()).containsExactly(PTR);
    }

    @Test
    void testComparisonKeywords() {
        assertThat(IntegerComparison.fromKeyword("uge")).contains(IntegerComparison.UNSIGNED_GREATER_OR_EQUAL);
        assertThat(IntegerComparison.SIGNED_LESS_THAN.isSigned()).isTrue();
        assertThat(IntegerComparison.EQUAL.isSigned()).isFalse();
    }

    @Test
    void testTerminatorSuccessors() {
        // Arrange
        Value exit = new Value.FromLabel("%exit");
        Value loop = new Value.FromLabel("%loop");
        Value condition = new Value.FromIdentifier(Type.integer(1), "%c");

        // Act & Assert
        assertThat(Terminator.Return.ofVoid().operands()).isEmpty();
        assertThat(Terminator.Return.ofVoid().successors()).isEmpty();
        assertThat(new Terminator.Return(I32_ONE).operands()).containsExactly(I32_ONE);
        assertThat(new Terminator.ConditionalBranch(condition, loop, exit).successors()).containsExactly(loop, exit);
        assertThat(new Terminator.ConditionalBranch(condition, loop, exit).operands()).containsExactly(condition, loop, exit);
        assertThat(new Terminator.Switch(I32_ONE, exit, List.of(new SwitchCase(I32_ONE, loop))).successors())
                .containsExactly(exit, loop);
        assertThat(new Terminator.Unreachable().operands()).isEmpty();
    }

    /**
     * The exception-handling terminators list their labels as successors and every value as an operand.
     */
    @Test
    void testExceptionHandlingTerminators() {
        // Arrange
        Value ok = new Value.FromLabel("%ok");
        Value bad = new Value.FromLabel("%bad");
        Value pad = new Value.FromIdentifier(new Type.Token(), "%pad");
        Value none = new Value.FromConstant(new Type.Token(), new Constant.NoneToken());
        Value x = new Value.FromIdentifier(Type.integer(32), "%x");
        Type.Function signature = new Type.Function(Type.integer(32), List.of(Type.integer(32)), false);

        // Act
        Terminator.Invoke invoke = new Terminator.Invoke(Optional.empty(), List.of(), Optional.empty(), signature,
                "@f", List.of(CallArgument.of(x)), ok, bad, List.of());
        Terminator.CallBranch callBranch = new Terminator.CallBranch(Optional.empty(), List.of(), Optional.empty(),
                signature, "@g", List.of(CallArgument.of(x)), ok, List.of(bad), List.of());
        Terminator.CatchSwitch toCaller = new Terminator.CatchSwitch(none, List.of(ok), Optional.empty());
        Terminator.CatchSwitch unwinding = new Terminator.CatchSwitch(pad, List.of(ok), Optional.of(bad));

        // Assert
        assertThat(invoke.successors()).containsExactly(ok, bad);
        assertThat(invoke.operands()).containsExactly(x, ok, bad);
        assertThat(callBranch.successors()).containsExactly(ok, bad);
        assertThat(callBranch.operands()).containsExactly(x, ok, bad);
        assertThat(new Terminator.Resume(x).successors()).isEmpty();
        assertThat(new Terminator.Resume(x).operands()).containsExactly(x);
        assertThat(toCaller.successors()).containsExactly(ok);
        assertThat(toCaller.operands()).containsExactly(none, ok);
        assertThat(unwinding.successors()).containsExactly(ok, bad);
        assertThat(unwinding.operands()).containsExactly(pad, ok, bad);
        assertThat(new Terminator.CatchReturn(pad, ok).successors()).containsExactly(ok);
        assertThat(new Terminator.CatchReturn(pad, ok).operands()).containsExactly(pad, ok);
        assertThat(new Terminator.CleanupReturn(pad, Optional.empty()).successors()).isEmpty();
        assertThat(new Terminator.CleanupReturn(pad, Optional.of(bad)).successors()).containsExactly(bad);
    }
}
