package org.llfront.frontend.parser;

import org.llfront.IrParser;
import org.llfront.api.IrErrorCode;
import org.llfront.api.IrException;
import org.llfront.api.SyntaxErrorException;
import org.llfront.api.TypeMismatchException;
import org.llfront.api.UnsupportedConstructException;
import org.llfront.ir.function.BasicBlock;
import org.llfront.ir.function.Operation;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.instructions.TailCallHint;
import org.llfront.ir.instructions.Terminator;
import org.llfront.ir.types.AddressSpace;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Constant;
import org.llfront.ir.values.Value;
import org.llfront.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the block structure read by {@link IrParser#parseBasicBlock(String)}: labels, assignments,
 * the terminator rule and the errors raised for malformed blocks.
 */
@ExtendWith(LogWatchExtension.class)
public class BasicBlockParsingTest {

    private final IrParser parser = new IrParser();

    @Test
    @Tag("unit")
    @DisplayName("A call to puts followed by a return reads as a standalone call and a constant return")
    void testCallAndReturn() throws IrException {
        // Act
        BasicBlock block = parser.parseBasicBlock("call i32 @puts(ptr @.str)\nret i32 0");

        // Assert
        assertThat(block.name()).isEmpty();
        assertThat(block.operations()).hasSize(1);
        Operation operation = block.operations().get(0);
        assertThat(operation).isInstanceOf(Operation.Standalone.class);

        Instruction.Call call = (Instruction.Call) operation.instruction();
        assertThat(call.tailCallHint()).isEqualTo(TailCallHint.INDIFFERENT);
        assertThat(call.functionName()).isEqualTo("@puts");
        assertThat(call.functionType()).isEqualTo(new Type.Function(new Type.Integer(32), List.of(Type.pointer()), false));
        assertThat(call.arguments()).singleElement()
                .satisfies(argument -> assertThat(argument.value()).isEqualTo(new Value.FromGlobal("@.str", AddressSpace.DEFAULT)));

        assertThat(block.terminator()).isEqualTo(
                new Terminator.Return(new Value.FromConstant(new Type.Integer(32), Constant.Integer.of(0))));
    }

    @Test
    @Tag("unit")
    void testLabelAndAssignments() throws IrException {
        // Act
        BasicBlock block = parser.parseBasicBlock(
                "loop:\n  %next = add nsw i32 %i, 1\n  %done = icmp eq i32 %next, %n\n  br i1 %done, label %exit, label %loop");

        // Assert
        assertThat(block.name()).contains("loop");
        assertThat(block.operations()).extracting(op -> ((Operation.Assignment) op).identifier())
                .containsExactly("%next", "%done");
        assertThat(block.terminator()).isEqualTo(new Terminator.ConditionalBranch(
                new Value.FromIdentifier(new Type.Integer(1), "%done"),
                new Value.FromLabel("%exit"), new Value.FromLabel("%loop")));
    }

    /**
     * Names are not resolved when a block is read on its own, so an unknown name is accepted.
     */
    @Test
    @Tag("unit")
    void testLocalNamesAreNotResolvedForStandaloneBlocks() throws IrException {
        // Act
        BasicBlock block = parser.parseBasicBlock("ret ptr %nowhere");

        // Assert
        assertThat(block.terminator()).isEqualTo(new Terminator.Return(new Value.FromIdentifier(Type.pointer(), "%nowhere")));
    }

    @Test
    @Tag("unit")
    void testNumberedLabel() throws IrException {
        // Act
        BasicBlock block = parser.parseBasicBlock("7:\n  unreachable");

        // Assert
        assertThat(block.name()).isEqualTo(Optional.of("7"));
        assertThat(block.terminator()).isInstanceOf(Terminator.Unreachable.class);
    }

    @Test
    @Tag("unit")
    void testAssigningAVoidResultIsRejected() {
        assertThatThrownBy(() -> parser.parseBasicBlock("%x = store i32 0, ptr %p\nret void"))
                .isInstanceOfSatisfying(SyntaxErrorException.class, e -> {
                    assertThat(e.code()).isEqualTo(IrErrorCode.UNEXPECTED_TOKEN);
                    assertThat(e.sourceInfo()).get().hasToString("<memory>:1:1");
                });
    }

    @Test
    @Tag("unit")
    void testAssigningATerminatorIsRejected() {
        assertThatThrownBy(() -> parser.parseBasicBlock("%x = ret void"))
                .isInstanceOfSatisfying(SyntaxErrorException.class, e -> assertThat(e.code()).isEqualTo(IrErrorCode.UNEXPECTED_TOKEN));
    }

    @Test
    @Tag("unit")
    void testMissingTerminatorIsRejected() {
        assertThatThrownBy(() -> parser.parseBasicBlock("%a = add i32 1, 2"))
                .isInstanceOfSatisfying(SyntaxErrorException.class, e -> {
                    assertThat(e.code()).isEqualTo(IrErrorCode.UNEXPECTED_TOKEN);
                    assertThat(e.found()).isEqualTo("end of input");
                });
    }

    @Test
    @Tag("unit")
    void testOperationsAfterTheTerminatorAreRejected() {
        assertThatThrownBy(() -> parser.parseBasicBlock("ret void\nunreachable"))
                .isInstanceOfSatisfying(SyntaxErrorException.class, e -> {
                    assertThat(e.code()).isEqualTo(IrErrorCode.UNEXPECTED_TOKEN);
                    assertThat(e.sourceInfo()).get().hasToString("<memory>:2:1");
                });
    }

    @Test
    @Tag("unit")
    void testUnknownOpcodeIsRejected() {
        assertThatThrownBy(() -> parser.parseBasicBlock("%x = frobnicate i32 1\nret void"))
                .isInstanceOfSatisfying(SyntaxErrorException.class, e -> {
                    assertThat(e.code()).isEqualTo(IrErrorCode.UNEXPECTED_TOKEN);
                    assertThat(e.expected()).isEqualTo("an opcode");
                });
    }

    @Test
    @Tag("unit")
    void testKnownButUnsupportedOpcodes() {
        assertThatThrownBy(() -> parser.parseBasicBlock("%x = phi i32 [ 0, %a ], [ 1, %b ]\nret void"))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessageContaining("phi");
        assertThatThrownBy(() -> parser.parseBasicBlock("%x = fadd float 1.0, 2.0\nret void"))
                .isInstanceOf(UnsupportedConstructException.class);
        assertThatThrownBy(() -> parser.parseBasicBlock("resume { ptr, i32 } %lp"))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessageContaining("resume");
    }

    @Test
    @Tag("unit")
    void testMetadataAttachmentIsUnsupported() {
        assertThatThrownBy(() -> parser.parseBasicBlock("ret void, !dbg !0"))
                .isInstanceOfSatisfying(UnsupportedConstructException.class,
                        e -> assertThat(e.code()).isEqualTo(IrErrorCode.UNSUPPORTED_CONSTRUCT));
    }

    /**
     * Verifies that an ill-typed literal is reported where the literal is written.
     */
    @Test
    @Tag("unit")
    void testIllTypedLiteralIsReportedAtItsPosition() {
        assertThatThrownBy(() -> parser.parseBasicBlock("ret i32 true"))
                .isInstanceOfSatisfying(TypeMismatchException.class, e -> {
                    assertThat(e.code()).isEqualTo(IrErrorCode.TYPE_MISMATCH);
                    assertThat(e.expectedType()).isEqualTo(new Type.Integer(32));
                    assertThat(e.constant()).isEqualTo(new Constant.Boolean(true));
                    assertThat(e.sourceInfo()).get().hasToString("<memory>:1:9");
                });
    }

    @Test
    @Tag("unit")
    void testLexicalErrorAbortsParsing() {
        assertThatThrownBy(() -> parser.parseBasicBlock("ret i32 ^"))
                .isInstanceOfSatisfying(IrException.class, e -> {
                    assertThat(e.code()).isEqualTo(IrErrorCode.UNEXPECTED_CHARACTER);
                    assertThat(e.sourceInfo()).get().hasToString("<memory>:1:9");
                });
    }

    @Test
    @Tag("unit")
    void testOversizedNumberedNamesAreSyntaxErrors() {
        assertThatThrownBy(() -> parser.parseBasicBlock("ret i32 %99999999999999999999"))
                .isInstanceOfSatisfying(SyntaxErrorException.class, e -> {
                    assertThat(e.code()).isEqualTo(IrErrorCode.INVALID_NUMBER);
                    assertThat(e.sourceInfo()).get().hasToString("<memory>:1:9");
                });
        assertThatThrownBy(() -> parser.parseBasicBlock("ret ptr @99999999999999999999"))
                .isInstanceOfSatisfying(IrException.class, e -> assertThat(e.code()).isEqualTo(IrErrorCode.INVALID_NUMBER));
        assertThatThrownBy(() -> parser.parseBasicBlock("99999999999999999999:\nret void"))
                .isInstanceOfSatisfying(IrException.class, e -> assertThat(e.code()).isEqualTo(IrErrorCode.INVALID_NUMBER));
        assertThatThrownBy(() -> parser.parseFunction("define void @f() #99999999999999999999 {\n  ret void\n}"))
                .isInstanceOfSatisfying(IrException.class, e -> assertThat(e.code()).isEqualTo(IrErrorCode.INVALID_NUMBER));
    }
}
