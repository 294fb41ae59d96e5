package org.llfront.frontend.parser;

import org.llfront.IrParser;
import org.llfront.api.IrErrorCode;
import org.llfront.api.IrException;
import org.llfront.api.SyntaxErrorException;
import org.llfront.api.UnsupportedConstructException;
import org.llfront.ir.function.BasicBlock;
import org.llfront.ir.function.Function;
import org.llfront.ir.function.FunctionParameter;
import org.llfront.ir.function.LinkageType;
import org.llfront.ir.function.PreemptionSpecifier;
import org.llfront.ir.function.UnnamedAddress;
import org.llfront.ir.function.Visibility;
import org.llfront.ir.instructions.Terminator;
import org.llfront.ir.print.IrPrinter;
import org.llfront.ir.types.AddressSpace;
import org.llfront.ir.types.ParameterAttribute;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Value;
import org.llfront.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains tests for {@link IrParser#parseFunction(String)}: the definition header,
 * forward references between blocks and the numbering of unnamed values.
 */
@ExtendWith(LogWatchExtension.class)
public class FunctionParsingTest {

    private static final String MAX = String.join("\n",
            "define dso_local i32 @max(i32 %a, i32 %b) #0 {",
            "entry:",
            "  %cmp = icmp sgt i32 %a, %b",
            "  br i1 %cmp, label %then, label %exit",
            "",
            "then:",
            "  br label %exit",
            "",
            "exit:",
            "  ret i32 %a",
            "}");

    private final IrParser parser = new IrParser();

    private static IrErrorCode codeOf(IrParser parser, String source) {
        try {
            parser.parseFunction(source);
        } catch (IrException e) {
            return e.code();
        }
        throw new AssertionError("Expected a parse error for: " + source);
    }

    @Test
    @Tag("unit")
    void testHeaderWithEveryClause() throws IrException {
        // Act
        Function function = parser.parseFunction(
                "define internal dso_local hidden fastcc noundef i32 @f(ptr noundef %p, ...) local_unnamed_addr "
                        + "addrspace(1) nounwind \"frame-pointer\"=\"all\" section \".text.f\" partition \"part\" "
                        + "align 16 gc \"shadow-stack\" {\n  ret i32 0\n}");

        // Assert
        assertThat(function.linkage()).isEqualTo(LinkageType.INTERNAL);
        assertThat(function.preemptionSpecifier()).isEqualTo(PreemptionSpecifier.LOCAL);
        assertThat(function.visibility()).isEqualTo(Visibility.HIDDEN);
        assertThat(function.callingConvention()).contains("fastcc");
        assertThat(function.returnAttributes()).extracting(ParameterAttribute::kind)
                .containsExactly(ParameterAttribute.Kind.NOUNDEF);
        assertThat(function.name()).isEqualTo("@f");
        assertThat(function.parameters()).containsExactly(new FunctionParameter(Type.pointer(),
                List.of(new ParameterAttribute.Simple(ParameterAttribute.Kind.NOUNDEF)), Optional.of("%p")));
        assertThat(function.hasVarargs()).isTrue();
        assertThat(function.unnamedAddress()).isEqualTo(UnnamedAddress.LOCAL_UNNAMED_ADDR);
        assertThat(function.addressSpace()).contains(new AddressSpace.Numbered(1));
        assertThat(function.functionAttributes()).containsExactly("nounwind", "\"frame-pointer\"=\"all\"");
        assertThat(function.section()).contains(".text.f");
        assertThat(function.partition()).contains("part");
        assertThat(function.alignment()).isEqualTo(OptionalLong.of(16));
        assertThat(function.garbageCollector()).contains("shadow-stack");
        assertThat(function.type()).isEqualTo(new Type.Function(new Type.Integer(32), List.of(Type.pointer()), true));
    }

    @Test
    @Tag("unit")
    void testDefaultsWhenHeaderIsMinimal() throws IrException {
        // Act
        Function function = parser.parseFunction("define void @f() {\n  ret void\n}");

        // Assert
        assertThat(function.linkage()).isEqualTo(LinkageType.EXTERNAL);
        assertThat(function.preemptionSpecifier()).isEqualTo(PreemptionSpecifier.PREEMPTABLE);
        assertThat(function.visibility()).isEqualTo(Visibility.DEFAULT);
        assertThat(function.unnamedAddress()).isEqualTo(UnnamedAddress.NONE);
        assertThat(function.callingConvention()).isEmpty();
        assertThat(function.section()).isEmpty();
        assertThat(function.isGarbageCollected()).isFalse();
    }

    /**
     * Verifies that a branch may name blocks defined further down and that the labels resolve to those blocks.
     */
    @Test
    @Tag("unit")
    @DisplayName("Branches may refer to blocks that are defined later")
    void testForwardReferencesResolveToBlocks() throws IrException {
        // Act
        Function function = parser.parseFunction(MAX);

        // Assert
        List<BasicBlock> blocks = function.basicBlocks();
        assertThat(blocks).hasSize(3);
        BasicBlock entry = blocks.get(0);
        assertThat(function.labelOf(entry)).contains("entry");
        assertThat(function.resolveLabel(new Value.FromLabel("%exit"))).containsSame(blocks.get(2));
        assertThat(function.successorsOf(entry)).containsExactly(blocks.get(1), blocks.get(2));
        assertThat(function.successorsOf(blocks.get(2))).isEmpty();
        assertThat(function.functionAttributes()).containsExactly("#0");
    }

    @Test
    @Tag("unit")
    void testUnnamedParameterAndBlockTakeSlots() throws IrException {
        // Act
        Function function = parser.parseFunction("define i32 @g(i32) {\n  %2 = add i32 %0, 1\n  ret i32 %2\n}");

        // Assert
        assertThat(function.parameters().get(0).name()).isEmpty();
        assertThat(function.labelOf(function.basicBlocks().get(0))).contains("1");
        assertThat(function.basicBlocks().get(0).name()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testUnnamedNonVoidCallTakesASlot() throws IrException {
        // Act
        Function function = parser.parseFunction(
                "define void @h() {\n  call i32 @f()\n  call void @g()\n  %2 = add i32 %1, 1\n  ret void\n}");

        // Assert
        assertThat(function.basicBlocks().get(0).operations()).hasSize(3);
    }

    @Test
    @Tag("unit")
    void testBranchToImplicitlyNumberedBlock() throws IrException {
        // Act
        Function function = parser.parseFunction("define void @f() {\n  br label %1\n\n  ret void\n}");

        // Assert
        BasicBlock first = function.basicBlocks().get(0);
        BasicBlock second = function.basicBlocks().get(1);
        assertThat(function.labelOf(second)).contains("1");
        assertThat(function.successorsOf(first)).containsExactly(second);
    }

    @Test
    @Tag("unit")
    void testExplicitNumberedLabels() throws IrException {
        // Act
        Function function = parser.parseFunction("define void @f() {\n0:\n  br label %1\n1:\n  ret void\n}");

        // Assert
        assertThat(function.basicBlocks()).extracting(BasicBlock::name)
                .containsExactly(Optional.of("0"), Optional.of("1"));
    }

    @Test
    @Tag("unit")
    void testNumberingMismatch() {
        assertThatThrownBy(() -> parser.parseFunction("define i32 @g(i32) {\n  %3 = add i32 %0, 1\n  ret i32 %3\n}"))
                .isInstanceOfSatisfying(SyntaxErrorException.class, e -> {
                    assertThat(e.code()).isEqualTo(IrErrorCode.NUMBERING_MISMATCH);
                    assertThat(e.expected()).isEqualTo("%2");
                    assertThat(e.sourceInfo()).get().hasToString("<memory>:2:3");
                });
        assertThat(codeOf(parser, "define void @f() {\n5:\n  ret void\n}")).isEqualTo(IrErrorCode.NUMBERING_MISMATCH);
    }

    @Test
    @Tag("unit")
    void testDuplicateDefinition() {
        assertThatThrownBy(() -> parser.parseFunction(
                "define i32 @f(i32 %x) {\n  %x = add i32 %x, 1\n  ret i32 %x\n}"))
                .isInstanceOfSatisfying(SyntaxErrorException.class, e -> {
                    assertThat(e.code()).isEqualTo(IrErrorCode.DUPLICATE_DEFINITION);
                    assertThat(e.getMessage()).contains("first defined at <memory>:1:19");
                });
        assertThat(codeOf(parser, "define void @f() {\nb:\n  br label %b\nb:\n  ret void\n}"))
                .isEqualTo(IrErrorCode.DUPLICATE_DEFINITION);
    }

    @Test
    @Tag("unit")
    void testUndefinedNames() {
        assertThat(codeOf(parser, "define i32 @f() {\n  ret i32 %missing\n}")).isEqualTo(IrErrorCode.UNDEFINED_VALUE);
        assertThat(codeOf(parser, "define void @f() {\n  br label %nowhere\n}")).isEqualTo(IrErrorCode.UNDEFINED_LABEL);
        assertThat(codeOf(parser, "define void @f(i32 %x) {\n  br label %x\n}")).isEqualTo(IrErrorCode.UNDEFINED_LABEL);
        assertThat(codeOf(parser, "define ptr @f() {\nentry:\n  ret ptr %entry\n}")).isEqualTo(IrErrorCode.UNDEFINED_VALUE);
    }

    @Test
    @Tag("unit")
    void testMalformedDefinitions() {
        assertThatThrownBy(() -> parser.parseFunction("declare i32 @puts(ptr)"))
                .isInstanceOf(UnsupportedConstructException.class);
        assertThatThrownBy(() -> parser.parseFunction("define void @f() personality ptr @p {\n  ret void\n}"))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessageContaining("personality");
        assertThat(codeOf(parser, "define void @f() {\n}")).isEqualTo(IrErrorCode.UNEXPECTED_TOKEN);
        assertThat(codeOf(parser, "define void @f() {\n  ret void\n")).isEqualTo(IrErrorCode.UNEXPECTED_TOKEN);
        assertThat(codeOf(parser, "define void @f() {\n  ret void\n}\n}")).isEqualTo(IrErrorCode.UNEXPECTED_TOKEN);
    }

    /**
     * Verifies that printing a parsed function yields text that parses back to an equal function.
     */
    @Test
    @Tag("unit")
    void testPrintedFunctionReadsBack() throws IrException {
        // Arrange
        Function original = parser.parseFunction(MAX);

        // Act
        String printed = IrPrinter.print(original);
        Function reparsed = parser.parseFunction(printed);

        // Assert
        assertThat(reparsed).isEqualTo(original);
        assertThat(reparsed.basicBlocks().get(2).terminator())
                .isEqualTo(new Terminator.Return(new Value.FromIdentifier(new Type.Integer(32), "%a")));
    }
}
