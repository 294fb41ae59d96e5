package org.llfront.frontend.parser.features;

import org.llfront.IrParser;
import org.llfront.api.IrErrorCode;
import org.llfront.api.IrException;
import org.llfront.api.UnsupportedConstructException;
import org.llfront.ir.instructions.SwitchCase;
import org.llfront.ir.instructions.Terminator;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Constant;
import org.llfront.ir.values.Value;
import org.llfront.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the terminator handlers.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class TerminatorParsingTest {

    private final IrParser parser = new IrParser();

    private Terminator parse(String text) throws IrException {
        return parser.parseBasicBlock(text).terminator();
    }

    @Test
    void testReturn() throws IrException {
        assertThat(parse("ret void")).isEqualTo(Terminator.Return.ofVoid());
        assertThat(((Terminator.Return) parse("ret void")).isVoid()).isTrue();
        assertThat(parse("ret ptr null"))
                .isEqualTo(new Terminator.Return(new Value.FromConstant(Type.pointer(), new Constant.NullPointer())));
    }

    @Test
    void testUnconditionalBranch() throws IrException {
        // Act
        Terminator terminator = parse("br label %exit");

        // Assert
        assertThat(terminator).isEqualTo(new Terminator.Branch(new Value.FromLabel("%exit")));
        assertThat(terminator.successors()).containsExactly(new Value.FromLabel("%exit"));
    }

    @Test
    void testConditionalBranchOnConstant() throws IrException {
        // Act
        Terminator terminator = parse("br i1 true, label %then, label %else");

        // Assert
        assertThat(terminator).isEqualTo(new Terminator.ConditionalBranch(
                new Value.FromConstant(new Type.Integer(1), new Constant.Boolean(true)),
                new Value.FromLabel("%then"), new Value.FromLabel("%else")));
    }

    /**
     * Cases follow each other without separating commas; the default destination comes first among the successors.
     */
    @Test
    void testSwitch() throws IrException {
        // Act
        Terminator terminator = parse("switch i32 %v, label %default [\n"
                + "    i32 0, label %zero\n"
                + "    i32 1, label %one\n"
                + "  ]");

        // Assert
        Terminator.Switch switchTerminator = (Terminator.Switch) terminator;
        assertThat(switchTerminator.value()).isEqualTo(new Value.FromIdentifier(new Type.Integer(32), "%v"));
        assertThat(switchTerminator.cases()).containsExactly(
                new SwitchCase(new Value.FromConstant(new Type.Integer(32), Constant.Integer.of(0)), new Value.FromLabel("%zero")),
                new SwitchCase(new Value.FromConstant(new Type.Integer(32), Constant.Integer.of(1)), new Value.FromLabel("%one")));
        assertThat(switchTerminator.successors()).containsExactly(
                new Value.FromLabel("%default"), new Value.FromLabel("%zero"), new Value.FromLabel("%one"));
    }

    @Test
    void testSwitchWithoutCases() throws IrException {
        // Act
        Terminator terminator = parse("switch i8 %v, label %only []");

        // Assert
        assertThat(((Terminator.Switch) terminator).cases()).isEmpty();
    }

    @Test
    void testUnclosedSwitchIsRejected() {
        assertThatThrownBy(() -> parse("switch i8 %v, label %d [ i8 1, label %a"))
                .isInstanceOfSatisfying(IrException.class, e -> assertThat(e.code()).isEqualTo(IrErrorCode.UNEXPECTED_TOKEN));
    }

    @Test
    void testIndirectBranch() throws IrException {
        // Act
        Terminator terminator = parse("indirectbr ptr %target, [label %a, label %b]");

        // Assert
        assertThat(terminator).isEqualTo(new Terminator.IndirectBranch(
                new Value.FromIdentifier(Type.pointer(), "%target"),
                List.of(new Value.FromLabel("%a"), new Value.FromLabel("%b"))));
        assertThat(terminator.operands()).contains(new Value.FromIdentifier(Type.pointer(), "%target"));
    }

    @Test
    void testUnreachable() throws IrException {
        assertThat(parse("unreachable")).isEqualTo(new Terminator.Unreachable());
        assertThat(parse("unreachable").successors()).isEmpty();
    }

    @Test
    void testBranchToNonLabelIsRejected() {
        assertThatThrownBy(() -> parse("br i1 %c, i32 %a, label %b"))
                .isInstanceOfSatisfying(IrException.class, e -> assertThat(e.code()).isEqualTo(IrErrorCode.UNEXPECTED_TOKEN));
    }

    @Test
    void testExceptionHandlingTerminatorsAreUnsupported() {
        assertThatThrownBy(() -> parse("invoke void @f() to label %ok unwind label %bad"))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessage("Unsupported construct 'instruction 'invoke'' at <memory>:1:1");
        assertThatThrownBy(() -> parse("cleanupret from %pad unwind to caller"))
                .isInstanceOf(UnsupportedConstructException.class);
    }
}
