package org.llfront.ir.values;

import org.llfront.ir.types.FloatingPointKind;
import org.llfront.ir.types.Type;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the compatibility rules between constants and types.
 */
@Tag("unit")
public class ConstantTest {

    private static final Type I1 = Type.integer(1);
    private static final Type I32 = Type.integer(32);
    private static final Type DOUBLE = new Type.FloatingPoint(FloatingPointKind.BINARY64);

    @Test
    void testScalarCompatibility() {
        assertThat(new Constant.Boolean(true).isCompatibleWith(I1)).isTrue();
        assertThat(new Constant.Boolean(true).isCompatibleWith(I32)).isFalse();
        assertThat(Constant.Integer.of(300).isCompatibleWith(Type.integer(8))).isTrue();
        assertThat(Constant.Integer.of(1).isCompatibleWith(DOUBLE)).isFalse();
        assertThat(new Constant.FloatingPoint("1.5").isCompatibleWith(DOUBLE)).isTrue();
        assertThat(new Constant.NullPointer().isCompatibleWith(Type.pointer())).isTrue();
        assertThat(new Constant.NullPointer().isCompatibleWith(I32)).isFalse();
        assertThat(new Constant.NoneToken().isCompatibleWith(new Type.Token())).isTrue();
        assertThat(new Constant.Void().isCompatibleWith(new Type.Void())).isTrue();
        assertThat(new Constant.Metadata().isCompatibleWith(new Type.Metadata())).isTrue();
    }

    /**
     * zeroinitializer and poison fit every type; undef fits every type except label and void.
     */
    @Test
    void testUniversalConstants() {
        List<Type> types = List.of(I32, DOUBLE, Type.pointer(), new Type.Array(2, I32),
                new Type.Structure(List.of(), false), new Type.Token());
        for (Type type : types) {
            assertThat(new Constant.Zero().isCompatibleWith(type)).as("zeroinitializer as %s", type).isTrue();
            assertThat(new Constant.Poison().isCompatibleWith(type)).as("poison as %s", type).isTrue();
            assertThat(new Constant.Undefined().isCompatibleWith(type)).as("undef as %s", type).isTrue();
        }
        assertThat(new Constant.Undefined().isCompatibleWith(new Type.Label())).isFalse();
        assertThat(new Constant.Undefined().isCompatibleWith(new Type.Void())).isFalse();
        assertThat(new Constant.Poison().isCompatibleWith(new Type.Label())).isTrue();
    }

    @Test
    void testAggregateCompatibility() {
        // Arrange
        Value one = new Value.FromConstant(I32, Constant.Integer.of(1));
        Value nil = new Value.FromConstant(Type.pointer(), new Constant.NullPointer());
        Constant structure = new Constant.Structure(List.of(one, nil));
        Constant array = new Constant.Array(List.of(one, one));

        // Act & Assert
        assertThat(structure.isCompatibleWith(new Type.Structure(List.of(I32, Type.pointer()), false))).isTrue();
        assertThat(structure.isCompatibleWith(new Type.Structure(List.of(Type.pointer(), I32), false))).isFalse();
        assertThat(structure.isCompatibleWith(new Type.Structure(List.of(I32), false))).isFalse();
        assertThat(array.isCompatibleWith(new Type.Array(2, I32))).isTrue();
        assertThat(array.isCompatibleWith(new Type.Array(3, I32))).isFalse();
        assertThat(array.isCompatibleWith(new Type.Array(2, Type.integer(64)))).isFalse();
        assertThat(new Constant.Vector(List.of(one, one)).isCompatibleWith(new Type.Vector(2, I32, false))).isTrue();
        assertThat(new Constant.Vector(List.of(one)).isCompatibleWith(new Type.Array(1, I32))).isFalse();
    }

    @Test
    void testFloatingPointLiteralsAreKeptAsWritten() {
        Constant hex = new Constant.FloatingPoint("0xK4000");
        assertThat(((Constant.FloatingPoint) hex).literal()).isEqualTo("0xK4000");
        assertThat(hex.isCompatibleWith(new Type.FloatingPoint(FloatingPointKind.X86_FP80))).isTrue();
        assertThat(new Constant.FloatingPoint("2.5e1").isCompatibleWith(I32)).isFalse();
    }
}
