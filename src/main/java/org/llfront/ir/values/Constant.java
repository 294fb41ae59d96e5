package org.llfront.ir.values;

import org.llfront.ir.types.Type;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * A literal or constant form. Whether a constant may be used with a type is decided by
 * {@link #isCompatibleWith(Type)}; {@link Value#constant(Type, Constant)} enforces it.
 */
public sealed interface Constant {

    /**
     * Checks whether this constant may carry the given type.
     * <p>
     * {@link Zero} and {@link Poison} fit every type, {@link Undefined} every type except
     * {@code label} and {@code void}. Aggregates require the matching aggregate type, an equal
     * element count and positional equality between each element's type and the declared one.
     *
     * @param type The declared type.
     * @return {@code true} if the constant fits the type.
     */
    boolean isCompatibleWith(Type type);

    /** The only value of {@code void}. */
    record Void() implements Constant {
        @Override
        public boolean isCompatibleWith(Type type) {
            return type instanceof Type.Void;
        }
    }

    /**
     * {@code true} or {@code false}; only fits {@code i1}.
     * @param value The truth value.
     */
    record Boolean(boolean value) implements Constant {
        @Override
        public boolean isCompatibleWith(Type type) {
            return type instanceof Type.Integer integer && integer.bitWidth() == 1;
        }
    }

    /**
     * An integer literal. Its width is given by the type it is used with.
     * @param value The literal value.
     */
    record Integer(BigInteger value) implements Constant {
        public Integer {
            Objects.requireNonNull(value, "value");
        }

        /**
         * @param value The literal value.
         * @return The integer constant.
         */
        public static Integer of(long value) {
            return new Integer(BigInteger.valueOf(value));
        }

        @Override
        public boolean isCompatibleWith(Type type) {
            return type instanceof Type.Integer;
        }
    }

    /**
     * A floating point literal, kept as written (decimal or hexadecimal).
     * @param literal The literal text.
     */
    record FloatingPoint(String literal) implements Constant {
        public FloatingPoint {
            Objects.requireNonNull(literal, "literal");
        }

        @Override
        public boolean isCompatibleWith(Type type) {
            return type instanceof Type.FloatingPoint;
        }
    }

    /** {@code null}, the null pointer. */
    record NullPointer() implements Constant {
        @Override
        public boolean isCompatibleWith(Type type) {
            return type instanceof Type.Pointer;
        }
    }

    /** {@code none}, the empty token. */
    record NoneToken() implements Constant {
        @Override
        public boolean isCompatibleWith(Type type) {
            return type instanceof Type.Token;
        }
    }

    /**
     * A structure constant.
     * @param values The field values, in order.
     */
    record Structure(List<Value> values) implements Constant {
        public Structure {
            values = List.copyOf(values);
        }

        @Override
        public boolean isCompatibleWith(Type type) {
            if (!(type instanceof Type.Structure structure)) {
                return false;
            }
            return elementsMatch(values, structure.types());
        }
    }

    /**
     * An array constant.
     * @param values The elements, in order.
     */
    record Array(List<Value> values) implements Constant {
        public Array {
            values = List.copyOf(values);
        }

        @Override
        public boolean isCompatibleWith(Type type) {
            if (!(type instanceof Type.Array array)) {
                return false;
            }
            return array.length() == values.size() && allOfType(values, array.elementType());
        }
    }

    /**
     * A vector constant.
     * @param values The elements, in order.
     */
    record Vector(List<Value> values) implements Constant {
        public Vector {
            values = List.copyOf(values);
        }

        @Override
        public boolean isCompatibleWith(Type type) {
            if (!(type instanceof Type.Vector vector)) {
                return false;
            }
            return vector.length() == values.size() && allOfType(values, vector.elementType());
        }
    }

    /** {@code zeroinitializer}; fits every type. */
    record Zero() implements Constant {
        @Override
        public boolean isCompatibleWith(Type type) {
            return true;
        }
    }

    /** An embedded metadata operand. */
    record Metadata() implements Constant {
        @Override
        public boolean isCompatibleWith(Type type) {
            return type instanceof Type.Metadata;
        }
    }

    /** {@code undef}; fits every type except {@code label} and {@code void}. */
    record Undefined() implements Constant {
        @Override
        public boolean isCompatibleWith(Type type) {
            return !(type instanceof Type.Label) && !(type instanceof Type.Void);
        }
    }

    /** {@code poison}; fits every type. */
    record Poison() implements Constant {
        @Override
        public boolean isCompatibleWith(Type type) {
            return true;
        }
    }

    private static boolean elementsMatch(List<Value> values, List<Type> types) {
        if (values.size() != types.size()) {
            return false;
        }
        for (int i = 0; i < values.size(); i++) {
            if (!values.get(i).type().equals(types.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean allOfType(List<Value> values, Type elementType) {
        for (Value value : values) {
            if (!value.type().equals(elementType)) {
                return false;
            }
        }
        return true;
    }
}
