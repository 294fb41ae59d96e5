package org.llfront.ir.types;

import java.util.List;
import java.util.Objects;

/**
 * A type of the IR. The set of variants is closed and maps directly onto the
 * textual type system. Types are immutable and compared structurally.
 * <p>
 * Two structural predicates classify every variant: {@link #isFirstClass()} and
 * {@link #isSized()}. Both are answered from the variant alone, without computing sizes.
 */
public sealed interface Type {

    /** The widest integer type the textual format accepts. */
    int MAX_INTEGER_BIT_WIDTH = (1 << 23) - 1;

    /**
     * Whether values of this type can be produced by instructions and held in registers.
     * @return {@code true} for integer, floating point, AMX, MMX, pointer, target extension and vector types.
     */
    default boolean isFirstClass() {
        return false;
    }

    /**
     * Whether this type has a well-defined size in memory.
     * @return {@code true} for integer, floating point, pointer, vector, array and structure types.
     */
    default boolean isSized() {
        return false;
    }

    /**
     * Creates an integer type.
     * @param bitWidth The width in bits.
     * @return The integer type.
     */
    static Integer integer(int bitWidth) {
        return new Integer(bitWidth);
    }

    /**
     * @return A pointer into the default address space.
     */
    static Pointer pointer() {
        return new Pointer(AddressSpace.DEFAULT);
    }

    /**
     * The void type. Represents no value; neither first-class nor sized.
     */
    record Void() implements Type {}

    /**
     * A function signature. Neither first-class nor sized.
     *
     * @param returnType The return type.
     * @param parameters The parameter types, in order.
     * @param hasVarargs Whether the function accepts C-style variable arguments.
     */
    record Function(Type returnType, List<Type> parameters, boolean hasVarargs) implements Type {
        public Function {
            Objects.requireNonNull(returnType, "returnType");
            parameters = List.copyOf(parameters);
        }
    }

    /**
     * An integer of arbitrary bit width. First-class and sized.
     *
     * @param bitWidth The width in bits, at least 1.
     */
    record Integer(int bitWidth) implements Type {
        public Integer {
            if (bitWidth < 1 || bitWidth > MAX_INTEGER_BIT_WIDTH) {
                throw new IllegalArgumentException("Integer bit width out of range: " + bitWidth);
            }
        }

        @Override public boolean isFirstClass() { return true; }
        @Override public boolean isSized() { return true; }
    }

    /**
     * A floating point type. First-class and sized.
     *
     * @param kind The floating point format.
     */
    record FloatingPoint(FloatingPointKind kind) implements Type {
        public FloatingPoint {
            Objects.requireNonNull(kind, "kind");
        }

        @Override public boolean isFirstClass() { return true; }
        @Override public boolean isSized() { return true; }
    }

    /**
     * A value held in an x86 AMX register. First-class but not sized.
     */
    record Amx() implements Type {
        @Override public boolean isFirstClass() { return true; }
    }

    /**
     * A value held in an x86 MMX register. First-class but not sized.
     */
    record Mmx() implements Type {
        @Override public boolean isFirstClass() { return true; }
    }

    /**
     * An address of a value in memory. First-class and sized.
     *
     * @param addressSpace The address space the pointer points into.
     */
    record Pointer(AddressSpace addressSpace) implements Type {
        public Pointer {
            Objects.requireNonNull(addressSpace, "addressSpace");
        }

        @Override public boolean isFirstClass() { return true; }
        @Override public boolean isSized() { return true; }
    }

    /**
     * A target specific type whose representation is not modelled. First-class.
     *
     * @param name The target extension name.
     * @param parameters The type and integer parameters, in the order written.
     */
    record TargetExtension(String name, List<TargetExtensionParameter> parameters) implements Type {
        public TargetExtension {
            Objects.requireNonNull(name, "name");
            parameters = List.copyOf(parameters);
        }

        @Override public boolean isFirstClass() { return true; }
    }

    /**
     * A packed sequence of primitive elements. First-class and sized.
     *
     * @param length The number of elements, greater than 0. For scalable vectors the runtime length
     *               is a multiple of this value.
     * @param elementType The element type; first-class and not itself a vector.
     * @param isScalable Whether the vector is scalable ({@code vscale x}).
     */
    record Vector(long length, Type elementType, boolean isScalable) implements Type {
        public Vector {
            Objects.requireNonNull(elementType, "elementType");
            if (length <= 0) {
                throw new IllegalArgumentException("Vector length must be greater than 0: " + length);
            }
            if (!elementType.isFirstClass() || elementType instanceof Vector) {
                throw new IllegalArgumentException("Invalid vector element type: " + elementType);
            }
        }

        @Override public boolean isFirstClass() { return true; }
        @Override public boolean isSized() { return true; }
    }

    /**
     * The type of basic block labels. Neither first-class nor sized.
     */
    record Label() implements Type {}

    /**
     * The token type, for values that must not be inspected or obscured. Neither first-class nor sized.
     */
    record Token() implements Type {}

    /**
     * Embedded metadata. Neither first-class nor sized.
     */
    record Metadata() implements Type {}

    /**
     * A fixed-length sequence of elements in memory. Sized but not first-class.
     *
     * @param length The number of elements, greater than 0.
     * @param elementType The element type.
     */
    record Array(long length, Type elementType) implements Type {
        public Array {
            Objects.requireNonNull(elementType, "elementType");
            if (length <= 0) {
                throw new IllegalArgumentException("Array length must be greater than 0: " + length);
            }
        }

        @Override public boolean isSized() { return true; }
    }

    /**
     * A collection of fields in memory. Sized but not first-class.
     *
     * @param types The field types, in order.
     * @param isPacked Whether the structure is packed ({@code <{ ... }>}).
     */
    record Structure(List<Type> types, boolean isPacked) implements Type {
        public Structure {
            types = List.copyOf(types);
        }

        @Override public boolean isSized() { return true; }
    }

    /**
     * A structure whose body has not been defined. Neither first-class nor sized.
     */
    record OpaqueStructure() implements Type {}
}
