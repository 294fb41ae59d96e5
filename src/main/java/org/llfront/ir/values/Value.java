package org.llfront.ir.values;

import org.llfront.api.TypeMismatchException;
import org.llfront.ir.instructions.Instruction;
import org.llfront.ir.types.AddressSpace;
import org.llfront.ir.types.Type;

import java.util.Objects;

/**
 * An operand of an instruction or terminator.
 * <p>
 * Values are immutable. One value node may be referenced by any number of instructions;
 * consumers that need a different value construct a new node instead of changing one.
 * Names are sigil-qualified: {@code %} for function-local names, {@code @} for globals.
 */
public sealed interface Value {

    /**
     * Returns the type of this value. For instruction results the type is derived
     * from the instruction, see {@link Instruction#resultType()}.
     *
     * @return The type of the value.
     */
    Type type();

    /**
     * Constructs a constant value after checking that the constant fits the type.
     *
     * @param type The declared type.
     * @param constant The constant.
     * @return The constant value.
     * @throws TypeMismatchException if {@code constant} is not compatible with {@code type}.
     */
    static FromConstant constant(Type type, Constant constant) throws TypeMismatchException {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(constant, "constant");
        if (!constant.isCompatibleWith(type)) {
            throw new TypeMismatchException(type, constant);
        }
        return new FromConstant(type, constant);
    }

    /**
     * The result of an instruction, used directly as an operand.
     * @param instruction The producing instruction.
     */
    record FromInstruction(Instruction instruction) implements Value {
        public FromInstruction {
            Objects.requireNonNull(instruction, "instruction");
        }

        @Override
        public Type type() {
            return instruction.resultType();
        }
    }

    /**
     * A constant of a declared type. Use {@link Value#constant(Type, Constant)} to construct
     * one with a checked error; this constructor rejects incompatible pairs with an
     * {@link IllegalArgumentException}.
     *
     * @param type The declared type.
     * @param constant The constant, compatible with {@code type}.
     */
    record FromConstant(Type type, Constant constant) implements Value {
        public FromConstant {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(constant, "constant");
            if (!constant.isCompatibleWith(type)) {
                throw new IllegalArgumentException("Constant " + constant + " is incompatible with type " + type);
            }
        }
    }

    /**
     * The address of a global variable.
     * @param name The sigil-qualified name, e.g. {@code @counter}.
     * @param addressSpace The address space the global lives in.
     */
    record FromGlobal(String name, AddressSpace addressSpace) implements Value {
        public FromGlobal {
            requireSigil(name, '@');
            Objects.requireNonNull(addressSpace, "addressSpace");
        }

        @Override
        public Type type() {
            return new Type.Pointer(addressSpace);
        }
    }

    /**
     * The address of a function.
     * @param name The sigil-qualified name, e.g. {@code @main}.
     * @param functionType The signature of the function.
     * @param addressSpace The program address space of the function.
     */
    record FromFunction(String name, Type.Function functionType, AddressSpace addressSpace) implements Value {
        public FromFunction {
            requireSigil(name, '@');
            Objects.requireNonNull(functionType, "functionType");
            Objects.requireNonNull(addressSpace, "addressSpace");
        }

        @Override
        public Type type() {
            return new Type.Pointer(addressSpace);
        }
    }

    /**
     * A reference to a basic block of the enclosing function, e.g. {@code label %exit}.
     * The block may be defined after the reference.
     * @param name The sigil-qualified label name, e.g. {@code %exit} or {@code %3}.
     */
    record FromLabel(String name) implements Value {
        public FromLabel {
            requireSigil(name, '%');
        }

        /**
         * @return The label name without its sigil.
         */
        public String labelName() {
            return name.substring(1);
        }

        @Override
        public Type type() {
            return new Type.Label();
        }
    }

    /**
     * A named or numbered value, resolved against the enclosing function (local names)
     * or the surrounding module (global names).
     * @param type The type the value is used with.
     * @param name The sigil-qualified name, e.g. {@code %x}, {@code %0} or {@code @puts}.
     */
    record FromIdentifier(Type type, String name) implements Value {
        public FromIdentifier {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(name, "name");
            if (name.length() < 2 || (name.charAt(0) != '%' && name.charAt(0) != '@')) {
                throw new IllegalArgumentException("Identifier must start with '%' or '@': " + name);
            }
        }

        /**
         * @return {@code true} for function-local ({@code %}) names.
         */
        public boolean isLocal() {
            return name.charAt(0) == '%';
        }
    }

    private static void requireSigil(String name, char sigil) {
        Objects.requireNonNull(name, "name");
        if (name.length() < 2 || name.charAt(0) != sigil) {
            throw new IllegalArgumentException("Name must start with '" + sigil + "': " + name);
        }
    }
}
