package org.llfront.api;

import org.llfront.ir.types.Type;
import org.llfront.ir.values.Constant;

/**
 * Thrown when a constant is combined with a type it is not compatible with.
 * Carries both operands so callers can report the mismatch and continue.
 */
public class TypeMismatchException extends IrException {

    private final Type expectedType;
    private final Constant constant;

    /**
     * @param expectedType The declared type.
     * @param constant The incompatible constant.
     */
    public TypeMismatchException(Type expectedType, Constant constant) {
        this(expectedType, constant, null);
    }

    /**
     * @param expectedType The declared type.
     * @param constant The incompatible constant.
     * @param sourceInfo Where the constant was written, or {@code null} for programmatic construction.
     */
    public TypeMismatchException(Type expectedType, Constant constant, SourceInfo sourceInfo) {
        super(IrErrorCode.TYPE_MISMATCH, "Constant " + constant + " is incompatible with type " + expectedType, sourceInfo, null);
        this.expectedType = expectedType;
        this.constant = constant;
    }

    public Type expectedType() {
        return expectedType;
    }

    public Constant constant() {
        return constant;
    }
}
