package org.llfront.ir.instructions;

/**
 * Which kinds of overflow an arithmetic instruction is allowed to produce.
 * {@code nuw} forbids unsigned wrapping, {@code nsw} forbids signed wrapping;
 * without either flag both are allowed.
 *
 * @param canWrapUnsigned {@code false} if the instruction carries {@code nuw}.
 * @param canWrapSigned {@code false} if the instruction carries {@code nsw}.
 */
public record AllowedWrapping(boolean canWrapUnsigned, boolean canWrapSigned) {

    /** Both kinds of wrapping allowed, the value when no flag is written. */
    public static final AllowedWrapping DEFAULT = new AllowedWrapping(true, true);

    /**
     * Builds the wrapping permissions from the flags written in the source.
     * @param noUnsignedWrap Whether {@code nuw} was present.
     * @param noSignedWrap Whether {@code nsw} was present.
     * @return The wrapping permissions.
     */
    public static AllowedWrapping fromFlags(boolean noUnsignedWrap, boolean noSignedWrap) {
        return new AllowedWrapping(!noUnsignedWrap, !noSignedWrap);
    }
}
