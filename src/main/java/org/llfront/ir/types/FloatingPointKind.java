package org.llfront.ir.types;

import java.util.Optional;

/**
 * The kinds of floating point types the IR knows about.
 */
public enum FloatingPointKind {
    /** A 16 bit IEEE-754-2008 {@code binary16} value. */
    BINARY16("half"),
    /** A 16 bit value with the dynamic range of {@code binary32} but far less precision. */
    BRAIN("bfloat"),
    /** A 32 bit IEEE-754-2008 {@code binary32} value. */
    BINARY32("float"),
    /** A 64 bit IEEE-754-2008 {@code binary64} value. */
    BINARY64("double"),
    /** A 128 bit IEEE-754-2008 {@code binary128} value. */
    BINARY128("fp128"),
    /** The 80 bit extended format of the x87 FPU. */
    X86_FP80("x86_fp80"),
    /** The 128 bit double-double format used on PowerPC. */
    PPC_FP128("ppc_fp128");

    private final String keyword;

    FloatingPointKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return The keyword that spells this kind in the textual IR.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Looks up a kind by its textual keyword.
     * @param keyword The keyword, e.g. {@code double}.
     * @return The matching kind, or empty if the keyword names no floating point type.
     */
    public static Optional<FloatingPointKind> fromKeyword(String keyword) {
        for (FloatingPointKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
