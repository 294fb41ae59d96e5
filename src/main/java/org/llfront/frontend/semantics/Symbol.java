package org.llfront.frontend.semantics;

import org.llfront.api.SourceInfo;

/**
 * Represents a single function-local definition in the symbol table.
 *
 * @param name The sigil-qualified name, e.g. {@code %x}; implicit slot numbers are stored as {@code %N}.
 * @param type The kind of definition.
 * @param sourceInfo Where the definition appears.
 */
public record Symbol(String name, Type type, SourceInfo sourceInfo) {
    /**
     * The kind of a local definition.
     */
    public enum Type {
        /** A formal parameter of the function. */
        PARAMETER,
        /** The result of an instruction. */
        VALUE,
        /** A basic block. */
        BLOCK
    }
}
