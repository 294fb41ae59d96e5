package org.llfront.api;

/**
 * Defines unique, testable error codes for everything that can go wrong while
 * building the syntax tree. This decouples tests from the wording of messages.
 */
public enum IrErrorCode {
    // region Lexical errors
    /** A character that starts no token. */
    UNEXPECTED_CHARACTER,
    /** A string literal without its closing quote. */
    UNTERMINATED_STRING,
    /** A numeric literal that cannot be read. */
    INVALID_NUMBER,
    /** A string literal whose escape sequences are kept verbatim (reported as a warning). */
    VERBATIM_ESCAPE,
    // endregion

    // region Grammar errors
    /** A token other than the one the grammar requires. */
    UNEXPECTED_TOKEN,
    /** A type that is syntactically valid but violates a type invariant (e.g. {@code i0}). */
    INVALID_TYPE,
    /** An alignment that is not a power of two. */
    INVALID_ALIGNMENT,
    /** An index path that does not lead into the aggregate type. */
    INVALID_INDICES,
    /** Type or constant syntax nested deeper than the configured limit. */
    NESTING_TOO_DEEP,
    // endregion

    // region Function level errors
    /** A local value or label defined twice in one function. */
    DUPLICATE_DEFINITION,
    /** A numbered value, argument or block whose number is out of sequence. */
    NUMBERING_MISMATCH,
    /** A use of a local value that is never defined in the function. */
    UNDEFINED_VALUE,
    /** A branch target naming no basic block of the function. */
    UNDEFINED_LABEL,
    // endregion

    // region Model errors
    /** A constant used with a type it is not compatible with. */
    TYPE_MISMATCH,
    /** Valid IR that this front end does not model yet. */
    UNSUPPORTED_CONSTRUCT
    // endregion
}
