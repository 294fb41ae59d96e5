package org.llfront.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    COMMA,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    LEFT_BRACE,
    RIGHT_BRACE,
    /** The '<' character, opening vectors and packed structures. */
    LESS,
    /** The '>' character. */
    GREATER,
    EQUALS,
    STAR,
    /** The '...' marker of variadic signatures. */
    ELLIPSIS,

    // Identifiers.
    /** A function-local name, such as %x or %3. */
    LOCAL_ID,
    /** A global name, such as @puts or @0. */
    GLOBAL_ID,
    /** A basic block label definition, such as entry: or 3: (the text excludes the colon). */
    LABEL,
    /** A metadata reference, such as !dbg or !0; a lone '!' opens an inline node. */
    METADATA,
    /** An attribute group reference, such as #0. */
    ATTRIBUTE_GROUP,
    /** A comdat reference, such as $foo. */
    COMDAT,

    // Literals.
    /** An integer literal, optionally negative. */
    INTEGER,
    /** A decimal or hexadecimal floating point literal. */
    FLOAT,
    /** A string literal. */
    STRING,

    // Keywords.
    /** A bare word: type keywords, opcodes, flags and attributes. */
    WORD,

    // Miscellaneous.
    /** Represents the end of the source text. */
    END_OF_FILE
}
