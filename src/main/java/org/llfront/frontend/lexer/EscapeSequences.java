package org.llfront.frontend.lexer;

/**
 * Decoding of escape sequences ({@code \\} and {@code \XX}) in string literals.
 */
public final class EscapeSequences {

    private EscapeSequences() {}

    /**
     * Decodes the escape sequences of a string literal's content.
     * <p>
     * Currently the content is returned verbatim; the lexer reports a warning for literals
     * that contain a backslash so that callers can tell.
     *
     * @param content The literal content between the quotes.
     * @return The decoded content.
     */
    public static String decode(String content) {
        return content;
    }

    /**
     * @param content The literal content between the quotes.
     * @return {@code true} if the content contains an escape sequence.
     */
    public static boolean containsEscapes(String content) {
        return content.indexOf('\\') >= 0;
    }
}
