package org.llfront.frontend.lexer;

import org.llfront.api.SourceInfo;

/**
 * Represents a single token extracted from the source text by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., WORD, LOCAL_ID, INTEGER).
 * @param text The exact text of the token from the source, sigils included.
 * @param value The processed value of the token: a {@link java.math.BigInteger} for integers,
 *              the decoded content for strings, the slot number ({@link Long}) for numbered
 *              identifiers and labels, otherwise {@code null}.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical name of the text the token comes from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {
    /**
     * @return The position of this token.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, line, column);
    }

    /**
     * @param keyword A bare keyword.
     * @return {@code true} if this token is the given keyword.
     */
    public boolean isWord(String keyword) {
        return type == TokenType.WORD && text.equals(keyword);
    }
}
