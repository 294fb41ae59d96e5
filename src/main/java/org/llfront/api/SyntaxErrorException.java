package org.llfront.api;

/**
 * Thrown when the input text does not conform to the grammar, or when a function
 * body fails name resolution. Carries what was expected and what was found.
 */
public class SyntaxErrorException extends IrException {

    private final String expected;
    private final String found;

    /**
     * @param code The error code.
     * @param expected A description of the expected construct.
     * @param found The offending token text.
     * @param sourceInfo The position of the offending token.
     */
    public SyntaxErrorException(IrErrorCode code, String expected, String found, SourceInfo sourceInfo) {
        super(code, "Expected " + expected + " but found '" + found + "'", sourceInfo, null);
        this.expected = expected;
        this.found = found;
    }

    /**
     * Constructs an error with a free-form message, for errors that are not about a single expected token.
     * @param code The error code.
     * @param message The detail message.
     * @param found The offending token text.
     * @param sourceInfo The position of the offending token.
     * @param cause The cause, may be {@code null}.
     */
    public SyntaxErrorException(IrErrorCode code, String message, String found, SourceInfo sourceInfo, Throwable cause) {
        super(code, message, sourceInfo, cause);
        this.expected = message;
        this.found = found;
    }

    public String expected() {
        return expected;
    }

    public String found() {
        return found;
    }
}
