package org.llfront.api;

import java.util.Optional;

/**
 * Base class of every error the front end reports. It is part of the public API
 * and hides the internal types of the lexer and parser.
 */
public abstract class IrException extends Exception {

    private final IrErrorCode code;
    private final SourceInfo sourceInfo;

    /**
     * @param code The error code.
     * @param message The detail message.
     * @param sourceInfo The position of the error, or {@code null} if it did not come from source text.
     * @param cause The cause, may be {@code null}.
     */
    protected IrException(IrErrorCode code, String message, SourceInfo sourceInfo, Throwable cause) {
        super(sourceInfo == null ? message : String.format("%s at %s", message, sourceInfo), cause);
        this.code = code;
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The error code.
     */
    public IrErrorCode code() {
        return code;
    }

    /**
     * @return The source position, if the error was raised while reading text.
     */
    public Optional<SourceInfo> sourceInfo() {
        return Optional.ofNullable(sourceInfo);
    }
}
