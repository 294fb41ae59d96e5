package org.llfront.diagnostics;

import org.llfront.api.IrErrorCode;
import org.llfront.api.SourceInfo;

/**
 * Represents a single diagnostic message (error or warning) produced while reading textual IR.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code; for warnings the code of the construct that triggered it.
 * @param message The diagnostic message.
 * @param sourceInfo Where the issue occurred.
 */
public record Diagnostic(
        Type type,
        IrErrorCode code,
        String message,
        SourceInfo sourceInfo
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that makes the input unreadable. */
        ERROR,
        /** A warning that does not prevent parsing. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", type, sourceInfo, message);
    }
}
