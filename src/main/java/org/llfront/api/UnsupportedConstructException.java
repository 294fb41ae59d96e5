package org.llfront.api;

/**
 * Thrown for input that is valid IR but names a construct this front end does not
 * model (e.g. {@code phi} or {@code invoke}). Lets callers tell
 * "not yet supported" apart from "invalid".
 */
public class UnsupportedConstructException extends IrException {

    private final String construct;

    /**
     * @param construct The name of the unsupported construct.
     * @param sourceInfo Where it was found.
     */
    public UnsupportedConstructException(String construct, SourceInfo sourceInfo) {
        super(IrErrorCode.UNSUPPORTED_CONSTRUCT, "Unsupported construct '" + construct + "'", sourceInfo, null);
        this.construct = construct;
    }

    public String construct() {
        return construct;
    }
}
