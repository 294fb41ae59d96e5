package org.llfront.ir.instructions;

/**
 * The tail call marker of a {@code call}. Exactly one applies to every call.
 */
public enum TailCallHint {
    /** No marker. */
    INDIFFERENT(""),
    /** {@code tail}: the callee may be tail call optimised. */
    SHOULD_TAIL("tail"),
    /** {@code musttail}: the call must be tail call optimised. */
    MUST_TAIL("musttail"),
    /** {@code notail}: the call must not be tail call optimised. */
    NEVER_TAIL("notail");

    private final String keyword;

    TailCallHint(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
