package org.llfront.ir.function;

import java.util.Optional;

/**
 * Whether the address of a function is significant.
 */
public enum UnnamedAddress {
    /** The address is significant; no keyword is written. */
    NONE(""),
    /** The address is insignificant within the module. */
    LOCAL_UNNAMED_ADDR("local_unnamed_addr"),
    /** The address is insignificant everywhere. */
    UNNAMED_ADDR("unnamed_addr");

    private final String keyword;

    UnnamedAddress(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<UnnamedAddress> fromKeyword(String keyword) {
        if (keyword.isEmpty()) {
            return Optional.empty();
        }
        for (UnnamedAddress unnamedAddress : values()) {
            if (unnamedAddress.keyword.equals(keyword)) {
                return Optional.of(unnamedAddress);
            }
        }
        return Optional.empty();
    }
}
