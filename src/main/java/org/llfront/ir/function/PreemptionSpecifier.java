package org.llfront.ir.function;

import java.util.Optional;

/**
 * Whether a definition may be replaced by one from outside the linkage unit.
 */
public enum PreemptionSpecifier {
    PREEMPTABLE("dso_preemptable"),
    LOCAL("dso_local");

    private final String keyword;

    PreemptionSpecifier(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<PreemptionSpecifier> fromKeyword(String keyword) {
        for (PreemptionSpecifier specifier : values()) {
            if (specifier.keyword.equals(keyword)) {
                return Optional.of(specifier);
            }
        }
        return Optional.empty();
    }
}
