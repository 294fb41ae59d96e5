package org.llfront.ir.instructions;

import java.util.Optional;

/**
 * The predicates of {@code icmp}.
 */
public enum IntegerComparison {
    EQUAL("eq"),
    NOT_EQUAL("ne"),
    UNSIGNED_GREATER_THAN("ugt"),
    UNSIGNED_GREATER_OR_EQUAL("uge"),
    UNSIGNED_LESS_THAN("ult"),
    UNSIGNED_LESS_OR_EQUAL("ule"),
    SIGNED_GREATER_THAN("sgt"),
    SIGNED_GREATER_OR_EQUAL("sge"),
    SIGNED_LESS_THAN("slt"),
    SIGNED_LESS_OR_EQUAL("sle");

    private final String keyword;

    IntegerComparison(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * @return {@code true} for the predicates that interpret their operands as signed.
     */
    public boolean isSigned() {
        return keyword.charAt(0) == 's';
    }

    /**
     * @param keyword The predicate keyword, e.g. {@code slt}.
     * @return The predicate, or empty if the keyword names none.
     */
    public static Optional<IntegerComparison> fromKeyword(String keyword) {
        for (IntegerComparison comparison : values()) {
            if (comparison.keyword.equals(keyword)) {
                return Optional.of(comparison);
            }
        }
        return Optional.empty();
    }
}
