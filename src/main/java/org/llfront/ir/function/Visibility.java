package org.llfront.ir.function;

import java.util.Optional;

public enum Visibility {
    DEFAULT("default"),
    HIDDEN("hidden"),
    PROTECTED("protected");

    private final String keyword;

    Visibility(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<Visibility> fromKeyword(String keyword) {
        for (Visibility visibility : values()) {
            if (visibility.keyword.equals(keyword)) {
                return Optional.of(visibility);
            }
        }
        return Optional.empty();
    }
}
