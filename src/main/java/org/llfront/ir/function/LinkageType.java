package org.llfront.ir.function;

import java.util.Optional;

/**
 * How a function is visible to the linker. {@link #EXTERNAL} applies when no keyword is written.
 */
public enum LinkageType {
    PRIVATE("private"),
    INTERNAL("internal"),
    AVAILABLE_EXTERNALLY("available_externally"),
    LINK_ONCE("linkonce"),
    WEAK("weak"),
    COMMON("common"),
    APPENDING("appending"),
    EXTERN_WEAK("extern_weak"),
    LINK_ONCE_ODR("linkonce_odr"),
    WEAK_ODR("weak_odr"),
    EXTERNAL("external");

    private final String keyword;

    LinkageType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<LinkageType> fromKeyword(String keyword) {
        for (LinkageType linkage : values()) {
            if (linkage.keyword.equals(keyword)) {
                return Optional.of(linkage);
            }
        }
        return Optional.empty();
    }
}
