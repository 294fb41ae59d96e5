package org.llfront.ir.types;

import java.util.Objects;
import java.util.Optional;

/**
 * An attribute attached to a function parameter, a return value or a call argument.
 * Depending on its kind an attribute carries nothing, a type or an integer.
 */
public sealed interface ParameterAttribute
        permits ParameterAttribute.Simple, ParameterAttribute.WithType, ParameterAttribute.WithInteger {

    /**
     * @return The kind of this attribute.
     */
    Kind kind();

    /**
     * What an attribute carries besides its keyword.
     */
    enum Payload {
        /** Nothing. */
        NONE,
        /** A type in parentheses, e.g. {@code byval(i32)}. */
        TYPE,
        /** An integer, e.g. {@code dereferenceable(8)} or {@code align 4}. */
        INTEGER
    }

    /**
     * The attribute kinds the parser recognises.
     */
    enum Kind {
        ZEROEXT("zeroext", Payload.NONE),
        SIGNEXT("signext", Payload.NONE),
        INREG("inreg", Payload.NONE),
        NOALIAS("noalias", Payload.NONE),
        NOCAPTURE("nocapture", Payload.NONE),
        NOFREE("nofree", Payload.NONE),
        NEST("nest", Payload.NONE),
        RETURNED("returned", Payload.NONE),
        NONNULL("nonnull", Payload.NONE),
        NOUNDEF("noundef", Payload.NONE),
        READNONE("readnone", Payload.NONE),
        READONLY("readonly", Payload.NONE),
        WRITEONLY("writeonly", Payload.NONE),
        IMMARG("immarg", Payload.NONE),
        SWIFTSELF("swiftself", Payload.NONE),
        SWIFTERROR("swifterror", Payload.NONE),
        SWIFTASYNC("swiftasync", Payload.NONE),
        ALLOCALIGN("allocalign", Payload.NONE),
        ALLOCPTR("allocptr", Payload.NONE),
        WRITABLE("writable", Payload.NONE),
        DEAD_ON_UNWIND("dead_on_unwind", Payload.NONE),
        BYVAL("byval", Payload.TYPE),
        BYREF("byref", Payload.TYPE),
        PREALLOCATED("preallocated", Payload.TYPE),
        INALLOCA("inalloca", Payload.TYPE),
        SRET("sret", Payload.TYPE),
        ELEMENTTYPE("elementtype", Payload.TYPE),
        ALIGN("align", Payload.INTEGER),
        ALIGNSTACK("alignstack", Payload.INTEGER),
        DEREFERENCEABLE("dereferenceable", Payload.INTEGER),
        DEREFERENCEABLE_OR_NULL("dereferenceable_or_null", Payload.INTEGER);

        private final String keyword;
        private final Payload payload;

        Kind(String keyword, Payload payload) {
            this.keyword = keyword;
            this.payload = payload;
        }

        public String keyword() {
            return keyword;
        }

        public Payload payload() {
            return payload;
        }

        /**
         * Looks up an attribute kind by keyword.
         * @param keyword The keyword as written in the source.
         * @return The kind, or empty if the keyword is not a parameter attribute.
         */
        public static Optional<Kind> fromKeyword(String keyword) {
            for (Kind kind : values()) {
                if (kind.keyword.equals(keyword)) {
                    return Optional.of(kind);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * An attribute consisting of its keyword only.
     * @param kind The attribute kind.
     */
    record Simple(Kind kind) implements ParameterAttribute {
        public Simple {
            requirePayload(kind, Payload.NONE);
        }
    }

    /**
     * An attribute carrying a type.
     * @param kind The attribute kind.
     * @param type The carried type.
     */
    record WithType(Kind kind, Type type) implements ParameterAttribute {
        public WithType {
            requirePayload(kind, Payload.TYPE);
            Objects.requireNonNull(type, "type");
        }
    }

    /**
     * An attribute carrying an integer.
     * @param kind The attribute kind.
     * @param value The carried integer.
     */
    record WithInteger(Kind kind, long value) implements ParameterAttribute {
        public WithInteger {
            requirePayload(kind, Payload.INTEGER);
        }
    }

    private static void requirePayload(Kind kind, Payload expected) {
        Objects.requireNonNull(kind, "kind");
        if (kind.payload() != expected) {
            throw new IllegalArgumentException("Attribute '" + kind.keyword() + "' carries " + kind.payload() + ", not " + expected);
        }
    }
}
