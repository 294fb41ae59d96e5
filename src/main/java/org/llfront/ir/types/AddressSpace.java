package org.llfront.ir.types;

import java.util.Objects;

/**
 * A numbered or named partition of the pointer value space.
 * Equality is by value.
 */
public sealed interface AddressSpace permits AddressSpace.Numbered, AddressSpace.Named {

    /** The address space used when none is spelled out. */
    AddressSpace DEFAULT = new Numbered(0);

    /**
     * An address space identified by a non-negative number, e.g. {@code addrspace(3)}.
     * @param number The address space number.
     */
    record Numbered(long number) implements AddressSpace {
        public Numbered {
            if (number < 0) {
                throw new IllegalArgumentException("Address space number must not be negative: " + number);
            }
        }
    }

    /**
     * An address space identified by a name, e.g. {@code addrspace("A")}.
     * @param name The address space name.
     */
    record Named(String name) implements AddressSpace {
        public Named {
            Objects.requireNonNull(name, "name");
        }
    }
}
