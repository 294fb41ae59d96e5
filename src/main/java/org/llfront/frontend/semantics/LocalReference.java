package org.llfront.frontend.semantics;

import org.llfront.api.SourceInfo;

/**
 * A use of a function-local name, recorded while parsing and checked once the
 * whole function body is known.
 *
 * @param name The sigil-qualified name, e.g. {@code %x} or {@code %2}.
 * @param isLabel Whether the name is used as a branch target ({@code label %x}).
 * @param sourceInfo Where the name is used.
 */
public record LocalReference(String name, boolean isLabel, SourceInfo sourceInfo) {
}
