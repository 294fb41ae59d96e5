package org.llfront.frontend.semantics;

import org.llfront.api.SourceInfo;

import java.util.Optional;

/**
 * A formal parameter as written, with its position.
 *
 * @param name The sigil-qualified name, or empty for an unnamed parameter.
 * @param sourceInfo Where the parameter is written.
 */
public record ParsedParameter(Optional<String> name, SourceInfo sourceInfo) {
}
