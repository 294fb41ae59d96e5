package org.llfront.diagnostics;

import org.llfront.api.IrErrorCode;
import org.llfront.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Collects diagnostic messages (errors, warnings) while source text is scanned.
 * <p>
 * This decouples error reporting from the lexer; the parser decides when collected
 * errors become an exception.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code       The error code.
     * @param message    The error message.
     * @param sourceInfo Where the error occurred.
     */
    public void reportError(IrErrorCode code, String message, SourceInfo sourceInfo) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, sourceInfo));
    }

    /**
     * Reports a warning.
     *
     * @param code       The code of the construct the warning is about.
     * @param message    The warning message.
     * @param sourceInfo Where the construct occurred.
     */
    public void reportWarning(IrErrorCode code, String message, SourceInfo sourceInfo) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, sourceInfo));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return The earliest reported error, if any.
     */
    public Optional<Diagnostic> firstError() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).findFirst();
    }

    /**
     * @return The reported warnings in reporting order.
     */
    public List<Diagnostic> getWarnings() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.WARNING).collect(Collectors.toList());
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
