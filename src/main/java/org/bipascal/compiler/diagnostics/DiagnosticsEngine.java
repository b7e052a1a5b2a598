package org.bipascal.compiler.diagnostics;

import org.bipascal.compiler.frontend.CompilerPhase;
import org.bipascal.compiler.frontend.lexer.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur while lexing and parsing.
 * <p>
 * This decouples error reporting from the actual frontend logic (lexer, parser).
 * Diagnostics are plain data; nothing here throws on a source error.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param phase    The phase reporting the error.
     * @param message  The error message.
     * @param fileName The file in which the error occurred.
     * @param position The position of the error.
     */
    public void reportError(CompilerPhase phase, String message, String fileName, Position position) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, phase, message, fileName, position));
    }

    /**
     * Reports a warning.
     *
     * @param phase    The phase reporting the warning.
     * @param message  The warning message.
     * @param fileName The file in which the warning occurred.
     * @param position The position of the warning.
     */
    public void reportWarning(CompilerPhase phase, String message, String fileName, Position position) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, phase, message, fileName, position));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    public long errorCount() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * Counts the errors reported by one phase.
     * @param phase The phase.
     * @return The number of errors.
     */
    public long errorCount(CompilerPhase phase) {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR && d.phase() == phase)
                .count();
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
