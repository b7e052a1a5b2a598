package org.bipascal.compiler.diagnostics;

import org.bipascal.compiler.frontend.CompilerPhase;
import org.bipascal.compiler.frontend.lexer.Position;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs while lexing or parsing.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param phase The phase that reported the diagnostic.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param position The source position of the issue.
 */
public record Diagnostic(
        Type type,
        CompilerPhase phase,
        String message,
        String fileName,
        Position position
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error in the source. */
        ERROR,
        /** A suspicious construct that does not make the source invalid. */
        WARNING,
        /** An informational message. */
        INFO
    }

    public int lineNumber() {
        return position.line();
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, fileName, position.line(), position.column(), message);
    }
}
