package org.bipascal.compiler.frontend.parser;

import org.bipascal.compiler.frontend.parser.ast.ProgramNode;

import java.util.List;

/**
 * The outcome of a parse: a best-effort tree and the syntax errors in source order.
 *
 * @param program The syntax tree, or null if the input had no recognizable program structure.
 * @param errors The syntax errors.
 */
public record ParseResult(ProgramNode program, List<SyntaxError> errors) {

    public ParseResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @return true if parsing was abandoned because of a terminal error.
     */
    public boolean isAborted() {
        return errors.stream().anyMatch(e -> e.kind().isTerminal());
    }
}
