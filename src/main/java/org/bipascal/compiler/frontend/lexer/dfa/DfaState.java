package org.bipascal.compiler.frontend.lexer.dfa;

import org.bipascal.compiler.frontend.lexer.LexError;
import org.bipascal.compiler.frontend.lexer.TokenType;

/**
 * A state of the lexical DFA.
 *
 * @param id The index of the state in the transition table.
 * @param name A descriptive name, for debugging and tests.
 * @param accepts The token type produced when a match ends here, or null for a non-accepting state.
 * @param tag The {@link org.bipascal.compiler.frontend.lexer.Operator} or
 *            {@link org.bipascal.compiler.frontend.lexer.Delimiter} produced by a symbol state, otherwise null.
 * @param failure The error to report when a match dies in this state with no earlier accept, or null.
 * @param commits Whether entering this state discards any earlier accept, so that a failure
 *                in the remainder of the path is reported instead of backtracking.
 */
public record DfaState(
        int id,
        String name,
        TokenType accepts,
        Object tag,
        LexError failure,
        boolean commits
) {

    public boolean isAccepting() {
        return accepts != null;
    }
}
