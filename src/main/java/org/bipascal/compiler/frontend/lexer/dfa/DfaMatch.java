package org.bipascal.compiler.frontend.lexer.dfa;

import org.bipascal.compiler.frontend.lexer.LexError;
import org.bipascal.compiler.frontend.lexer.Position;

/**
 * The outcome of one {@link DfaEngine#run} call.
 *
 * @param state The accepting state the match ended in, or null if the match failed.
 * @param error The failure reason, or null if the match succeeded.
 * @param start The position where the match began.
 * @param end The end of the accepted lexeme, or of the explored input for a failure.
 */
public record DfaMatch(DfaState state, LexError error, Position start, Position end) {

    static DfaMatch accepted(DfaState state, Position start, Position end) {
        return new DfaMatch(state, null, start, end);
    }

    static DfaMatch rejected(LexError error, Position start, Position explored) {
        return new DfaMatch(null, error, start, explored);
    }

    public boolean isAccepted() {
        return state != null;
    }

    public int length() {
        return end.offset() - start.offset();
    }
}
