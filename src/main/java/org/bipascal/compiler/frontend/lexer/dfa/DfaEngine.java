package org.bipascal.compiler.frontend.lexer.dfa;

import org.bipascal.compiler.frontend.lexer.CharacterStream;
import org.bipascal.compiler.frontend.lexer.LexError;
import org.bipascal.compiler.frontend.lexer.Position;

/**
 * Simulates a {@link DfaRuleSet} over a {@link CharacterStream} using maximal munch.
 * <p>
 * The engine follows edges for as long as one exists, remembering the most recent
 * accepting state. When the path dies it rewinds the stream to the end of that
 * accept. Without any accept the match fails, and the stream is left at the end
 * of the explored input so the caller can decide how far to skip.
 * The engine is stateless; one instance may serve any number of streams.
 */
public final class DfaEngine {

    private final DfaRuleSet rules;

    public DfaEngine(DfaRuleSet rules) {
        this.rules = rules;
    }

    public DfaRuleSet rules() {
        return rules;
    }

    /**
     * Matches the longest token starting at the current stream position.
     * @param stream The stream to read; advanced past the match on success.
     * @param startState The state to start in, normally {@link DfaRuleSet#startState()}.
     * @return The match, accepted or failed.
     */
    public DfaMatch run(CharacterStream stream, int startState) {
        Position start = stream.position();
        int state = startState;
        DfaState lastAccept = null;
        Position lastAcceptEnd = null;

        while (true) {
            int next = rules.next(state, CharClass.classify(stream.peek()));
            if (next == DfaRuleSet.NO_TRANSITION) {
                break;
            }
            stream.advance();
            state = next;
            DfaState current = rules.state(state);
            if (current.commits()) {
                lastAccept = null;
                lastAcceptEnd = null;
            }
            if (current.isAccepting()) {
                lastAccept = current;
                lastAcceptEnd = stream.position();
            }
        }

        if (lastAccept != null) {
            stream.reset(lastAcceptEnd);
            return DfaMatch.accepted(lastAccept, start, lastAcceptEnd);
        }

        LexError failure = rules.state(state).failure();
        return DfaMatch.rejected(failure != null ? failure : LexError.INVALID_CHARACTER, start, stream.position());
    }
}
