package org.bipascal.compiler.frontend.lexer.dfa;

import org.bipascal.compiler.frontend.lexer.CharacterStream;
import org.bipascal.compiler.frontend.lexer.Delimiter;
import org.bipascal.compiler.frontend.lexer.LexError;
import org.bipascal.compiler.frontend.lexer.Operator;
import org.bipascal.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DfaEngine}: maximal munch and backtracking to the last accept.
 */
@Tag("unit")
class DfaEngineTest {

    private final DfaEngine engine = new DfaEngine(DfaRuleSet.standard());

    private DfaMatch run(CharacterStream stream) {
        return engine.run(stream, engine.rules().startState());
    }

    @Test
    void takesTheLongestOperator() {
        CharacterStream stream = new CharacterStream("<=5");

        DfaMatch match = run(stream);

        assertThat(match.isAccepted()).isTrue();
        assertThat(match.state().tag()).isEqualTo(Operator.LESS_EQUAL);
        assertThat(match.length()).isEqualTo(2);
        assertThat(stream.position().offset()).isEqualTo(2);
    }

    @Test
    void backtracksFromFractionDotToTheInteger() {
        CharacterStream stream = new CharacterStream("1..10");

        DfaMatch integer = run(stream);
        DfaMatch range = run(stream);
        DfaMatch high = run(stream);

        assertThat(integer.state().accepts()).isEqualTo(TokenType.INTEGER_LITERAL);
        assertThat(integer.length()).isEqualTo(1);
        assertThat(range.state().tag()).isEqualTo(Operator.RANGE);
        assertThat(high.state().accepts()).isEqualTo(TokenType.INTEGER_LITERAL);
        assertThat(stream.isAtEnd()).isTrue();
    }

    @Test
    void backtracksFromAnIncompleteExponent() {
        CharacterStream stream = new CharacterStream("2e+x");

        DfaMatch match = run(stream);

        assertThat(match.state().accepts()).isEqualTo(TokenType.INTEGER_LITERAL);
        assertThat(stream.position().offset()).isEqualTo(1);
    }

    @Test
    void acceptsARealWithExponent() {
        DfaMatch match = run(new CharacterStream("3.14e-2;"));

        assertThat(match.state().accepts()).isEqualTo(TokenType.REAL_LITERAL);
        assertThat(match.length()).isEqualTo(7);
    }

    @Test
    void leftParenthesisWithoutStarIsADelimiter() {
        DfaMatch match = run(new CharacterStream("(x"));

        assertThat(match.state().tag()).isEqualTo(Delimiter.LEFT_PAREN);
    }

    @Test
    void unterminatedParenCommentDoesNotFallBackToTheParenthesis() {
        CharacterStream stream = new CharacterStream("(* never closed");

        DfaMatch match = run(stream);

        assertThat(match.isAccepted()).isFalse();
        assertThat(match.error()).isEqualTo(LexError.UNTERMINATED_COMMENT);
        assertThat(stream.isAtEnd()).isTrue();
    }

    @Test
    void unterminatedStringStopsAtTheLineEnd() {
        CharacterStream stream = new CharacterStream("'abc\nx");

        DfaMatch match = run(stream);

        assertThat(match.error()).isEqualTo(LexError.UNTERMINATED_STRING);
        assertThat(match.end().offset()).isEqualTo(4);
    }

    @Test
    void unknownCharacterFailsWithoutConsumingInput() {
        CharacterStream stream = new CharacterStream("@");

        DfaMatch match = run(stream);

        assertThat(match.error()).isEqualTo(LexError.INVALID_CHARACTER);
        assertThat(match.length()).isZero();
    }
}
