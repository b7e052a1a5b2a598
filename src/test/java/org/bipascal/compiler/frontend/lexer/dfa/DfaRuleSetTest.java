package org.bipascal.compiler.frontend.lexer.dfa;

import org.bipascal.compiler.frontend.lexer.Operator;
import org.bipascal.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DfaRuleSet} and its builder.
 */
@Tag("unit")
class DfaRuleSetTest {

    @Test
    void standardRuleSetFollowsTwoCharacterOperators() {
        DfaRuleSet rules = DfaRuleSet.standard();

        int less = rules.next(rules.startState(), CharClass.LESS);
        int lessEqual = rules.next(less, CharClass.EQUAL);

        assertThat(rules.state(less).name()).isEqualTo("LESS");
        assertThat(rules.state(lessEqual).accepts()).isEqualTo(TokenType.OPERATOR);
        assertThat(rules.state(lessEqual).tag()).isEqualTo(Operator.LESS_EQUAL);
        assertThat(rules.next(lessEqual, CharClass.EQUAL)).isEqualTo(DfaRuleSet.NO_TRANSITION);
    }

    @Test
    void startStateHasNoEdgeForUnknownCharacters() {
        DfaRuleSet rules = DfaRuleSet.standard();

        assertThat(rules.next(rules.startState(), CharClass.OTHER)).isEqualTo(DfaRuleSet.NO_TRANSITION);
        assertThat(rules.next(rules.startState(), CharClass.END_OF_INPUT)).isEqualTo(DfaRuleSet.NO_TRANSITION);
    }

    @Test
    void fractionDotIsNotAccepting() {
        DfaRuleSet rules = DfaRuleSet.standard();

        assertThat(rules.state("FRACTION_DOT").isAccepting()).isFalse();
        assertThat(rules.state("STRING_BODY").commits()).isTrue();
    }

    @Test
    void builderResolvesForwardReferences() {
        DfaRuleSet rules = DfaRuleSet.builder().start("A")
                .state("A").on(CharClass.DIGIT).to("B")
                .state("B").accepting(TokenType.INTEGER_LITERAL).on(CharClass.DIGIT).to("B")
                .build();

        int b = rules.next(rules.startState(), CharClass.DIGIT);
        assertThat(rules.state(b).name()).isEqualTo("B");
        assertThat(rules.next(b, CharClass.DIGIT)).isEqualTo(b);
        assertThatThrownBy(() -> rules.state("C")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builderRejectsUndeclaredTargets() {
        DfaRuleSet.Builder builder = DfaRuleSet.builder().start("A");
        builder.state("A").on(CharClass.DIGIT).to("MISSING");

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("MISSING");
    }

    @Test
    void builderRejectsMissingStartState() {
        assertThatThrownBy(() -> DfaRuleSet.builder().start("NOWHERE").build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("NOWHERE");
    }

    @Test
    void builderRejectsConflictingEdges() {
        DfaRuleSet.StateBuilder state = DfaRuleSet.builder().state("A").on(CharClass.DIGIT).to("A");

        assertThatThrownBy(() -> state.on(CharClass.DIGIT, CharClass.LETTER).to("B"))
                .isInstanceOf(IllegalStateException.class);
    }
}
