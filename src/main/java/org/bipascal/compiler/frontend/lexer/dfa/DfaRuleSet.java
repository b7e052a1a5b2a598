package org.bipascal.compiler.frontend.lexer.dfa;

import org.bipascal.compiler.frontend.lexer.Delimiter;
import org.bipascal.compiler.frontend.lexer.LexError;
import org.bipascal.compiler.frontend.lexer.Operator;
import org.bipascal.compiler.frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The states and transitions of the lexical DFA.
 * <p>
 * A rule set is immutable once built. The {@link #standard()} rule set is built once
 * at class load time and shared by every lexer, so it can be used from any number
 * of threads without locking.
 */
public final class DfaRuleSet {

    /** Marks a missing edge in the transition table. */
    public static final int NO_TRANSITION = -1;

    private static final int NUM_CHAR_CLASSES = CharClass.values().length;

    private static final DfaRuleSet STANDARD = buildStandard();

    private final List<DfaState> states;
    private final int[][] transitions;
    private final int startState;

    private DfaRuleSet(List<DfaState> states, int[][] transitions, int startState) {
        this.states = List.copyOf(states);
        this.transitions = transitions;
        this.startState = startState;
    }

    /**
     * @return The shared rule set of the Pascal-S dialect.
     */
    public static DfaRuleSet standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int startState() {
        return startState;
    }

    public DfaState state(int id) {
        return states.get(id);
    }

    /**
     * Looks up a state by name.
     * @param name The state name given to the builder.
     * @return The state.
     * @throws IllegalArgumentException if no state has that name.
     */
    public DfaState state(String name) {
        return states.stream()
                .filter(s -> s.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown DFA state: " + name));
    }

    /**
     * @param state The current state id.
     * @param charClass The class of the next input character.
     * @return The next state id, or {@link #NO_TRANSITION}.
     */
    public int next(int state, CharClass charClass) {
        return transitions[state][charClass.ordinal()];
    }

    private static DfaRuleSet buildStandard() {
        Builder b = builder();

        b.state("START")
                .on(CharClass.LETTER, CharClass.LETTER_E, CharClass.UNDERSCORE).to("WORD")
                .on(CharClass.DIGIT).to("INTEGER")
                .on(CharClass.QUOTE).to("STRING_BODY")
                .on(CharClass.WHITESPACE, CharClass.NEWLINE).to("WHITESPACE")
                .on(CharClass.LEFT_BRACE).to("BRACE_COMMENT")
                .on(CharClass.LEFT_PAREN).to("LEFT_PAREN")
                .on(CharClass.RIGHT_PAREN).to("RIGHT_PAREN")
                .on(CharClass.LEFT_BRACKET).to("LEFT_BRACKET")
                .on(CharClass.RIGHT_BRACKET).to("RIGHT_BRACKET")
                .on(CharClass.SEMICOLON).to("SEMICOLON")
                .on(CharClass.COMMA).to("COMMA")
                .on(CharClass.COLON).to("COLON")
                .on(CharClass.DOT).to("DOT")
                .on(CharClass.LESS).to("LESS")
                .on(CharClass.GREATER).to("GREATER")
                .on(CharClass.EQUAL).to("EQUAL")
                .on(CharClass.PLUS).to("PLUS")
                .on(CharClass.MINUS).to("MINUS")
                .on(CharClass.STAR).to("STAR")
                .on(CharClass.SLASH).to("SLASH");
        b.start("START");

        // Words; keywords are told apart from identifiers after the match.
        b.state("WORD").accepting(TokenType.IDENTIFIER)
                .on(CharClass.LETTER, CharClass.LETTER_E, CharClass.DIGIT, CharClass.UNDERSCORE).to("WORD");

        // Numbers. "1..10" reaches FRACTION_DOT and backtracks to "1".
        b.state("INTEGER").accepting(TokenType.INTEGER_LITERAL)
                .on(CharClass.DIGIT).to("INTEGER")
                .on(CharClass.DOT).to("FRACTION_DOT")
                .on(CharClass.LETTER_E).to("EXPONENT_MARK");
        b.state("FRACTION_DOT")
                .on(CharClass.DIGIT).to("FRACTION");
        b.state("FRACTION").accepting(TokenType.REAL_LITERAL)
                .on(CharClass.DIGIT).to("FRACTION")
                .on(CharClass.LETTER_E).to("EXPONENT_MARK");
        b.state("EXPONENT_MARK")
                .on(CharClass.PLUS, CharClass.MINUS).to("EXPONENT_SIGN")
                .on(CharClass.DIGIT).to("EXPONENT");
        b.state("EXPONENT_SIGN")
                .on(CharClass.DIGIT).to("EXPONENT");
        b.state("EXPONENT").accepting(TokenType.REAL_LITERAL)
                .on(CharClass.DIGIT).to("EXPONENT");

        // Quoted literals; '' inside the quotes is an escaped quote.
        b.state("STRING_BODY").committing().failingWith(LexError.UNTERMINATED_STRING)
                .onAnyExcept(CharClass.QUOTE, CharClass.NEWLINE).to("STRING_BODY")
                .on(CharClass.QUOTE).to("STRING_END");
        b.state("STRING_END").accepting(TokenType.STRING_LITERAL)
                .on(CharClass.QUOTE).to("STRING_BODY");

        b.state("WHITESPACE").accepting(TokenType.WHITESPACE)
                .on(CharClass.WHITESPACE, CharClass.NEWLINE).to("WHITESPACE");

        // { ... }
        b.state("BRACE_COMMENT").failingWith(LexError.UNTERMINATED_COMMENT)
                .onAnyExcept(CharClass.RIGHT_BRACE).to("BRACE_COMMENT")
                .on(CharClass.RIGHT_BRACE).to("COMMENT_END");

        // (* ... *); the "(" accept is dropped once "(*" is seen.
        b.state("LEFT_PAREN").accepting(TokenType.DELIMITER, Delimiter.LEFT_PAREN)
                .on(CharClass.STAR).to("PAREN_COMMENT");
        b.state("PAREN_COMMENT").committing().failingWith(LexError.UNTERMINATED_COMMENT)
                .onAnyExcept(CharClass.STAR).to("PAREN_COMMENT")
                .on(CharClass.STAR).to("PAREN_COMMENT_STAR");
        b.state("PAREN_COMMENT_STAR").failingWith(LexError.UNTERMINATED_COMMENT)
                .on(CharClass.STAR).to("PAREN_COMMENT_STAR")
                .on(CharClass.RIGHT_PAREN).to("COMMENT_END")
                .onAnyExcept(CharClass.STAR, CharClass.RIGHT_PAREN).to("PAREN_COMMENT");
        b.state("COMMENT_END").accepting(TokenType.COMMENT);

        // Symbols that may be followed by a second character.
        b.state("COLON").accepting(TokenType.DELIMITER, Delimiter.COLON)
                .on(CharClass.EQUAL).to("ASSIGN");
        b.state("ASSIGN").accepting(TokenType.OPERATOR, Operator.ASSIGN);
        b.state("LESS").accepting(TokenType.OPERATOR, Operator.LESS)
                .on(CharClass.EQUAL).to("LESS_EQUAL")
                .on(CharClass.GREATER).to("NOT_EQUAL");
        b.state("LESS_EQUAL").accepting(TokenType.OPERATOR, Operator.LESS_EQUAL);
        b.state("NOT_EQUAL").accepting(TokenType.OPERATOR, Operator.NOT_EQUAL);
        b.state("GREATER").accepting(TokenType.OPERATOR, Operator.GREATER)
                .on(CharClass.EQUAL).to("GREATER_EQUAL");
        b.state("GREATER_EQUAL").accepting(TokenType.OPERATOR, Operator.GREATER_EQUAL);
        b.state("DOT").accepting(TokenType.DELIMITER, Delimiter.DOT)
                .on(CharClass.DOT).to("RANGE");
        b.state("RANGE").accepting(TokenType.OPERATOR, Operator.RANGE);

        // Single-character symbols.
        b.state("RIGHT_PAREN").accepting(TokenType.DELIMITER, Delimiter.RIGHT_PAREN);
        b.state("LEFT_BRACKET").accepting(TokenType.DELIMITER, Delimiter.LEFT_BRACKET);
        b.state("RIGHT_BRACKET").accepting(TokenType.DELIMITER, Delimiter.RIGHT_BRACKET);
        b.state("SEMICOLON").accepting(TokenType.DELIMITER, Delimiter.SEMICOLON);
        b.state("COMMA").accepting(TokenType.DELIMITER, Delimiter.COMMA);
        b.state("EQUAL").accepting(TokenType.OPERATOR, Operator.EQUAL);
        b.state("PLUS").accepting(TokenType.OPERATOR, Operator.PLUS);
        b.state("MINUS").accepting(TokenType.OPERATOR, Operator.MINUS);
        b.state("STAR").accepting(TokenType.OPERATOR, Operator.STAR);
        b.state("SLASH").accepting(TokenType.OPERATOR, Operator.SLASH);

        return b.build();
    }

    /**
     * Fluent builder for rule sets. States are referred to by name and may be
     * used as transition targets before they are declared.
     */
    public static final class Builder {

        private final Map<String, StateBuilder> states = new LinkedHashMap<>();
        private String startName;

        private Builder() {}

        /**
         * Declares a state, or returns the existing declaration.
         * @param name The state name.
         * @return The state builder.
         */
        public StateBuilder state(String name) {
            return states.computeIfAbsent(name, n -> new StateBuilder(this, n));
        }

        public Builder start(String name) {
            this.startName = name;
            return this;
        }

        /**
         * Resolves state names and freezes the table.
         * @return The rule set.
         * @throws IllegalStateException if the start state is missing or a transition targets an undeclared state.
         */
        public DfaRuleSet build() {
            if (startName == null || !states.containsKey(startName)) {
                throw new IllegalStateException("Start state is not declared: " + startName);
            }
            Map<String, Integer> ids = new LinkedHashMap<>();
            for (String name : states.keySet()) {
                ids.put(name, ids.size());
            }
            List<DfaState> built = new ArrayList<>();
            int[][] table = new int[states.size()][NUM_CHAR_CLASSES];
            for (StateBuilder sb : states.values()) {
                int id = ids.get(sb.name);
                built.add(new DfaState(id, sb.name, sb.accepts, sb.tag, sb.failure, sb.commits));
                Arrays.fill(table[id], NO_TRANSITION);
                for (Map.Entry<CharClass, String> edge : sb.edges.entrySet()) {
                    Integer target = ids.get(edge.getValue());
                    if (target == null) {
                        throw new IllegalStateException("State " + sb.name + " has an edge on " + edge.getKey()
                                + " to undeclared state " + edge.getValue());
                    }
                    table[id][edge.getKey().ordinal()] = target;
                }
            }
            return new DfaRuleSet(built, table, ids.get(startName));
        }
    }

    /**
     * Declares the properties and outgoing edges of one state.
     */
    public static final class StateBuilder {

        private final Builder parent;
        private final String name;
        private final Map<CharClass, String> edges = new EnumMap<>(CharClass.class);
        private TokenType accepts;
        private Object tag;
        private LexError failure;
        private boolean commits;

        private StateBuilder(Builder parent, String name) {
            this.parent = parent;
            this.name = name;
        }

        public StateBuilder accepting(TokenType type) {
            return accepting(type, null);
        }

        public StateBuilder accepting(TokenType type, Object tag) {
            this.accepts = type;
            this.tag = tag;
            return this;
        }

        public StateBuilder failingWith(LexError error) {
            this.failure = error;
            return this;
        }

        public StateBuilder committing() {
            this.commits = true;
            return this;
        }

        /**
         * Starts an edge on the given character classes.
         * @param classes The classes that take the edge.
         * @return A handle that completes the edge with its target.
         */
        public Edge on(CharClass... classes) {
            return new Edge(this, EnumSet.copyOf(Arrays.asList(classes)));
        }

        /**
         * Starts an edge on every character class except the given ones and {@link CharClass#END_OF_INPUT}.
         * @param excluded The classes that do not take the edge.
         * @return A handle that completes the edge with its target.
         */
        public Edge onAnyExcept(CharClass... excluded) {
            Set<CharClass> classes = EnumSet.allOf(CharClass.class);
            classes.remove(CharClass.END_OF_INPUT);
            classes.removeAll(Arrays.asList(excluded));
            return new Edge(this, classes);
        }

        public StateBuilder state(String other) {
            return parent.state(other);
        }

        public DfaRuleSet build() {
            return parent.build();
        }
    }

    /**
     * An edge under construction.
     */
    public static final class Edge {

        private final StateBuilder from;
        private final Set<CharClass> classes;

        private Edge(StateBuilder from, Set<CharClass> classes) {
            this.from = from;
            this.classes = classes;
        }

        /**
         * Completes the edge.
         * @param target The name of the target state.
         * @return The source state builder, for chaining further edges.
         * @throws IllegalStateException if one of the classes already has an edge from this state.
         */
        public StateBuilder to(String target) {
            for (CharClass c : classes) {
                String previous = from.edges.putIfAbsent(c, target);
                if (previous != null) {
                    throw new IllegalStateException("State " + from.name + " already has an edge on " + c);
                }
            }
            return from;
        }
    }
}
