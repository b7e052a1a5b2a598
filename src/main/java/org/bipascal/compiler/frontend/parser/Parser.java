package org.bipascal.compiler.frontend.parser;

import org.bipascal.compiler.api.FrontendOptions;
import org.bipascal.compiler.diagnostics.DiagnosticsEngine;
import org.bipascal.compiler.frontend.CompilerPhase;
import org.bipascal.compiler.frontend.lexer.Delimiter;
import org.bipascal.compiler.frontend.lexer.Keyword;
import org.bipascal.compiler.frontend.lexer.Operator;
import org.bipascal.compiler.frontend.lexer.Token;
import org.bipascal.compiler.frontend.lexer.TokenType;
import org.bipascal.compiler.frontend.parser.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The parser for Pascal-S. It consumes the tokens produced by the
 * {@link org.bipascal.compiler.frontend.lexer.Lexer} and builds a {@link ProgramNode}.
 * <p>
 * Declarations and statements are parsed by recursive descent, expressions by
 * precedence climbing over {@link BinaryOperator#precedence()}. A syntax error
 * puts the parser into panic mode, in which further errors are not recorded,
 * until the enclosing declaration or statement list resynchronizes on its stop set.
 * The tree is built on a best-effort basis: statement and declaration nodes may
 * have missing children after an error, expression nodes are either complete or absent.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final StopSet STATEMENT_STOP = new StopSet(
            EnumSet.of(Keyword.END, Keyword.ELSE, Keyword.IF, Keyword.WHILE, Keyword.FOR, Keyword.BEGIN),
            EnumSet.of(Delimiter.SEMICOLON, Delimiter.DOT));

    private static final StopSet DECLARATION_STOP = new StopSet(
            EnumSet.of(Keyword.VAR, Keyword.CONST, Keyword.TYPE, Keyword.PROCEDURE, Keyword.FUNCTION, Keyword.BEGIN),
            EnumSet.of(Delimiter.SEMICOLON));

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final int maxErrors;
    private final List<SyntaxError> errors = new ArrayList<>();
    private int current = 0;
    private boolean panicking = false;
    private boolean aborted = false;

    /**
     * Constructs a new Parser with the default error limit.
     * @param tokens The tokens to parse, ending with END_OF_FILE.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, FrontendOptions.defaults());
    }

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse, ending with END_OF_FILE. INVALID tokens are skipped.
     * @param diagnostics The engine for reporting errors.
     * @param options Supplies the error limit.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, FrontendOptions options) {
        Objects.requireNonNull(tokens, "tokens");
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_FILE) {
            throw new IllegalArgumentException("Token list must end with END_OF_FILE");
        }
        // Lexical errors have already been reported by the lexer.
        this.tokens = tokens.stream().filter(t -> t.type() != TokenType.INVALID).toList();
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.maxErrors = options.maxErrors();
    }

    /**
     * Parses the whole token list.
     * @return The program tree and the syntax errors.
     */
    public ParseResult parse() {
        current = 0;
        panicking = false;
        aborted = false;
        errors.clear();

        Token first = peek();
        if (!check(Keyword.PROGRAM) && tokens.stream().noneMatch(t -> t.is(Keyword.BEGIN))) {
            record(new SyntaxError(SyntaxErrorKind.MISSING_PROGRAM_STRUCTURE, first.position(),
                    "a 'program' header or a 'begin' block", first));
            return new ParseResult(null, errors);
        }

        Token name = null;
        if (match(Keyword.PROGRAM)) {
            name = expect(TokenType.IDENTIFIER, "a program name after 'program'", SyntaxErrorKind.UNEXPECTED_TOKEN);
            if (!panicking) {
                expect(Delimiter.SEMICOLON, "';' after the program header", SyntaxErrorKind.UNEXPECTED_TOKEN);
            }
        } else {
            error(SyntaxErrorKind.UNEXPECTED_TOKEN, "a 'program' header");
        }
        if (panicking) {
            recoverDeclaration();
        }

        List<DeclarationNode> declarations = declarations();

        BlockNode block = null;
        if (check(Keyword.BEGIN)) {
            block = block();
        } else {
            error(SyntaxErrorKind.UNEXPECTED_TOKEN, "'begin' to start the main block");
            while (!isAtEnd() && !check(Keyword.BEGIN)) {
                advance();
            }
            if (check(Keyword.BEGIN)) {
                panicking = false;
                block = block();
            }
        }

        boolean terminated = false;
        if (!panicking) {
            terminated = expect(Delimiter.DOT, "'.' after the main block", SyntaxErrorKind.UNEXPECTED_TOKEN) != null;
        }
        panicking = false;
        if (terminated && !isAtEnd()) {
            error(SyntaxErrorKind.UNEXPECTED_TOKEN, "end of file after the final '.'");
        }

        ProgramNode program = new ProgramNode(first.position(), name, declarations, block);
        LOG.debug("Parsed {}: {} declarations, {} syntax errors",
                first.fileName(), declarations.size(), errors.size());
        return new ParseResult(program, errors);
    }

    // --- Declarations ---

    private List<DeclarationNode> declarations() {
        List<DeclarationNode> declarations = new ArrayList<>();
        while (!isAtEnd()) {
            if (check(Keyword.VAR)) {
                varSection(declarations);
            } else if (check(Keyword.CONST)) {
                constSection(declarations);
            } else if (check(Keyword.TYPE)) {
                typeSection(declarations);
            } else if (check(Keyword.PROCEDURE)) {
                declarations.add(procedure());
            } else if (check(Keyword.FUNCTION)) {
                declarations.add(function());
            } else {
                break;
            }
            if (panicking) {
                recoverDeclaration();
            }
        }
        return declarations;
    }

    private void varSection(List<DeclarationNode> declarations) {
        advance();
        do {
            List<Token> names = identifierList("a variable name");
            if (!names.isEmpty() && expect(Delimiter.COLON, "':' after the variable names",
                    SyntaxErrorKind.MALFORMED_DECLARATION) != null) {
                declarations.add(new VarDeclNode(names, type()));
            } else if (!names.isEmpty()) {
                declarations.add(new VarDeclNode(names, null));
            }
            endDeclaration("';' after the variable declaration");
        } while (check(TokenType.IDENTIFIER));
    }

    private void constSection(List<DeclarationNode> declarations) {
        advance();
        do {
            Token name = expect(TokenType.IDENTIFIER, "a constant name", SyntaxErrorKind.MALFORMED_DECLARATION);
            if (name != null) {
                ExpressionNode value = null;
                if (expect(Operator.EQUAL, "'=' after the constant name", SyntaxErrorKind.MALFORMED_DECLARATION) != null) {
                    value = constant();
                }
                declarations.add(new ConstDeclNode(name, value));
            }
            endDeclaration("';' after the constant declaration");
        } while (check(TokenType.IDENTIFIER));
    }

    private void typeSection(List<DeclarationNode> declarations) {
        advance();
        do {
            Token name = expect(TokenType.IDENTIFIER, "a type name", SyntaxErrorKind.MALFORMED_DECLARATION);
            if (name != null) {
                TypeNode type = null;
                if (expect(Operator.EQUAL, "'=' after the type name", SyntaxErrorKind.MALFORMED_DECLARATION) != null) {
                    type = type();
                }
                declarations.add(new TypeDeclNode(name, type));
            }
            endDeclaration("';' after the type declaration");
        } while (check(TokenType.IDENTIFIER));
    }

    private ProcedureDeclNode procedure() {
        Token keyword = advance();
        Token name = expect(TokenType.IDENTIFIER, "a procedure name", SyntaxErrorKind.MALFORMED_DECLARATION);
        List<ParameterNode> parameters = name != null && check(Delimiter.LEFT_PAREN) ? parameters() : List.of();
        endDeclaration("';' after the procedure header");
        List<DeclarationNode> locals = declarations();
        BlockNode body = subprogramBody("'begin' to start the procedure body");
        if (!panicking) {
            expect(Delimiter.SEMICOLON, "';' after the procedure body", SyntaxErrorKind.MALFORMED_DECLARATION);
        }
        return new ProcedureDeclNode(keyword, name, parameters, locals, body);
    }

    private FunctionDeclNode function() {
        Token keyword = advance();
        Token name = expect(TokenType.IDENTIFIER, "a function name", SyntaxErrorKind.MALFORMED_DECLARATION);
        List<ParameterNode> parameters = name != null && check(Delimiter.LEFT_PAREN) ? parameters() : List.of();
        TypeNode returnType = null;
        if (!panicking && expect(Delimiter.COLON, "':' before the function's return type",
                SyntaxErrorKind.MALFORMED_DECLARATION) != null) {
            returnType = type();
        }
        endDeclaration("';' after the function header");
        List<DeclarationNode> locals = declarations();
        BlockNode body = subprogramBody("'begin' to start the function body");
        if (!panicking) {
            expect(Delimiter.SEMICOLON, "';' after the function body", SyntaxErrorKind.MALFORMED_DECLARATION);
        }
        return new FunctionDeclNode(keyword, name, parameters, returnType, locals, body);
    }

    private BlockNode subprogramBody(String expected) {
        if (check(Keyword.BEGIN)) {
            return block();
        }
        error(SyntaxErrorKind.UNEXPECTED_TOKEN, expected);
        return null;
    }

    private List<ParameterNode> parameters() {
        advance(); // Consume '('
        List<ParameterNode> parameters = new ArrayList<>();
        do {
            boolean byReference = match(Keyword.VAR);
            List<Token> names = identifierList("a parameter name");
            if (names.isEmpty()) {
                break;
            }
            if (expect(Delimiter.COLON, "':' after the parameter names", SyntaxErrorKind.MALFORMED_DECLARATION) == null) {
                parameters.add(new ParameterNode(names, null, byReference));
                break;
            }
            parameters.add(new ParameterNode(names, type(), byReference));
        } while (!panicking && match(Delimiter.SEMICOLON));
        if (!panicking) {
            expect(Delimiter.RIGHT_PAREN, "')' after the parameters", SyntaxErrorKind.MALFORMED_DECLARATION);
        }
        return parameters;
    }

    private List<Token> identifierList(String expected) {
        List<Token> names = new ArrayList<>();
        Token name = expect(TokenType.IDENTIFIER, expected, SyntaxErrorKind.MALFORMED_DECLARATION);
        if (name == null) {
            return names;
        }
        names.add(name);
        while (match(Delimiter.COMMA)) {
            name = expect(TokenType.IDENTIFIER, expected + " after ','", SyntaxErrorKind.MALFORMED_DECLARATION);
            if (name == null) {
                break;
            }
            names.add(name);
        }
        return names;
    }

    private void endDeclaration(String expected) {
        if (!panicking) {
            expect(Delimiter.SEMICOLON, expected, SyntaxErrorKind.MALFORMED_DECLARATION);
        }
        if (panicking) {
            recoverDeclaration();
        }
    }

    private void recoverDeclaration() {
        synchronize(DECLARATION_STOP);
        match(Delimiter.SEMICOLON);
    }

    private ExpressionNode constant() {
        if ((check(Operator.MINUS) || check(Operator.PLUS))
                && (checkNext(TokenType.INTEGER_LITERAL) || checkNext(TokenType.REAL_LITERAL))) {
            Token sign = advance();
            return new UnaryNode(sign.is(Operator.MINUS) ? UnaryOperator.NEGATE : UnaryOperator.PLUS,
                    sign, new LiteralNode(advance()));
        }
        if (checkLiteral()) {
            return new LiteralNode(advance());
        }
        if (check(TokenType.IDENTIFIER)) {
            return new VariableNode(advance(), null);
        }
        error(SyntaxErrorKind.MALFORMED_DECLARATION, "a constant value");
        return null;
    }

    // --- Types ---

    private TypeNode type() {
        if (check(Keyword.ARRAY)) {
            return arrayType();
        }
        if (check(TokenType.INTEGER_LITERAL) || check(TokenType.CHAR_LITERAL)
                || check(Operator.MINUS) || check(Operator.PLUS)
                || (check(TokenType.IDENTIFIER) && checkNext(Operator.RANGE))) {
            return subrange();
        }
        if (check(TokenType.IDENTIFIER)) {
            return new NamedTypeNode(advance());
        }
        error(SyntaxErrorKind.MALFORMED_DECLARATION, "a type");
        return null;
    }

    private ArrayTypeNode arrayType() {
        Token array = advance();
        if (expect(Delimiter.LEFT_BRACKET, "'[' after 'array'", SyntaxErrorKind.MALFORMED_DECLARATION) == null) {
            return new ArrayTypeNode(array, null, null);
        }
        SubrangeTypeNode range = subrange();
        if (panicking
                || expect(Delimiter.RIGHT_BRACKET, "']' after the index range", SyntaxErrorKind.MALFORMED_DECLARATION) == null
                || expect(Keyword.OF, "'of' after the index range", SyntaxErrorKind.MALFORMED_DECLARATION) == null) {
            return new ArrayTypeNode(array, range, null);
        }
        return new ArrayTypeNode(array, range, type());
    }

    private SubrangeTypeNode subrange() {
        ExpressionNode low = bound();
        if (low == null) {
            return null;
        }
        if (expect(Operator.RANGE, "'..' in the subrange", SyntaxErrorKind.MALFORMED_DECLARATION) == null) {
            return new SubrangeTypeNode(low, null);
        }
        return new SubrangeTypeNode(low, bound());
    }

    private ExpressionNode bound() {
        if ((check(Operator.MINUS) || check(Operator.PLUS)) && checkNext(TokenType.INTEGER_LITERAL)) {
            Token sign = advance();
            return new UnaryNode(sign.is(Operator.MINUS) ? UnaryOperator.NEGATE : UnaryOperator.PLUS,
                    sign, new LiteralNode(advance()));
        }
        if (check(TokenType.INTEGER_LITERAL) || check(TokenType.CHAR_LITERAL)) {
            return new LiteralNode(advance());
        }
        if (check(TokenType.IDENTIFIER)) {
            return new VariableNode(advance(), null);
        }
        error(SyntaxErrorKind.MALFORMED_DECLARATION, "a subrange bound");
        return null;
    }

    // --- Statements ---

    private BlockNode block() {
        Token begin = advance();
        List<StatementNode> statements = statementList();
        if (!match(Keyword.END)) {
            error(SyntaxErrorKind.UNCLOSED_BLOCK, "'end' to close the block opened at " + begin.position());
        }
        return new BlockNode(begin, statements);
    }

    private List<StatementNode> statementList() {
        List<StatementNode> statements = new ArrayList<>();
        while (!isAtEnd() && !check(Keyword.END) && !check(Delimiter.DOT)) {
            StatementNode statement = statement();
            if (statement != null) {
                statements.add(statement);
            }
            boolean recovering = panicking;
            if (panicking) {
                synchronize(STATEMENT_STOP);
            }
            if (match(Delimiter.SEMICOLON)) {
                continue;
            }
            if (isAtEnd() || check(Keyword.END) || check(Delimiter.DOT)) {
                break;
            }
            if (startsStatement()) {
                if (!recovering) {
                    error(SyntaxErrorKind.UNEXPECTED_TOKEN, "';' between statements");
                    panicking = false;
                }
                continue;
            }
            error(SyntaxErrorKind.UNEXPECTED_TOKEN, "';' or 'end'");
            advance();
            synchronize(STATEMENT_STOP);
        }
        return statements;
    }

    private StatementNode statement() {
        if (check(Keyword.IF)) return ifStatement();
        if (check(Keyword.WHILE)) return whileStatement();
        if (check(Keyword.FOR)) return forStatement();
        if (check(Keyword.BEGIN)) return block();
        if (check(TokenType.IDENTIFIER)) {
            if (checkNext(Operator.ASSIGN) || checkNext(Delimiter.LEFT_BRACKET)) {
                return assignment();
            }
            return procedureCall();
        }
        if (isAtEnd() || check(Delimiter.SEMICOLON) || check(Keyword.END)
                || check(Keyword.ELSE) || check(Delimiter.DOT)) {
            return new EmptyStatementNode(peek().position());
        }
        error(SyntaxErrorKind.UNEXPECTED_TOKEN, "a statement");
        return null;
    }

    private IfNode ifStatement() {
        Token ifToken = advance();
        ExpressionNode condition = expression();
        StatementNode thenBranch = null;
        if (!panicking && expect(Keyword.THEN, "'then' after the condition", SyntaxErrorKind.UNEXPECTED_TOKEN) != null) {
            thenBranch = statement();
        }
        if (panicking) {
            // Recovery inside an if resumes at its else; any other stop is left to the statement list.
            synchronize(STATEMENT_STOP);
            if (!check(Keyword.ELSE)) {
                panicking = true;
                return new IfNode(ifToken, condition, thenBranch, null);
            }
        }
        // A trailing else belongs to the nearest if.
        StatementNode elseBranch = match(Keyword.ELSE) ? statement() : null;
        return new IfNode(ifToken, condition, thenBranch, elseBranch);
    }

    private WhileNode whileStatement() {
        Token whileToken = advance();
        ExpressionNode condition = expression();
        if (panicking || expect(Keyword.DO, "'do' after the loop condition", SyntaxErrorKind.UNEXPECTED_TOKEN) == null) {
            return new WhileNode(whileToken, condition, null);
        }
        return new WhileNode(whileToken, condition, statement());
    }

    private ForNode forStatement() {
        Token forToken = advance();
        Token variable = expect(TokenType.IDENTIFIER, "a loop variable after 'for'", SyntaxErrorKind.UNEXPECTED_TOKEN);
        if (variable == null || expect(Operator.ASSIGN, "':=' after the loop variable", SyntaxErrorKind.UNEXPECTED_TOKEN) == null) {
            return new ForNode(forToken, variable, null, null, false, null);
        }
        ExpressionNode start = expression();
        if (panicking) {
            return new ForNode(forToken, variable, start, null, false, null);
        }
        boolean downTo;
        if (match(Keyword.TO)) {
            downTo = false;
        } else if (match(Keyword.DOWNTO)) {
            downTo = true;
        } else {
            error(SyntaxErrorKind.UNEXPECTED_TOKEN, "'to' or 'downto'");
            return new ForNode(forToken, variable, start, null, false, null);
        }
        ExpressionNode end = expression();
        if (panicking || expect(Keyword.DO, "'do' after the loop range", SyntaxErrorKind.UNEXPECTED_TOKEN) == null) {
            return new ForNode(forToken, variable, start, end, downTo, null);
        }
        return new ForNode(forToken, variable, start, end, downTo, statement());
    }

    private AssignmentNode assignment() {
        VariableNode target = variable();
        if (target == null) {
            return null;
        }
        if (expect(Operator.ASSIGN, "':=' in the assignment", SyntaxErrorKind.UNEXPECTED_TOKEN) == null) {
            return new AssignmentNode(target, null);
        }
        return new AssignmentNode(target, expression());
    }

    private ProcedureCallNode procedureCall() {
        Token name = advance();
        if (!match(Delimiter.LEFT_PAREN)) {
            return new ProcedureCallNode(name, List.of());
        }
        List<ExpressionNode> arguments = arguments();
        return new ProcedureCallNode(name, arguments != null ? arguments : List.of());
    }

    private VariableNode variable() {
        Token name = advance();
        if (!match(Delimiter.LEFT_BRACKET)) {
            return new VariableNode(name, null);
        }
        ExpressionNode index = expression();
        if (index == null || expect(Delimiter.RIGHT_BRACKET, "']' after the index", SyntaxErrorKind.UNEXPECTED_TOKEN) == null) {
            return null;
        }
        return new VariableNode(name, index);
    }

    /**
     * Parses an argument list after its opening parenthesis.
     * @return The arguments, or null if one of them could not be parsed.
     */
    private List<ExpressionNode> arguments() {
        List<ExpressionNode> arguments = new ArrayList<>();
        if (match(Delimiter.RIGHT_PAREN)) {
            return arguments;
        }
        do {
            ExpressionNode argument = expression();
            if (argument == null) {
                return null;
            }
            arguments.add(argument);
        } while (match(Delimiter.COMMA));
        if (expect(Delimiter.RIGHT_PAREN, "')' after the arguments", SyntaxErrorKind.UNEXPECTED_TOKEN) == null) {
            return null;
        }
        return arguments;
    }

    // --- Expressions ---

    /**
     * Parses an expression.
     * @return The expression, or null if it could not be parsed.
     */
    private ExpressionNode expression() {
        return binary(1);
    }

    private ExpressionNode binary(int minPrecedence) {
        ExpressionNode left = unary();
        if (left == null) {
            return null;
        }
        while (true) {
            BinaryOperator operator = binaryOperator(peek());
            if (operator == null || operator.precedence() < minPrecedence) {
                return left;
            }
            Token operatorToken = advance();
            ExpressionNode right = binary(operator.precedence() + 1);
            if (right == null) {
                return null;
            }
            left = new BinaryNode(operator, operatorToken, left, right);
            if (operator.isRelational()) {
                BinaryOperator next = binaryOperator(peek());
                if (next != null && next.isRelational()) {
                    // Reported once; the chain is still read left-nested.
                    error(SyntaxErrorKind.UNEXPECTED_TOKEN, "a single comparison, relational operators do not chain");
                }
            }
        }
    }

    private ExpressionNode unary() {
        if (check(Operator.MINUS) || check(Operator.PLUS) || check(Keyword.NOT)) {
            Token operatorToken = advance();
            ExpressionNode operand = unary();
            if (operand == null) {
                return null;
            }
            UnaryOperator operator = operatorToken.is(Operator.MINUS) ? UnaryOperator.NEGATE
                    : operatorToken.is(Operator.PLUS) ? UnaryOperator.PLUS
                    : UnaryOperator.NOT;
            return new UnaryNode(operator, operatorToken, operand);
        }
        return primary();
    }

    private ExpressionNode primary() {
        if (checkLiteral()) {
            return new LiteralNode(advance());
        }
        if (check(TokenType.IDENTIFIER)) {
            if (checkNext(Delimiter.LEFT_PAREN)) {
                Token name = advance();
                advance(); // Consume '('
                List<ExpressionNode> arguments = arguments();
                return arguments != null ? new FunctionCallNode(name, arguments) : null;
            }
            return variable();
        }
        if (match(Delimiter.LEFT_PAREN)) {
            ExpressionNode inner = expression();
            if (inner == null || expect(Delimiter.RIGHT_PAREN, "')' after the expression", SyntaxErrorKind.UNEXPECTED_TOKEN) == null) {
                return null;
            }
            return inner;
        }
        error(SyntaxErrorKind.UNEXPECTED_TOKEN, "an expression");
        return null;
    }

    private static BinaryOperator binaryOperator(Token token) {
        if (token.type() == TokenType.KEYWORD) {
            switch (token.keyword()) {
                case OR: return BinaryOperator.OR;
                case AND: return BinaryOperator.AND;
                case DIV: return BinaryOperator.INT_DIVIDE;
                case MOD: return BinaryOperator.MODULO;
                default: return null;
            }
        }
        if (token.type() == TokenType.OPERATOR) {
            switch (token.operator()) {
                case EQUAL: return BinaryOperator.EQUAL;
                case NOT_EQUAL: return BinaryOperator.NOT_EQUAL;
                case LESS: return BinaryOperator.LESS;
                case LESS_EQUAL: return BinaryOperator.LESS_EQUAL;
                case GREATER: return BinaryOperator.GREATER;
                case GREATER_EQUAL: return BinaryOperator.GREATER_EQUAL;
                case PLUS: return BinaryOperator.ADD;
                case MINUS: return BinaryOperator.SUBTRACT;
                case STAR: return BinaryOperator.MULTIPLY;
                case SLASH: return BinaryOperator.DIVIDE;
                default: return null;
            }
        }
        return null;
    }

    // --- Error handling ---

    private void error(SyntaxErrorKind kind, String expected) {
        if (panicking || aborted) {
            return;
        }
        panicking = true;
        Token found = peek();
        if (errors.size() >= maxErrors) {
            record(new SyntaxError(SyntaxErrorKind.TOO_MANY_ERRORS, found.position(), String.valueOf(maxErrors), found));
            aborted = true;
            current = tokens.size() - 1;
            return;
        }
        record(new SyntaxError(kind, found.position(), expected, found));
    }

    private void record(SyntaxError error) {
        errors.add(error);
        diagnostics.reportError(CompilerPhase.PARSING, error.message(), error.found().fileName(), error.position());
    }

    private void synchronize(StopSet stopSet) {
        while (!isAtEnd() && !stopSet.contains(peek())) {
            advance();
        }
        panicking = false;
    }

    private boolean startsStatement() {
        return check(TokenType.IDENTIFIER) || check(Keyword.IF) || check(Keyword.WHILE)
                || check(Keyword.FOR) || check(Keyword.BEGIN);
    }

    // --- Token primitives ---

    private Token expect(TokenType type, String expected, SyntaxErrorKind kind) {
        if (check(type)) return advance();
        error(kind, expected);
        return null;
    }

    private Token expect(Keyword keyword, String expected, SyntaxErrorKind kind) {
        if (check(keyword)) return advance();
        error(kind, expected);
        return null;
    }

    private Token expect(Operator operator, String expected, SyntaxErrorKind kind) {
        if (check(operator)) return advance();
        error(kind, expected);
        return null;
    }

    private Token expect(Delimiter delimiter, String expected, SyntaxErrorKind kind) {
        if (check(delimiter)) return advance();
        error(kind, expected);
        return null;
    }

    private boolean match(Keyword keyword) {
        if (check(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean match(Delimiter delimiter) {
        if (check(delimiter)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean check(Keyword keyword) {
        return peek().is(keyword);
    }

    private boolean check(Operator operator) {
        return peek().is(operator);
    }

    private boolean check(Delimiter delimiter) {
        return peek().is(delimiter);
    }

    private boolean checkLiteral() {
        return check(TokenType.INTEGER_LITERAL) || check(TokenType.REAL_LITERAL)
                || check(TokenType.STRING_LITERAL) || check(TokenType.CHAR_LITERAL);
    }

    private boolean checkNext(TokenType type) {
        return current + 1 < tokens.size() && tokens.get(current + 1).type() == type;
    }

    private boolean checkNext(Operator operator) {
        return current + 1 < tokens.size() && tokens.get(current + 1).is(operator);
    }

    private boolean checkNext(Delimiter delimiter) {
        return current + 1 < tokens.size() && tokens.get(current + 1).is(delimiter);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private record StopSet(Set<Keyword> keywords, Set<Delimiter> delimiters) {
        boolean contains(Token token) {
            Keyword keyword = token.keyword();
            if (keyword != null) {
                return keywords.contains(keyword);
            }
            return token.type() == TokenType.DELIMITER && delimiters.contains((Delimiter) token.value());
        }
    }
}
