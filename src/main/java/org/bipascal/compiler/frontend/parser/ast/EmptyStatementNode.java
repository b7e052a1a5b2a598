package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;

/**
 * The empty statement, e.g. between two consecutive semicolons or before {@code end}.
 *
 * @param position The position of the token that follows the empty statement.
 */
public record EmptyStatementNode(Position position) implements StatementNode {
}
