package org.csu.vhdlfmt.compiler.parser.ast.expression;

import org.csu.vhdlfmt.compiler.parser.ast.AstNode;
import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

/**
 * left to|downto right，方向关键字紧跟在 left 之后
 */
public record Range(Expression left, Expression right, TokenSpan span) implements AstNode {
}
