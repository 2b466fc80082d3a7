package org.csu.vhdlfmt.compiler.parser.ast.expression;

import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

/**
 * 二元表达式，运算符紧跟在 left 的最后一个 Token 之后
 */
public record BinaryExpression(Expression left, Expression right, TokenSpan span) implements Expression {
}
