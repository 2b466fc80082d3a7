package org.csu.vhdlfmt.compiler.parser.ast.expression;

import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

/**
 * 一元表达式，运算符是 span 的第一个 Token
 */
public record UnaryExpression(Expression operand, TokenSpan span) implements Expression {
}
