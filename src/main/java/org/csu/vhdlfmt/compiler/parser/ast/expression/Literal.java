package org.csu.vhdlfmt.compiler.parser.ast.expression;

import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

/**
 * 单 Token 字面量：数字、字符串、位串、字符，以及 open / null / others
 */
public record Literal(String text, TokenSpan span) implements Expression {
}
