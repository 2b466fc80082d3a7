package org.csu.vhdlfmt.compiler.parser.ast.expression;

import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

/**
 * 单个 Token 构成的名字，例如 rtl、\extended id\ 或运算符符号 "and"
 */
public record SimpleName(String designator, TokenSpan span) implements Name {
}
