package org.csu.vhdlfmt.compiler.parser.ast.expression;

import org.csu.vhdlfmt.compiler.parser.ast.Ident;
import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

/**
 * 属性名 prefix'attr 或 prefix'attr(expr)
 *
 * @param argument 可选参数，可以为 null
 */
public record AttributeName(Name prefix, Ident attribute, Expression argument, TokenSpan span) implements Name {
}
