package org.csu.vhdlfmt.compiler.parser.ast.expression;

import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

/**
 * prefix.suffix，'.' 紧跟在 prefix 之后，suffix 是 span 的最后一个 Token
 */
public record SelectedName(Name prefix, String suffix, TokenSpan span) implements Name {
}
