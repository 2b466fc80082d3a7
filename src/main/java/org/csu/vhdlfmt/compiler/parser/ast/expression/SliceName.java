package org.csu.vhdlfmt.compiler.parser.ast.expression;

import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

/**
 * 切片名 prefix(0 to 3)
 */
public record SliceName(Name prefix, Range range, TokenSpan span) implements Name {
}
