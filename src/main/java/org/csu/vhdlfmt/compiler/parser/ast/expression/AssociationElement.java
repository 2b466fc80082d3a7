package org.csu.vhdlfmt.compiler.parser.ast.expression;

import org.csu.vhdlfmt.compiler.parser.ast.AstNode;
import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

/**
 * 关联元素 formal => actual，或仅有 actual 的位置关联
 *
 * @param formal 形参名，位置关联时为 null
 * @param actual 实参表达式，可以是 open
 */
public record AssociationElement(Name formal, Expression actual, TokenSpan span) implements AstNode {
}
