package org.csu.vhdlfmt.compiler.parser.ast.expression;

/**
 * 名字：简单名、选择名、下标/调用、切片、属性
 */
public interface Name extends Expression {
}
