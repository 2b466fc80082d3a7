package org.csu.vhdlfmt.compiler.parser.ast.context;

import org.csu.vhdlfmt.compiler.parser.ast.AstNode;

/**
 * 上下文子句中的一项：library 子句、use 子句或 context 引用
 */
public interface ContextItem extends AstNode {
}
