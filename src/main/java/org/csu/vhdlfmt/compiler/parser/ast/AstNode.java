package org.csu.vhdlfmt.compiler.parser.ast;

/**
 * 所有语法树节点的公共接口，每个节点都记录它在 Token 流中的范围
 */
public interface AstNode {

    TokenSpan span();
}
