package org.csu.vhdlfmt.compiler.parser.ast;

/**
 * 单个标识符 Token
 *
 * @param name  标识符文本
 * @param token 标识符所在的 Token id
 */
public record Ident(String name, int token) implements AstNode {

    @Override
    public TokenSpan span() {
        return TokenSpan.single(token);
    }
}
