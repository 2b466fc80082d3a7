package org.csu.vhdlfmt.compiler.lexer;

import java.util.List;

/**
 * @param kind             词法单元的类型 (种别码)
 * @param text             词法单元的原始文本，格式化时逐字节复制
 * @param line             所在的行号
 * @param column           所在的列号
 * @param leadingComments  位于该 Token 之前、独占行的注释
 * @param trailingComment  与该 Token 同一行、紧随其后的注释，可以为 null
 */
public record Token(TokenKind kind, String text, int line, int column,
                    List<Comment> leadingComments, Comment trailingComment) {

    public Token {
        leadingComments = List.copyOf(leadingComments);
    }

    public Token(TokenKind kind, String text, int line, int column) {
        this(kind, text, line, column, List.of(), null);
    }

    /**
     * Token 占据的最后一行 (含行尾注释)
     */
    public int endLine() {
        return trailingComment != null ? trailingComment.endLine() : line;
    }

    /**
     * Token 占据的第一行 (含前导注释)
     */
    public int startLine() {
        return leadingComments.isEmpty() ? line : leadingComments.get(0).line();
    }

    @Override
    public String toString() {
        return String.format("Token[Kind=%-17s, Text='%s', Position=%d:%d]",
                kind, text, line, column);
    }
}
