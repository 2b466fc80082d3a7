package org.csu.vhdlfmt.compiler.lexer;

/**
 * 源码中的注释，原样保存
 *
 * @param text    注释全文，包括定界符
 * @param line    起始行号
 * @param endLine 结束行号 (块注释可跨行)
 * @param block   是否为块注释
 */
public record Comment(String text, int line, int endLine, boolean block) {

    /**
     * 行注释之后同一行不能再跟任何内容
     */
    public boolean endsLine() {
        return !block;
    }
}
