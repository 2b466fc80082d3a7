package org.csu.vhdlfmt.formatter;

import org.csu.vhdlfmt.compiler.lexer.Comment;
import org.csu.vhdlfmt.compiler.lexer.Token;
import org.csu.vhdlfmt.compiler.lexer.TokenSource;

/**
 * @description: 基于 StringBuilder 的 OutputSink 实现
 *
 * 缩进在一行写入第一段文本时才输出，所以空行不会带行尾空白。
 * 行注释之后需要换行，但换行推迟到下一段文本写入时再做，这样紧随其后的
 * lineBreak() 不会多出一个空行。
 */
public class Buffer implements OutputSink {

    private final TokenSource tokens;
    private final FormatOptions options;
    private final StringBuilder out = new StringBuilder();
    private int indentLevel = 0;
    private boolean atLineStart = true;
    private boolean pendingLineBreak = false;

    public Buffer(TokenSource tokens, FormatOptions options) {
        this.tokens = tokens;
        this.options = options;
    }

    @Override
    public void copyToken(int id) {
        Token token = tokens.token(id);
        writeLeadingComments(token);
        pushText(token.text());
        Comment trailing = token.trailingComment();
        if (trailing != null) {
            space();
            pushText(trailing.text());
            if (trailing.endsLine()) {
                pendingLineBreak = true;
            }
        }
    }

    @Override
    public void copyLeadingComments(int id) {
        writeLeadingComments(tokens.token(id));
    }

    @Override
    public void space() {
        if (pendingLineBreak || atLineStart || out.length() == 0) {
            return;
        }
        if (out.charAt(out.length() - 1) == ' ') {
            return;
        }
        out.append(' ');
    }

    @Override
    public void lineBreak() {
        pendingLineBreak = false;
        trimTrailingSpaces();
        if (out.length() == 0) {
            return;
        }
        // 末尾已有 n 个换行即已有 n-1 个空行
        if (trailingNewlines() > options.maxBlankLines()) {
            return;
        }
        out.append('\n');
        atLineStart = true;
    }

    @Override
    public IndentScope indent() {
        indentLevel++;
        return new IndentScope(() -> indentLevel--);
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    public String text() {
        return out.toString();
    }

    @Override
    public String toString() {
        return text();
    }

    /**
     * 前导注释各占一行；注释之间、注释与 Token 之间的源码空行最多保留一个
     */
    private void writeLeadingComments(Token token) {
        if (token.leadingComments().isEmpty()) {
            return;
        }
        if (!atLineStart) {
            lineBreak();
        }
        Comment previous = null;
        for (Comment comment : token.leadingComments()) {
            if (previous != null && comment.line() - previous.endLine() > 1) {
                lineBreak();
            }
            pushText(comment.text());
            lineBreak();
            previous = comment;
        }
        if (token.line() - previous.endLine() > 1) {
            lineBreak();
        }
    }

    private void pushText(String text) {
        if (pendingLineBreak) {
            lineBreak();
        }
        if (atLineStart) {
            for (int i = 0; i < indentLevel; i++) {
                out.append(options.indentUnit());
            }
            atLineStart = false;
        }
        out.append(text);
    }

    private void trimTrailingSpaces() {
        int length = out.length();
        while (length > 0 && (out.charAt(length - 1) == ' ' || out.charAt(length - 1) == '\t')) {
            length--;
        }
        out.setLength(length);
    }

    private int trailingNewlines() {
        int count = 0;
        for (int i = out.length() - 1; i >= 0 && out.charAt(i) == '\n'; i--) {
            count++;
        }
        return count;
    }
}
