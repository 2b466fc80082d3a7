package org.csu.vhdlfmt.formatter;

import org.csu.vhdlfmt.common.exception.FormatterContractException;
import org.csu.vhdlfmt.compiler.lexer.Token;
import org.csu.vhdlfmt.compiler.lexer.TokenKind;
import org.csu.vhdlfmt.compiler.lexer.TokenSource;
import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

import java.util.Set;

/**
 * @description: 各格式化器共用的 Token 复制与偏移定位方法
 *
 * 关键字和分隔符不从语法树字段合成，而是按相对节点 span 的固定偏移从 Token 流中复制。
 * 复制前校验该位置的 Token 种别，偏移与语法不一致时抛出 FormatterContractException，
 * 而不是悄悄输出错误的文本。
 */
public abstract class AbstractFormatter {

    protected final TokenSource tokens;

    protected AbstractFormatter(TokenSource tokens) {
        this.tokens = tokens;
    }

    /**
     * 复制 id 处的 Token，它必须是 expected 种别
     */
    protected void copyToken(OutputSink sink, int id, TokenKind expected) {
        expectToken(id, expected);
        sink.copyToken(id);
    }

    /**
     * 复制 id 处的 Token，它必须是 expected 中的某一种
     */
    protected void copyToken(OutputSink sink, int id, Set<TokenKind> expected) {
        Token token = tokens.token(id);
        if (!expected.contains(token.kind())) {
            throw new FormatterContractException(String.format(
                    "Token %d at line %d, column %d should be one of %s, but is '%s' (%s)",
                    id, token.line(), token.column(), expected, token.text(), token.kind()));
        }
        sink.copyToken(id);
    }

    /**
     * 依次复制 span 内的全部 Token，相邻 Token 之间一个空格
     */
    protected void copyTokensSpaced(OutputSink sink, TokenSpan span) {
        for (int id = span.startToken(); id <= span.endToken(); id++) {
            if (id > span.startToken()) {
                sink.space();
            }
            sink.copyToken(id);
        }
    }

    /**
     * 输出 span 末尾固定的 end for;
     */
    protected void formatEndFor(OutputSink sink, TokenSpan span) {
        int end = span.endToken();
        copyToken(sink, end - 2, TokenKind.END);
        sink.space();
        copyToken(sink, end - 1, TokenKind.FOR);
        copyToken(sink, end, TokenKind.SEMICOLON);
    }

    /**
     * 换行；若源码中 previousToken 与下一个 Token 之间有空行，则保留一个空行
     */
    protected void lineBreakPreservingBlankLines(OutputSink sink, int previousToken) {
        sink.lineBreak();
        Token previous = tokens.token(previousToken);
        tokens.find(previousToken + 1).ifPresent(next -> {
            if (next.startLine() - previous.endLine() > 1) {
                sink.lineBreak();
            }
        });
    }

    /**
     * 源码中紧跟在 id 之后的 Token 是否为 kind
     */
    protected boolean isFollowedBy(int id, TokenKind kind) {
        return tokens.find(id + 1)
                .map(token -> token.kind() == kind)
                .orElse(false);
    }

    protected Token expectToken(int id, TokenKind expected) {
        Token token = tokens.token(id);
        if (token.kind() != expected) {
            throw FormatterContractException.unexpectedToken(id, token, expected);
        }
        return token;
    }
}
