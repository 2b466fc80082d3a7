package org.csu.vhdlfmt.compiler.parser.ast;

/**
 * 节点在 Token 流中的闭区间 [startToken, endToken]，由语法分析器一次性记录。
 * 格式化器据此按固定偏移定位关键字，例如块配置末尾的 end / for / ;。
 */
public record TokenSpan(int startToken, int endToken) {

    public TokenSpan {
        if (startToken < 0 || endToken < startToken) {
            throw new IllegalArgumentException("Invalid token span [" + startToken + ", " + endToken + "]");
        }
    }

    public static TokenSpan single(int token) {
        return new TokenSpan(token, token);
    }

    public int length() {
        return endToken - startToken + 1;
    }
}
