package org.csu.vhdlfmt.common.exception;

import org.csu.vhdlfmt.compiler.lexer.Token;

/**
 * @description: 语法分析阶段的异常，面向用户的源码诊断
 */
public class ParseException extends RuntimeException {

    private final int line;
    private final int column;

    public ParseException(String message) {
        super(message);
        this.line = 0;
        this.column = 0;
    }

    public ParseException(Token token, String expected) {
        super(String.format("Syntax Error at line %d, column %d: Expected %s, but found '%s' (%s)",
                token.line(),
                token.column(),
                expected,
                token.text(),
                token.kind()));
        this.line = token.line();
        this.column = token.column();
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
