package org.csu.vhdlfmt.common.exception;

import org.csu.vhdlfmt.compiler.lexer.Token;
import org.csu.vhdlfmt.compiler.lexer.TokenKind;

/**
 * @description: 格式化器内部错误
 *
 * 语法树与格式化器约定不一致时抛出：遇到不支持的语法结构、Token id 越界、
 * 固定偏移处的 Token 不是预期的关键字或分隔符。这不是源码的问题，而是
 * 语法分析器与格式化器之间的契约被破坏，因此不可恢复，本次格式化立即终止。
 */
public class FormatterContractException extends RuntimeException {

    public FormatterContractException(String message) {
        super(message);
    }

    public static FormatterContractException unsupported(String construct, Token at) {
        return new FormatterContractException(String.format(
                "Unsupported construct at line %d, column %d: %s",
                at.line(), at.column(), construct));
    }

    public static FormatterContractException tokenOutOfRange(int id, int size) {
        return new FormatterContractException(String.format(
                "Token id %d is out of range (token stream has %d tokens)", id, size));
    }

    public static FormatterContractException unexpectedToken(int id, Token actual, TokenKind expected) {
        return new FormatterContractException(String.format(
                "Token %d at line %d, column %d should be %s, but is '%s' (%s)",
                id, actual.line(), actual.column(), expected, actual.text(), actual.kind()));
    }
}
