package org.csu.vhdlfmt.compiler.lexer;

import java.util.Optional;

/**
 * 按下标访问的 Token 序列。下标即 Token id，语法树中的 TokenSpan 都引用它。
 */
public interface TokenSource {

    /**
     * @throws org.csu.vhdlfmt.common.exception.FormatterContractException id 越界时
     */
    Token token(int id);

    /**
     * 越界时返回 empty，用于向后窥视可选的分隔符
     */
    Optional<Token> find(int id);

    int size();
}
