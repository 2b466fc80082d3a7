package org.csu.vhdlfmt.compiler.lexer;

import org.csu.vhdlfmt.common.exception.FormatterContractException;

import java.util.List;
import java.util.Optional;

/**
 * 基于 List 的 TokenSource，词法分析的结果一次性放入
 */
public class TokenStream implements TokenSource {

    private final List<Token> tokens;

    public TokenStream(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public static TokenStream of(String source) {
        return new TokenStream(new Lexer(source).tokenize());
    }

    @Override
    public Token token(int id) {
        if (id < 0 || id >= tokens.size()) {
            throw FormatterContractException.tokenOutOfRange(id, tokens.size());
        }
        return tokens.get(id);
    }

    @Override
    public Optional<Token> find(int id) {
        if (id < 0 || id >= tokens.size()) {
            return Optional.empty();
        }
        return Optional.of(tokens.get(id));
    }

    @Override
    public int size() {
        return tokens.size();
    }

    public List<Token> tokens() {
        return tokens;
    }
}
