package org.csu.vhdlfmt.compiler.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将 VHDL 源码分解为一系列的 Token。注释不会丢弃，而是挂在相邻的 Token 上：
 * 与上一个 Token 同一行开始的注释作为它的行尾注释，其余注释作为下一个 Token 的前导注释。
 */
public class Lexer {

    private static final Set<String> BIT_STRING_BASES = Set.of(
            "b", "o", "x", "d", "ub", "uo", "ux", "sb", "so", "sx");

    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号
    private TokenKind lastKind = null;

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token，最后一个总是 EOF
     * @return Token列表
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.kind() != TokenKind.EOF);
        return tokens;
    }

    private Token nextToken() {
        List<Comment> leading = new ArrayList<>();
        skipWhitespace();
        while (startsComment()) {
            leading.add(readComment());
            skipWhitespace();
        }

        if (position >= input.length()) {
            return new Token(TokenKind.EOF, "", line, column, leading, null);
        }

        int startLine = line;
        int startCol = column;
        int startPos = position;
        TokenKind kind = scan();
        lastKind = kind;
        String text = input.substring(startPos, position);
        Comment trailing = readTrailingComment();
        return new Token(kind, text, startLine, startCol, leading, trailing);
    }

    /**
     * 读取一个 Token 的文本，返回其种别码；position 停在 Token 之后
     */
    private TokenKind scan() {
        char currentChar = peek();

        if (isLetter(currentChar)) {
            return readIdentifierOrKeyword();
        }
        if (isDigit(currentChar)) {
            return readNumber();
        }

        switch (currentChar) {
            case '\\':
                return readExtendedIdentifier();
            case '"':
                return readString() ? TokenKind.STRING_LITERAL : TokenKind.ILLEGAL;
            case '\'':
                // 'x' 是字符字面量，name'attr 中的 ' 是 TICK
                if (peekAt(2) == '\'' && !followsName()) {
                    advance();
                    advance();
                    advance();
                    return TokenKind.CHARACTER_LITERAL;
                }
                return consume(TokenKind.TICK);
            case '(':
                return consume(TokenKind.LEFT_PAR);
            case ')':
                return consume(TokenKind.RIGHT_PAR);
            case ',':
                return consume(TokenKind.COMMA);
            case ';':
                return consume(TokenKind.SEMICOLON);
            case ':':
                return consume(TokenKind.COLON);
            case '.':
                return consume(TokenKind.DOT);
            case '|':
                return consume(TokenKind.BAR);
            case '&':
                return consume(TokenKind.CONCAT);
            case '+':
                return consume(TokenKind.PLUS);
            case '-':
                return consume(TokenKind.MINUS);
            case '=':
                if (peekNext() == '>') {
                    advance();
                    return consume(TokenKind.RIGHT_ARROW);
                }
                return consume(TokenKind.EQ);
            case '*':
                if (peekNext() == '*') {
                    advance();
                    return consume(TokenKind.POW);
                }
                return consume(TokenKind.TIMES);
            case '/':
                if (peekNext() == '=') {
                    advance();
                    return consume(TokenKind.NE);
                }
                return consume(TokenKind.DIV);
            case '<':
                if (peekNext() == '=') {
                    advance();
                    return consume(TokenKind.LTE);
                }
                return consume(TokenKind.LT);
            case '>':
                if (peekNext() == '=') {
                    advance();
                    return consume(TokenKind.GTE);
                }
                return consume(TokenKind.GT);
            default:
                return consume(TokenKind.ILLEGAL);
        }
    }

    private TokenKind readIdentifierOrKeyword() {
        int startPos = position;
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        if (peek() == '"' && BIT_STRING_BASES.contains(text.toLowerCase())) {
            return readString() ? TokenKind.BIT_STRING : TokenKind.ILLEGAL;
        }
        // 关键字忽略大小写
        return TokenKind.keywordOrIdentifier(text);
    }

    private TokenKind readExtendedIdentifier() {
        advance(); // 跳过起始的反斜杠
        while (position < input.length() && peek() != '\n') {
            if (peek() == '\\') {
                if (peekNext() == '\\') {
                    advance();
                    advance();
                    continue;
                }
                advance();
                return TokenKind.IDENTIFIER;
            }
            advance();
        }
        return TokenKind.ILLEGAL;
    }

    private TokenKind readNumber() {
        readDigits();

        if (peek() == '#') {
            advance();
            while (position < input.length() && (isHexDigit(peek()) || peek() == '_' || peek() == '.')) {
                advance();
            }
            if (peek() != '#') {
                return TokenKind.ILLEGAL;
            }
            advance();
        } else if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            readDigits();
        } else if (isBitStringPrefix()) {
            // 带位宽的位串，例如 8x"FF"
            while (isLetter(peek())) {
                advance();
            }
            return readString() ? TokenKind.BIT_STRING : TokenKind.ILLEGAL;
        }

        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            readDigits();
        }
        return TokenKind.ABSTRACT_LITERAL;
    }

    private boolean isBitStringPrefix() {
        int end = position;
        while (end < input.length() && isLetter(input.charAt(end))) {
            end++;
        }
        return end > position
                && end < input.length()
                && input.charAt(end) == '"'
                && BIT_STRING_BASES.contains(input.substring(position, end).toLowerCase());
    }

    /**
     * 读取双引号字符串，"" 表示转义的引号；不允许跨行
     * @return 字符串是否正确闭合
     */
    private boolean readString() {
        advance(); // 跳过起始的双引号
        while (position < input.length() && peek() != '\n') {
            if (peek() == '"') {
                if (peekNext() == '"') {
                    advance();
                    advance();
                    continue;
                }
                advance();
                return true;
            }
            advance();
        }
        return false; // 未闭合的字符串
    }

    // --- 注释 ---

    private boolean startsComment() {
        return (peek() == '-' && peekNext() == '-') || (peek() == '/' && peekNext() == '*');
    }

    private Comment readComment() {
        int startPos = position;
        int startLine = line;
        if (peek() == '-') {
            while (position < input.length() && peek() != '\n' && peek() != '\r') {
                advance();
            }
            return new Comment(input.substring(startPos, position), startLine, startLine, false);
        }
        advance();
        advance();
        while (position < input.length() && !(peek() == '*' && peekNext() == '/')) {
            advance();
        }
        // 未闭合的块注释一直读到文件末尾
        if (position < input.length()) {
            advance();
            advance();
        }
        return new Comment(input.substring(startPos, position), startLine, line, true);
    }

    private Comment readTrailingComment() {
        int save = position;
        int saveCol = column;
        while (position < input.length() && (peek() == ' ' || peek() == '\t')) {
            advance();
        }
        if (startsComment()) {
            return readComment();
        }
        position = save;
        column = saveCol;
        return null;
    }

    // --- 辅助方法 ---

    private boolean followsName() {
        return lastKind == TokenKind.IDENTIFIER
                || lastKind == TokenKind.RIGHT_PAR
                || lastKind == TokenKind.ALL;
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private void readDigits() {
        while (position < input.length() && (isDigit(peek()) || peek() == '_')) {
            advance();
        }
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (position + offset >= input.length()) return '\0'; // 文件结束符
        return input.charAt(position + offset);
    }

    private void advance() {
        if (input.charAt(position) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        position++;
    }

    private TokenKind consume(TokenKind kind) {
        advance();
        return kind;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c) || c == '_';
    }
}
