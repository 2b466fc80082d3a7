package org.csu.vhdlfmt.compiler.lexer;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * @description: 词法单元（Token）的种别码
 *
 * 只收录配置声明语法用得到的保留字；其余 VHDL 保留字按普通标识符处理。
 */
public enum TokenKind {
    // ---- 关键字 (Keywords) ----
    ABS,
    ALL,
    AND,
    CONFIGURATION,
    CONTEXT,
    DOWNTO,
    END,
    ENTITY,
    FOR,
    GENERIC,
    IS,
    LIBRARY,
    MAP,
    MOD,
    NAND,
    NOR,
    NOT,
    NULL,
    OF,
    OPEN,
    OR,
    OTHERS,
    PORT,
    REM,
    ROL,
    ROR,
    SLA,
    SLL,
    SRA,
    SRL,
    TO,
    USE,
    VUNIT,
    XNOR,
    XOR,

    // ---- 标识符 (Identifier) ----
    IDENTIFIER,         // 普通标识符与扩展标识符 \foo bar\

    // ---- 常量 (Literals) ----
    ABSTRACT_LITERAL,   // 123, 1.5e3, 16#FF#
    STRING_LITERAL,     // "text"
    BIT_STRING,         // x"FF", 8b"0101"
    CHARACTER_LITERAL,  // 'a'

    // ---- 分隔符 (Delimiters) ----
    LEFT_PAR,       // (
    RIGHT_PAR,      // )
    COMMA,          // ,
    SEMICOLON,      // ;
    COLON,          // :
    DOT,            // .
    RIGHT_ARROW,    // =>
    TICK,           // '
    BAR,            // |

    // ---- 运算符 (Operators) ----
    PLUS,           // +
    MINUS,          // -
    TIMES,          // *
    DIV,            // /
    POW,            // **
    CONCAT,         // &
    EQ,             // =
    NE,             // /=
    LT,             // <
    LTE,            // <=
    GT,             // >
    GTE,            // >=

    // ---- 特殊 Token ----
    EOF,
    ILLEGAL;

    private static final Map<String, TokenKind> KEYWORDS;

    static {
        Map<String, TokenKind> keywords = new HashMap<>();
        for (TokenKind kind : EnumSet.range(ABS, XOR)) {
            keywords.put(kind.name().toLowerCase(), kind);
        }
        KEYWORDS = Collections.unmodifiableMap(keywords);
    }

    /**
     * 按小写拼写查找保留字，找不到时返回 IDENTIFIER
     */
    public static TokenKind keywordOrIdentifier(String text) {
        return KEYWORDS.getOrDefault(text.toLowerCase(), IDENTIFIER);
    }

    public static Set<TokenKind> keywords() {
        return EnumSet.range(ABS, XOR);
    }

    public boolean isKeyword() {
        return compareTo(ABS) >= 0 && compareTo(XOR) <= 0;
    }
}
