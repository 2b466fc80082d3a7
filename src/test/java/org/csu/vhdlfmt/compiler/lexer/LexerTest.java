package org.csu.vhdlfmt.compiler.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @description: Lexer 类的单元测试
 */
public class LexerTest {

    private List<Token> tokenize(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        System.out.println("Tokens: " + tokens);
        return tokens;
    }

    private void assertKinds(List<Token> tokens, TokenKind... expected) {
        assertEquals(expected.length, tokens.size(), "Token数量不匹配");
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], tokens.get(i).kind(), "Token类型不匹配 at index " + i);
        }
    }

    @Test
    void testConfigurationHeader() {
        System.out.println("--- Running test: testConfigurationHeader ---");
        List<Token> tokens = tokenize("configuration cfg of entity_name is");

        assertKinds(tokens, TokenKind.CONFIGURATION, TokenKind.IDENTIFIER, TokenKind.OF,
                TokenKind.IDENTIFIER, TokenKind.IS, TokenKind.EOF);
        assertEquals("cfg", tokens.get(1).text());
        assertEquals("entity_name", tokens.get(3).text());
    }

    @Test
    void testKeywordsAreCaseInsensitiveButTextIsKept() {
        List<Token> tokens = tokenize("CONFIGURATION Cfg Of E iS");

        assertKinds(tokens, TokenKind.CONFIGURATION, TokenKind.IDENTIFIER, TokenKind.OF,
                TokenKind.IDENTIFIER, TokenKind.IS, TokenKind.EOF);
        assertEquals("CONFIGURATION", tokens.get(0).text());
        assertEquals("Of", tokens.get(2).text());
        assertEquals("iS", tokens.get(4).text());
    }

    @Test
    void testLiterals() {
        List<Token> tokens = tokenize("16#FF# 1.5e3 x\"FF\" 8b\"0101\" \"a\"\"b\" '0' 42");

        assertKinds(tokens, TokenKind.ABSTRACT_LITERAL, TokenKind.ABSTRACT_LITERAL, TokenKind.BIT_STRING,
                TokenKind.BIT_STRING, TokenKind.STRING_LITERAL, TokenKind.CHARACTER_LITERAL,
                TokenKind.ABSTRACT_LITERAL, TokenKind.EOF);
        assertEquals("16#FF#", tokens.get(0).text());
        assertEquals("1.5e3", tokens.get(1).text());
        assertEquals("x\"FF\"", tokens.get(2).text());
        assertEquals("8b\"0101\"", tokens.get(3).text());
        assertEquals("\"a\"\"b\"", tokens.get(4).text());
        assertEquals("'0'", tokens.get(5).text());
    }

    @Test
    void testTickAfterNameIsAttribute() {
        List<Token> tokens = tokenize("sig'range (others => '1')");

        assertKinds(tokens, TokenKind.IDENTIFIER, TokenKind.TICK, TokenKind.IDENTIFIER,
                TokenKind.LEFT_PAR, TokenKind.OTHERS, TokenKind.RIGHT_ARROW, TokenKind.CHARACTER_LITERAL,
                TokenKind.RIGHT_PAR, TokenKind.EOF);
    }

    @Test
    void testDelimiters() {
        List<Token> tokens = tokenize("( ) , ; : . => ' | + - * / ** & = /= < <= > >=");

        assertKinds(tokens, TokenKind.LEFT_PAR, TokenKind.RIGHT_PAR, TokenKind.COMMA, TokenKind.SEMICOLON,
                TokenKind.COLON, TokenKind.DOT, TokenKind.RIGHT_ARROW, TokenKind.TICK, TokenKind.BAR,
                TokenKind.PLUS, TokenKind.MINUS, TokenKind.TIMES, TokenKind.DIV, TokenKind.POW,
                TokenKind.CONCAT, TokenKind.EQ, TokenKind.NE, TokenKind.LT, TokenKind.LTE,
                TokenKind.GT, TokenKind.GTE, TokenKind.EOF);
    }

    @Test
    void testExtendedIdentifier() {
        List<Token> tokens = tokenize("\\my id\\ \\a\\\\b\\");

        assertKinds(tokens, TokenKind.IDENTIFIER, TokenKind.IDENTIFIER, TokenKind.EOF);
        assertEquals("\\my id\\", tokens.get(0).text());
        assertEquals("\\a\\\\b\\", tokens.get(1).text());
    }

    @Test
    void testUnterminatedStringIsIllegal() {
        List<Token> tokens = tokenize("\"abc\nend");

        assertEquals(TokenKind.ILLEGAL, tokens.get(0).kind());
        assertEquals(TokenKind.END, tokens.get(1).kind());
    }

    @Test
    void testLineAndColumn() {
        List<Token> tokens = tokenize("for rtl\n  end for;");

        assertEquals(1, tokens.get(1).line());
        assertEquals(5, tokens.get(1).column());
        assertEquals(2, tokens.get(2).line());
        assertEquals(3, tokens.get(2).column());
    }

    @Test
    void testLeadingAndTrailingComments() {
        System.out.println("--- Running test: testLeadingAndTrailingComments ---");
        String source = """
                -- header
                /* block
                   comment */
                configuration cfg of e is -- trailing
                end;
                -- tail
                """;
        List<Token> tokens = tokenize(source);

        Token configuration = tokens.get(0);
        assertEquals(2, configuration.leadingComments().size());
        assertEquals("-- header", configuration.leadingComments().get(0).text());
        assertFalse(configuration.leadingComments().get(0).block());
        Comment block = configuration.leadingComments().get(1);
        assertTrue(block.block());
        assertEquals(2, block.line());
        assertEquals(3, block.endLine());
        assertEquals(1, configuration.startLine());

        Token is = tokens.get(4);
        assertEquals(TokenKind.IS, is.kind());
        assertNotNull(is.trailingComment());
        assertEquals("-- trailing", is.trailingComment().text());
        assertTrue(is.trailingComment().endsLine());

        Token end = tokens.get(5);
        assertTrue(end.leadingComments().isEmpty(), "注释只挂在一个 Token 上");

        Token eof = tokens.get(tokens.size() - 1);
        assertEquals(TokenKind.EOF, eof.kind());
        assertEquals(1, eof.leadingComments().size());
        assertEquals("-- tail", eof.leadingComments().get(0).text());
    }

    @Test
    void testTrailingBlockCommentDoesNotEndLine() {
        List<Token> tokens = tokenize("a /* x */ b");

        assertKinds(tokens, TokenKind.IDENTIFIER, TokenKind.IDENTIFIER, TokenKind.EOF);
        Comment trailing = tokens.get(0).trailingComment();
        assertEquals("/* x */", trailing.text());
        assertFalse(trailing.endsLine());
        assertTrue(tokens.get(1).leadingComments().isEmpty());
    }

    @Test
    void testEmptyInputYieldsOnlyEof() {
        assertKinds(tokenize(""), TokenKind.EOF);
        assertKinds(tokenize("  \n\t "), TokenKind.EOF);
    }

    @Test
    void testTokenStreamBounds() {
        TokenStream stream = TokenStream.of("use vunit a;");

        assertEquals(5, stream.size());
        assertEquals(TokenKind.VUNIT, stream.token(1).kind());
        assertTrue(stream.find(4).isPresent());
        assertTrue(stream.find(5).isEmpty());
        assertTrue(stream.find(-1).isEmpty());
    }

    @Test
    void testKeywordSet() {
        assertTrue(TokenKind.keywords().contains(TokenKind.VUNIT));
        assertFalse(TokenKind.keywords().contains(TokenKind.IDENTIFIER));
        assertTrue(TokenKind.FOR.isKeyword());
        assertFalse(TokenKind.SEMICOLON.isKeyword());
        assertEquals(TokenKind.IDENTIFIER, TokenKind.keywordOrIdentifier("range"));
    }
}
