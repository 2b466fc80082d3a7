package org.csu.vhdlfmt.formatter;

import org.csu.vhdlfmt.compiler.lexer.TokenStream;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BufferTest {

    private static final FormatOptions TABS = new FormatOptions(4, true, 1, 256);

    private Buffer buffer(String source) {
        return new Buffer(TokenStream.of(source), FormatOptions.defaults());
    }

    @Test
    void testCopyAndSpace() {
        Buffer buffer = buffer("alpha beta gamma");
        buffer.copyToken(0);
        buffer.space();
        buffer.space();
        buffer.copyToken(1);
        buffer.copyToken(2);

        assertEquals("alpha betagamma", buffer.text());
    }

    @Test
    void testSpaceAndLineBreakAtStartAreIgnored() {
        Buffer buffer = buffer("alpha");
        buffer.space();
        buffer.lineBreak();
        buffer.copyToken(0);

        assertEquals("alpha", buffer.text());
    }

    @Test
    void testIndentIsWrittenLazily() {
        Buffer buffer = buffer("alpha beta gamma");
        buffer.copyToken(0);
        try (IndentScope ignored = buffer.indent()) {
            assertEquals(1, buffer.getIndentLevel());
            buffer.lineBreak();
            buffer.lineBreak();
            buffer.copyToken(1);
        }
        assertEquals(0, buffer.getIndentLevel());
        buffer.lineBreak();
        buffer.copyToken(2);

        // 空行上没有缩进
        assertEquals("alpha\n\n    beta\ngamma", buffer.text());
    }

    @Test
    void testTabIndent() {
        Buffer buffer = new Buffer(TokenStream.of("alpha beta"), TABS);
        buffer.copyToken(0);
        try (IndentScope ignored = buffer.indent()) {
            try (IndentScope nested = buffer.indent()) {
                buffer.lineBreak();
                buffer.copyToken(1);
            }
        }

        assertEquals("alpha\n\t\tbeta", buffer.text());
    }

    @Test
    void testIndentScopeCloseIsIdempotent() {
        Buffer buffer = buffer("alpha");
        IndentScope scope = buffer.indent();
        scope.close();
        scope.close();

        assertEquals(0, buffer.getIndentLevel());
    }

    @Test
    void testBlankLinesAreCapped() {
        Buffer buffer = buffer("alpha beta");
        buffer.copyToken(0);
        for (int i = 0; i < 4; i++) {
            buffer.lineBreak();
        }
        buffer.copyToken(1);

        assertEquals("alpha\n\nbeta", buffer.text());

        Buffer compact = new Buffer(TokenStream.of("alpha beta"), new FormatOptions(4, false, 0, 256));
        compact.copyToken(0);
        compact.lineBreak();
        compact.lineBreak();
        compact.copyToken(1);

        assertEquals("alpha\nbeta", compact.text());
    }

    @Test
    void testLineBreakTrimsTrailingSpace() {
        Buffer buffer = buffer("alpha beta");
        buffer.copyToken(0);
        buffer.space();
        buffer.lineBreak();
        buffer.copyToken(1);

        assertEquals("alpha\nbeta", buffer.text());
    }

    @Test
    void testTrailingLineCommentForcesLineBreak() {
        Buffer buffer = buffer("a -- note\nb");
        buffer.copyToken(0);
        buffer.space();
        buffer.copyToken(1);

        assertEquals("a -- note\nb", buffer.text());
    }

    @Test
    void testTrailingLineCommentFollowedByLineBreakAddsNoBlankLine() {
        Buffer buffer = buffer("a -- note\nb");
        buffer.copyToken(0);
        buffer.lineBreak();
        buffer.copyToken(1);

        assertEquals("a -- note\nb", buffer.text());
    }

    @Test
    void testTrailingBlockCommentStaysInline() {
        Buffer buffer = buffer("a /* x */ b");
        buffer.copyToken(0);
        buffer.space();
        buffer.copyToken(1);

        assertEquals("a /* x */ b", buffer.text());
    }

    @Test
    void testLeadingCommentStartsOnOwnLine() {
        Buffer buffer = buffer("a\n-- lead\nb");
        buffer.copyToken(0);
        buffer.space();
        try (IndentScope ignored = buffer.indent()) {
            buffer.copyToken(1);
        }

        assertEquals("a\n    -- lead\n    b", buffer.text());
    }

    @Test
    void testBlankLineBetweenCommentAndTokenIsKept() {
        Buffer buffer = buffer("-- one\n\n\n-- two\n\nb");
        buffer.copyToken(0);

        assertEquals("-- one\n\n-- two\n\nb", buffer.text());
    }

    @Test
    void testCopyLeadingCommentsOnly() {
        Buffer buffer = buffer("a\n-- tail\n");
        buffer.copyToken(0);
        buffer.lineBreak();
        buffer.copyLeadingComments(1);

        assertEquals("a\n-- tail\n", buffer.text());
    }
}
