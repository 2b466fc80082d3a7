package org.csu.vhdlfmt.formatter;

import org.csu.vhdlfmt.common.exception.FormatterContractException;
import org.csu.vhdlfmt.compiler.lexer.TokenKind;
import org.csu.vhdlfmt.compiler.lexer.TokenSource;
import org.csu.vhdlfmt.compiler.parser.ast.context.ContextItem;
import org.csu.vhdlfmt.compiler.parser.ast.context.ContextReference;
import org.csu.vhdlfmt.compiler.parser.ast.context.LibraryClause;
import org.csu.vhdlfmt.compiler.parser.ast.context.UseClause;

import java.util.List;

/**
 * 上下文子句 (library / use / context) 以及配置声明部分中的 use 子句
 */
public class ContextClauseFormatter extends AbstractFormatter {

    private final NameFormatter names;

    public ContextClauseFormatter(TokenSource tokens, NameFormatter names) {
        super(tokens);
        this.names = names;
    }

    /**
     * 每项一行，项与项之间保留源码中的空行 (最多一个)；最后一项之后不换行
     */
    public void formatContextClause(List<ContextItem> items, OutputSink sink) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                lineBreakPreservingBlankLines(sink, items.get(i - 1).span().endToken());
            }
            formatContextItem(items.get(i), sink);
        }
    }

    /**
     * 声明部分：每条声明前换行，保留源码中的空行
     */
    public void formatDeclarations(List<UseClause> declarations, OutputSink sink) {
        for (UseClause declaration : declarations) {
            lineBreakPreservingBlankLines(sink, declaration.span().startToken() - 1);
            formatUseClause(declaration, sink);
        }
    }

    public void formatContextItem(ContextItem item, OutputSink sink) {
        if (item instanceof LibraryClause library) {
            copyToken(sink, library.span().startToken(), TokenKind.LIBRARY);
            sink.space();
            names.formatIdentList(library.libraries(), sink);
            copyToken(sink, library.span().endToken(), TokenKind.SEMICOLON);
        } else if (item instanceof UseClause use) {
            formatUseClause(use, sink);
        } else if (item instanceof ContextReference reference) {
            copyToken(sink, reference.span().startToken(), TokenKind.CONTEXT);
            sink.space();
            names.formatNameList(reference.names(), sink);
            copyToken(sink, reference.span().endToken(), TokenKind.SEMICOLON);
        } else {
            throw new FormatterContractException("Unknown context item: " + item.getClass().getSimpleName());
        }
    }

    public void formatUseClause(UseClause use, OutputSink sink) {
        copyToken(sink, use.span().startToken(), TokenKind.USE);
        sink.space();
        names.formatNameList(use.names(), sink);
        copyToken(sink, use.span().endToken(), TokenKind.SEMICOLON);
    }
}
