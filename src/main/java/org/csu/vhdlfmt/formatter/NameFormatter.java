package org.csu.vhdlfmt.formatter;

import org.csu.vhdlfmt.common.exception.FormatterContractException;
import org.csu.vhdlfmt.compiler.lexer.TokenKind;
import org.csu.vhdlfmt.compiler.lexer.TokenSource;
import org.csu.vhdlfmt.compiler.parser.ast.Ident;
import org.csu.vhdlfmt.compiler.parser.ast.configuration.MapAspect;
import org.csu.vhdlfmt.compiler.parser.ast.expression.*;

import java.util.List;
import java.util.Set;

/**
 * @description: 名字、表达式、关联列表与映射子句的格式化
 *
 * 名字内部不加空白：lib.pkg.comp、rtl(0)、sig'range；
 * 列表元素之间是 ", "；二元运算符和 =>、to/downto 两侧各一个空格。
 */
public class NameFormatter extends AbstractFormatter {

    private static final Set<TokenKind> RANGE_DIRECTIONS = Set.of(TokenKind.TO, TokenKind.DOWNTO);
    private static final Set<TokenKind> MAP_KEYWORDS = Set.of(TokenKind.GENERIC, TokenKind.PORT);

    public NameFormatter(TokenSource tokens) {
        super(tokens);
    }

    public void formatName(Name name, OutputSink sink) {
        if (name instanceof SimpleName) {
            sink.copyToken(name.span().startToken());
        } else if (name instanceof SelectedName selected) {
            formatName(selected.prefix(), sink);
            copyToken(sink, selected.prefix().span().endToken() + 1, TokenKind.DOT);
            sink.copyToken(selected.span().endToken());
        } else if (name instanceof CallName call) {
            formatName(call.prefix(), sink);
            copyToken(sink, call.prefix().span().endToken() + 1, TokenKind.LEFT_PAR);
            formatAssociationList(call.arguments(), sink);
            copyToken(sink, call.span().endToken(), TokenKind.RIGHT_PAR);
        } else if (name instanceof SliceName slice) {
            formatName(slice.prefix(), sink);
            copyToken(sink, slice.prefix().span().endToken() + 1, TokenKind.LEFT_PAR);
            formatRange(slice.range(), sink);
            copyToken(sink, slice.span().endToken(), TokenKind.RIGHT_PAR);
        } else if (name instanceof AttributeName attribute) {
            formatName(attribute.prefix(), sink);
            copyToken(sink, attribute.prefix().span().endToken() + 1, TokenKind.TICK);
            copyToken(sink, attribute.attribute().token(), TokenKind.IDENTIFIER);
            if (attribute.argument() != null) {
                copyToken(sink, attribute.attribute().token() + 1, TokenKind.LEFT_PAR);
                formatExpression(attribute.argument(), sink);
                copyToken(sink, attribute.span().endToken(), TokenKind.RIGHT_PAR);
            }
        } else {
            throw new FormatterContractException("Unknown name node: " + name.getClass().getSimpleName());
        }
    }

    public void formatExpression(Expression expression, OutputSink sink) {
        if (expression instanceof Name name) {
            formatName(name, sink);
        } else if (expression instanceof Literal literal) {
            copyTokensSpaced(sink, literal.span());
        } else if (expression instanceof UnaryExpression unary) {
            int operator = unary.span().startToken();
            sink.copyToken(operator);
            if (tokens.token(operator).kind().isKeyword()) {
                sink.space();
            }
            formatExpression(unary.operand(), sink);
        } else if (expression instanceof BinaryExpression binary) {
            formatExpression(binary.left(), sink);
            sink.space();
            sink.copyToken(binary.left().span().endToken() + 1);
            sink.space();
            formatExpression(binary.right(), sink);
        } else if (expression instanceof Aggregate aggregate) {
            formatAggregate(aggregate, sink);
        } else {
            throw new FormatterContractException("Unknown expression node: " + expression.getClass().getSimpleName());
        }
    }

    /**
     * generic map (
     *     a => b,
     *     c => d
     * )
     */
    public void formatMapAspect(MapAspect mapAspect, OutputSink sink) {
        int start = mapAspect.span().startToken();
        copyToken(sink, start, MAP_KEYWORDS);
        sink.space();
        copyToken(sink, start + 1, TokenKind.MAP);
        sink.space();
        copyToken(sink, start + 2, TokenKind.LEFT_PAR);
        List<AssociationElement> elements = mapAspect.elements();
        try (IndentScope ignored = sink.indent()) {
            for (int i = 0; i < elements.size(); i++) {
                sink.lineBreak();
                formatAssociationElement(elements.get(i), sink);
                if (i < elements.size() - 1) {
                    copyToken(sink, elements.get(i).span().endToken() + 1, TokenKind.COMMA);
                }
            }
        }
        if (!elements.isEmpty()) {
            sink.lineBreak();
        }
        copyToken(sink, mapAspect.span().endToken(), TokenKind.RIGHT_PAR);
    }

    public void formatAssociationElement(AssociationElement element, OutputSink sink) {
        if (element.formal() != null) {
            formatName(element.formal(), sink);
            sink.space();
            copyToken(sink, element.formal().span().endToken() + 1, TokenKind.RIGHT_ARROW);
            sink.space();
        }
        formatExpression(element.actual(), sink);
    }

    /**
     * a, b, c: 标签列表，逗号取自源码
     */
    public void formatIdentList(List<Ident> idents, OutputSink sink) {
        for (int i = 0; i < idents.size(); i++) {
            int token = idents.get(i).token();
            copyToken(sink, token, TokenKind.IDENTIFIER);
            if (i < idents.size() - 1) {
                copyToken(sink, token + 1, TokenKind.COMMA);
                sink.space();
            }
        }
    }

    public void formatNameList(List<Name> names, OutputSink sink) {
        for (int i = 0; i < names.size(); i++) {
            Name name = names.get(i);
            formatName(name, sink);
            if (i < names.size() - 1) {
                copyToken(sink, name.span().endToken() + 1, TokenKind.COMMA);
                sink.space();
            }
        }
    }

    private void formatAssociationList(List<AssociationElement> elements, OutputSink sink) {
        for (int i = 0; i < elements.size(); i++) {
            AssociationElement element = elements.get(i);
            formatAssociationElement(element, sink);
            if (i < elements.size() - 1) {
                copyToken(sink, element.span().endToken() + 1, TokenKind.COMMA);
                sink.space();
            }
        }
    }

    private void formatRange(Range range, OutputSink sink) {
        formatExpression(range.left(), sink);
        sink.space();
        copyToken(sink, range.left().span().endToken() + 1, RANGE_DIRECTIONS);
        sink.space();
        formatExpression(range.right(), sink);
    }

    private void formatAggregate(Aggregate aggregate, OutputSink sink) {
        copyToken(sink, aggregate.span().startToken(), TokenKind.LEFT_PAR);
        List<ElementAssociation> elements = aggregate.elements();
        for (int i = 0; i < elements.size(); i++) {
            ElementAssociation element = elements.get(i);
            List<Expression> choices = element.choices();
            for (int c = 0; c < choices.size(); c++) {
                formatExpression(choices.get(c), sink);
                sink.space();
                int separator = choices.get(c).span().endToken() + 1;
                copyToken(sink, separator, c < choices.size() - 1 ? TokenKind.BAR : TokenKind.RIGHT_ARROW);
                sink.space();
            }
            formatExpression(element.value(), sink);
            if (i < elements.size() - 1) {
                copyToken(sink, element.span().endToken() + 1, TokenKind.COMMA);
                sink.space();
            }
        }
        copyToken(sink, aggregate.span().endToken(), TokenKind.RIGHT_PAR);
    }
}
