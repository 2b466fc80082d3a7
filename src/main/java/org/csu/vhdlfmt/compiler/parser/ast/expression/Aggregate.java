package org.csu.vhdlfmt.compiler.parser.ast.expression;

import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

import java.util.List;

/**
 * 聚合 (others => '0')；带括号的表达式 (a + b) 也按只有一个位置元素的聚合处理
 */
public record Aggregate(List<ElementAssociation> elements, TokenSpan span) implements Expression {

    public Aggregate {
        elements = List.copyOf(elements);
    }
}
