package org.csu.vhdlfmt.compiler.parser.ast.expression;

import org.csu.vhdlfmt.compiler.parser.ast.AstNode;
import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

import java.util.List;

/**
 * 聚合元素 choice | choice => value；choices 为空表示位置关联
 */
public record ElementAssociation(List<Expression> choices, Expression value, TokenSpan span) implements AstNode {

    public ElementAssociation {
        choices = List.copyOf(choices);
    }
}
