package org.csu.vhdlfmt.compiler.parser.ast.configuration;

import org.csu.vhdlfmt.compiler.parser.ast.AstNode;
import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;
import org.csu.vhdlfmt.compiler.parser.ast.expression.AssociationElement;

import java.util.List;

/**
 * generic map (...) 或 port map (...)；span 从 generic/port 开始，到 ')' 为止
 */
public record MapAspect(List<AssociationElement> elements, TokenSpan span) implements AstNode {

    public MapAspect {
        elements = List.copyOf(elements);
    }
}
