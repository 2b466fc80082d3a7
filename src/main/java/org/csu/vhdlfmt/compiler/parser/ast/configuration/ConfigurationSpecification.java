package org.csu.vhdlfmt.compiler.parser.ast.configuration;

import org.csu.vhdlfmt.compiler.parser.ast.AstNode;
import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

import java.util.List;

/**
 * 块外的配置说明 for inst : comp use entity work.e; [end for;]
 *
 * @param endToken 可选的 end 关键字 Token id，源码中没有 end for; 时为 null
 */
public record ConfigurationSpecification(
        ComponentSpecification spec,
        BindingIndication bindingIndication,
        List<VUnitBindingIndication> vunitBindings,
        Integer endToken,
        TokenSpan span
) implements AstNode {

    public ConfigurationSpecification {
        vunitBindings = List.copyOf(vunitBindings);
    }
}
