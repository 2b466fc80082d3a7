package org.csu.vhdlfmt.compiler.parser.ast.configuration;

import org.csu.vhdlfmt.compiler.parser.ast.AstNode;
import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

/**
 * use [entity_aspect] [generic map (...)] [port map (...)] ;
 *
 * span 从 use 开始，到结尾的 ';' 为止。
 *
 * @param entityAspect 可以为 null
 * @param genericMap   可以为 null
 * @param portMap      可以为 null
 */
public record BindingIndication(
        EntityAspect entityAspect,
        MapAspect genericMap,
        MapAspect portMap,
        TokenSpan span
) implements AstNode {
}
