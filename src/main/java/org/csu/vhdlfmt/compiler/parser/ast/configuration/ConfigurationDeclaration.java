package org.csu.vhdlfmt.compiler.parser.ast.configuration;

import org.csu.vhdlfmt.compiler.parser.ast.AstNode;
import org.csu.vhdlfmt.compiler.parser.ast.Ident;
import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;
import org.csu.vhdlfmt.compiler.parser.ast.context.ContextItem;
import org.csu.vhdlfmt.compiler.parser.ast.context.UseClause;
import org.csu.vhdlfmt.compiler.parser.ast.expression.Name;

import java.util.List;

/**
 * @description: 配置声明
 *
 * <pre>
 * configuration cfg of entity_name is
 *     use lib.foo.bar;
 *     use vunit baz;
 *     for rtl
 *     end for;
 * end configuration cfg;
 * </pre>
 *
 * span 从 configuration 关键字开始（不含上下文子句），到结尾的 ';' 为止。
 *
 * @param contextClause      位于声明之前的上下文子句
 * @param name               配置名
 * @param entityName         被配置的实体名
 * @param declarations       声明部分，目前只有 use 子句
 * @param vunitBindings      use vunit 绑定
 * @param blockConfiguration 唯一的根块配置
 * @param endToken           结尾 end 关键字的 Token id
 */
public record ConfigurationDeclaration(
        List<ContextItem> contextClause,
        Ident name,
        Name entityName,
        List<UseClause> declarations,
        List<VUnitBindingIndication> vunitBindings,
        BlockConfiguration blockConfiguration,
        int endToken,
        TokenSpan span
) implements AstNode {

    public ConfigurationDeclaration {
        contextClause = List.copyOf(contextClause);
        declarations = List.copyOf(declarations);
        vunitBindings = List.copyOf(vunitBindings);
    }
}
