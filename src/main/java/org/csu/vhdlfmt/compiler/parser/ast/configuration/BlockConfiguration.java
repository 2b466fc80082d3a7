package org.csu.vhdlfmt.compiler.parser.ast.configuration;

import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;
import org.csu.vhdlfmt.compiler.parser.ast.context.UseClause;
import org.csu.vhdlfmt.compiler.parser.ast.expression.Name;

import java.util.List;

/**
 * for block_spec { use_clause } { configuration_item } end for;
 *
 * span 的最后三个 Token 固定是 end、for、';'。
 *
 * @param blockSpec  被配置的块、生成语句或架构名，例如 rtl(0)、name(0 to 3)
 * @param useClauses 块内的 use 子句，格式化器不支持
 * @param items      按源码顺序排列的配置项
 */
public record BlockConfiguration(
        Name blockSpec,
        List<UseClause> useClauses,
        List<ConfigurationItem> items,
        TokenSpan span
) implements ConfigurationItem {

    public BlockConfiguration {
        useClauses = List.copyOf(useClauses);
        items = List.copyOf(items);
    }
}
