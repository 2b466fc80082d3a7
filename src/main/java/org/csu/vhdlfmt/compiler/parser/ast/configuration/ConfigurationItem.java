package org.csu.vhdlfmt.compiler.parser.ast.configuration;

import org.csu.vhdlfmt.compiler.parser.ast.AstNode;

/**
 * 块配置中的一项，只有 {@link BlockConfiguration} 和 {@link ComponentConfiguration} 两种
 */
public interface ConfigurationItem extends AstNode {
}
