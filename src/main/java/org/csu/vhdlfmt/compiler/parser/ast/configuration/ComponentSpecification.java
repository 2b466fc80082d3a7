package org.csu.vhdlfmt.compiler.parser.ast.configuration;

import org.csu.vhdlfmt.compiler.parser.ast.AstNode;
import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;
import org.csu.vhdlfmt.compiler.parser.ast.expression.Name;

/**
 * for inst1, inst2 : lib.pkg.comp
 *
 * @param colonToken ':' 的 Token id
 */
public record ComponentSpecification(
        InstantiationList instantiationList,
        int colonToken,
        Name componentName,
        TokenSpan span
) implements AstNode {
}
