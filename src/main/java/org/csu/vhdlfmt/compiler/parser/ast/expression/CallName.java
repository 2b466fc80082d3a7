package org.csu.vhdlfmt.compiler.parser.ast.expression;

import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

import java.util.List;

/**
 * 下标名或函数调用 prefix(a, b => c)，span 以 ')' 结束
 */
public record CallName(Name prefix, List<AssociationElement> arguments, TokenSpan span) implements Name {

    public CallName {
        arguments = List.copyOf(arguments);
    }
}
