package org.csu.vhdlfmt.compiler.parser.ast.context;

import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;
import org.csu.vhdlfmt.compiler.parser.ast.expression.Name;

import java.util.List;

/**
 * use ieee.std_logic_1164.all, work.pkg;
 */
public record UseClause(List<Name> names, TokenSpan span) implements ContextItem {

    public UseClause {
        names = List.copyOf(names);
    }
}
