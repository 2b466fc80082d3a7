package org.csu.vhdlfmt.compiler.parser.ast.context;

import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;
import org.csu.vhdlfmt.compiler.parser.ast.expression.Name;

import java.util.List;

/**
 * context lib.ctx;
 */
public record ContextReference(List<Name> names, TokenSpan span) implements ContextItem {

    public ContextReference {
        names = List.copyOf(names);
    }
}
