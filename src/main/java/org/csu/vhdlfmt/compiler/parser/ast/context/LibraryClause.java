package org.csu.vhdlfmt.compiler.parser.ast.context;

import org.csu.vhdlfmt.compiler.parser.ast.Ident;
import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

import java.util.List;

/**
 * library ieee, work;
 */
public record LibraryClause(List<Ident> libraries, TokenSpan span) implements ContextItem {

    public LibraryClause {
        libraries = List.copyOf(libraries);
    }
}
