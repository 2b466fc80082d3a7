package org.csu.vhdlfmt.compiler.parser.ast.configuration;

import org.csu.vhdlfmt.compiler.parser.ast.AstNode;
import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;
import org.csu.vhdlfmt.compiler.parser.ast.expression.Name;

import java.util.List;

/**
 * use vunit a, lib.b;
 */
public record VUnitBindingIndication(List<Name> vunits, TokenSpan span) implements AstNode {

    public VUnitBindingIndication {
        if (vunits.isEmpty()) {
            throw new IllegalArgumentException("A vunit binding indication names at least one vunit");
        }
        vunits = List.copyOf(vunits);
    }
}
