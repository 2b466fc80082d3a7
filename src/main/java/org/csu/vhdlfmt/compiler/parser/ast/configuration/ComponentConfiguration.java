package org.csu.vhdlfmt.compiler.parser.ast.configuration;

import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;

import java.util.List;

/**
 * for component_spec [binding_indication;] {vunit_binding} [block_configuration] end for;
 *
 * @param bindingIndication  可以为 null
 * @param blockConfiguration 可以为 null
 */
public record ComponentConfiguration(
        ComponentSpecification spec,
        BindingIndication bindingIndication,
        List<VUnitBindingIndication> vunitBindings,
        BlockConfiguration blockConfiguration,
        TokenSpan span
) implements ConfigurationItem {

    public ComponentConfiguration {
        vunitBindings = List.copyOf(vunitBindings);
    }
}
