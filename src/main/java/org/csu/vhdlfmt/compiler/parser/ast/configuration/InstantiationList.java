package org.csu.vhdlfmt.compiler.parser.ast.configuration;

import org.csu.vhdlfmt.compiler.parser.ast.Ident;

import java.util.List;

/**
 * 组件说明中的实例列表：标签列表、others 或 all
 */
public interface InstantiationList {

    record Labels(List<Ident> labels) implements InstantiationList {

        public Labels {
            if (labels.isEmpty()) {
                throw new IllegalArgumentException("Instantiation label list must not be empty");
            }
            labels = List.copyOf(labels);
        }
    }

    record Others() implements InstantiationList {
    }

    record All() implements InstantiationList {
    }
}
