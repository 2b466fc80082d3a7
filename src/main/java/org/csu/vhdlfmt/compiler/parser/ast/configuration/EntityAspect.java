package org.csu.vhdlfmt.compiler.parser.ast.configuration;

import org.csu.vhdlfmt.compiler.parser.ast.Ident;
import org.csu.vhdlfmt.compiler.parser.ast.expression.Name;

/**
 * 绑定指示中的实体方面：entity name [(arch)]、configuration name 或 open
 */
public interface EntityAspect {

    /**
     * @param architecture 可选的结构体名，可以为 null
     */
    record Entity(Name entityName, Ident architecture) implements EntityAspect {
    }

    record Configuration(Name configurationName) implements EntityAspect {
    }

    record Open() implements EntityAspect {
    }
}
