package org.csu.vhdlfmt.compiler.parser.ast;

import org.csu.vhdlfmt.compiler.parser.ast.configuration.ConfigurationDeclaration;

import java.util.List;

/**
 * 一个设计文件，由若干配置声明组成
 *
 * @param units    设计单元，按源码顺序
 * @param eofToken EOF Token 的 id，文件末尾的注释挂在它上面
 */
public record DesignFile(List<ConfigurationDeclaration> units, int eofToken) {

    public DesignFile {
        units = List.copyOf(units);
    }
}
