package org.csu.vhdlfmt.formatter;

import org.csu.vhdlfmt.common.exception.FormatterContractException;
import org.csu.vhdlfmt.compiler.lexer.TokenKind;
import org.csu.vhdlfmt.compiler.lexer.TokenSource;
import org.csu.vhdlfmt.compiler.parser.ast.DesignFile;
import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;
import org.csu.vhdlfmt.compiler.parser.ast.configuration.*;
import org.csu.vhdlfmt.compiler.parser.ast.context.ContextItem;
import org.csu.vhdlfmt.compiler.parser.ast.expression.Name;

import java.util.List;

/**
 * @description: 配置声明家族的格式化器
 *
 * 关键字与分隔符按相对 span 的固定偏移从源码复制，空白、换行和缩进由这里决定。
 * 块配置与组件配置相互递归，递归深度等于源码的嵌套深度。
 * 本类不保存任何格式化状态，所有输出都写入调用方传入的 OutputSink。
 */
public class ConfigurationFormatter extends AbstractFormatter {

    private final NameFormatter names;
    private final ContextClauseFormatter contextClauses;

    public ConfigurationFormatter(TokenSource tokens) {
        super(tokens);
        this.names = new NameFormatter(tokens);
        this.contextClauses = new ContextClauseFormatter(tokens, names);
    }

    /**
     * 整个设计文件：设计单元之间空一行，文件末尾的注释原样保留
     */
    public void formatDesignFile(DesignFile file, OutputSink sink) {
        List<ConfigurationDeclaration> units = file.units();
        for (int i = 0; i < units.size(); i++) {
            if (i > 0) {
                sink.lineBreak();
                sink.lineBreak();
            }
            formatConfigurationDeclaration(units.get(i), sink);
        }
        if (!tokens.token(file.eofToken()).leadingComments().isEmpty()) {
            if (file.eofToken() > 0) {
                lineBreakPreservingBlankLines(sink, file.eofToken() - 1);
            }
            sink.copyLeadingComments(file.eofToken());
        }
    }

    /**
     * context_clause
     * configuration cfg of entity_name is
     *     declarations
     *     vunit bindings
     *     block_configuration
     * end [configuration] [cfg];
     */
    public void formatConfigurationDeclaration(ConfigurationDeclaration configuration, OutputSink sink) {
        List<ContextItem> contextClause = configuration.contextClause();
        contextClauses.formatContextClause(contextClause, sink);
        if (!contextClause.isEmpty()) {
            lineBreakPreservingBlankLines(sink, contextClause.get(contextClause.size() - 1).span().endToken());
        }

        // configuration cfg of entity_name is
        copyToken(sink, configuration.span().startToken(), TokenKind.CONFIGURATION);
        sink.space();
        copyToken(sink, configuration.name().token(), TokenKind.IDENTIFIER);
        sink.space();
        copyToken(sink, configuration.name().token() + 1, TokenKind.OF);
        sink.space();
        names.formatName(configuration.entityName(), sink);
        sink.space();
        copyToken(sink, configuration.entityName().span().endToken() + 1, TokenKind.IS);

        BlockConfiguration root = configuration.blockConfiguration();
        try (IndentScope ignored = sink.indent()) {
            contextClauses.formatDeclarations(configuration.declarations(), sink);
            formatVUnitBindingIndications(configuration.vunitBindings(), sink);
            lineBreakPreservingBlankLines(sink, root.span().startToken() - 1);
            formatBlockConfiguration(root, sink);
        }
        sink.lineBreak();

        // end; | end configuration; | end configuration cfg;
        int end = configuration.span().endToken();
        expectToken(configuration.endToken(), TokenKind.END);
        copyTokensSpaced(sink, new TokenSpan(configuration.endToken(), end - 1));
        copyToken(sink, end, TokenKind.SEMICOLON);
    }

    public void formatVUnitBindingIndications(List<VUnitBindingIndication> bindings, OutputSink sink) {
        for (VUnitBindingIndication binding : bindings) {
            sink.lineBreak();
            formatVUnitBindingIndication(binding, sink);
        }
    }

    /**
     * for block_spec
     *     items...
     * end for;
     */
    public void formatBlockConfiguration(BlockConfiguration block, OutputSink sink) {
        if (!block.useClauses().isEmpty()) {
            throw FormatterContractException.unsupported("use clause in block configuration",
                    tokens.token(block.useClauses().get(0).span().startToken()));
        }
        copyToken(sink, block.span().startToken(), TokenKind.FOR);
        sink.space();
        names.formatName(block.blockSpec(), sink);
        try (IndentScope ignored = sink.indent()) {
            for (ConfigurationItem item : block.items()) {
                lineBreakPreservingBlankLines(sink, item.span().startToken() - 1);
                formatConfigurationItem(item, sink);
            }
        }
        sink.lineBreak();
        formatEndFor(sink, block.span());
    }

    /**
     * for inst: lib.pkg.comp
     *     binding_indication
     *     vunit bindings
     *     block_configuration
     * end for;
     */
    public void formatComponentConfiguration(ComponentConfiguration configuration, OutputSink sink) {
        formatComponentSpecification(configuration.spec(), sink);
        try (IndentScope ignored = sink.indent()) {
            if (configuration.bindingIndication() != null) {
                sink.lineBreak();
                formatBindingIndication(configuration.bindingIndication(), sink);
            }
            formatVUnitBindingIndications(configuration.vunitBindings(), sink);
            if (configuration.blockConfiguration() != null) {
                sink.lineBreak();
                formatBlockConfiguration(configuration.blockConfiguration(), sink);
            }
        }
        sink.lineBreak();
        formatEndFor(sink, configuration.span());
    }

    /**
     * for inst1, inst2: comp | for all: comp | for others: comp
     */
    public void formatComponentSpecification(ComponentSpecification spec, OutputSink sink) {
        int start = spec.span().startToken();
        copyToken(sink, start, TokenKind.FOR);
        sink.space();
        InstantiationList instantiationList = spec.instantiationList();
        if (instantiationList instanceof InstantiationList.Labels labels) {
            names.formatIdentList(labels.labels(), sink);
        } else if (instantiationList instanceof InstantiationList.Others) {
            copyToken(sink, start + 1, TokenKind.OTHERS);
        } else if (instantiationList instanceof InstantiationList.All) {
            copyToken(sink, start + 1, TokenKind.ALL);
        } else {
            throw new FormatterContractException("Unknown instantiation list: " + instantiationList);
        }
        copyToken(sink, spec.colonToken(), TokenKind.COLON);
        sink.space();
        names.formatName(spec.componentName(), sink);
    }

    /**
     * use entity lib.ent(arch)
     *     generic map (...)
     *     port map (...);
     */
    public void formatBindingIndication(BindingIndication indication, OutputSink sink) {
        int start = indication.span().startToken();
        copyToken(sink, start, TokenKind.USE);
        EntityAspect aspect = indication.entityAspect();
        if (aspect != null) {
            sink.space();
            if (aspect instanceof EntityAspect.Entity entity) {
                copyToken(sink, start + 1, TokenKind.ENTITY);
                sink.space();
                names.formatName(entity.entityName(), sink);
                if (entity.architecture() != null) {
                    int architecture = entity.architecture().token();
                    copyToken(sink, architecture - 1, TokenKind.LEFT_PAR);
                    copyToken(sink, architecture, TokenKind.IDENTIFIER);
                    copyToken(sink, architecture + 1, TokenKind.RIGHT_PAR);
                }
            } else if (aspect instanceof EntityAspect.Configuration configuration) {
                copyToken(sink, start + 1, TokenKind.CONFIGURATION);
                sink.space();
                names.formatName(configuration.configurationName(), sink);
            } else if (aspect instanceof EntityAspect.Open) {
                copyToken(sink, start + 1, TokenKind.OPEN);
            } else {
                throw new FormatterContractException("Unknown entity aspect: " + aspect);
            }
        }
        if (indication.genericMap() != null) {
            try (IndentScope ignored = sink.indent()) {
                sink.lineBreak();
                names.formatMapAspect(indication.genericMap(), sink);
            }
        }
        if (indication.portMap() != null) {
            try (IndentScope ignored = sink.indent()) {
                sink.lineBreak();
                names.formatMapAspect(indication.portMap(), sink);
            }
        }
        copyToken(sink, indication.span().endToken(), TokenKind.SEMICOLON);
    }

    /**
     * for inst: comp
     *     use entity work.e;
     * [end for;]
     */
    public void formatConfigurationSpecification(ConfigurationSpecification configuration, OutputSink sink) {
        formatComponentSpecification(configuration.spec(), sink);
        try (IndentScope ignored = sink.indent()) {
            sink.lineBreak();
            formatBindingIndication(configuration.bindingIndication(), sink);
            formatVUnitBindingIndications(configuration.vunitBindings(), sink);
        }
        if (configuration.endToken() != null) {
            int endToken = configuration.endToken();
            sink.lineBreak();
            copyToken(sink, endToken, TokenKind.END);
            sink.space();
            copyToken(sink, endToken + 1, TokenKind.FOR);
            copyToken(sink, configuration.span().endToken(), TokenKind.SEMICOLON);
        }
    }

    /**
     * use vunit a, b;
     *
     * 语法树不记录 vunit 名之间的逗号，这里直接看源码中名字后面的 Token 是不是逗号。
     */
    public void formatVUnitBindingIndication(VUnitBindingIndication binding, OutputSink sink) {
        int start = binding.span().startToken();
        copyToken(sink, start, TokenKind.USE);
        sink.space();
        copyToken(sink, start + 1, TokenKind.VUNIT);
        sink.space();
        for (Name vunit : binding.vunits()) {
            names.formatName(vunit, sink);
            int next = vunit.span().endToken() + 1;
            if (isFollowedBy(vunit.span().endToken(), TokenKind.COMMA)) {
                sink.copyToken(next);
                sink.space();
            }
        }
        copyToken(sink, binding.span().endToken(), TokenKind.SEMICOLON);
    }

    private void formatConfigurationItem(ConfigurationItem item, OutputSink sink) {
        if (item instanceof BlockConfiguration block) {
            formatBlockConfiguration(block, sink);
        } else if (item instanceof ComponentConfiguration component) {
            formatComponentConfiguration(component, sink);
        } else {
            throw new FormatterContractException("Unknown configuration item: " + item.getClass().getSimpleName());
        }
    }
}
