package org.csu.vhdlfmt.cli;

import org.csu.vhdlfmt.compiler.parser.Parser;
import org.csu.vhdlfmt.formatter.FormatOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * application.properties 中 vhdlfmt.* 配置项
 */
@ConfigurationProperties(prefix = "vhdlfmt")
public class FormatterProperties {

    private int indentWidth = 4;
    private boolean useTabs = false;
    private int maxBlankLines = 1;
    private int maxNestingDepth = Parser.DEFAULT_MAX_NESTING_DEPTH;

    public int getIndentWidth() {
        return indentWidth;
    }

    public void setIndentWidth(int indentWidth) {
        this.indentWidth = indentWidth;
    }

    public boolean isUseTabs() {
        return useTabs;
    }

    public void setUseTabs(boolean useTabs) {
        this.useTabs = useTabs;
    }

    public int getMaxBlankLines() {
        return maxBlankLines;
    }

    public void setMaxBlankLines(int maxBlankLines) {
        this.maxBlankLines = maxBlankLines;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    public FormatOptions toFormatOptions() {
        return new FormatOptions(indentWidth, useTabs, maxBlankLines, maxNestingDepth);
    }
}
