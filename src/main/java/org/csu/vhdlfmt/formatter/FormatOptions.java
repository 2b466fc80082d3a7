package org.csu.vhdlfmt.formatter;

/**
 * 格式化选项
 *
 * @param indentWidth     每级缩进的空格数 (useTabs 为 false 时生效)
 * @param useTabs         是否用制表符缩进
 * @param maxBlankLines   最多保留的连续空行数
 * @param maxNestingDepth 语法分析允许的最大配置嵌套层数
 */
public record FormatOptions(int indentWidth, boolean useTabs, int maxBlankLines, int maxNestingDepth) {

    public FormatOptions {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth must not be negative: " + indentWidth);
        }
        if (maxBlankLines < 0) {
            throw new IllegalArgumentException("maxBlankLines must not be negative: " + maxBlankLines);
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
    }

    public static FormatOptions defaults() {
        return new FormatOptions(4, false, 1, 256);
    }

    public String indentUnit() {
        return useTabs ? "\t" : " ".repeat(indentWidth);
    }
}
