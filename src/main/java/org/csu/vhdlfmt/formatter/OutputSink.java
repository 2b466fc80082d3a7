package org.csu.vhdlfmt.formatter;

/**
 * 格式化输出的目标。所有文本都来自源码 Token，格式化器只决定空白、换行与缩进。
 */
public interface OutputSink {

    /**
     * 原样输出 id 处 Token 的文本，连同挂在它上面的注释
     */
    void copyToken(int id);

    /**
     * 只输出 id 处 Token 的前导注释，用于文件末尾挂在 EOF 上的注释
     */
    void copyLeadingComments(int id);

    /**
     * 输出一个空格；行首或刚换行时忽略
     */
    void space();

    /**
     * 换行；连续的空行不会超过配置的上限
     */
    void lineBreak();

    /**
     * 缩进加一级，直到返回的 scope 关闭
     */
    IndentScope indent();
}
