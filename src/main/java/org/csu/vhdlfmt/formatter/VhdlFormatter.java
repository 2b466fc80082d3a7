package org.csu.vhdlfmt.formatter;

import org.csu.vhdlfmt.compiler.lexer.Lexer;
import org.csu.vhdlfmt.compiler.lexer.Token;
import org.csu.vhdlfmt.compiler.lexer.TokenSource;
import org.csu.vhdlfmt.compiler.lexer.TokenStream;
import org.csu.vhdlfmt.compiler.parser.Parser;
import org.csu.vhdlfmt.compiler.parser.ast.DesignFile;
import org.csu.vhdlfmt.compiler.parser.ast.configuration.ConfigurationSpecification;

import java.util.List;

/**
 * @description: 格式化入口：词法分析 -> 语法分析 -> 打印
 *
 * 每次调用都新建 Buffer，异常时半成品输出直接丢弃，因此同一个实例可以被并发复用。
 */
public class VhdlFormatter {

    private final FormatOptions options;

    public VhdlFormatter() {
        this(FormatOptions.defaults());
    }

    public VhdlFormatter(FormatOptions options) {
        this.options = options;
    }

    public FormatOptions getOptions() {
        return options;
    }

    /**
     * 格式化整个源文件，输出以换行结尾
     *
     * @throws org.csu.vhdlfmt.common.exception.ParseException            源码有语法错误
     * @throws org.csu.vhdlfmt.common.exception.FormatterContractException 语法树含不支持的结构
     */
    public String format(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        DesignFile file = new Parser(tokens, options.maxNestingDepth()).parseDesignFile();
        return format(file, new TokenStream(tokens));
    }

    public String format(DesignFile file, TokenSource tokens) {
        Buffer buffer = new Buffer(tokens, options);
        new ConfigurationFormatter(tokens).formatDesignFile(file, buffer);
        return withTrailingNewline(buffer.text());
    }

    /**
     * 格式化单独一条配置说明 (for inst: comp use ...; [end for;])
     */
    public String formatConfigurationSpecification(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        ConfigurationSpecification specification =
                new Parser(tokens, options.maxNestingDepth()).parseConfigurationSpecification();
        TokenSource tokenSource = new TokenStream(tokens);
        Buffer buffer = new Buffer(tokenSource, options);
        new ConfigurationFormatter(tokenSource).formatConfigurationSpecification(specification, buffer);
        return withTrailingNewline(buffer.text());
    }

    /**
     * 源码是否已经是格式化后的样子
     */
    public boolean isFormatted(String source) {
        return format(source).equals(source);
    }

    /**
     * 文件末尾恰好一个换行
     */
    private static String withTrailingNewline(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\n') {
            end--;
        }
        return end == 0 ? "" : text.substring(0, end) + "\n";
    }
}
