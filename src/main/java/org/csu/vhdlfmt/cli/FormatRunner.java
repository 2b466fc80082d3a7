package org.csu.vhdlfmt.cli;

import com.formdev.flatlaf.themes.FlatMacDarkLaf;
import org.csu.vhdlfmt.cli.client.FormatterWorkbench;
import org.csu.vhdlfmt.common.exception.FormatterContractException;
import org.csu.vhdlfmt.common.exception.ParseException;
import org.csu.vhdlfmt.formatter.VhdlFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import javax.swing.*;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * @description: 按命令行参数格式化文件
 *
 * 默认把结果打印到标准输出；--check 只列出未格式化的文件；--write 原地改写。
 * 退出码取所有文件中最严重的一种。
 */
@Component
public class FormatRunner implements CommandLineRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_NOT_FORMATTED = 1;
    public static final int EXIT_INVALID_INPUT = 2;
    public static final int EXIT_INTERNAL_ERROR = 3;

    private static final Logger log = LoggerFactory.getLogger(FormatRunner.class);

    private final VhdlFormatter formatter;
    private final PrintStream out;
    private int exitCode = EXIT_OK;
    private boolean guiLaunched = false;

    @Autowired
    public FormatRunner(FormatterProperties properties) {
        this(new VhdlFormatter(properties.toFormatOptions()), System.out);
    }

    FormatRunner(VhdlFormatter formatter, PrintStream out) {
        this.formatter = formatter;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        boolean check = false;
        boolean write = false;
        boolean gui = false;
        List<Path> files = new ArrayList<>();
        for (String arg : args) {
            switch (arg) {
                case "--check" -> check = true;
                case "--write" -> write = true;
                case "--gui" -> gui = true;
                default -> {
                    // --vhdlfmt.indent-width=2 之类交给 Spring 处理
                    if (arg.startsWith("--") && arg.contains("=")) {
                        continue;
                    }
                    if (arg.startsWith("--")) {
                        log.error("Unknown option: {}", arg);
                        printUsage();
                        exitCode = EXIT_INVALID_INPUT;
                        return;
                    }
                    files.add(Path.of(arg));
                }
            }
        }

        if (gui) {
            launchWorkbench();
            return;
        }
        if (check && write) {
            log.error("--check and --write cannot be used together");
            exitCode = EXIT_INVALID_INPUT;
            return;
        }
        if (files.isEmpty()) {
            printUsage();
            exitCode = EXIT_INVALID_INPUT;
            return;
        }

        for (Path file : files) {
            exitCode = Math.max(exitCode, formatFile(file, check, write));
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public boolean isGuiLaunched() {
        return guiLaunched;
    }

    int formatFile(Path file, boolean check, boolean write) {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Cannot read {}", file, e);
            return EXIT_INVALID_INPUT;
        }

        String formatted;
        try {
            formatted = formatter.format(source);
        } catch (ParseException e) {
            log.error("{}:{}:{}: {}", file, e.getLine(), e.getColumn(), e.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (FormatterContractException e) {
            log.error("Internal formatter error in {}: {}", file, e.getMessage());
            return EXIT_INTERNAL_ERROR;
        }

        if (check) {
            if (!formatted.equals(source)) {
                out.println(file);
                return EXIT_NOT_FORMATTED;
            }
            log.debug("{} is formatted", file);
            return EXIT_OK;
        }
        if (write) {
            if (formatted.equals(source)) {
                return EXIT_OK;
            }
            try {
                Files.writeString(file, formatted, StandardCharsets.UTF_8);
                log.info("Reformatted {}", file);
                return EXIT_OK;
            } catch (IOException e) {
                log.error("Cannot write {}", file, e);
                return EXIT_INVALID_INPUT;
            }
        }
        out.print(formatted);
        return EXIT_OK;
    }

    private void launchWorkbench() {
        guiLaunched = true;
        SwingUtilities.invokeLater(() -> {
            FlatMacDarkLaf.setup();
            new FormatterWorkbench(formatter).setVisible(true);
        });
    }

    private void printUsage() {
        out.println("Usage: vhdlfmt [--check | --write] <file.vhd>...");
        out.println("       vhdlfmt --gui");
    }
}
