package org.csu.vhdlfmt.cli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * 命令行入口
 *
 * <pre>
 * vhdlfmt [--check | --write] file.vhd ...
 * vhdlfmt --gui
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class FormatterApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(FormatterApplication.class);
        // 工作台需要图形环境
        application.setHeadless(false);
        ConfigurableApplicationContext context = application.run(args);
        if (!context.getBean(FormatRunner.class).isGuiLaunched()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
