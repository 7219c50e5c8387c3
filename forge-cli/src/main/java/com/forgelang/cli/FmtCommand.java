package com.forgelang.cli;

import com.forgelang.compiler.printer.PrintConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * forge fmt &lt;file&gt;
 */
@Command(name = "fmt", description = "格式化源文件")
public class FmtCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "源文件")
    String file;

    @Option(names = "--indent-size", defaultValue = "4", description = "缩进大小（默认 4）")
    int indentSize;

    @Option(names = "--use-tabs", description = "使用 Tab 缩进")
    boolean useTabs;

    @Option(names = "--stdout", description = "输出到标准输出而不是写回文件")
    boolean toStdout;

    @Mixin
    LoggingMixin logging;

    @Override
    public Integer call() {
        logging.apply();
        CommandLine cmd = spec.commandLine();
        PrintConfig config = new PrintConfig();
        try {
            config.setIndentSize(indentSize);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(cmd, e.getMessage(), e);
        }
        config.setUseSpaces(!useTabs);
        return new ExpandRunner(cmd.getOut(), cmd.getErr()).format(file, config, toStdout);
    }
}
