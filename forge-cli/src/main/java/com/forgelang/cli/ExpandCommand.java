package com.forgelang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * forge expand &lt;file&gt;
 */
@Command(name = "expand", description = "展开文件中的合约模块")
public class ExpandCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "源文件")
    String file;

    @Option(names = {"-o", "--output"}, description = "输出文件（默认写到标准输出）")
    String output;

    @Option(names = "--manifest", description = "导出清单 JSON 文件")
    String manifest;

    @Mixin
    ExpansionOptionsMixin expansion;

    @Mixin
    LoggingMixin logging;

    @Override
    public Integer call() {
        logging.apply();
        CommandLine cmd = spec.commandLine();
        try {
            return new ExpandRunner(cmd.getOut(), cmd.getErr())
                    .expand(file, output, manifest, expansion.toOptions());
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(cmd, e.getMessage(), e);
        }
    }
}
