package com.forgelang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * forge check &lt;file&gt;
 */
@Command(name = "check", description = "检查合约模块并报告诊断，不输出展开结果")
public class CheckCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "源文件")
    String file;

    @Mixin
    ExpansionOptionsMixin expansion;

    @Mixin
    LoggingMixin logging;

    @Override
    public Integer call() {
        logging.apply();
        CommandLine cmd = spec.commandLine();
        try {
            return new ExpandRunner(cmd.getOut(), cmd.getErr()).check(file, expansion.toOptions());
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(cmd, e.getMessage(), e);
        }
    }
}
