package com.forgelang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;

/**
 * Forge CLI 入口点（picocli）
 */
@Command(name = "forge", version = "Forge v0.1.0",
         mixinStandardHelpOptions = true,
         description = "合约模块展开工具",
         subcommands = {ExpandCommand.class, CheckCommand.class, FmtCommand.class})
public class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // 未指定子命令时输出用法
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static CommandLine createCommandLine() {
        return new CommandLine(new Main());
    }

    public static void main(String[] args) {
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = createCommandLine();
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(createCommandLine().execute(args));
        }
    }

    /**
     * 获取控制台实际使用的字符编码名。
     * native.encoding 属性（Java 17+）反映操作系统原生编码。
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
