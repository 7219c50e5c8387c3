package com.forgelang.cli;

import com.forgelang.compiler.ForgeCompiler;
import com.forgelang.compiler.contract.ContractDiagnostic;
import com.forgelang.compiler.contract.ExpansionOptions;
import com.forgelang.compiler.contract.ExpansionResult;
import com.forgelang.compiler.contract.ExportManifest;
import com.forgelang.compiler.parser.ParseException;
import com.forgelang.compiler.printer.PrintConfig;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 子命令的共享执行逻辑；返回进程退出码（0 成功，1 失败）
 */
public class ExpandRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final PrintWriter out;
    private final PrintWriter err;

    public ExpandRunner(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 展开合约模块：输出到文件或标准输出，可选写出导出清单
     */
    public int expand(String file, String output, String manifest, ExpansionOptions options) {
        Path path = Paths.get(file);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + file);
            return EXIT_FAILURE;
        }

        try {
            ForgeCompiler compiler = new ForgeCompiler(options, new PrintConfig());
            ExpansionResult result = compiler.expandFile(path);
            report(result);
            if (!result.isSuccess()) {
                return EXIT_FAILURE;
            }

            String expanded = compiler.print(result.getOutput());
            if (output != null) {
                writeFile(Paths.get(output), expanded);
                out.println("已展开: " + file + " -> " + output);
            } else {
                out.print(expanded);
            }

            if (manifest != null) {
                writeFile(Paths.get(manifest), ExportManifest.toJson(result));
                out.println("导出清单: " + manifest);
            }
            out.flush();
            return EXIT_OK;
        } catch (IOException e) {
            err.println("错误: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * 仅检查，不输出展开结果
     */
    public int check(String file, ExpansionOptions options) {
        Path path = Paths.get(file);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + file);
            return EXIT_FAILURE;
        }

        try {
            ExpansionResult result = new ForgeCompiler(options, new PrintConfig()).expandFile(path);
            report(result);
            if (!result.isSuccess()) {
                err.println("检查失败: " + file + " (" + result.getErrors().size() + " 个错误)");
                return EXIT_FAILURE;
            }
            out.println("检查通过: " + file + " (" + result.getContracts().size() + " 个合约, "
                    + result.getWarnings().size() + " 个警告)");
            return EXIT_OK;
        } catch (IOException e) {
            err.println("错误: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * 格式化文件；toStdout 为 false 时就地写回
     */
    public int format(String file, PrintConfig config, boolean toStdout) {
        Path path = Paths.get(file);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + file);
            return EXIT_FAILURE;
        }

        try {
            String source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            ForgeCompiler compiler = new ForgeCompiler(new ExpansionOptions(), config);
            String formatted = compiler.format(source, file);
            if (toStdout) {
                out.print(formatted);
            } else {
                writeFile(path, formatted);
                out.println("已格式化: " + file);
            }
            out.flush();
            return EXIT_OK;
        } catch (ParseException e) {
            err.println(ForgeCompiler.toDiagnostic(e, file).format());
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("错误: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private void report(ExpansionResult result) {
        for (ContractDiagnostic diagnostic : result.getDiagnostics()) {
            err.println(diagnostic.format());
        }
        err.flush();
    }

    private static void writeFile(Path path, String content) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
    }
}
