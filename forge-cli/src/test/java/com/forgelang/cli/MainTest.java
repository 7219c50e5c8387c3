package com.forgelang.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * forge 命令行测试
 */
class MainTest {

    private static final String COUNTER = "#[contract]\n"
            + "mod counter {\n"
            + "    pub struct Counter { value: i32 }\n"
            + "    impl Counter {\n"
            + "        pub fn new() -> Self { Self { value: 0 } }\n"
            + "        pub fn new() -> Self { Self { value: 1 } }\n"
            + "        pub fn increment(&mut self, n: i32) { self.value += n; }\n"
            + "    }\n"
            + "}\n";

    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = Main.createCommandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("expand")
    class Expand {

        @Test
        @DisplayName("输出到标准输出，诊断输出到 stderr")
        void testExpandToStdout() throws IOException {
            Path file = write("counter.fg", COUNTER);

            assertThat(run("expand", file.toString())).isEqualTo(0);
            assertThat(out.toString()).contains("pub(crate) static mut STATE: Counter = Counter { value: 0 };");
            assertThat(out.toString()).contains("counter::STATE.increment(n)");
            assertThat(err.toString()).contains("warning[DuplicateConstructor]");
        }

        @Test
        @DisplayName("写出展开文件和导出清单")
        void testExpandToFiles() throws IOException {
            Path file = write("counter.fg", COUNTER);
            Path output = dir.resolve("build/counter.out.fg");
            Path manifest = dir.resolve("build/counter.json");

            int code = run("expand", file.toString(), "-o", output.toString(), "--manifest", manifest.toString());

            assertThat(code).isEqualTo(0);
            assertThat(read(output)).contains("pub unsafe fn increment(arg_len: u32) -> u32 {");
            assertThat(read(manifest)).contains("\"symbol\": \"increment\"");
            assertThat(out.toString()).contains("已展开: ").contains("导出清单: ");
        }

        @Test
        @DisplayName("严格模式下警告导致失败")
        void testStrict() throws IOException {
            Path file = write("counter.fg", COUNTER);

            assertThat(run("expand", "--strict", file.toString())).isEqualTo(1);
            assertThat(err.toString()).contains("error[DuplicateConstructor]");
            assertThat(out.toString()).isEmpty();
        }

        @Test
        @DisplayName("自定义状态名")
        void testStateName() throws IOException {
            Path file = write("counter.fg", COUNTER);

            assertThat(run("expand", "--state-name", "INSTANCE", file.toString())).isEqualTo(0);
            assertThat(out.toString()).contains("static mut INSTANCE: Counter");
        }

        @Test
        @DisplayName("非法的选项值被拒绝")
        void testInvalidStateName() throws IOException {
            Path file = write("counter.fg", COUNTER);

            assertThat(run("expand", "--state-name", "1abc", file.toString()))
                    .isEqualTo(CommandLine.ExitCode.USAGE);
            assertThat(err.toString()).contains("stateName is not a valid identifier: 1abc");
        }

        @Test
        @DisplayName("文件不存在")
        void testMissingFile() {
            String missing = dir.resolve("missing.fg").toString();

            assertThat(run("expand", missing)).isEqualTo(1);
            assertThat(err.toString()).contains("错误: 文件不存在 - " + missing);
        }
    }

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        @DisplayName("检查通过时报告合约与警告数")
        void testCheckPasses() throws IOException {
            Path file = write("counter.fg", COUNTER);

            assertThat(run("check", file.toString())).isEqualTo(0);
            assertThat(out.toString()).contains("检查通过: ").contains("(1 个合约, 1 个警告)");
            assertThat(out.toString()).doesNotContain("static mut");
        }

        @Test
        @DisplayName("检查失败时报告错误数")
        void testCheckFails() throws IOException {
            Path file = write("broken.fg", "#[contract]\nmod m {\n    struct Hidden;\n}\n");

            assertThat(run("check", file.toString())).isEqualTo(1);
            assertThat(err.toString()).contains("error[MissingPublicType]").contains("(1 个错误)");
        }

        @Test
        @DisplayName("语法错误")
        void testParseError() throws IOException {
            Path file = write("syntax.fg", "mod m {");

            assertThat(run("check", file.toString())).isEqualTo(1);
            assertThat(err.toString()).contains("error[ParseError]: Unterminated module 'm'");
        }
    }

    @Nested
    @DisplayName("fmt")
    class Fmt {

        @Test
        @DisplayName("就地格式化")
        void testFormatInPlace() throws IOException {
            Path file = write("messy.fg", "fn main(){run();}");

            assertThat(run("fmt", file.toString())).isEqualTo(0);
            assertThat(read(file)).isEqualTo("fn main() {\n    run();\n}\n");
            assertThat(out.toString()).contains("已格式化: ");
        }

        @Test
        @DisplayName("输出到标准输出时不改写文件")
        void testFormatToStdout() throws IOException {
            Path file = write("messy.fg", "fn main(){run();}");

            assertThat(run("fmt", "--stdout", "--use-tabs", file.toString())).isEqualTo(0);
            assertThat(out.toString()).isEqualTo("fn main() {\n\trun();\n}\n");
            assertThat(read(file)).isEqualTo("fn main(){run();}");
        }

        @Test
        @DisplayName("语法错误时不改写文件")
        void testFormatParseError() throws IOException {
            Path file = write("bad.fg", "fn main( {");

            assertThat(run("fmt", file.toString())).isEqualTo(1);
            assertThat(err.toString()).contains("error[ParseError]");
            assertThat(read(file)).isEqualTo("fn main( {");
        }
    }

    @Test
    @DisplayName("无子命令时输出用法")
    void testUsage() {
        assertThat(run()).isEqualTo(0);
        assertThat(out.toString()).contains("Usage: forge").contains("expand").contains("fmt");
    }
}
