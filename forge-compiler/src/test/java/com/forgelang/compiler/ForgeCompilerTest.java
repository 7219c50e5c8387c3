package com.forgelang.compiler;

import com.forgelang.compiler.contract.ContractDiagnostic;
import com.forgelang.compiler.contract.DiagnosticKind;
import com.forgelang.compiler.contract.ExpansionOptions;
import com.forgelang.compiler.contract.ExpansionResult;
import com.forgelang.compiler.parser.ParseException;
import com.forgelang.compiler.printer.PrintConfig;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ForgeCompiler 门面测试
 */
class ForgeCompilerTest {

    private static final String COUNTER = "#[contract]\n"
            + "mod counter {\n"
            + "    pub struct Counter { value: i32 }\n"
            + "    impl Counter {\n"
            + "        pub fn new() -> Self { Self { value: 0 } }\n"
            + "        pub fn get(&self) -> i32 { self.value }\n"
            + "    }\n"
            + "}\n";

    @Test
    @DisplayName("展开并输出")
    void testExpandAndPrint() {
        ForgeCompiler compiler = new ForgeCompiler();
        ExpansionResult result = compiler.expand(COUNTER, "counter.fg");

        assertTrue(result.isSuccess());
        String output = compiler.print(result.getOutput());
        assertTrue(output.contains("pub(crate) static mut STATE: Counter = Counter { value: 0 };"));
        assertTrue(output.contains("pub unsafe fn get(arg_len: u32) -> u32 {"));
    }

    @Test
    @DisplayName("语法错误转为 ParseError 诊断")
    void testParseErrorDiagnostic() {
        ExpansionResult result = new ForgeCompiler().expand("#[contract]\nmod m {\n    pub struct S\n}", "bad.fg");

        assertFalse(result.isSuccess());
        assertEquals(1, result.getDiagnostics().size());
        ContractDiagnostic diagnostic = result.getDiagnostics().get(0);
        assertEquals(DiagnosticKind.PARSE_ERROR, diagnostic.getKind());
        assertTrue(diagnostic.isError());
        assertEquals("bad.fg:4:1: error[ParseError]: Expected '{' or ';' after struct name (found '}')",
                diagnostic.format());
    }

    @Test
    @DisplayName("文件结尾的语法错误")
    void testParseErrorAtEof() {
        ExpansionResult result = new ForgeCompiler().expand("mod m {", "eof.fg");
        ContractDiagnostic diagnostic = result.getDiagnostics().get(0);
        assertEquals(DiagnosticKind.PARSE_ERROR, diagnostic.getKind());
        assertEquals("Unterminated module 'm'", diagnostic.getMessage());
    }

    @Test
    @DisplayName("parse 直接抛出 ParseException")
    void testParseThrows() {
        assertThrows(ParseException.class, () -> new ForgeCompiler().parse("fn (", "x.fg"));
    }

    @Test
    @DisplayName("从文件展开，诊断使用文件路径")
    void testExpandFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("plain.fg");
        Files.write(file, "fn main() {}\n".getBytes(StandardCharsets.UTF_8));

        ExpansionResult result = new ForgeCompiler().expandFile(file);
        assertTrue(result.isSuccess());
        assertEquals(DiagnosticKind.NO_CONTRACT_MODULE, result.getWarnings().get(0).getKind());
        assertEquals(file.toString(), result.getWarnings().get(0).getLocation().getFile());
    }

    @Test
    @DisplayName("按配置格式化")
    void testFormat() {
        PrintConfig config = new PrintConfig();
        config.setIndentSize(2);
        ForgeCompiler compiler = new ForgeCompiler(new ExpansionOptions(), config);
        assertEquals("fn main() {\n  run();\n}\n", compiler.format("fn main(){run();}", "f.fg"));
    }
}
