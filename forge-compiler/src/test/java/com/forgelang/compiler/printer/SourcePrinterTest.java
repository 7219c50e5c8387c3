package com.forgelang.compiler.printer;

import com.forgelang.compiler.ast.decl.SourceFile;
import com.forgelang.compiler.ast.expr.Expression;
import com.forgelang.compiler.ast.expr.Literal;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.lexer.Lexer;
import com.forgelang.compiler.parser.Parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SourcePrinter 单元测试
 */
class SourcePrinterTest {

    private final SourcePrinter printer = new SourcePrinter();

    private SourceFile parse(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>").parse();
    }

    private String print(String source) {
        return printer.print(parse(source));
    }

    private String printExpr(String source) {
        Expression expr = new Parser(new Lexer(source, "<test>"), "<test>").parseStandaloneExpression();
        return printer.render(expr);
    }

    /** 输出结果再次解析并输出，应与第一次完全一致 */
    private void assertStable(String source) {
        String once = print(source);
        String twice = print(once);
        assertEquals(once, twice);
    }

    // ============ 项 ============

    @Nested
    @DisplayName("项")
    class ItemTests {

        @Test
        @DisplayName("规范格式的源码原样输出")
        void testCanonicalModule() {
            String source = "#[contract]\n"
                    + "mod counter {\n"
                    + "    pub struct Counter {\n"
                    + "        value: i32,\n"
                    + "    }\n"
                    + "\n"
                    + "    impl Counter {\n"
                    + "        pub fn new() -> Self {\n"
                    + "            Self { value: 0 }\n"
                    + "        }\n"
                    + "    }\n"
                    + "}\n";
            assertEquals(source, print(source));
        }

        @Test
        @DisplayName("压缩的源码被展开为统一格式")
        void testNormalizesLayout() {
            String expected = "pub(crate) static mut STATE: Counter = Counter { value: 0 };\n"
                    + "\n"
                    + "use a::{b, c};\n";
            assertEquals(expected, print("pub(crate)   static mut STATE:Counter=Counter{value:0};use a::{b,c};"));
        }

        @Test
        @DisplayName("属性参数按原文输出")
        void testAttributeArguments() {
            assertEquals("#[derive(Clone,  Debug)]\nstruct P;\n", print("#[derive( Clone,  Debug )]   struct P;"));
        }

        @Test
        @DisplayName("unsafe 函数与能力标签")
        void testUnsafeFnAndCapability() {
            String expected = "impl Tag for Counter {\n"
                    + "    pub unsafe fn run(&mut self, x: u32) -> u32 {\n"
                    + "        x\n"
                    + "    }\n"
                    + "}\n";
            assertEquals(expected, print("impl Tag for Counter { pub unsafe fn run(&mut self, x: u32) -> u32 { x } }"));
        }

        @Test
        @DisplayName("空模块与空函数体")
        void testEmptyBodies() {
            assertEquals("mod m {}\n\nfn f() {}\n", print("mod m { }\nfn f() { ; }"));
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("括号被保留")
        void testParens() {
            assertEquals("(a + b) * c", printExpr("(a+b)*c"));
        }

        @Test
        @DisplayName("区间运算符两侧无空格")
        void testRange() {
            assertEquals("0..n", printExpr("0 .. n"));
            assertEquals("..=5", printExpr("..= 5"));
        }

        @Test
        @DisplayName("单元素元组保留尾随逗号")
        void testSingleTuple() {
            assertEquals("(a,)", printExpr("( a , )"));
        }

        @Test
        @DisplayName("闭包")
        void testClosure() {
            assertEquals("|(a, b): (i32, u8)| a + b", printExpr("|(a,b):(i32,u8)|a+b"));
            assertEquals("|| 1", printExpr("||1"));
            assertEquals("move |x| x", printExpr("move |x| x"));
        }

        @Test
        @DisplayName("结构体字面量")
        void testStructLiteral() {
            assertEquals("P { x, y: 2, ..base }", printExpr("P{x,y:2,..base}"));
            assertEquals("P {}", printExpr("P {}"));
        }

        @Test
        @DisplayName("方法调用与 turbofish")
        void testMethodCall() {
            assertEquals("v.iter().collect::<Vec<u8>>()?", printExpr("v . iter() . collect::<Vec<u8>>()?"));
            assertEquals("Vec::<u8>::new()", printExpr("Vec::<u8>::new()"));
        }

        @Test
        @DisplayName("字面量保留原始词素")
        void testLiteralLexeme() {
            assertEquals("0xff_u8", printExpr("0xff_u8"));
            assertEquals("\"a\\n\"", printExpr("\"a\\n\""));
        }

        @Test
        @DisplayName("生成的字面量按值转义输出")
        void testGeneratedLiteral() {
            Literal literal = new Literal(SourceLocation.UNKNOWN, "say \"hi\"\n", Literal.LiteralKind.STRING, null);
            assertEquals("\"say \\\"hi\\\"\\n\"", printer.render(literal));
        }

        @Test
        @DisplayName("引用与类型转换")
        void testUnaryAndCast() {
            assertEquals("&mut counter::STATE", printExpr("&mut counter::STATE"));
            assertEquals("x as u64", printExpr("x as u64"));
            assertEquals("!done", printExpr("! done"));
        }

        @Test
        @DisplayName("宏调用")
        void testMacro() {
            assertEquals("vec![1, 2]", printExpr("vec![1,2]"));
            assertEquals("assert!(ok)", printExpr("assert!( ok )"));
        }
    }

    // ============ 语句与控制流 ============

    @Nested
    @DisplayName("语句与控制流")
    class StatementTests {

        @Test
        @DisplayName("if / else if / else")
        void testIfChain() {
            String expected = "fn f() {\n"
                    + "    if a {\n"
                    + "        x;\n"
                    + "    } else if b {\n"
                    + "        y;\n"
                    + "    } else {\n"
                    + "        z;\n"
                    + "    }\n"
                    + "}\n";
            assertEquals(expected, print("fn f() { if a { x; } else if b { y; } else { z; } }"));
        }

        @Test
        @DisplayName("循环与 let")
        void testLoops() {
            String expected = "fn f() {\n"
                    + "    let mut total: u64 = 0;\n"
                    + "    for i in 0..10 {\n"
                    + "        total += i;\n"
                    + "    }\n"
                    + "    while total > 0 {\n"
                    + "        total -= 1;\n"
                    + "    }\n"
                    + "    loop {\n"
                    + "        break;\n"
                    + "    }\n"
                    + "}\n";
            assertEquals(expected, print("fn f() { let mut total: u64 = 0; for i in 0..10 { total += i; } "
                    + "while total > 0 { total -= 1; } loop { break; } }"));
        }
    }

    // ============ 配置 ============

    @Nested
    @DisplayName("输出配置")
    class ConfigTests {

        @Test
        @DisplayName("Tab 缩进")
        void testTabs() {
            PrintConfig config = new PrintConfig();
            config.setUseSpaces(false);
            assertEquals("fn f() {\n\tx\n}\n", printer.print(parse("fn f() { x }"), config));
        }

        @Test
        @DisplayName("自定义缩进宽度")
        void testIndentSize() {
            PrintConfig config = new PrintConfig();
            config.setIndentSize(2);
            assertEquals("fn f() {\n  x\n}\n", printer.print(parse("fn f() { x }"), config));
        }

        @Test
        @DisplayName("负缩进被拒绝")
        void testNegativeIndent() {
            assertThrows(IllegalArgumentException.class, () -> new PrintConfig().setIndentSize(-1));
        }
    }

    // ============ 稳定性 ============

    @Test
    @DisplayName("输出结果再次解析后输出不变")
    void testStableOutput() {
        assertStable("#[contract] mod token { use super::abi; pub struct Token { owner: [u8; 32], balances: Vec<(u64, u8)> }"
                + " impl Token { pub fn new() -> Self { Self { owner: [0; 32], balances: vec![] } }"
                + " pub fn transfer(&mut self, to: [u8; 32], amount: u64) -> Result<(), u8> {"
                + " if self.balances.len() > 0 && amount >> 1 != 0 { return Err(1); } Ok(()) } } }");
    }
}
