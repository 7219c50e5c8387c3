package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.decl.ImplBlock;
import com.forgelang.compiler.ast.decl.ModuleDecl;
import com.forgelang.compiler.ast.expr.StructLiteral;
import com.forgelang.compiler.lexer.Lexer;
import com.forgelang.compiler.parser.Parser;
import com.forgelang.compiler.printer.SourcePrinter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * ContractParser 单元测试
 */
class ContractParserTest {

    private ModuleDecl module(String body) {
        String source = "mod counter {\n" + body + "\n}";
        return (ModuleDecl) new Parser(new Lexer(source, "counter.fg"), "counter.fg").parse().getItems().get(0);
    }

    private ContractComponents parse(String body) {
        return new ContractParser().parse(module(body));
    }

    @Nested
    @DisplayName("公开类型")
    class PublicTypeTests {

        @Test
        @DisplayName("记录唯一的公开结构体，私有结构体不影响")
        void testSinglePublicType() {
            ContractComponents components = parse(
                    "struct Entry { key: u32 }\npub struct Counter { value: i32 }\npub(crate) struct Cache;");
            assertThat(components.getTypeName()).isEqualTo("Counter");
            assertThat(components.getWarnings()).isEmpty();
        }

        @Test
        @DisplayName("没有公开结构体")
        void testMissingPublicType() {
            ModuleDecl module = module("struct Hidden { x: u8 }\npub(crate) struct Crate;");
            assertThatThrownBy(() -> new ContractParser().parse(module))
                    .isInstanceOf(StructuralException.class)
                    .satisfies(e -> {
                        ContractDiagnostic diagnostic = ((StructuralException) e).getDiagnostic();
                        assertThat(diagnostic.getKind()).isEqualTo(DiagnosticKind.MISSING_PUBLIC_TYPE);
                        assertThat(diagnostic.getLocation()).isEqualTo(module.getNameLocation());
                        assertThat(diagnostic.getMessage()).contains("exactly one public struct");
                    });
        }

        @Test
        @DisplayName("两个公开结构体，定位到第二个")
        void testMultiplePublicTypes() {
            assertThatThrownBy(() -> parse("pub struct A;\npub struct B;"))
                    .isInstanceOf(StructuralException.class)
                    .satisfies(e -> {
                        ContractDiagnostic diagnostic = ((StructuralException) e).getDiagnostic();
                        assertThat(diagnostic.getKind()).isEqualTo(DiagnosticKind.MULTIPLE_PUBLIC_TYPES);
                        assertThat(diagnostic.getLocation().getLine()).isEqualTo(3);
                        assertThat(diagnostic.getMessage()).contains("'A'").contains("'B'");
                    });
        }
    }

    @Nested
    @DisplayName("构造函数")
    class ConstructorTests {

        @Test
        @DisplayName("new 被移除，首条表达式作为构造表达式")
        void testConstructorExtracted() {
            ContractComponents components = parse("pub struct Counter { value: i32 }\n"
                    + "impl Counter {\n"
                    + "    pub fn new() -> Self { Self { value: 0 } }\n"
                    + "    pub fn get(&self) -> i32 { self.value }\n"
                    + "}");
            assertThat(components.getConstructor()).isInstanceOf(StructLiteral.class);
            assertThat(components.hasConstructorMethod()).isTrue();
            ImplBlock block = components.getBlocks().get(0);
            assertThat(block.getMethods()).extracting("name").containsExactly("get");
        }

        @Test
        @DisplayName("多个块各有 new 时只取第一个，其余被移除并警告")
        void testDuplicateConstructor() {
            ContractComponents components = parse("pub struct Counter { value: i32 }\n"
                    + "impl Counter { pub fn new() -> Self { Self { value: 1 } } }\n"
                    + "impl Counter { pub fn new() -> Self { Self { value: 2 } } pub fn reset(&mut self) {} }");

            StructLiteral constructor = (StructLiteral) components.getConstructor();
            assertThat(new SourcePrinter().render(constructor)).isEqualTo("Self { value: 1 }");
            assertThat(components.getConstructorMethod().getNameLocation().getLine()).isEqualTo(3);
            assertThat(components.getBlocks()).hasSize(2);
            assertThat(components.getBlocks().get(0).getMethods()).isEmpty();
            assertThat(components.getBlocks().get(1).getMethods()).extracting("name").containsExactly("reset");

            assertThat(components.getWarnings()).hasSize(1);
            ContractDiagnostic warning = components.getWarnings().get(0);
            assertThat(warning.getKind()).isEqualTo(DiagnosticKind.DUPLICATE_CONSTRUCTOR);
            assertThat(warning.isError()).isFalse();
            assertThat(warning.getLocation().getLine()).isEqualTo(4);
        }

        @Test
        @DisplayName("new 中多余的语句被忽略并警告")
        void testExtraStatementsIgnored() {
            ContractComponents components = parse("pub struct Counter { value: i32 }\n"
                    + "impl Counter { pub fn new() -> Self { Self { value: 0 }; log(1); } }");
            assertThat(components.getConstructor()).isInstanceOf(StructLiteral.class);
            assertThat(components.getWarnings())
                    .extracting(ContractDiagnostic::getKind)
                    .containsExactly(DiagnosticKind.CONSTRUCTOR_STATEMENTS_IGNORED);
        }

        @Test
        @DisplayName("首条语句不是表达式时没有构造表达式")
        void testFirstStatementNotExpression() {
            ContractComponents components = parse("pub struct Counter { value: i32 }\n"
                    + "impl Counter { pub fn new() -> Self { let c = Self { value: 0 }; c } }");
            assertThat(components.hasConstructorMethod()).isTrue();
            assertThat(components.getConstructor()).isNull();
        }

        @Test
        @DisplayName("没有 new")
        void testNoConstructor() {
            ContractComponents components = parse("pub struct Counter { value: i32 }\n"
                    + "impl Counter { pub fn get(&self) -> i32 { self.value } }");
            assertThat(components.hasConstructorMethod()).isFalse();
            assertThat(components.getConstructor()).isNull();
        }

        @Test
        @DisplayName("能力标签块中的 new 同样被移除")
        void testConstructorInCapabilityBlock() {
            ContractComponents components = parse("pub struct Counter { value: i32 }\n"
                    + "impl Init for Counter { fn new() -> Self { Self { value: 7 } } }");
            assertThat(components.getConstructor()).isNotNull();
            assertThat(components.getBlocks().get(0).getMethods()).isEmpty();
        }

        @Test
        @DisplayName("其他类型的 impl 块不被收集，其中的 new 保持原样")
        void testForeignImplBlockSkipped() {
            ContractComponents components = parse("pub struct Counter { value: i32 }\n"
                    + "struct Helper { k: u32 }\n"
                    + "impl Helper { fn new() -> Self { Helper { k: 0 } } pub fn peek(&self) -> u32 { self.k } }\n"
                    + "impl Counter { fn new() -> Self { Self { value: 3 } } }");

            assertThat(components.getBlocks()).extracting(ImplBlock::getName).containsExactly("Counter");
            assertThat(new SourcePrinter().render(components.getConstructor())).isEqualTo("Self { value: 3 }");
            assertThat(components.getWarnings()).isEmpty();

            ImplBlock helper = (ImplBlock) components.getModule().getItems().get(2);
            assertThat(helper.getMethods()).extracting(m -> m.getName()).containsExactly("new", "peek");
        }
    }
}
