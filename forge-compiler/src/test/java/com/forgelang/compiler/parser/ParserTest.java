package com.forgelang.compiler.parser;

import com.forgelang.compiler.ast.Visibility;
import com.forgelang.compiler.ast.decl.*;
import com.forgelang.compiler.ast.expr.*;
import com.forgelang.compiler.ast.pattern.*;
import com.forgelang.compiler.ast.stmt.*;
import com.forgelang.compiler.ast.type.*;
import com.forgelang.compiler.lexer.Lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private SourceFile parse(String source) {
        Lexer lexer = new Lexer(source, "<test>");
        Parser parser = new Parser(lexer, "<test>");
        return parser.parse();
    }

    private Expression parseExpr(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>").parseStandaloneExpression();
    }

    private Item firstItem(String source) {
        return parse(source).getItems().get(0);
    }

    /** 解析单个函数体内的语句 */
    private java.util.List<Statement> statements(String body) {
        FnDecl fn = (FnDecl) firstItem("fn test() {\n" + body + "\n}");
        return fn.getBody().getStatements();
    }

    // ============ 项 ============

    @Nested
    @DisplayName("项声明")
    class ItemTests {

        @Test
        @DisplayName("带属性的模块")
        void testModuleWithAttribute() {
            Item item = firstItem("#[contract]\nmod counter { pub struct Counter { value: i32 } }");
            assertTrue(item instanceof ModuleDecl);
            ModuleDecl module = (ModuleDecl) item;
            assertEquals("counter", module.getName());
            assertTrue(module.hasAttribute("contract"));
            assertEquals(1, module.getItems().size());
            assertEquals(2, module.getNameLocation().getLine());
            assertEquals(5, module.getNameLocation().getColumn());
        }

        @Test
        @DisplayName("属性按最后一段名称匹配，参数按原文保存")
        void testAttributeArguments() {
            ModuleDecl module = (ModuleDecl) firstItem("#[forge::contract(name = \"x\", v(1))]\nmod m {}");
            Attribute attribute = module.getAttributes().get(0);
            assertTrue(attribute.hasSimpleName("contract"));
            assertEquals("name = \"x\", v(1)", attribute.getArguments());
            assertTrue(module.hasAttribute("contract"));
        }

        @Test
        @DisplayName("结构体字段与可见性")
        void testStruct() {
            StructDecl struct = (StructDecl) firstItem("pub struct Counter { pub value: i32, owner: [u8; 32], }");
            assertEquals(Visibility.PUBLIC, struct.getVisibility());
            assertEquals(2, struct.getFields().size());
            assertEquals(Visibility.PUBLIC, struct.getFields().get(0).getVisibility());
            FieldDecl owner = struct.getFields().get(1);
            assertEquals("owner", owner.getName());
            assertTrue(owner.getType() instanceof ArrayType);
            assertFalse(((ArrayType) owner.getType()).isSlice());
        }

        @Test
        @DisplayName("pub(crate) 不算公开")
        void testCrateVisibility() {
            StructDecl struct = (StructDecl) firstItem("pub(crate) struct Hidden;");
            assertEquals(Visibility.CRATE, struct.getVisibility());
            assertFalse(struct.isPublic());
            assertTrue(struct.isUnit());
        }

        @Test
        @DisplayName("impl 块与能力标签")
        void testImplBlocks() {
            SourceFile file = parse("impl Counter { fn a(&self) {} }\nimpl Tag for Counter { pub fn b(&mut self) {} }");
            ImplBlock plain = (ImplBlock) file.getItems().get(0);
            assertFalse(plain.hasCapability());
            assertEquals("Counter", plain.getName());

            ImplBlock tagged = (ImplBlock) file.getItems().get(1);
            assertTrue(tagged.hasCapability());
            assertEquals("Tag", tagged.getCapability().getFullName());
            assertEquals("Counter", tagged.getName());
            assertTrue(tagged.getMethods().get(0).isPublic());
        }

        @Test
        @DisplayName("接收者形式")
        void testReceivers() {
            ImplBlock block = (ImplBlock) firstItem(
                    "impl T { fn a(self) {} fn b(mut self) {} fn c(&self) {} fn d(&mut self, x: i32) {} fn e(x: i32) {} }");
            assertEquals(Parameter.ReceiverKind.VALUE, block.getMethods().get(0).getReceiver().getReceiverKind());
            assertEquals(Parameter.ReceiverKind.MUT_VALUE, block.getMethods().get(1).getReceiver().getReceiverKind());
            assertEquals(Parameter.ReceiverKind.REF, block.getMethods().get(2).getReceiver().getReceiverKind());
            FnDecl d = block.getMethods().get(3);
            assertEquals(Parameter.ReceiverKind.REF_MUT, d.getReceiver().getReceiverKind());
            assertEquals(2, d.getParams().size());
            assertEquals("x", d.getParams().get(1).getName());
            assertFalse(block.getMethods().get(4).hasReceiver());
        }

        @Test
        @DisplayName("元组模式参数没有简单名称")
        void testTuplePatternParameter() {
            FnDecl fn = (FnDecl) firstItem("fn f((a, b): (i32, u8), _: bool) {}");
            assertNull(fn.getParams().get(0).getName());
            assertTrue(fn.getParams().get(0).getPattern() instanceof TuplePattern);
            assertTrue(fn.getParams().get(0).getType() instanceof TupleType);
            assertNull(fn.getParams().get(1).getName());
        }

        @Test
        @DisplayName("use 声明的各种形式")
        void testUse() {
            SourceFile file = parse("use a::b;\nuse a::b as c;\nuse a::*;\nuse a::{b, c};");
            assertEquals(UseDecl.UseKind.SINGLE, ((UseDecl) file.getItems().get(0)).getKind());
            assertEquals("c", ((UseDecl) file.getItems().get(1)).getAlias());
            assertEquals(UseDecl.UseKind.GLOB, ((UseDecl) file.getItems().get(2)).getKind());
            UseDecl group = (UseDecl) file.getItems().get(3);
            assertEquals(UseDecl.UseKind.GROUP, group.getKind());
            assertEquals(java.util.Arrays.asList("b", "c"), group.getMembers());
        }

        @Test
        @DisplayName("const 与 static mut")
        void testStatics() {
            SourceFile file = parse("const MAX: u32 = 10;\npub static mut COUNT: u64 = 0;");
            StaticDecl max = (StaticDecl) file.getItems().get(0);
            assertTrue(max.isConst());
            StaticDecl count = (StaticDecl) file.getItems().get(1);
            assertTrue(count.isMutable());
            assertEquals("COUNT", count.getName());
        }

        @Test
        @DisplayName("泛型类型与嵌套的 >>")
        void testNestedGenerics() {
            FnDecl fn = (FnDecl) firstItem("fn f(x: Vec<Vec<u8>>) -> Option<&mut Self> {}");
            PathType param = (PathType) fn.getParams().get(0).getType();
            assertEquals("Vec", param.getPath().getLastSegment().getName());
            PathType inner = (PathType) param.getPath().getLastSegment().getGenericArgs().get(0);
            assertEquals("Vec", inner.getPath().getFullName());
            PathType ret = (PathType) fn.getReturnType();
            assertTrue(ret.getPath().getLastSegment().getGenericArgs().get(0) instanceof RefType);
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            BinaryExpr expr = (BinaryExpr) parseExpr("1 + 2 * 3");
            assertEquals(BinaryExpr.BinaryOp.ADD, expr.getOperator());
            assertEquals(BinaryExpr.BinaryOp.MUL, ((BinaryExpr) expr.getRight()).getOperator());
        }

        @Test
        @DisplayName("右移由两个相邻 '>' 组成")
        void testShiftRight() {
            BinaryExpr expr = (BinaryExpr) parseExpr("a >> 2");
            assertEquals(BinaryExpr.BinaryOp.SHR, expr.getOperator());
        }

        @Test
        @DisplayName("分开的 '> >' 不是右移")
        void testSeparatedGreaterThan() {
            assertThrows(ParseException.class, () -> parseExpr("a > > 2"));
        }

        @Test
        @DisplayName("括号表达式被保留")
        void testParenPreserved() {
            BinaryExpr expr = (BinaryExpr) parseExpr("(1 + 2) * 3");
            assertTrue(expr.getLeft() instanceof ParenExpr);
        }

        @Test
        @DisplayName("结构体字面量、简写字段与 ..base")
        void testStructLiteral() {
            StructLiteral literal = (StructLiteral) parseExpr("Self { value, owner: 1, ..Default::default() }");
            assertEquals("Self", literal.getPath().getFullName());
            assertTrue(literal.getFields().get(0).isShorthand());
            assertFalse(literal.getFields().get(1).isShorthand());
            assertTrue(literal.hasBase());
            assertTrue(literal.getBase() instanceof CallExpr);
        }

        @Test
        @DisplayName("方法调用、turbofish 与 ? 运算符")
        void testPostfix() {
            TryExpr expr = (TryExpr) parseExpr("self.items.iter().collect::<Vec<u8>>()?");
            MethodCallExpr collect = (MethodCallExpr) expr.getOperand();
            assertEquals("collect", collect.getMethodName());
            assertEquals(1, collect.getTypeArgs().size());
            MethodCallExpr iter = (MethodCallExpr) collect.getReceiver();
            assertTrue(iter.getReceiver() instanceof FieldExpr);
        }

        @Test
        @DisplayName("x.0.1 拆分为两层元组字段访问")
        void testNestedTupleField() {
            FieldExpr outer = (FieldExpr) parseExpr("x.0.1");
            assertEquals("1", outer.getFieldName());
            FieldExpr inner = (FieldExpr) outer.getTarget();
            assertEquals("0", inner.getFieldName());
        }

        @Test
        @DisplayName("路径表达式中的 turbofish")
        void testPathTurbofish() {
            CallExpr call = (CallExpr) parseExpr("Vec::<u8>::new()");
            PathExpr callee = (PathExpr) call.getCallee();
            assertTrue(callee.getPath().getSegments().get(0).isTurbofish());
            assertEquals("new", callee.getPath().getLastSegment().getName());
        }

        @Test
        @DisplayName("闭包参数与元组模式")
        void testClosure() {
            ClosureExpr closure = (ClosureExpr) parseExpr("|(a, b): (i32, u8)| a + b");
            assertEquals(1, closure.getParams().size());
            assertTrue(closure.getParams().get(0).getPattern() instanceof TuplePattern);
            assertTrue(closure.getBody() instanceof BinaryExpr);

            ClosureExpr empty = (ClosureExpr) parseExpr("|| 1");
            assertTrue(empty.getParams().isEmpty());
        }

        @Test
        @DisplayName("宏调用")
        void testMacro() {
            MacroCallExpr vec = (MacroCallExpr) parseExpr("vec![1, 2, 3]");
            assertTrue(vec.isBracketed());
            assertEquals(3, vec.getArgs().size());
        }

        @Test
        @DisplayName("区间两端可省略")
        void testRanges() {
            BinaryExpr full = (BinaryExpr) parseExpr("0..10");
            assertEquals(BinaryExpr.BinaryOp.RANGE, full.getOperator());
            BinaryExpr open = (BinaryExpr) parseExpr("a..");
            assertNull(open.getRight());
            BinaryExpr inclusive = (BinaryExpr) parseExpr("..=5");
            assertNull(inclusive.getLeft());
        }

        @Test
        @DisplayName("单元素元组需要尾随逗号")
        void testTuple() {
            assertTrue(parseExpr("(1,)") instanceof TupleExpr);
            assertTrue(parseExpr("(1)") instanceof ParenExpr);
            assertTrue(parseExpr("()") instanceof TupleExpr);
        }

        @Test
        @DisplayName("引用与解引用")
        void testUnary() {
            UnaryExpr ref = (UnaryExpr) parseExpr("&mut STATE");
            assertEquals(UnaryExpr.UnaryOp.REF_MUT, ref.getOperator());
            UnaryExpr deref = (UnaryExpr) parseExpr("*x");
            assertEquals(UnaryExpr.UnaryOp.DEREF, deref.getOperator());
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("if 条件中不解析结构体字面量")
        void testNoStructLiteralInCondition() {
            java.util.List<Statement> stmts = statements("if x == y { a } else { b }");
            IfExpr ifExpr = (IfExpr) ((ExpressionStmt) stmts.get(0)).getExpression();
            assertTrue(ifExpr.getCondition() instanceof BinaryExpr);
            assertTrue(ifExpr.hasElse());
        }

        @Test
        @DisplayName("条件中括号内允许结构体字面量")
        void testStructLiteralInParens() {
            java.util.List<Statement> stmts = statements("if (P { x: 1 }).x == 1 { }");
            IfExpr ifExpr = (IfExpr) ((ExpressionStmt) stmts.get(0)).getExpression();
            assertTrue(ifExpr.getCondition() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("块状表达式自成一句，无需分号")
        void testBlockLikeStatements() {
            java.util.List<Statement> stmts = statements("while i < 10 { i += 1; }\nfor x in 0..n { }\nloop { break; }\n*p = 1;");
            assertEquals(4, stmts.size());
            assertTrue(((ExpressionStmt) stmts.get(0)).getExpression() instanceof WhileExpr);
            assertTrue(((ExpressionStmt) stmts.get(1)).getExpression() instanceof ForExpr);
            assertTrue(((ExpressionStmt) stmts.get(2)).getExpression() instanceof LoopExpr);
            assertTrue(((ExpressionStmt) stmts.get(3)).getExpression() instanceof AssignExpr);
        }

        @Test
        @DisplayName("let 语句")
        void testLet() {
            LetStmt let = (LetStmt) statements("let mut total: u64 = 0;").get(0);
            IdentPattern pattern = (IdentPattern) let.getPattern();
            assertTrue(pattern.isMutable());
            assertEquals("total", pattern.getName());
            assertNotNull(let.getType());
        }

        @Test
        @DisplayName("块尾表达式无分号")
        void testTailExpression() {
            ExpressionStmt stmt = (ExpressionStmt) statements("Self { value: 0 }").get(0);
            assertFalse(stmt.hasSemicolon());
            assertTrue(stmt.getExpression() instanceof StructLiteral);
        }

        @Test
        @DisplayName("unsafe 块")
        void testUnsafeBlock() {
            ExpressionStmt stmt = (ExpressionStmt) statements("unsafe { STATE.value }").get(0);
            assertTrue(((BlockExpr) stmt.getExpression()).isUnsafe());
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("缺少分号")
        void testMissingSemicolon() {
            ParseException e = assertThrows(ParseException.class, () -> statements("a = 1\nb = 2;"));
            assertEquals("SEMICOLON", e.getExpected());
            assertEquals(3, e.getToken().getLine());
        }

        @Test
        @DisplayName("不支持的项")
        void testUnsupportedItems() {
            assertThrows(ParseException.class, () -> parse("trait T {}"));
            assertThrows(ParseException.class, () -> parse("enum E { A }"));
            assertThrows(ParseException.class, () -> parse("mod outside;"));
            assertThrows(ParseException.class, () -> parse("struct P(i32);"));
            assertThrows(ParseException.class, () -> parse("fn id<T>(x: T) -> T { x }"));
            assertThrows(ParseException.class, () -> parse("pub impl T {}"));
        }

        @Test
        @DisplayName("match 表达式不受支持")
        void testMatchRejected() {
            ParseException e = assertThrows(ParseException.class, () -> statements("match x { _ => 1 }"));
            assertTrue(e.getRawMessage().contains("match"));
        }

        @Test
        @DisplayName("self 只能是第一个参数")
        void testReceiverPosition() {
            assertThrows(ParseException.class, () -> parse("impl T { fn f(x: i32, &self) {} }"));
        }

        @Test
        @DisplayName("词法错误作为 ParseException 抛出")
        void testLexerError() {
            ParseException e = assertThrows(ParseException.class, () -> parse("fn f() { \"open }"));
            assertTrue(e.getRawMessage().contains("Unterminated string"));
        }

        @Test
        @DisplayName("函数体内不能嵌套项")
        void testNestedItem() {
            assertThrows(ParseException.class, () -> statements("fn inner() {}"));
        }
    }
}
