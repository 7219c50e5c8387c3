package com.forgelang.compiler.ast;

import com.forgelang.compiler.ast.decl.*;
import com.forgelang.compiler.ast.expr.*;
import com.forgelang.compiler.ast.pattern.*;
import com.forgelang.compiler.ast.stmt.*;
import com.forgelang.compiler.ast.type.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。
 * 需要遍历全部子节点时继承 {@link AstScanner}。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 项 ============

    default R visitSourceFile(SourceFile node, C ctx) { return null; }

    default R visitModuleDecl(ModuleDecl node, C ctx) { return null; }

    default R visitStructDecl(StructDecl node, C ctx) { return null; }

    default R visitFieldDecl(FieldDecl node, C ctx) { return null; }

    default R visitImplBlock(ImplBlock node, C ctx) { return null; }

    default R visitFnDecl(FnDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    default R visitUseDecl(UseDecl node, C ctx) { return null; }

    default R visitStaticDecl(StaticDecl node, C ctx) { return null; }

    default R visitAttribute(Attribute node, C ctx) { return null; }

    default R visitPath(Path node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitLetStmt(LetStmt node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitPathExpr(PathExpr node, C ctx) { return null; }

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitStructLiteral(StructLiteral node, C ctx) { return null; }

    default R visitFieldInit(StructLiteral.FieldInit node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitMethodCallExpr(MethodCallExpr node, C ctx) { return null; }

    default R visitFieldExpr(FieldExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitAssignExpr(AssignExpr node, C ctx) { return null; }

    default R visitCastExpr(CastExpr node, C ctx) { return null; }

    default R visitClosureExpr(ClosureExpr node, C ctx) { return null; }

    default R visitClosureParam(ClosureExpr.ClosureParam node, C ctx) { return null; }

    default R visitTupleExpr(TupleExpr node, C ctx) { return null; }

    default R visitArrayExpr(ArrayExpr node, C ctx) { return null; }

    default R visitParenExpr(ParenExpr node, C ctx) { return null; }

    default R visitBlockExpr(BlockExpr node, C ctx) { return null; }

    default R visitIfExpr(IfExpr node, C ctx) { return null; }

    default R visitWhileExpr(WhileExpr node, C ctx) { return null; }

    default R visitForExpr(ForExpr node, C ctx) { return null; }

    default R visitLoopExpr(LoopExpr node, C ctx) { return null; }

    default R visitReturnExpr(ReturnExpr node, C ctx) { return null; }

    default R visitJumpExpr(JumpExpr node, C ctx) { return null; }

    default R visitMacroCallExpr(MacroCallExpr node, C ctx) { return null; }

    default R visitTryExpr(TryExpr node, C ctx) { return null; }

    // ============ 模式 ============

    default R visitIdentPattern(IdentPattern node, C ctx) { return null; }

    default R visitWildcardPattern(WildcardPattern node, C ctx) { return null; }

    default R visitTuplePattern(TuplePattern node, C ctx) { return null; }

    // ============ 类型 ============

    default R visitPathType(PathType node, C ctx) { return null; }

    default R visitRefType(RefType node, C ctx) { return null; }

    default R visitTupleType(TupleType node, C ctx) { return null; }

    default R visitArrayType(ArrayType node, C ctx) { return null; }
}
