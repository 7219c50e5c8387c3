package com.forgelang.compiler.ast;

import com.forgelang.compiler.ast.decl.*;
import com.forgelang.compiler.ast.expr.*;
import com.forgelang.compiler.ast.pattern.*;
import com.forgelang.compiler.ast.stmt.*;
import com.forgelang.compiler.ast.type.*;

import java.util.List;

/**
 * 深度优先遍历全部子节点的访问者基类
 *
 * <p>每个 visit 方法默认访问该节点的所有子节点并返回 null。子类覆盖某个方法后，
 * 如需继续向下遍历，调用 super 对应方法即可。新增节点类型时必须同步补充此处，
 * 否则依赖完整遍历的改写（如 Self 替换）会漏掉该节点下的内容。</p>
 */
public abstract class AstScanner<C> implements AstVisitor<Void, C> {

    protected void scan(AstNode node, C ctx) {
        if (node != null) {
            node.accept(this, ctx);
        }
    }

    protected void scanAll(List<? extends AstNode> nodes, C ctx) {
        if (nodes == null) return;
        for (AstNode node : nodes) {
            scan(node, ctx);
        }
    }

    // ============ 项 ============

    @Override
    public Void visitSourceFile(SourceFile node, C ctx) {
        scanAll(node.getItems(), ctx);
        return null;
    }

    @Override
    public Void visitModuleDecl(ModuleDecl node, C ctx) {
        scanAll(node.getAttributes(), ctx);
        scanAll(node.getItems(), ctx);
        return null;
    }

    @Override
    public Void visitStructDecl(StructDecl node, C ctx) {
        scanAll(node.getAttributes(), ctx);
        scanAll(node.getFields(), ctx);
        return null;
    }

    @Override
    public Void visitFieldDecl(FieldDecl node, C ctx) {
        scan(node.getType(), ctx);
        return null;
    }

    @Override
    public Void visitImplBlock(ImplBlock node, C ctx) {
        scanAll(node.getAttributes(), ctx);
        scan(node.getCapability(), ctx);
        scan(node.getSelfType(), ctx);
        scanAll(node.getMethods(), ctx);
        return null;
    }

    @Override
    public Void visitFnDecl(FnDecl node, C ctx) {
        scanAll(node.getAttributes(), ctx);
        scanAll(node.getParams(), ctx);
        scan(node.getReturnType(), ctx);
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitParameter(Parameter node, C ctx) {
        scan(node.getPattern(), ctx);
        scan(node.getType(), ctx);
        return null;
    }

    @Override
    public Void visitUseDecl(UseDecl node, C ctx) {
        scan(node.getPath(), ctx);
        return null;
    }

    @Override
    public Void visitStaticDecl(StaticDecl node, C ctx) {
        scanAll(node.getAttributes(), ctx);
        scan(node.getType(), ctx);
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitAttribute(Attribute node, C ctx) {
        scan(node.getPath(), ctx);
        return null;
    }

    @Override
    public Void visitPath(Path node, C ctx) {
        for (PathSegment segment : node.getSegments()) {
            scanAll(segment.getGenericArgs(), ctx);
        }
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, C ctx) {
        scanAll(node.getStatements(), ctx);
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt node, C ctx) {
        scan(node.getPattern(), ctx);
        scan(node.getType(), ctx);
        scan(node.getInitializer(), ctx);
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, C ctx) {
        scan(node.getExpression(), ctx);
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitPathExpr(PathExpr node, C ctx) {
        scan(node.getPath(), ctx);
        return null;
    }

    @Override
    public Void visitLiteral(Literal node, C ctx) {
        return null;
    }

    @Override
    public Void visitStructLiteral(StructLiteral node, C ctx) {
        scan(node.getPath(), ctx);
        scanAll(node.getFields(), ctx);
        scan(node.getBase(), ctx);
        return null;
    }

    @Override
    public Void visitFieldInit(StructLiteral.FieldInit node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, C ctx) {
        scan(node.getCallee(), ctx);
        scanAll(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitMethodCallExpr(MethodCallExpr node, C ctx) {
        scan(node.getReceiver(), ctx);
        scanAll(node.getTypeArgs(), ctx);
        scanAll(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitFieldExpr(FieldExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getIndex(), ctx);
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, C ctx) {
        scan(node.getLeft(), ctx);
        scan(node.getRight(), ctx);
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, C ctx) {
        scan(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitAssignExpr(AssignExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitCastExpr(CastExpr node, C ctx) {
        scan(node.getOperand(), ctx);
        scan(node.getTargetType(), ctx);
        return null;
    }

    @Override
    public Void visitClosureExpr(ClosureExpr node, C ctx) {
        scanAll(node.getParams(), ctx);
        scan(node.getReturnType(), ctx);
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitClosureParam(ClosureExpr.ClosureParam node, C ctx) {
        scan(node.getPattern(), ctx);
        scan(node.getType(), ctx);
        return null;
    }

    @Override
    public Void visitTupleExpr(TupleExpr node, C ctx) {
        scanAll(node.getElements(), ctx);
        return null;
    }

    @Override
    public Void visitArrayExpr(ArrayExpr node, C ctx) {
        scanAll(node.getElements(), ctx);
        scan(node.getRepeatCount(), ctx);
        return null;
    }

    @Override
    public Void visitParenExpr(ParenExpr node, C ctx) {
        scan(node.getInner(), ctx);
        return null;
    }

    @Override
    public Void visitBlockExpr(BlockExpr node, C ctx) {
        scan(node.getBlock(), ctx);
        return null;
    }

    @Override
    public Void visitIfExpr(IfExpr node, C ctx) {
        scan(node.getCondition(), ctx);
        scan(node.getThenBranch(), ctx);
        scan(node.getElseBranch(), ctx);
        return null;
    }

    @Override
    public Void visitWhileExpr(WhileExpr node, C ctx) {
        scan(node.getCondition(), ctx);
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitForExpr(ForExpr node, C ctx) {
        scan(node.getPattern(), ctx);
        scan(node.getIterable(), ctx);
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitLoopExpr(LoopExpr node, C ctx) {
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitReturnExpr(ReturnExpr node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitJumpExpr(JumpExpr node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitMacroCallExpr(MacroCallExpr node, C ctx) {
        scan(node.getPath(), ctx);
        scanAll(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitTryExpr(TryExpr node, C ctx) {
        scan(node.getOperand(), ctx);
        return null;
    }

    // ============ 模式 ============

    @Override
    public Void visitIdentPattern(IdentPattern node, C ctx) {
        return null;
    }

    @Override
    public Void visitWildcardPattern(WildcardPattern node, C ctx) {
        return null;
    }

    @Override
    public Void visitTuplePattern(TuplePattern node, C ctx) {
        scanAll(node.getElements(), ctx);
        return null;
    }

    // ============ 类型 ============

    @Override
    public Void visitPathType(PathType node, C ctx) {
        scan(node.getPath(), ctx);
        return null;
    }

    @Override
    public Void visitRefType(RefType node, C ctx) {
        scan(node.getTarget(), ctx);
        return null;
    }

    @Override
    public Void visitTupleType(TupleType node, C ctx) {
        scanAll(node.getElements(), ctx);
        return null;
    }

    @Override
    public Void visitArrayType(ArrayType node, C ctx) {
        scan(node.getElementType(), ctx);
        scan(node.getLength(), ctx);
        return null;
    }
}
