package com.forgelang.compiler.printer;

import com.forgelang.compiler.ast.*;
import com.forgelang.compiler.ast.decl.*;
import com.forgelang.compiler.ast.expr.*;
import com.forgelang.compiler.ast.pattern.*;
import com.forgelang.compiler.ast.stmt.*;
import com.forgelang.compiler.ast.type.*;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * Forge AST 源码输出器
 *
 * <p>遍历 AST，按统一格式规则输出源码。解析器保留括号表达式，
 * 因此这里不做优先级推导，输出与重新解析得到的树结构一致。</p>
 */
public class SourcePrinter implements AstVisitor<Void, PrinterContext> {

    /**
     * 输出整个源文件
     */
    public String print(SourceFile file, PrintConfig config) {
        PrinterContext ctx = new PrinterContext(config);
        visitSourceFile(file, ctx);
        return ctx.getOutput();
    }

    /**
     * 使用默认配置输出
     */
    public String print(SourceFile file) {
        return print(file, new PrintConfig());
    }

    /**
     * 输出任意节点（单行片段，如类型、表达式）
     */
    public String render(AstNode node) {
        PrinterContext ctx = new PrinterContext(new PrintConfig());
        node.accept(this, ctx);
        return ctx.getOutput();
    }

    // ============ 项 ============

    @Override
    public Void visitSourceFile(SourceFile node, PrinterContext ctx) {
        formatItems(node.getItems(), ctx);
        return null;
    }

    @Override
    public Void visitModuleDecl(ModuleDecl node, PrinterContext ctx) {
        formatAttributes(node.getAttributes(), ctx);
        formatVisibility(node.getVisibility(), ctx);
        ctx.append("mod ");
        ctx.append(node.getName());
        ctx.append(" {");
        if (node.getItems().isEmpty()) {
            ctx.append("}");
            return null;
        }
        ctx.newLine();
        ctx.indent();
        formatItems(node.getItems(), ctx);
        ctx.dedent();
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitStructDecl(StructDecl node, PrinterContext ctx) {
        formatAttributes(node.getAttributes(), ctx);
        formatVisibility(node.getVisibility(), ctx);
        ctx.append("struct ");
        ctx.append(node.getName());
        if (node.isUnit()) {
            ctx.append(";");
            return null;
        }
        ctx.append(" {");
        if (node.getFields().isEmpty()) {
            ctx.append("}");
            return null;
        }
        ctx.newLine();
        ctx.indent();
        for (FieldDecl field : node.getFields()) {
            visitFieldDecl(field, ctx);
            ctx.append(",");
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitFieldDecl(FieldDecl node, PrinterContext ctx) {
        formatVisibility(node.getVisibility(), ctx);
        ctx.append(node.getName());
        ctx.append(": ");
        formatNode(node.getType(), ctx);
        return null;
    }

    @Override
    public Void visitImplBlock(ImplBlock node, PrinterContext ctx) {
        formatAttributes(node.getAttributes(), ctx);
        ctx.append("impl ");
        if (node.hasCapability()) {
            visitPath(node.getCapability(), ctx);
            ctx.append(" for ");
        }
        formatNode(node.getSelfType(), ctx);
        ctx.append(" {");
        if (node.getMethods().isEmpty()) {
            ctx.append("}");
            return null;
        }
        ctx.newLine();
        ctx.indent();
        formatItems(node.getMethods(), ctx);
        ctx.dedent();
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitFnDecl(FnDecl node, PrinterContext ctx) {
        formatAttributes(node.getAttributes(), ctx);
        formatVisibility(node.getVisibility(), ctx);
        if (node.isUnsafe()) {
            ctx.append("unsafe ");
        }
        ctx.append("fn ");
        ctx.append(node.getName());
        ctx.append("(");
        formatJoined(node.getParams(), ctx, ", ", this::formatNode);
        ctx.append(")");
        if (node.getReturnType() != null) {
            ctx.append(" -> ");
            formatNode(node.getReturnType(), ctx);
        }
        ctx.space();
        formatBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitParameter(Parameter node, PrinterContext ctx) {
        if (node.isReceiver()) {
            ctx.append(node.getReceiverKind().toSourceString());
            return null;
        }
        formatNode(node.getPattern(), ctx);
        ctx.append(": ");
        formatNode(node.getType(), ctx);
        return null;
    }

    @Override
    public Void visitUseDecl(UseDecl node, PrinterContext ctx) {
        formatAttributes(node.getAttributes(), ctx);
        formatVisibility(node.getVisibility(), ctx);
        ctx.append("use ");
        visitPath(node.getPath(), ctx);
        switch (node.getKind()) {
            case GLOB:
                ctx.append("::*");
                break;
            case GROUP:
                ctx.append("::{");
                formatJoined(node.getMembers(), ctx, ", ", (member, c) -> c.append(member));
                ctx.append("}");
                break;
            default:
                if (node.hasAlias()) {
                    ctx.append(" as ");
                    ctx.append(node.getAlias());
                }
                break;
        }
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitStaticDecl(StaticDecl node, PrinterContext ctx) {
        formatAttributes(node.getAttributes(), ctx);
        formatVisibility(node.getVisibility(), ctx);
        if (node.isConst()) {
            ctx.append("const ");
        } else {
            ctx.append(node.isMutable() ? "static mut " : "static ");
        }
        ctx.append(node.getName());
        ctx.append(": ");
        formatNode(node.getType(), ctx);
        ctx.append(" = ");
        formatNode(node.getValue(), ctx);
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitAttribute(Attribute node, PrinterContext ctx) {
        ctx.append("#[");
        visitPath(node.getPath(), ctx);
        if (node.hasArguments()) {
            ctx.append("(");
            ctx.append(node.getArguments());
            ctx.append(")");
        }
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitPath(Path node, PrinterContext ctx) {
        List<PathSegment> segments = node.getSegments();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) {
                ctx.append("::");
            }
            PathSegment segment = segments.get(i);
            ctx.append(segment.getName());
            if (segment.hasGenericArgs()) {
                ctx.append(segment.isTurbofish() ? "::<" : "<");
                formatJoined(segment.getGenericArgs(), ctx, ", ", this::formatNode);
                ctx.append(">");
            }
        }
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, PrinterContext ctx) {
        formatBlock(node, ctx);
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt node, PrinterContext ctx) {
        ctx.append("let ");
        formatNode(node.getPattern(), ctx);
        if (node.getType() != null) {
            ctx.append(": ");
            formatNode(node.getType(), ctx);
        }
        if (node.getInitializer() != null) {
            ctx.append(" = ");
            formatNode(node.getInitializer(), ctx);
        }
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, PrinterContext ctx) {
        formatNode(node.getExpression(), ctx);
        if (node.hasSemicolon()) {
            ctx.append(";");
        }
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitPathExpr(PathExpr node, PrinterContext ctx) {
        visitPath(node.getPath(), ctx);
        return null;
    }

    @Override
    public Void visitLiteral(Literal node, PrinterContext ctx) {
        if (node.getLexeme() != null) {
            ctx.append(node.getLexeme());
            return null;
        }
        // 生成的字面量没有原始词素
        Object value = node.getValue();
        switch (node.getKind()) {
            case STRING:
                ctx.append("\"");
                ctx.append(ForgeStringUtils.escapeString(value.toString()));
                ctx.append("\"");
                break;
            case CHAR:
                ctx.append("'");
                ctx.append(ForgeStringUtils.escapeChar((Character) value));
                ctx.append("'");
                break;
            default:
                ctx.append(value.toString());
                break;
        }
        return null;
    }

    @Override
    public Void visitStructLiteral(StructLiteral node, PrinterContext ctx) {
        visitPath(node.getPath(), ctx);
        if (node.getFields().isEmpty() && !node.hasBase()) {
            ctx.append(" {}");
            return null;
        }
        ctx.append(" { ");
        formatJoined(node.getFields(), ctx, ", ", this::formatNode);
        if (node.hasBase()) {
            if (!node.getFields().isEmpty()) {
                ctx.append(", ");
            }
            ctx.append("..");
            formatNode(node.getBase(), ctx);
        }
        ctx.append(" }");
        return null;
    }

    @Override
    public Void visitFieldInit(StructLiteral.FieldInit node, PrinterContext ctx) {
        ctx.append(node.getName());
        if (!node.isShorthand()) {
            ctx.append(": ");
            formatNode(node.getValue(), ctx);
        }
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, PrinterContext ctx) {
        formatNode(node.getCallee(), ctx);
        ctx.append("(");
        formatJoined(node.getArgs(), ctx, ", ", this::formatNode);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitMethodCallExpr(MethodCallExpr node, PrinterContext ctx) {
        formatNode(node.getReceiver(), ctx);
        ctx.append(".");
        ctx.append(node.getMethodName());
        if (!node.getTypeArgs().isEmpty()) {
            ctx.append("::<");
            formatJoined(node.getTypeArgs(), ctx, ", ", this::formatNode);
            ctx.append(">");
        }
        ctx.append("(");
        formatJoined(node.getArgs(), ctx, ", ", this::formatNode);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitFieldExpr(FieldExpr node, PrinterContext ctx) {
        formatNode(node.getTarget(), ctx);
        ctx.append(".");
        ctx.append(node.getFieldName());
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, PrinterContext ctx) {
        formatNode(node.getTarget(), ctx);
        ctx.append("[");
        formatNode(node.getIndex(), ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, PrinterContext ctx) {
        BinaryExpr.BinaryOp op = node.getOperator();
        if (op == BinaryExpr.BinaryOp.RANGE || op == BinaryExpr.BinaryOp.RANGE_INCLUSIVE) {
            formatNode(node.getLeft(), ctx);
            ctx.append(op.toSourceString());
            formatNode(node.getRight(), ctx);
            return null;
        }
        formatNode(node.getLeft(), ctx);
        ctx.append(" ");
        ctx.append(op.toSourceString());
        ctx.append(" ");
        formatNode(node.getRight(), ctx);
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, PrinterContext ctx) {
        ctx.append(node.getOperator().toSourceString());
        formatNode(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitAssignExpr(AssignExpr node, PrinterContext ctx) {
        formatNode(node.getTarget(), ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        formatNode(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitCastExpr(CastExpr node, PrinterContext ctx) {
        formatNode(node.getOperand(), ctx);
        ctx.append(" as ");
        formatNode(node.getTargetType(), ctx);
        return null;
    }

    @Override
    public Void visitClosureExpr(ClosureExpr node, PrinterContext ctx) {
        if (node.isMove()) {
            ctx.append("move ");
        }
        ctx.append("|");
        formatJoined(node.getParams(), ctx, ", ", this::formatNode);
        ctx.append("| ");
        if (node.getReturnType() != null) {
            ctx.append("-> ");
            formatNode(node.getReturnType(), ctx);
            ctx.space();
        }
        formatNode(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitClosureParam(ClosureExpr.ClosureParam node, PrinterContext ctx) {
        formatNode(node.getPattern(), ctx);
        if (node.getType() != null) {
            ctx.append(": ");
            formatNode(node.getType(), ctx);
        }
        return null;
    }

    @Override
    public Void visitTupleExpr(TupleExpr node, PrinterContext ctx) {
        ctx.append("(");
        formatJoined(node.getElements(), ctx, ", ", this::formatNode);
        if (node.getElements().size() == 1) {
            ctx.append(",");
        }
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitArrayExpr(ArrayExpr node, PrinterContext ctx) {
        ctx.append("[");
        formatJoined(node.getElements(), ctx, ", ", this::formatNode);
        if (node.isRepeat()) {
            ctx.append("; ");
            formatNode(node.getRepeatCount(), ctx);
        }
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitParenExpr(ParenExpr node, PrinterContext ctx) {
        ctx.append("(");
        formatNode(node.getInner(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitBlockExpr(BlockExpr node, PrinterContext ctx) {
        if (node.isUnsafe()) {
            ctx.append("unsafe ");
        }
        formatBlock(node.getBlock(), ctx);
        return null;
    }

    @Override
    public Void visitIfExpr(IfExpr node, PrinterContext ctx) {
        ctx.append("if ");
        formatNode(node.getCondition(), ctx);
        ctx.space();
        formatBlock(node.getThenBranch(), ctx);
        if (node.hasElse()) {
            ctx.append(" else ");
            formatNode(node.getElseBranch(), ctx);
        }
        return null;
    }

    @Override
    public Void visitWhileExpr(WhileExpr node, PrinterContext ctx) {
        ctx.append("while ");
        formatNode(node.getCondition(), ctx);
        ctx.space();
        formatBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitForExpr(ForExpr node, PrinterContext ctx) {
        ctx.append("for ");
        formatNode(node.getPattern(), ctx);
        ctx.append(" in ");
        formatNode(node.getIterable(), ctx);
        ctx.space();
        formatBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitLoopExpr(LoopExpr node, PrinterContext ctx) {
        ctx.append("loop ");
        formatBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitReturnExpr(ReturnExpr node, PrinterContext ctx) {
        ctx.append("return");
        if (node.hasValue()) {
            ctx.space();
            formatNode(node.getValue(), ctx);
        }
        return null;
    }

    @Override
    public Void visitJumpExpr(JumpExpr node, PrinterContext ctx) {
        ctx.append(node.getKind().toSourceString());
        if (node.getValue() != null) {
            ctx.space();
            formatNode(node.getValue(), ctx);
        }
        return null;
    }

    @Override
    public Void visitMacroCallExpr(MacroCallExpr node, PrinterContext ctx) {
        visitPath(node.getPath(), ctx);
        ctx.append(node.isBracketed() ? "![" : "!(");
        formatJoined(node.getArgs(), ctx, ", ", this::formatNode);
        ctx.append(node.isBracketed() ? "]" : ")");
        return null;
    }

    @Override
    public Void visitTryExpr(TryExpr node, PrinterContext ctx) {
        formatNode(node.getOperand(), ctx);
        ctx.append("?");
        return null;
    }

    // ============ 模式 ============

    @Override
    public Void visitIdentPattern(IdentPattern node, PrinterContext ctx) {
        if (node.isMutable()) {
            ctx.append("mut ");
        }
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitWildcardPattern(WildcardPattern node, PrinterContext ctx) {
        ctx.append("_");
        return null;
    }

    @Override
    public Void visitTuplePattern(TuplePattern node, PrinterContext ctx) {
        ctx.append("(");
        formatJoined(node.getElements(), ctx, ", ", this::formatNode);
        ctx.append(")");
        return null;
    }

    // ============ 类型 ============

    @Override
    public Void visitPathType(PathType node, PrinterContext ctx) {
        visitPath(node.getPath(), ctx);
        return null;
    }

    @Override
    public Void visitRefType(RefType node, PrinterContext ctx) {
        ctx.append(node.isMutable() ? "&mut " : "&");
        formatNode(node.getTarget(), ctx);
        return null;
    }

    /**
     * 单元素元组类型输出为 {@code (T)}，与导出包装闭包的参数写法一致
     */
    @Override
    public Void visitTupleType(TupleType node, PrinterContext ctx) {
        ctx.append("(");
        formatJoined(node.getElements(), ctx, ", ", this::formatNode);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitArrayType(ArrayType node, PrinterContext ctx) {
        ctx.append("[");
        formatNode(node.getElementType(), ctx);
        if (!node.isSlice()) {
            ctx.append("; ");
            formatNode(node.getLength(), ctx);
        }
        ctx.append("]");
        return null;
    }

    // ============ 辅助方法 ============

    private <T> void formatJoined(List<T> items, PrinterContext ctx, String separator,
                                  BiConsumer<T, PrinterContext> formatter) {
        for (int i = 0; i < items.size(); i++) {
            formatter.accept(items.get(i), ctx);
            if (i < items.size() - 1) {
                ctx.append(separator);
            }
        }
    }

    private void formatNode(AstNode node, PrinterContext ctx) {
        if (node != null) {
            node.accept(this, ctx);
        }
    }

    /**
     * 项之间空一行
     */
    private void formatItems(List<? extends Item> items, PrinterContext ctx) {
        for (int i = 0; i < items.size(); i++) {
            items.get(i).accept(this, ctx);
            ctx.newLine();
            if (i < items.size() - 1) {
                ctx.newLine();
            }
        }
    }

    private void formatBlock(Block block, PrinterContext ctx) {
        ctx.append("{");
        if (block.getStatements().isEmpty()) {
            ctx.append("}");
            return;
        }
        ctx.newLine();
        ctx.indent();
        for (Statement stmt : block.getStatements()) {
            stmt.accept(this, ctx);
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("}");
    }

    private void formatAttributes(List<Attribute> attributes, PrinterContext ctx) {
        if (attributes == null || attributes.isEmpty()) return;
        for (Attribute attribute : attributes) {
            visitAttribute(attribute, ctx);
            ctx.newLine();
        }
    }

    private void formatVisibility(Visibility visibility, PrinterContext ctx) {
        if (visibility != Visibility.PRIVATE) {
            ctx.append(visibility.toSourceString());
            ctx.space();
        }
    }
}
