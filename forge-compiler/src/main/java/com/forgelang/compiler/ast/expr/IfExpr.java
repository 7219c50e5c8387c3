package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.stmt.Block;

/**
 * if 表达式，else 分支为 {@link BlockExpr} 或嵌套的 {@link IfExpr}
 */
public class IfExpr extends Expression {
    private final Expression condition;
    private final Block thenBranch;
    private final Expression elseBranch;  // 可选

    public IfExpr(SourceLocation location, Expression condition, Block thenBranch, Expression elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBranch() {
        return thenBranch;
    }

    public Expression getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public boolean isBlockLike() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfExpr(this, context);
    }
}
