package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.stmt.Block;

/**
 * while 循环
 */
public class WhileExpr extends Expression {
    private final Expression condition;
    private final Block body;

    public WhileExpr(SourceLocation location, Expression condition, Block body) {
        super(location);
        this.condition = condition;
        this.body = body;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public boolean isBlockLike() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileExpr(this, context);
    }
}
