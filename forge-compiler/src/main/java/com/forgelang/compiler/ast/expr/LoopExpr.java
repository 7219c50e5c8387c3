package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.stmt.Block;

/**
 * 无条件循环 {@code loop { ... }}
 */
public class LoopExpr extends Expression {
    private final Block body;

    public LoopExpr(SourceLocation location, Block body) {
        super(location);
        this.body = body;
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
        return visitor.visitLoopExpr(this, context);
    }
}
