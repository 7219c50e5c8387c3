package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.stmt.Block;

/**
 * 块表达式 {@code { ... }} / {@code unsafe { ... }}
 */
public class BlockExpr extends Expression {
    private final Block block;
    private final boolean isUnsafe;

    public BlockExpr(SourceLocation location, Block block, boolean isUnsafe) {
        super(location);
        this.block = block;
        this.isUnsafe = isUnsafe;
    }

    public Block getBlock() {
        return block;
    }

    public boolean isUnsafe() {
        return isUnsafe;
    }

    @Override
    public boolean isBlockLike() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlockExpr(this, context);
    }
}
