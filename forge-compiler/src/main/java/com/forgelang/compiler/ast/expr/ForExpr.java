package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.pattern.Pattern;
import com.forgelang.compiler.ast.stmt.Block;

/**
 * for 循环 {@code for pattern in iterable { ... }}
 */
public class ForExpr extends Expression {
    private final Pattern pattern;
    private final Expression iterable;
    private final Block body;

    public ForExpr(SourceLocation location, Pattern pattern, Expression iterable, Block body) {
        super(location);
        this.pattern = pattern;
        this.iterable = iterable;
        this.body = body;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Expression getIterable() {
        return iterable;
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
        return visitor.visitForExpr(this, context);
    }
}
