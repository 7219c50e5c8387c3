package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * return 表达式
 */
public class ReturnExpr extends Expression {
    private final Expression value;  // 可选

    public ReturnExpr(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitReturnExpr(this, context);
    }
}
