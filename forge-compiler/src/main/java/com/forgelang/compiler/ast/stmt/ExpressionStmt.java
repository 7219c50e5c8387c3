package com.forgelang.compiler.ast.stmt;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.expr.Expression;

/**
 * 表达式语句；无分号时为块的尾表达式（或块状表达式）
 */
public class ExpressionStmt extends Statement {
    private final Expression expression;
    private final boolean semicolon;

    public ExpressionStmt(SourceLocation location, Expression expression, boolean semicolon) {
        super(location);
        this.expression = expression;
        this.semicolon = semicolon;
    }

    public Expression getExpression() {
        return expression;
    }

    public boolean hasSemicolon() {
        return semicolon;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionStmt(this, context);
    }
}
