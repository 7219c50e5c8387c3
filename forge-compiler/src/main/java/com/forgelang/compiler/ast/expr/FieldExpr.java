package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * 字段访问 {@code target.name}，元组下标以数字字符串表示
 */
public class FieldExpr extends Expression {
    private final Expression target;
    private final String fieldName;

    public FieldExpr(SourceLocation location, Expression target, String fieldName) {
        super(location);
        this.target = target;
        this.fieldName = fieldName;
    }

    public Expression getTarget() {
        return target;
    }

    public String getFieldName() {
        return fieldName;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldExpr(this, context);
    }
}
