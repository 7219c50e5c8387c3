package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.type.TypeRef;

/**
 * 类型转换 {@code expr as Type}
 */
public class CastExpr extends Expression {
    private final Expression operand;
    private final TypeRef targetType;

    public CastExpr(SourceLocation location, Expression operand, TypeRef targetType) {
        super(location);
        this.operand = operand;
        this.targetType = targetType;
    }

    public Expression getOperand() {
        return operand;
    }

    public TypeRef getTargetType() {
        return targetType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCastExpr(this, context);
    }
}
