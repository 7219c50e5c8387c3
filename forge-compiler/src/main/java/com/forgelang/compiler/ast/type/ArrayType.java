package com.forgelang.compiler.ast.type;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.expr.Expression;

/**
 * 数组类型 {@code [T; N]}，长度缺省时为切片 {@code [T]}
 */
public final class ArrayType extends TypeRef {
    private final TypeRef elementType;
    private final Expression length;  // 可选

    public ArrayType(SourceLocation location, TypeRef elementType, Expression length) {
        super(location);
        this.elementType = elementType;
        this.length = length;
    }

    public TypeRef getElementType() {
        return elementType;
    }

    public Expression getLength() {
        return length;
    }

    public boolean isSlice() {
        return length == null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayType(this, context);
    }
}
