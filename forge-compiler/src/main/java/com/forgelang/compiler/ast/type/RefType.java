package com.forgelang.compiler.ast.type;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * 引用类型 {@code &T} / {@code &mut T}
 */
public final class RefType extends TypeRef {
    private final boolean mutable;
    private final TypeRef target;

    public RefType(SourceLocation location, boolean mutable, TypeRef target) {
        super(location);
        this.mutable = mutable;
        this.target = target;
    }

    public boolean isMutable() {
        return mutable;
    }

    public TypeRef getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRefType(this, context);
    }
}
