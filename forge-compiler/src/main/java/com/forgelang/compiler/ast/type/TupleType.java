package com.forgelang.compiler.ast.type;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 元组类型，{@code ()} 为单元类型
 */
public final class TupleType extends TypeRef {
    private final List<TypeRef> elements;

    public TupleType(SourceLocation location, List<TypeRef> elements) {
        super(location);
        this.elements = elements;
    }

    public List<TypeRef> getElements() {
        return elements;
    }

    public boolean isUnit() {
        return elements.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTupleType(this, context);
    }
}
