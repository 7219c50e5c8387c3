package com.forgelang.compiler.ast.decl;

import com.forgelang.compiler.ast.AstNode;
import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.Visibility;
import com.forgelang.compiler.ast.type.TypeRef;

/**
 * 结构体字段
 */
public class FieldDecl extends AstNode {
    private final Visibility visibility;
    private final String name;
    private final TypeRef type;

    public FieldDecl(SourceLocation location, Visibility visibility, String name, TypeRef type) {
        super(location);
        this.visibility = visibility;
        this.name = name;
        this.type = type;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldDecl(this, context);
    }
}
