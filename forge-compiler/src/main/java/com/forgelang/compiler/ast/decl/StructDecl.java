package com.forgelang.compiler.ast.decl;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.Visibility;

import java.util.List;

/**
 * 结构体声明
 */
public class StructDecl extends Item {
    private final List<FieldDecl> fields;
    private final boolean unit;  // struct Name;

    public StructDecl(SourceLocation location, List<Attribute> attributes,
                      Visibility visibility, String name, List<FieldDecl> fields, boolean unit) {
        super(location, attributes, visibility, name);
        this.fields = fields;
        this.unit = unit;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    public boolean isUnit() {
        return unit;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }
}
