package com.forgelang.compiler.ast.decl;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.Visibility;

import java.util.List;

/**
 * 模块声明 {@code mod name { ... }}
 */
public class ModuleDecl extends Item {
    private final List<Item> items;

    public ModuleDecl(SourceLocation location, List<Attribute> attributes,
                      Visibility visibility, String name, List<Item> items) {
        super(location, attributes, visibility, name);
        this.items = items;
    }

    /** 可变列表：状态声明直接追加到这里 */
    public List<Item> getItems() {
        return items;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModuleDecl(this, context);
    }
}
