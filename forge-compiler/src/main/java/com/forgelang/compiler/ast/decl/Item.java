package com.forgelang.compiler.ast.decl;

import com.forgelang.compiler.ast.AstNode;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.Visibility;

import java.util.List;

/**
 * 顶层项基类（模块、结构体、impl 块、函数等）
 */
public abstract class Item extends AstNode {
    protected final List<Attribute> attributes;
    protected Visibility visibility;
    protected final String name;
    /** 名称标识符的精确位置，null 表示未设置 */
    private SourceLocation nameLocation;

    protected Item(SourceLocation location, List<Attribute> attributes,
                   Visibility visibility, String name) {
        super(location);
        this.attributes = attributes;
        this.visibility = visibility;
        this.name = name;
    }

    public List<Attribute> getAttributes() {
        return attributes;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public boolean isPublic() {
        return visibility.isPublic();
    }

    public String getName() {
        return name;
    }

    public SourceLocation getNameLocation() {
        return nameLocation != null ? nameLocation : location;
    }

    public void setNameLocation(SourceLocation loc) {
        this.nameLocation = loc;
    }

    /** 查找最后一段名称匹配的属性 */
    public Attribute findAttribute(String simpleName) {
        for (Attribute attribute : attributes) {
            if (attribute.hasSimpleName(simpleName)) {
                return attribute;
            }
        }
        return null;
    }

    public boolean hasAttribute(String simpleName) {
        return findAttribute(simpleName) != null;
    }
}
