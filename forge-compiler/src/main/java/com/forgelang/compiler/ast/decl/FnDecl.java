package com.forgelang.compiler.ast.decl;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.Visibility;
import com.forgelang.compiler.ast.stmt.Block;
import com.forgelang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 函数 / 方法声明
 */
public class FnDecl extends Item {
    private final boolean isUnsafe;
    private final List<Parameter> params;
    private final TypeRef returnType;            // 可选，默认 ()
    private final Block body;

    public FnDecl(SourceLocation location, List<Attribute> attributes, Visibility visibility,
                  boolean isUnsafe, String name, List<Parameter> params,
                  TypeRef returnType, Block body) {
        super(location, attributes, visibility, name);
        this.isUnsafe = isUnsafe;
        this.params = params;
        this.returnType = returnType;
        this.body = body;
    }

    public boolean isUnsafe() {
        return isUnsafe;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    /** 是否带有 self 接收者参数 */
    public boolean hasReceiver() {
        for (Parameter p : params) {
            if (p.isReceiver()) return true;
        }
        return false;
    }

    public Parameter getReceiver() {
        for (Parameter p : params) {
            if (p.isReceiver()) return p;
        }
        return null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFnDecl(this, context);
    }
}
