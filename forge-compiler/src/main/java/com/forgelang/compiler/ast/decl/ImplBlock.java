package com.forgelang.compiler.ast.decl;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.Path;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.Visibility;
import com.forgelang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 行为块 {@code impl Type { ... }} 或 {@code impl Capability for Type { ... }}
 *
 * <p>{@link #getName()} 为目标类型路径的最后一段。</p>
 */
public class ImplBlock extends Item {
    private final Path capability;   // 可选
    private final TypeRef selfType;
    private final List<FnDecl> methods;

    public ImplBlock(SourceLocation location, List<Attribute> attributes, String typeName,
                     Path capability, TypeRef selfType, List<FnDecl> methods) {
        super(location, attributes, Visibility.PRIVATE, typeName);
        this.capability = capability;
        this.selfType = selfType;
        this.methods = methods;
    }

    public Path getCapability() {
        return capability;
    }

    public boolean hasCapability() {
        return capability != null;
    }

    public TypeRef getSelfType() {
        return selfType;
    }

    /** 可变列表：解析阶段会从中移除 new */
    public List<FnDecl> getMethods() {
        return methods;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImplBlock(this, context);
    }
}
