package com.forgelang.compiler.ast.decl;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.Visibility;
import com.forgelang.compiler.ast.expr.Expression;
import com.forgelang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * {@code const NAME: T = v;} 或 {@code static [mut] NAME: T = v;}
 *
 * <p>合约状态单例也以此节点输出。</p>
 */
public class StaticDecl extends Item {
    private final boolean isConst;
    private final boolean isMutable;
    private final TypeRef type;
    private final Expression value;

    public StaticDecl(SourceLocation location, List<Attribute> attributes, Visibility visibility,
                      boolean isConst, boolean isMutable, String name, TypeRef type, Expression value) {
        super(location, attributes, visibility, name);
        this.isConst = isConst;
        this.isMutable = isMutable;
        this.type = type;
        this.value = value;
    }

    public boolean isConst() {
        return isConst;
    }

    public boolean isMutable() {
        return isMutable;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStaticDecl(this, context);
    }
}
