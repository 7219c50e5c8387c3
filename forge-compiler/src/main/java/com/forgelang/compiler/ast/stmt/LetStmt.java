package com.forgelang.compiler.ast.stmt;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.expr.Expression;
import com.forgelang.compiler.ast.pattern.Pattern;
import com.forgelang.compiler.ast.type.TypeRef;

/**
 * {@code let pattern [: Type] [= init];}
 */
public class LetStmt extends Statement {
    private final Pattern pattern;
    private final TypeRef type;          // 可选
    private final Expression initializer; // 可选

    public LetStmt(SourceLocation location, Pattern pattern, TypeRef type, Expression initializer) {
        super(location);
        this.pattern = pattern;
        this.type = type;
        this.initializer = initializer;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetStmt(this, context);
    }
}
