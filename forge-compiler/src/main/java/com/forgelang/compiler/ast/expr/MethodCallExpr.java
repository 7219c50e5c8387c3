package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 方法调用 {@code receiver.method::<T>(args)}
 */
public class MethodCallExpr extends Expression {
    private final Expression receiver;
    private final String methodName;
    private final List<TypeRef> typeArgs;
    private final List<Expression> args;

    public MethodCallExpr(SourceLocation location, Expression receiver, String methodName,
                          List<TypeRef> typeArgs, List<Expression> args) {
        super(location);
        this.receiver = receiver;
        this.methodName = methodName;
        this.typeArgs = typeArgs;
        this.args = args;
    }

    public Expression getReceiver() {
        return receiver;
    }

    public String getMethodName() {
        return methodName;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMethodCallExpr(this, context);
    }
}
