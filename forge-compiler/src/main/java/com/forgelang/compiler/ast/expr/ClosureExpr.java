package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstNode;
import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.pattern.Pattern;
import com.forgelang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 闭包 {@code [move] |params| body}
 */
public class ClosureExpr extends Expression {
    private final boolean isMove;
    private final List<ClosureParam> params;
    private final TypeRef returnType;  // 可选，存在时 body 必须是块
    private final Expression body;

    public ClosureExpr(SourceLocation location, boolean isMove, List<ClosureParam> params,
                       TypeRef returnType, Expression body) {
        super(location);
        this.isMove = isMove;
        this.params = params;
        this.returnType = returnType;
        this.body = body;
    }

    public boolean isMove() {
        return isMove;
    }

    public List<ClosureParam> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClosureExpr(this, context);
    }

    /**
     * 闭包参数：模式 + 可选类型
     */
    public static final class ClosureParam extends AstNode {
        private final Pattern pattern;
        private final TypeRef type;  // 可选

        public ClosureParam(SourceLocation location, Pattern pattern, TypeRef type) {
            super(location);
            this.pattern = pattern;
            this.type = type;
        }

        public Pattern getPattern() {
            return pattern;
        }

        public TypeRef getType() {
            return type;
        }

        @Override
        public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
            return visitor.visitClosureParam(this, context);
        }
    }
}
