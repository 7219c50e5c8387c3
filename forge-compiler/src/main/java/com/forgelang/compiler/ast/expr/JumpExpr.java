package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * break / continue
 */
public class JumpExpr extends Expression {
    private final JumpKind kind;
    private final Expression value;  // 仅 break 可带值

    public JumpExpr(SourceLocation location, JumpKind kind, Expression value) {
        super(location);
        this.kind = kind;
        this.value = value;
    }

    public JumpKind getKind() {
        return kind;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitJumpExpr(this, context);
    }

    public enum JumpKind {
        BREAK,
        CONTINUE;

        public String toSourceString() {
            return name().toLowerCase();
        }
    }
}
