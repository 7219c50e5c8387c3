package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * 一元前缀表达式
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, UnaryOp operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NEG("-"),
        NOT("!"),
        DEREF("*"),
        REF("&"),
        REF_MUT("&mut ");

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }
    }
}
