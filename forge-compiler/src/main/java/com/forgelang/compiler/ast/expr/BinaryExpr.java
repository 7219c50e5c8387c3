package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),

        // 位运算
        BIT_AND("&"),
        BIT_OR("|"),
        BIT_XOR("^"),
        SHL("<<"),
        SHR(">>"),

        // 比较
        EQ("=="),
        NE("!="),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),

        // 逻辑
        AND("&&"),
        OR("||"),

        // 范围
        RANGE(".."),
        RANGE_INCLUSIVE("..=");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }
    }
}
