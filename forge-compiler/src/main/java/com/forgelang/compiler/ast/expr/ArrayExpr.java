package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 数组表达式：列表形式 {@code [a, b]} 或重复形式 {@code [value; count]}
 */
public class ArrayExpr extends Expression {
    private final List<Expression> elements;
    private final Expression repeatCount;  // 重复形式时非 null，elements 仅含一个值

    public ArrayExpr(SourceLocation location, List<Expression> elements, Expression repeatCount) {
        super(location);
        this.elements = elements;
        this.repeatCount = repeatCount;
    }

    public List<Expression> getElements() {
        return elements;
    }

    public Expression getRepeatCount() {
        return repeatCount;
    }

    public boolean isRepeat() {
        return repeatCount != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayExpr(this, context);
    }
}
