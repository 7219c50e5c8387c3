package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 元组表达式 {@code (a, b)}，{@code ()} 为单元值
 */
public class TupleExpr extends Expression {
    private final List<Expression> elements;

    public TupleExpr(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = elements;
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTupleExpr(this, context);
    }
}
