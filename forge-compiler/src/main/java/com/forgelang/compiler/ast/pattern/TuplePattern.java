package com.forgelang.compiler.ast.pattern;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 元组模式 {@code (a, b)}
 */
public class TuplePattern extends Pattern {
    private final List<Pattern> elements;

    public TuplePattern(SourceLocation location, List<Pattern> elements) {
        super(location);
        this.elements = elements;
    }

    public List<Pattern> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTuplePattern(this, context);
    }
}
