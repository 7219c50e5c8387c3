package com.forgelang.compiler.ast.pattern;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * 标识符模式 {@code x} / {@code mut x}
 */
public class IdentPattern extends Pattern {
    private final String name;
    private final boolean mutable;

    public IdentPattern(SourceLocation location, String name, boolean mutable) {
        super(location);
        this.name = name;
        this.mutable = mutable;
    }

    public String getName() {
        return name;
    }

    public boolean isMutable() {
        return mutable;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentPattern(this, context);
    }
}
