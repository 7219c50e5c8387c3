package com.forgelang.compiler.ast.pattern;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * 通配模式 {@code _}
 */
public class WildcardPattern extends Pattern {

    public WildcardPattern(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWildcardPattern(this, context);
    }
}
