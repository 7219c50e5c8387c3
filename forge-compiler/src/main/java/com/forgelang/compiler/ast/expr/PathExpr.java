package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.Path;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * 路径表达式（变量、常量、关联函数：x, STATE, Self::new）
 */
public class PathExpr extends Expression {
    private final Path path;

    public PathExpr(SourceLocation location, Path path) {
        super(location);
        this.path = path;
    }

    public static PathExpr of(SourceLocation location, String... names) {
        return new PathExpr(location, Path.of(location, names));
    }

    public Path getPath() {
        return path;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPathExpr(this, context);
    }
}
