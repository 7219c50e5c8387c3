package com.forgelang.compiler.ast.type;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.Path;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * 路径类型（如 u32, Vec&lt;u8&gt;, Self, a::B）
 */
public final class PathType extends TypeRef {
    private final Path path;

    public PathType(SourceLocation location, Path path) {
        super(location);
        this.path = path;
    }

    public static PathType of(SourceLocation location, String... names) {
        return new PathType(location, Path.of(location, names));
    }

    public Path getPath() {
        return path;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPathType(this, context);
    }
}
