package com.forgelang.compiler.ast.decl;

import com.forgelang.compiler.ast.AstNode;
import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.Path;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * 属性 {@code #[path]} 或 {@code #[path(args)]}
 *
 * <p>参数部分不做解析，按原文保存。</p>
 */
public class Attribute extends AstNode {
    private final Path path;
    private final String arguments;  // 可选

    public Attribute(SourceLocation location, Path path, String arguments) {
        super(location);
        this.path = path;
        this.arguments = arguments;
    }

    public Path getPath() {
        return path;
    }

    public String getArguments() {
        return arguments;
    }

    public boolean hasArguments() {
        return arguments != null;
    }

    /** contract 与 forge::contract 都按最后一段匹配 */
    public boolean hasSimpleName(String simpleName) {
        return path.getLastSegment().getName().equals(simpleName);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAttribute(this, context);
    }
}
