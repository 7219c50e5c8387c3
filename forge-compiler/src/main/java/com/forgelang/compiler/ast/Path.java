package com.forgelang.compiler.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * 路径（a::b::C），表达式、结构体字面量和类型引用共用
 */
public final class Path extends AstNode {
    public static final String SELF_TYPE = "Self";

    private final List<PathSegment> segments;

    public Path(SourceLocation location, List<PathSegment> segments) {
        super(location);
        this.segments = segments;
    }

    /** 由名称序列构造不带泛型实参的路径 */
    public static Path of(SourceLocation location, String... names) {
        List<PathSegment> segments = new ArrayList<PathSegment>(names.length);
        for (String name : names) {
            segments.add(new PathSegment(name));
        }
        return new Path(location, segments);
    }

    public List<PathSegment> getSegments() {
        return segments;
    }

    public PathSegment getLastSegment() {
        return segments.get(segments.size() - 1);
    }

    /** 按名称拼接（忽略泛型实参），用于诊断信息 */
    public String getFullName() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) sb.append("::");
            sb.append(segments.get(i).getName());
        }
        return sb.toString();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPath(this, context);
    }

    @Override
    public String toString() {
        return getFullName();
    }
}
