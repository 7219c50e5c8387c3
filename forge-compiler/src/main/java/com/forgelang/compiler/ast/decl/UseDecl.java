package com.forgelang.compiler.ast.decl;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.Path;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.Visibility;

import java.util.List;

/**
 * 导入声明：{@code use a::b;}、{@code use a::*;}、{@code use a::{b, c};}
 */
public class UseDecl extends Item {
    private final Path path;
    private final UseKind kind;
    private final List<String> members;  // 仅 GROUP
    private final String alias;          // 仅 SINGLE，可选

    public UseDecl(SourceLocation location, List<Attribute> attributes, Visibility visibility,
                   Path path, UseKind kind, List<String> members, String alias) {
        super(location, attributes, visibility, path.getLastSegment().getName());
        this.path = path;
        this.kind = kind;
        this.members = members;
        this.alias = alias;
    }

    public Path getPath() {
        return path;
    }

    public UseKind getKind() {
        return kind;
    }

    public List<String> getMembers() {
        return members;
    }

    public String getAlias() {
        return alias;
    }

    public boolean hasAlias() {
        return alias != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUseDecl(this, context);
    }

    public enum UseKind {
        SINGLE,
        GLOB,
        GROUP
    }
}
