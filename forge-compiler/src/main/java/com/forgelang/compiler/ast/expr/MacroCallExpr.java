package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.Path;
import com.forgelang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 宏调用 {@code name!(args)} / {@code name![args]}，参数按逗号分隔的表达式解析
 */
public class MacroCallExpr extends Expression {
    private final Path path;
    private final boolean bracketed;
    private final List<Expression> args;

    public MacroCallExpr(SourceLocation location, Path path, boolean bracketed, List<Expression> args) {
        super(location);
        this.path = path;
        this.bracketed = bracketed;
        this.args = args;
    }

    public Path getPath() {
        return path;
    }

    /** 使用 [] 而不是 () 作为定界符 */
    public boolean isBracketed() {
        return bracketed;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMacroCallExpr(this, context);
    }
}
