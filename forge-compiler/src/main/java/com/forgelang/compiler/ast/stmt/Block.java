package com.forgelang.compiler.ast.stmt;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 代码块 {@code { stmts }}
 */
public class Block extends Statement {
    private final List<Statement> statements;

    public Block(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = statements;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
