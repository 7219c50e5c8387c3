package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * 字面量表达式
 *
 * <p>保留原始词素（如 {@code 1_000u64}），打印时原样输出。</p>
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;
    private final String lexeme;

    public Literal(SourceLocation location, Object value, LiteralKind kind, String lexeme) {
        super(location);
        this.value = value;
        this.kind = kind;
        this.lexeme = lexeme;
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    public String getLexeme() {
        return lexeme;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INTEGER,
        FLOAT,
        CHAR,
        STRING,
        BOOLEAN
    }
}
