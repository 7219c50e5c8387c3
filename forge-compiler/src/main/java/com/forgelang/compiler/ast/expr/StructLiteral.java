package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstNode;
import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.Path;
import com.forgelang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 结构体字面量 {@code Path { field: value, shorthand, ..base }}
 */
public class StructLiteral extends Expression {
    private final Path path;
    private final List<FieldInit> fields;
    private final Expression base;  // ..base，可选

    public StructLiteral(SourceLocation location, Path path, List<FieldInit> fields, Expression base) {
        super(location);
        this.path = path;
        this.fields = fields;
        this.base = base;
    }

    public Path getPath() {
        return path;
    }

    public List<FieldInit> getFields() {
        return fields;
    }

    public Expression getBase() {
        return base;
    }

    public boolean hasBase() {
        return base != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructLiteral(this, context);
    }

    /**
     * 字段初始化项
     */
    public static final class FieldInit extends AstNode {
        private final String name;
        private final Expression value;
        private final boolean shorthand;     // { value } 等价于 { value: value }

        public FieldInit(SourceLocation location, String name, Expression value, boolean shorthand) {
            super(location);
            this.name = name;
            this.value = value;
            this.shorthand = shorthand;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }

        public boolean isShorthand() {
            return shorthand;
        }

        @Override
        public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
            return visitor.visitFieldInit(this, context);
        }
    }
}
