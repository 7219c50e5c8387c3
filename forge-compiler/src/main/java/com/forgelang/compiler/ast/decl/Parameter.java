package com.forgelang.compiler.ast.decl;

import com.forgelang.compiler.ast.AstNode;
import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.pattern.IdentPattern;
import com.forgelang.compiler.ast.pattern.Pattern;
import com.forgelang.compiler.ast.type.TypeRef;

/**
 * 函数参数：接收者（self / &amp;self / &amp;mut self / mut self）或 {@code pattern: Type}
 */
public class Parameter extends AstNode {
    private final ReceiverKind receiver;  // null 表示普通参数
    private final Pattern pattern;
    private final TypeRef type;

    private Parameter(SourceLocation location, ReceiverKind receiver, Pattern pattern, TypeRef type) {
        super(location);
        this.receiver = receiver;
        this.pattern = pattern;
        this.type = type;
    }

    public static Parameter receiver(SourceLocation location, ReceiverKind kind) {
        return new Parameter(location, kind, null, null);
    }

    public static Parameter typed(SourceLocation location, Pattern pattern, TypeRef type) {
        return new Parameter(location, null, pattern, type);
    }

    public boolean isReceiver() {
        return receiver != null;
    }

    public ReceiverKind getReceiverKind() {
        return receiver;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public TypeRef getType() {
        return type;
    }

    /** 简单标识符模式的参数名；接收者返回 "self"；其他模式返回 null */
    public String getName() {
        if (receiver != null) return "self";
        if (pattern instanceof IdentPattern) {
            return ((IdentPattern) pattern).getName();
        }
        return null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }

    /**
     * 接收者形式
     */
    public enum ReceiverKind {
        VALUE("self"),
        MUT_VALUE("mut self"),
        REF("&self"),
        REF_MUT("&mut self");

        private final String source;

        ReceiverKind(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }
    }
}
