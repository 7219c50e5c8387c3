package com.forgelang.compiler.ast.expr;

import com.forgelang.compiler.ast.AstNode;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    /** 以块结尾的表达式作为语句时可省略分号 */
    public boolean isBlockLike() {
        return false;
    }
}
