package com.forgelang.compiler.ast.pattern;

import com.forgelang.compiler.ast.AstNode;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * 绑定模式基类（let、参数、闭包参数、for 循环变量）
 */
public abstract class Pattern extends AstNode {

    protected Pattern(SourceLocation location) {
        super(location);
    }
}
