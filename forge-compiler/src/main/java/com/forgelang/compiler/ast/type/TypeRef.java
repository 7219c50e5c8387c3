package com.forgelang.compiler.ast.type;

import com.forgelang.compiler.ast.AstNode;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * 类型引用基类
 */
public abstract class TypeRef extends AstNode {

    protected TypeRef(SourceLocation location) {
        super(location);
    }
}
