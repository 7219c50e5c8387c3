package com.forgelang.compiler.ast.stmt;

import com.forgelang.compiler.ast.AstNode;
import com.forgelang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
