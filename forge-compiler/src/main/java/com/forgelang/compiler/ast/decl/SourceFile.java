package com.forgelang.compiler.ast.decl;

import com.forgelang.compiler.ast.AstNode;
import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 源文件（编译单元）
 */
public class SourceFile extends AstNode {
    private final String fileName;
    private final List<Item> items;

    public SourceFile(SourceLocation location, String fileName, List<Item> items) {
        super(location);
        this.fileName = fileName;
        this.items = items;
    }

    public String getFileName() {
        return fileName;
    }

    public List<Item> getItems() {
        return items;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSourceFile(this, context);
    }
}
