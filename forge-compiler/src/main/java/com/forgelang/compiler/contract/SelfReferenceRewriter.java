package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.AstNode;
import com.forgelang.compiler.ast.AstScanner;
import com.forgelang.compiler.ast.Path;
import com.forgelang.compiler.ast.PathSegment;
import com.forgelang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 将树中所有 {@code Self} 路径段就地替换为具体类型名
 *
 * <p>替换规则只作用于 {@link Path} 节点，其余遍历交给 {@link AstScanner}，
 * 因此结构体字面量字段值、闭包、块、类型标注、泛型实参中的 {@code Self} 都会被替换。
 * 对已替换过的树再次执行不产生任何修改。</p>
 */
public class SelfReferenceRewriter extends AstScanner<Void> {

    private final String typeName;
    private int replacements;

    public SelfReferenceRewriter(String typeName) {
        if (Path.SELF_TYPE.equals(typeName)) {
            throw new IllegalArgumentException("Replacement type name must not be 'Self'");
        }
        this.typeName = typeName;
    }

    /**
     * 改写给定子树
     *
     * @return 本次替换的路径段数
     */
    public int rewrite(AstNode node) {
        int before = replacements;
        scan(node, null);
        return replacements - before;
    }

    public int getReplacements() {
        return replacements;
    }

    @Override
    public Void visitPath(Path node, Void ctx) {
        for (PathSegment segment : node.getSegments()) {
            if (Path.SELF_TYPE.equals(segment.getName())) {
                segment.setName(typeName);
                replacements++;
            }
        }
        return super.visitPath(node, ctx);
    }

    /**
     * 列出子树中残留的 {@code Self} 路径位置
     */
    public static List<SourceLocation> findResiduals(AstNode node) {
        return new ResidualFinder().find(node);
    }

    private static final class ResidualFinder extends AstScanner<Void> {
        private final List<SourceLocation> found = new ArrayList<SourceLocation>();

        List<SourceLocation> find(AstNode node) {
            scan(node, null);
            return found;
        }

        @Override
        public Void visitPath(Path node, Void ctx) {
            for (PathSegment segment : node.getSegments()) {
                if (Path.SELF_TYPE.equals(segment.getName())) {
                    found.add(node.getLocation());
                }
            }
            return super.visitPath(node, ctx);
        }
    }
}
