package com.forgelang.compiler.ast;

import com.forgelang.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.List;

/**
 * 路径段：名称 + 可选泛型实参（如 {@code Vec<u8>} 或 turbofish {@code Vec::<u8>}）
 *
 * <p>名称可变：Self 改写在原树上替换段名。</p>
 */
public final class PathSegment {
    private String name;
    private final List<TypeRef> genericArgs;
    private final boolean turbofish;

    public PathSegment(String name) {
        this(name, new ArrayList<TypeRef>(), false);
    }

    public PathSegment(String name, List<TypeRef> genericArgs, boolean turbofish) {
        this.name = name;
        this.genericArgs = genericArgs;
        this.turbofish = turbofish;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<TypeRef> getGenericArgs() {
        return genericArgs;
    }

    public boolean hasGenericArgs() {
        return !genericArgs.isEmpty();
    }

    /** 表达式位置的泛型实参需要写成 {@code ::<...>} */
    public boolean isTurbofish() {
        return turbofish;
    }
}
