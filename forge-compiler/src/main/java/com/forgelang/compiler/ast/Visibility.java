package com.forgelang.compiler.ast;

/**
 * 项与字段的可见性
 */
public enum Visibility {
    /** 未标注 */
    PRIVATE(""),
    /** pub */
    PUBLIC("pub"),
    /** pub(crate) */
    CRATE("pub(crate)");

    private final String source;

    Visibility(String source) {
        this.source = source;
    }

    /** 只有裸 pub 才算公开，pub(crate) 不算 */
    public boolean isPublic() {
        return this == PUBLIC;
    }

    /** 返回源码中对应的关键字，PRIVATE 为空串 */
    public String toSourceString() {
        return source;
    }
}
