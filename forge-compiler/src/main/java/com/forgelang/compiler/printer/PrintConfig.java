package com.forgelang.compiler.printer;

/**
 * 源码输出配置
 */
public class PrintConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;

    public PrintConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("Indent size must not be negative: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
