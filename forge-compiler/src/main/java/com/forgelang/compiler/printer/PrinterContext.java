package com.forgelang.compiler.printer;

/**
 * 输出上下文，跟踪输出缓冲区和缩进层级
 */
public class PrinterContext {
    private final StringBuilder output = new StringBuilder();
    private final PrintConfig config;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public PrinterContext(PrintConfig config) {
        this.config = config;
    }

    public PrintConfig getConfig() {
        return config;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            output.append(indentString());
            atLineStart = false;
        }
        output.append(text);
    }

    /**
     * 换行
     */
    public void newLine() {
        output.append("\n");
        atLineStart = true;
    }

    public void space() {
        append(" ");
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }

    private String indentString() {
        String unit = config.getIndentString();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(unit);
        }
        return sb.toString();
    }
}
