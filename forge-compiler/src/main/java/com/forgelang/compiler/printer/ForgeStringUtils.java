package com.forgelang.compiler.printer;

/**
 * Forge 源码字符串转义工具
 */
public final class ForgeStringUtils {

    private ForgeStringUtils() {}

    /** 转义字符串内容（用于双引号包裹的字符串） */
    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\0': sb.append("\\0"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /** 转义单个字符（用于单引号包裹的字符字面量） */
    public static String escapeChar(char c) {
        switch (c) {
            case '\\': return "\\\\";
            case '\'': return "\\'";
            case '\n': return "\\n";
            case '\r': return "\\r";
            case '\t': return "\\t";
            case '\0': return "\\0";
            default: return String.valueOf(c);
        }
    }
}
