package com.forgelang.compiler.lexer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Forge 词法分析器
 *
 * <p>换行视为空白；注释直接丢弃。词法错误不抛异常，而是产生一个 {@link TokenType#ERROR}
 * 令牌（字面量为错误信息），由解析器在读到时报告。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 项
        map.put("mod", TokenType.KW_MOD);
        map.put("struct", TokenType.KW_STRUCT);
        map.put("impl", TokenType.KW_IMPL);
        map.put("fn", TokenType.KW_FN);
        map.put("use", TokenType.KW_USE);
        map.put("const", TokenType.KW_CONST);
        map.put("static", TokenType.KW_STATIC);
        map.put("trait", TokenType.KW_TRAIT);
        map.put("enum", TokenType.KW_ENUM);
        map.put("type", TokenType.KW_TYPE);

        // 修饰符
        map.put("pub", TokenType.KW_PUB);
        map.put("crate", TokenType.KW_CRATE);
        map.put("mut", TokenType.KW_MUT);
        map.put("unsafe", TokenType.KW_UNSAFE);
        map.put("move", TokenType.KW_MOVE);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("while", TokenType.KW_WHILE);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("loop", TokenType.KW_LOOP);
        map.put("match", TokenType.KW_MATCH);
        map.put("return", TokenType.KW_RETURN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("let", TokenType.KW_LET);

        // 其他
        map.put("as", TokenType.KW_AS);
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("where", TokenType.KW_WHERE);
        map.put("self", TokenType.KW_SELF_VALUE);
        map.put("Self", TokenType.KW_SELF_TYPE);
        map.put("super", TokenType.KW_SUPER);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /** 截取源码片段（属性参数按原文保存时使用） */
    public String slice(int from, int to) {
        return source.substring(from, to);
    }

    /**
     * 获取下一个 Token（流式接口）
     *
     * @return 下一个 Token，源码结束后始终返回 EOF
     */
    public Token nextToken() {
        while (true) {
            skipWhitespace();

            if (isAtEnd()) {
                return new Token(TokenType.EOF, "", null, line, column, current);
            }

            start = current;
            scanToken();

            // 注释不产生 token，继续扫描
            if (!tokens.isEmpty()) {
                return tokens.remove(tokens.size() - 1);
            }
        }
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> result = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            result.add(token);
        } while (token.getType() != TokenType.EOF);
        return result;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '\n') {
                advance();
                newLine();
            } else {
                break;
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '#': addToken(TokenType.HASH); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '^': addToken(TokenType.CARET); break;
            case '_':
                if (isAlphaNumeric(peek())) {
                    identifier();
                } else {
                    addToken(TokenType.UNDERSCORE);
                }
                break;

            // 可能是多字符的 Token
            case '.':
                if (match('.')) {
                    addToken(match('=') ? TokenType.DOT_DOT_EQ : TokenType.DOT_DOT);
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case ':':
                addToken(match(':') ? TokenType.PATH_SEP : TokenType.COLON);
                break;

            case '+':
                addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
                break;

            case '-':
                if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                addToken(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR);
                break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    // 多行注释
                    blockComment();
                } else if (match('=')) {
                    addToken(TokenType.SLASH_ASSIGN);
                } else {
                    addToken(TokenType.SLASH);
                }
                break;

            case '%':
                addToken(match('=') ? TokenType.PERCENT_ASSIGN : TokenType.PERCENT);
                break;

            case '=':
                if (match('=')) {
                    addToken(TokenType.EQ);
                } else if (match('>')) {
                    addToken(TokenType.FAT_ARROW);
                } else {
                    addToken(TokenType.ASSIGN);
                }
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                if (match('=')) addToken(TokenType.LE);
                else if (match('<')) addToken(TokenType.SHL);
                else addToken(TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '&':
                addToken(match('&') ? TokenType.AND : TokenType.AMP);
                break;

            case '|':
                addToken(match('|') ? TokenType.OR : TokenType.PIPE);
                break;

            // 字符串
            case '"':
                string();
                break;

            // 字符
            case '\'':
                character();
                break;

            // 原始字符串 r"..."
            case 'r':
                if (peek() == '"') {
                    advance();
                    rawString();
                } else {
                    identifier();
                }
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        int tokenColumn = column - (current - start);
        tokens.add(new Token(type, lexeme, literal, line, tokenColumn, start));
    }

    /** 跨行 token（原始字符串、块注释）的列号按起始位置计算 */
    private void addToken(TokenType type, Object literal, int startLine, int startColumn) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine, startColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void string() {
        StringBuilder value = new StringBuilder();
        int startLine = line;
        int startColumn = column - 1;

        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\') {
                advance();
                value.append(escapeChar());
            } else {
                char c = advance();
                if (c == '\n') newLine();
                value.append(c);
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL, value.toString(), startLine, startColumn);
    }

    private void rawString() {
        int startLine = line;
        int startColumn = column - 2;
        while (peek() != '"' && !isAtEnd()) {
            if (advance() == '\n') newLine();
        }

        if (isAtEnd()) {
            error("Unterminated raw string");
            return;
        }

        advance(); // 闭合的 "
        String value = source.substring(start + 2, current - 1); // 去掉 r" 和 "
        addToken(TokenType.STRING_LITERAL, value, startLine, startColumn);
    }

    private String escapeChar() {
        if (isAtEnd()) {
            error("Unterminated escape sequence");
            return "";
        }
        char c = advance();
        switch (c) {
            case 'n': return "\n";
            case 't': return "\t";
            case 'r': return "\r";
            case '0': return "\0";
            case '\\': return "\\";
            case '"': return "\"";
            case '\'': return "'";
            case 'u': return unicodeEscape();
            default:
                error("Invalid escape character: \\" + c);
                return String.valueOf(c);
        }
    }

    /** \\u{1F600} 形式 */
    private String unicodeEscape() {
        if (!match('{')) {
            error("Invalid unicode escape: expected '{'");
            return "";
        }
        StringBuilder hex = new StringBuilder();
        while (!isAtEnd() && peek() != '}') {
            hex.append(advance());
        }
        if (!match('}')) {
            error("Unterminated unicode escape");
            return "";
        }
        try {
            return new String(Character.toChars(Integer.parseInt(hex.toString(), 16)));
        } catch (IllegalArgumentException e) {
            error("Invalid unicode escape: \\u{" + hex + "}");
            return "";
        }
    }

    private void character() {
        if (isAtEnd()) {
            error("Unterminated character literal");
            return;
        }

        String value;
        if (peek() == '\\') {
            advance();
            value = escapeChar();
        } else {
            value = String.valueOf(advance());
        }

        if (peek() != '\'') {
            error("Unterminated character literal (lifetimes are not supported)");
            return;
        }
        advance();

        addToken(TokenType.CHAR_LITERAL, value.isEmpty() ? '\0' : value.charAt(0));
    }

    /** 移除数字中的下划线分隔符 */
    private static String stripUnderscores(String text) {
        return text.indexOf('_') >= 0 ? text.replace("_", "") : text;
    }

    /** 消耗数字字符和下划线分隔符 */
    private void advanceDigits() {
        while (isDigit(peek()) || peek() == '_') advance();
    }

    /** 消耗类型后缀（u64、i32、f64 ...），返回后缀文本 */
    private String suffix() {
        int suffixStart = current;
        if (isAlpha(peek())) {
            while (isAlphaNumeric(peek())) advance();
        }
        return source.substring(suffixStart, current);
    }

    private void number() {
        // 检查进制
        if (source.charAt(start) == '0' && !isAtEnd()) {
            char next = peek();
            if (next == 'x') {
                radixNumber(16);
                return;
            } else if (next == 'b') {
                radixNumber(2);
                return;
            } else if (next == 'o') {
                radixNumber(8);
                return;
            }
        }

        advanceDigits();

        boolean isFloat = false;
        // 小数部分；1..2 与 x.0.method() 不在此处理
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance(); // 消费 .
            advanceDigits();
        }
        // 指数部分
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || peekNext() == '+' || peekNext() == '-')) {
            isFloat = true;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            advanceDigits();
        }

        int digitsEnd = current;
        String suffix = suffix();
        String text = stripUnderscores(source.substring(start, digitsEnd));
        if (isFloat || suffix.startsWith("f")) {
            try {
                addToken(TokenType.FLOAT_LITERAL, Double.parseDouble(text));
            } catch (NumberFormatException e) {
                error("Invalid float literal: " + source.substring(start, current));
            }
        } else {
            parseAndAddInteger(text, 10);
        }
    }

    private void radixNumber(int radix) {
        advance(); // 消费进制字母
        int digitsStart = current;
        while (isHexDigit(peek()) || peek() == '_') {
            // 十六进制之外遇到字母即为后缀
            if (radix != 16 && !isDigit(peek()) && peek() != '_') break;
            advance();
        }
        String text = stripUnderscores(source.substring(digitsStart, current));
        suffix();
        if (text.isEmpty()) {
            error("Missing digits in literal: " + source.substring(start, current));
            return;
        }
        parseAndAddInteger(text, radix);
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) ||
               (c >= 'a' && c <= 'f') ||
               (c >= 'A' && c <= 'F');
    }

    /** 能放入 long 时字面量为 Long，否则为 BigInteger（u128 常量） */
    private void parseAndAddInteger(String text, int radix) {
        try {
            BigInteger value = new BigInteger(text, radix);
            if (value.bitLength() < 64) {
                addToken(TokenType.INT_LITERAL, value.longValue());
            } else {
                addToken(TokenType.INT_LITERAL, value);
            }
        } catch (NumberFormatException e) {
            error("Invalid integer literal: " + source.substring(start, current));
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void blockComment() {
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            if (peek() == '/' && peekNext() == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                depth--;
            } else {
                if (advance() == '\n') newLine();
            }
        }
        if (depth > 0) {
            error("Unterminated block comment");
        }
    }

    private void error(String message) {
        addToken(TokenType.ERROR, String.format("[%s:%d:%d] Lexer error: %s",
                fileName, line, column, message));
    }
}
