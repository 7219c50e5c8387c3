package com.forgelang.compiler.parser;

import com.forgelang.compiler.ast.Path;
import com.forgelang.compiler.ast.PathSegment;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.decl.Item;
import com.forgelang.compiler.ast.decl.SourceFile;
import com.forgelang.compiler.ast.expr.Expression;
import com.forgelang.compiler.ast.pattern.Pattern;
import com.forgelang.compiler.ast.stmt.Block;
import com.forgelang.compiler.ast.type.TypeRef;
import com.forgelang.compiler.lexer.Lexer;
import com.forgelang.compiler.lexer.Token;
import com.forgelang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.forgelang.compiler.lexer.TokenType.*;

/**
 * Forge 语法分析器（递归下降）
 *
 * <p>遇到第一个语法错误即抛出 {@link ParseException}，不做容错恢复：
 * 展开器只处理完整的源文件。</p>
 */
@SuppressWarnings("this-escape")
public class Parser {

    final Lexer lexer;
    final String fileName;
    Token current;
    Token previous;
    private Token nextToken;  // 用于 lookahead 的缓冲

    /** 条件位置（if/while/for 头部）禁止顶层结构体字面量 */
    boolean noStructLiteral;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final PatternParser patternParser = new PatternParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
        advance();  // 读取第一个 token
    }

    public Parser(Lexer lexer) {
        this(lexer, lexer.getFileName());
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (nextToken != null) {
            current = nextToken;
            nextToken = null;
        } else {
            current = lexer.nextToken();
        }
        if (current.getType() == ERROR) {
            throw new ParseException(String.valueOf(current.getLiteral()), current);
        }
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        if (nextToken == null) {
            nextToken = lexer.nextToken();
        }
        return nextToken;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 向前看一个 token（不消费当前）
     */
    boolean checkAhead(TokenType type) {
        return peek().getType() == type;
    }

    /**
     * 当前与下一个都是 '>' 且紧邻（右移运算符）
     */
    boolean checkShiftRight() {
        return check(GT) && checkAhead(GT) && peek().getOffset() == current.getEndOffset();
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配任一类型，则前进
     */
    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    String expectIdentifier(String message) {
        return expect(IDENTIFIER, message).getLexeme();
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return locationOf(previous);
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLexeme().length());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 文件解析 ============

    /**
     * 解析整个源文件
     */
    public SourceFile parse() {
        SourceLocation loc = location();
        List<Item> items = new ArrayList<Item>();
        while (!isAtEnd()) {
            items.add(parseItem());
        }
        return new SourceFile(loc, fileName, items);
    }

    /**
     * 解析单个表达式（测试与工具使用），要求消费全部输入
     */
    public Expression parseStandaloneExpression() {
        Expression expr = parseExpression();
        if (!isAtEnd()) {
            throw new ParseException("Unexpected trailing input", current);
        }
        return expr;
    }

    // ============ 路径 ============

    boolean isPathSegmentStart() {
        return checkAny(IDENTIFIER, KW_SELF_VALUE, KW_SELF_TYPE, KW_SUPER, KW_CRATE);
    }

    /**
     * 解析路径。
     *
     * @param typeMode 类型位置允许 {@code Vec<u8>}；表达式位置泛型实参必须写成 {@code Vec::<u8>}
     */
    Path parsePath(boolean typeMode) {
        SourceLocation loc = location();
        List<PathSegment> segments = new ArrayList<PathSegment>();
        segments.add(parsePathSegment(typeMode));

        while (check(PATH_SEP)) {
            // a::<T> 的泛型实参挂在前一段上
            if (checkAhead(LT)) {
                advance(); // consume '::'
                PathSegment last = segments.get(segments.size() - 1);
                advance(); // consume '<'
                PathSegment withArgs = new PathSegment(last.getName(),
                        typeParser.parseGenericArgsAfterLt(), true);
                segments.set(segments.size() - 1, withArgs);
                continue;
            }
            // a::{b, c} / a::* 属于 use 语法，由 DeclParser 处理
            if (checkAhead(LBRACE) || checkAhead(STAR)) {
                break;
            }
            advance(); // consume '::'
            segments.add(parsePathSegment(typeMode));
        }

        return new Path(loc, segments);
    }

    private PathSegment parsePathSegment(boolean typeMode) {
        if (!isPathSegmentStart()) {
            throw new ParseException("Expected path segment", current, "IDENTIFIER");
        }
        String name = advance().getLexeme();
        if (typeMode && check(LT)) {
            advance(); // consume '<'
            return new PathSegment(name, typeParser.parseGenericArgsAfterLt(), false);
        }
        return new PathSegment(name, new ArrayList<TypeRef>(), false);
    }

    // ============ 委托 ============

    Item parseItem() { return declParser.parseItem(); }

    TypeRef parseType() { return typeParser.parseType(); }

    Pattern parsePattern() { return patternParser.parsePattern(); }

    Block parseBlock() { return stmtParser.parseBlock(); }

    Expression parseExpression() { return exprParser.parseExpression(); }

    /** 解析表达式，禁止顶层结构体字面量（if/while/for 条件位置） */
    Expression parseConditionExpression() { return exprParser.parseConditionExpression(); }

    /**
     * 解析以逗号分隔、以给定 token 结尾的表达式列表（消费结尾 token），允许尾随逗号
     */
    List<Expression> parseExpressionList(TokenType terminator) {
        if (match(terminator)) {
            return Collections.<Expression>emptyList();
        }
        boolean saved = noStructLiteral;
        noStructLiteral = false;
        List<Expression> result = new ArrayList<Expression>();
        do {
            if (check(terminator)) break;
            result.add(parseExpression());
        } while (match(COMMA));
        expect(terminator, "Expected '" + describe(terminator) + "'");
        noStructLiteral = saved;
        return result;
    }

    static String describe(TokenType type) {
        switch (type) {
            case RPAREN: return ")";
            case RBRACKET: return "]";
            case RBRACE: return "}";
            case GT: return ">";
            case PIPE: return "|";
            default: return type.name();
        }
    }
}
