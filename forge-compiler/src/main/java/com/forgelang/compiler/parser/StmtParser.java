package com.forgelang.compiler.parser;

import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.expr.Expression;
import com.forgelang.compiler.ast.pattern.Pattern;
import com.forgelang.compiler.ast.stmt.*;
import com.forgelang.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.List;

import static com.forgelang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析代码块 {@code { stmts }}
     */
    Block parseBlock() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");

        boolean saved = parser.noStructLiteral;
        parser.noStructLiteral = false;

        List<Statement> statements = new ArrayList<Statement>();
        while (!parser.check(RBRACE)) {
            if (parser.isAtEnd()) {
                throw new ParseException("Unterminated block", parser.current, "RBRACE");
            }
            // 空语句
            if (parser.match(SEMICOLON)) {
                continue;
            }
            statements.add(parseStatement());
        }
        parser.expect(RBRACE, "Expected '}'");

        parser.noStructLiteral = saved;
        return new Block(loc, statements);
    }

    Statement parseStatement() {
        if (parser.check(KW_LET)) {
            return parseLetStmt();
        }
        if (parser.checkAny(KW_FN, KW_STRUCT, KW_IMPL, KW_MOD, KW_USE, KW_CONST, KW_STATIC, HASH)) {
            throw new ParseException("Nested items are not supported inside function bodies", parser.current);
        }
        return parseExpressionStmt();
    }

    private LetStmt parseLetStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_LET, "Expected 'let'");
        Pattern pattern = parser.parsePattern();

        TypeRef type = null;
        if (parser.match(COLON)) {
            type = parser.parseType();
        }
        Expression initializer = null;
        if (parser.match(ASSIGN)) {
            initializer = parser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expected ';' after let statement");
        return new LetStmt(loc, pattern, type, initializer);
    }

    /**
     * 表达式语句。以块结尾的表达式（if / while / for / loop / 块）在语句位置自成一句，
     * 不再与后续运算符结合；其余表达式必须以 ';' 结束，块尾表达式除外。
     */
    private ExpressionStmt parseExpressionStmt() {
        SourceLocation loc = parser.location();

        Expression expr;
        if (parser.checkAny(KW_IF, KW_WHILE, KW_FOR, KW_LOOP, LBRACE)
                || (parser.check(KW_UNSAFE) && parser.checkAhead(LBRACE))) {
            expr = parser.exprParser.parsePrimary();
            // 块表达式后的方法调用仍按表达式继续，例如 {..}.len()
            if (parser.checkAny(DOT, QUESTION)) {
                expr = parser.exprParser.parsePostfix(expr);
            }
        } else {
            expr = parser.parseExpression();
        }

        if (parser.match(SEMICOLON)) {
            return new ExpressionStmt(loc, expr, true);
        }
        if (parser.check(RBRACE) || expr.isBlockLike()) {
            return new ExpressionStmt(loc, expr, false);
        }
        throw new ParseException("Expected ';' after expression", parser.current, "SEMICOLON");
    }
}
