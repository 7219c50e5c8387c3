package com.forgelang.compiler.parser;

import com.forgelang.compiler.ast.Path;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.expr.*;
import com.forgelang.compiler.ast.pattern.Pattern;
import com.forgelang.compiler.ast.stmt.Block;
import com.forgelang.compiler.ast.type.TypeRef;
import com.forgelang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.forgelang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级由低到高：赋值、区间、||、&amp;&amp;、比较、|、^、&amp;、移位、加减、乘除、as、一元、后缀。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseAssignment();
    }

    Expression parseConditionExpression() {
        boolean saved = parser.noStructLiteral;
        parser.noStructLiteral = true;
        Expression expr = parseExpression();
        parser.noStructLiteral = saved;
        return expr;
    }

    // ============ 二元运算 ============

    private Expression parseAssignment() {
        Expression left = parseRange();

        AssignExpr.AssignOp op = assignOp();
        if (op != null) {
            SourceLocation loc = parser.location();
            parser.advance();
            Expression right = parseAssignment();  // 右结合
            return new AssignExpr(loc, left, op, right);
        }
        return left;
    }

    private AssignExpr.AssignOp assignOp() {
        switch (parser.current.getType()) {
            case ASSIGN: return AssignExpr.AssignOp.ASSIGN;
            case PLUS_ASSIGN: return AssignExpr.AssignOp.ADD_ASSIGN;
            case MINUS_ASSIGN: return AssignExpr.AssignOp.SUB_ASSIGN;
            case STAR_ASSIGN: return AssignExpr.AssignOp.MUL_ASSIGN;
            case SLASH_ASSIGN: return AssignExpr.AssignOp.DIV_ASSIGN;
            case PERCENT_ASSIGN: return AssignExpr.AssignOp.MOD_ASSIGN;
            default: return null;
        }
    }

    /**
     * 区间：a..b、a..=b、a..、..b
     */
    private Expression parseRange() {
        SourceLocation loc = parser.location();
        Expression left = null;
        if (!parser.checkAny(DOT_DOT, DOT_DOT_EQ)) {
            left = parseOr();
            if (!parser.checkAny(DOT_DOT, DOT_DOT_EQ)) {
                return left;
            }
        }
        BinaryExpr.BinaryOp op = parser.advance().getType() == DOT_DOT_EQ
                ? BinaryExpr.BinaryOp.RANGE_INCLUSIVE
                : BinaryExpr.BinaryOp.RANGE;
        Expression right = null;
        if (op == BinaryExpr.BinaryOp.RANGE_INCLUSIVE || canStartExpression()) {
            right = parseOr();
        }
        return new BinaryExpr(loc, left, op, right);
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (parser.check(OR)) {
            SourceLocation loc = parser.location();
            parser.advance();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.OR, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseComparison();
        while (parser.check(AND)) {
            SourceLocation loc = parser.location();
            parser.advance();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.AND, parseComparison());
        }
        return left;
    }

    private Expression parseComparison() {
        Expression left = parseBitOr();
        while (true) {
            BinaryExpr.BinaryOp op;
            switch (parser.current.getType()) {
                case EQ: op = BinaryExpr.BinaryOp.EQ; break;
                case NE: op = BinaryExpr.BinaryOp.NE; break;
                case LT: op = BinaryExpr.BinaryOp.LT; break;
                case GT: op = BinaryExpr.BinaryOp.GT; break;
                case LE: op = BinaryExpr.BinaryOp.LE; break;
                case GE: op = BinaryExpr.BinaryOp.GE; break;
                default: return left;
            }
            SourceLocation loc = parser.location();
            parser.advance();
            left = new BinaryExpr(loc, left, op, parseBitOr());
        }
    }

    private Expression parseBitOr() {
        Expression left = parseBitXor();
        while (parser.check(PIPE)) {
            SourceLocation loc = parser.location();
            parser.advance();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.BIT_OR, parseBitXor());
        }
        return left;
    }

    private Expression parseBitXor() {
        Expression left = parseBitAnd();
        while (parser.check(CARET)) {
            SourceLocation loc = parser.location();
            parser.advance();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.BIT_XOR, parseBitAnd());
        }
        return left;
    }

    private Expression parseBitAnd() {
        Expression left = parseShift();
        while (parser.check(AMP)) {
            SourceLocation loc = parser.location();
            parser.advance();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.BIT_AND, parseShift());
        }
        return left;
    }

    private Expression parseShift() {
        Expression left = parseAdditive();
        while (true) {
            SourceLocation loc = parser.location();
            if (parser.match(SHL)) {
                left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.SHL, parseAdditive());
            } else if (parser.checkShiftRight()) {
                parser.advance();
                parser.advance();
                left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.SHR, parseAdditive());
            } else {
                return left;
            }
        }
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (parser.checkAny(PLUS, MINUS)) {
            SourceLocation loc = parser.location();
            BinaryExpr.BinaryOp op = parser.advance().getType() == PLUS
                    ? BinaryExpr.BinaryOp.ADD
                    : BinaryExpr.BinaryOp.SUB;
            left = new BinaryExpr(loc, left, op, parseMultiplicative());
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parseCast();
        while (parser.checkAny(STAR, SLASH, PERCENT)) {
            SourceLocation loc = parser.location();
            BinaryExpr.BinaryOp op;
            switch (parser.advance().getType()) {
                case STAR: op = BinaryExpr.BinaryOp.MUL; break;
                case SLASH: op = BinaryExpr.BinaryOp.DIV; break;
                default: op = BinaryExpr.BinaryOp.MOD; break;
            }
            left = new BinaryExpr(loc, left, op, parseCast());
        }
        return left;
    }

    private Expression parseCast() {
        Expression expr = parseUnary();
        while (parser.check(KW_AS)) {
            SourceLocation loc = parser.location();
            parser.advance();
            expr = new CastExpr(loc, expr, parser.parseType());
        }
        return expr;
    }

    // ============ 一元 ============

    private Expression parseUnary() {
        SourceLocation loc = parser.location();
        if (parser.match(MINUS)) {
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.NEG, parseUnary());
        }
        if (parser.match(NOT)) {
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.NOT, parseUnary());
        }
        if (parser.match(STAR)) {
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.DEREF, parseUnary());
        }
        if (parser.match(AMP)) {
            boolean mutable = parser.match(KW_MUT);
            return new UnaryExpr(loc, mutable ? UnaryExpr.UnaryOp.REF_MUT : UnaryExpr.UnaryOp.REF, parseUnary());
        }
        // &&x 被词法分析为 '&&'
        if (parser.match(AND)) {
            boolean mutable = parser.match(KW_MUT);
            Expression inner = new UnaryExpr(loc, mutable ? UnaryExpr.UnaryOp.REF_MUT : UnaryExpr.UnaryOp.REF, parseUnary());
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.REF, inner);
        }
        return parsePostfix(parsePrimary());
    }

    // ============ 后缀 ============

    Expression parsePostfix(Expression expr) {
        while (true) {
            SourceLocation loc = parser.location();
            if (parser.match(LPAREN)) {
                expr = new CallExpr(loc, expr, parser.parseExpressionList(RPAREN));
            } else if (parser.match(LBRACKET)) {
                boolean saved = parser.noStructLiteral;
                parser.noStructLiteral = false;
                Expression index = parseExpression();
                parser.noStructLiteral = saved;
                parser.expect(RBRACKET, "Expected ']' after index");
                expr = new IndexExpr(loc, expr, index);
            } else if (parser.match(QUESTION)) {
                expr = new TryExpr(loc, expr);
            } else if (parser.match(DOT)) {
                expr = parseMemberAccess(loc, expr);
            } else {
                return expr;
            }
        }
    }

    private Expression parseMemberAccess(SourceLocation loc, Expression target) {
        // 元组字段 x.0
        if (parser.check(INT_LITERAL)) {
            return new FieldExpr(loc, target, parser.advance().getLexeme());
        }
        // x.0.1 被词法分析为浮点数 "0.1"
        if (parser.check(FLOAT_LITERAL)) {
            Token token = parser.advance();
            String[] parts = token.getLexeme().split("\\.");
            if (parts.length != 2 || !isDigits(parts[0]) || !isDigits(parts[1])) {
                throw new ParseException("Invalid tuple field access", token);
            }
            return new FieldExpr(loc, new FieldExpr(loc, target, parts[0]), parts[1]);
        }

        String name = parser.expectIdentifier("Expected field or method name after '.'");

        List<TypeRef> typeArgs = Collections.emptyList();
        if (parser.check(PATH_SEP) && parser.checkAhead(LT)) {
            parser.advance(); // consume '::'
            parser.advance(); // consume '<'
            typeArgs = parser.typeParser.parseGenericArgsAfterLt();
            if (!parser.check(LPAREN)) {
                throw new ParseException("Expected '(' after method type arguments", parser.current, "LPAREN");
            }
        }
        if (parser.match(LPAREN)) {
            return new MethodCallExpr(loc, target, name, typeArgs, parser.parseExpressionList(RPAREN));
        }
        return new FieldExpr(loc, target, name);
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }

    // ============ 基本表达式 ============

    Expression parsePrimary() {
        SourceLocation loc = parser.location();

        switch (parser.current.getType()) {
            case INT_LITERAL:
                return literal(Literal.LiteralKind.INTEGER);
            case FLOAT_LITERAL:
                return literal(Literal.LiteralKind.FLOAT);
            case CHAR_LITERAL:
                return literal(Literal.LiteralKind.CHAR);
            case STRING_LITERAL:
                return literal(Literal.LiteralKind.STRING);
            case KW_TRUE:
            case KW_FALSE: {
                Token token = parser.advance();
                return new Literal(loc, token.getType() == KW_TRUE, Literal.LiteralKind.BOOLEAN, token.getLexeme());
            }
            case IDENTIFIER:
            case KW_SELF_VALUE:
            case KW_SELF_TYPE:
            case KW_SUPER:
            case KW_CRATE:
                return parsePathExpression();
            case LPAREN:
                return parseParenOrTuple();
            case LBRACKET:
                return parseArray();
            case LBRACE:
                return new BlockExpr(loc, parser.parseBlock(), false);
            case KW_UNSAFE:
                parser.advance();
                return new BlockExpr(loc, parser.parseBlock(), true);
            case KW_IF:
                return parseIf();
            case KW_WHILE: {
                parser.advance();
                Expression condition = parser.parseConditionExpression();
                return new WhileExpr(loc, condition, parser.parseBlock());
            }
            case KW_LOOP:
                parser.advance();
                return new LoopExpr(loc, parser.parseBlock());
            case KW_FOR: {
                parser.advance();
                Pattern pattern = parser.parsePattern();
                parser.expect(KW_IN, "Expected 'in' after for pattern");
                Expression iterable = parser.parseConditionExpression();
                return new ForExpr(loc, pattern, iterable, parser.parseBlock());
            }
            case KW_RETURN: {
                parser.advance();
                Expression value = canStartExpression() ? parseExpression() : null;
                return new ReturnExpr(loc, value);
            }
            case KW_BREAK: {
                parser.advance();
                Expression value = canStartExpression() ? parseExpression() : null;
                return new JumpExpr(loc, JumpExpr.JumpKind.BREAK, value);
            }
            case KW_CONTINUE:
                parser.advance();
                return new JumpExpr(loc, JumpExpr.JumpKind.CONTINUE, null);
            case PIPE:
            case OR:
            case KW_MOVE:
                return parseClosure();
            case KW_MATCH:
                throw new ParseException("'match' expressions are not supported", parser.current);
            default:
                throw new ParseException("Expected expression", parser.current);
        }
    }

    private Literal literal(Literal.LiteralKind kind) {
        SourceLocation loc = parser.location();
        Token token = parser.advance();
        return new Literal(loc, token.getLiteral(), kind, token.getLexeme());
    }

    /**
     * 路径、宏调用 {@code name!(..)} 或结构体字面量 {@code Path { .. }}
     */
    private Expression parsePathExpression() {
        SourceLocation loc = parser.location();
        Path path = parser.parsePath(false);

        if (parser.check(NOT) && (parser.checkAhead(LPAREN) || parser.checkAhead(LBRACKET))) {
            parser.advance(); // consume '!'
            boolean bracketed = parser.check(LBRACKET);
            parser.advance(); // consume '(' / '['
            List<Expression> args = parser.parseExpressionList(bracketed ? RBRACKET : RPAREN);
            return new MacroCallExpr(loc, path, bracketed, args);
        }

        if (parser.check(LBRACE) && !parser.noStructLiteral) {
            return parseStructLiteral(loc, path);
        }

        return new PathExpr(loc, path);
    }

    private StructLiteral parseStructLiteral(SourceLocation loc, Path path) {
        parser.expect(LBRACE, "Expected '{'");
        boolean saved = parser.noStructLiteral;
        parser.noStructLiteral = false;

        List<StructLiteral.FieldInit> fields = new ArrayList<StructLiteral.FieldInit>();
        Expression base = null;
        while (!parser.check(RBRACE)) {
            if (parser.match(DOT_DOT)) {
                base = parseExpression();
                break;
            }
            SourceLocation fieldLoc = parser.location();
            Token nameToken = parser.check(INT_LITERAL)
                    ? parser.advance()
                    : parser.expect(IDENTIFIER, "Expected field name in struct literal");
            String name = nameToken.getLexeme();
            if (parser.match(COLON)) {
                fields.add(new StructLiteral.FieldInit(fieldLoc, name, parseExpression(), false));
            } else {
                // 简写 { value } 等价于 { value: value }
                fields.add(new StructLiteral.FieldInit(fieldLoc, name,
                        PathExpr.of(fieldLoc, name), true));
            }
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RBRACE, "Expected '}' after struct literal");

        parser.noStructLiteral = saved;
        return new StructLiteral(loc, path, fields, base);
    }

    private Expression parseParenOrTuple() {
        SourceLocation loc = parser.location();
        parser.expect(LPAREN, "Expected '('");
        boolean saved = parser.noStructLiteral;
        parser.noStructLiteral = false;

        List<Expression> elements = new ArrayList<Expression>();
        boolean trailingComma = false;
        while (!parser.check(RPAREN)) {
            elements.add(parseExpression());
            trailingComma = parser.match(COMMA);
            if (!trailingComma) break;
        }
        parser.expect(RPAREN, "Expected ')'");
        parser.noStructLiteral = saved;

        if (elements.size() == 1 && !trailingComma) {
            return new ParenExpr(loc, elements.get(0));
        }
        return new TupleExpr(loc, elements);
    }

    private Expression parseArray() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACKET, "Expected '['");
        if (parser.match(RBRACKET)) {
            return new ArrayExpr(loc, new ArrayList<Expression>(), null);
        }

        boolean saved = parser.noStructLiteral;
        parser.noStructLiteral = false;
        Expression first = parseExpression();
        if (parser.match(SEMICOLON)) {
            // [value; count]
            Expression count = parseExpression();
            parser.expect(RBRACKET, "Expected ']' after array repeat count");
            parser.noStructLiteral = saved;
            List<Expression> elements = new ArrayList<Expression>();
            elements.add(first);
            return new ArrayExpr(loc, elements, count);
        }
        parser.noStructLiteral = saved;

        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        if (parser.match(COMMA)) {
            elements.addAll(parser.parseExpressionList(RBRACKET));
        } else {
            parser.expect(RBRACKET, "Expected ']' after array elements");
        }
        return new ArrayExpr(loc, elements, null);
    }

    private IfExpr parseIf() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "Expected 'if'");
        Expression condition = parser.parseConditionExpression();
        Block thenBranch = parser.parseBlock();

        Expression elseBranch = null;
        if (parser.match(KW_ELSE)) {
            if (parser.check(KW_IF)) {
                elseBranch = parseIf();
            } else {
                SourceLocation elseLoc = parser.location();
                elseBranch = new BlockExpr(elseLoc, parser.parseBlock(), false);
            }
        }
        return new IfExpr(loc, condition, thenBranch, elseBranch);
    }

    /**
     * 闭包：{@code [move] |a, b: T| body} 或 {@code || body}；声明返回类型时 body 必须是块
     */
    private ClosureExpr parseClosure() {
        SourceLocation loc = parser.location();
        boolean isMove = parser.match(KW_MOVE);

        List<ClosureExpr.ClosureParam> params = new ArrayList<ClosureExpr.ClosureParam>();
        if (!parser.match(OR)) {
            parser.expect(PIPE, "Expected '|' to start closure parameters");
            while (!parser.check(PIPE)) {
                SourceLocation paramLoc = parser.location();
                Pattern pattern = parser.parsePattern();
                TypeRef type = null;
                if (parser.match(COLON)) {
                    type = parser.parseType();
                }
                params.add(new ClosureExpr.ClosureParam(paramLoc, pattern, type));
                if (!parser.match(COMMA)) break;
            }
            parser.expect(PIPE, "Expected '|' after closure parameters");
        }

        TypeRef returnType = null;
        Expression body;
        if (parser.match(ARROW)) {
            returnType = parser.parseType();
            SourceLocation bodyLoc = parser.location();
            body = new BlockExpr(bodyLoc, parser.parseBlock(), false);
        } else {
            boolean saved = parser.noStructLiteral;
            parser.noStructLiteral = false;
            body = parseExpression();
            parser.noStructLiteral = saved;
        }
        return new ClosureExpr(loc, isMove, params, returnType, body);
    }

    /**
     * 当前 token 能否开始一个表达式（用于 return / break / 区间右端可省略的判断）
     */
    boolean canStartExpression() {
        if (parser.check(LBRACE)) {
            return !parser.noStructLiteral;
        }
        return parser.checkAny(INT_LITERAL, FLOAT_LITERAL, CHAR_LITERAL, STRING_LITERAL,
                KW_TRUE, KW_FALSE, IDENTIFIER, KW_SELF_VALUE, KW_SELF_TYPE, KW_SUPER, KW_CRATE,
                LPAREN, LBRACKET, MINUS, NOT, STAR, AMP, AND, PIPE, OR, KW_MOVE, KW_UNSAFE,
                KW_IF, KW_WHILE, KW_FOR, KW_LOOP, KW_RETURN, KW_BREAK, KW_CONTINUE, DOT_DOT);
    }
}
