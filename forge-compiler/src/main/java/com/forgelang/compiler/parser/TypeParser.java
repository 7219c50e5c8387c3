package com.forgelang.compiler.parser;

import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.expr.Expression;
import com.forgelang.compiler.ast.type.*;

import java.util.ArrayList;
import java.util.List;

import static com.forgelang.compiler.lexer.TokenType.*;

/**
 * 类型解析辅助类
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    TypeRef parseType() {
        SourceLocation loc = parser.location();

        // 引用类型: &T / &mut T
        if (parser.match(AMP)) {
            boolean mutable = parser.match(KW_MUT);
            return new RefType(loc, mutable, parseType());
        }
        // &&T 被词法分析为 '&&'
        if (parser.match(AND)) {
            boolean mutable = parser.match(KW_MUT);
            TypeRef inner = new RefType(loc, mutable, parseType());
            return new RefType(loc, false, inner);
        }

        // 元组类型: () / (A) / (A,) / (A, B)
        if (parser.match(LPAREN)) {
            List<TypeRef> elements = new ArrayList<TypeRef>();
            while (!parser.check(RPAREN)) {
                elements.add(parseType());
                if (!parser.match(COMMA)) break;
            }
            parser.expect(RPAREN, "Expected ')' after tuple type");
            // (T) 与 (T,) 都保存为单元素元组，输出统一为 (T)
            return new TupleType(loc, elements);
        }

        // 数组 / 切片: [T; N] / [T]
        if (parser.match(LBRACKET)) {
            TypeRef element = parseType();
            Expression length = null;
            if (parser.match(SEMICOLON)) {
                length = parser.parseExpression();
            }
            parser.expect(RBRACKET, "Expected ']' after array type");
            return new ArrayType(loc, element, length);
        }

        if (parser.check(UNDERSCORE)) {
            parser.advance();
            return PathType.of(loc, "_");
        }

        if (!parser.isPathSegmentStart()) {
            throw new ParseException("Expected type", parser.current);
        }
        return new PathType(loc, parser.parsePath(true));
    }

    /**
     * 解析泛型实参列表，调用时 '<' 已被消费
     */
    List<TypeRef> parseGenericArgsAfterLt() {
        List<TypeRef> args = new ArrayList<TypeRef>();
        while (!parser.check(GT)) {
            args.add(parseType());
            if (!parser.match(COMMA)) break;
        }
        parser.expect(GT, "Expected '>' after generic arguments");
        return args;
    }
}
