package com.forgelang.compiler.parser;

import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.pattern.IdentPattern;
import com.forgelang.compiler.ast.pattern.Pattern;
import com.forgelang.compiler.ast.pattern.TuplePattern;
import com.forgelang.compiler.ast.pattern.WildcardPattern;

import java.util.ArrayList;
import java.util.List;

import static com.forgelang.compiler.lexer.TokenType.*;

/**
 * 模式解析辅助类（标识符、通配符、元组）
 */
class PatternParser {

    final Parser parser;

    PatternParser(Parser parser) {
        this.parser = parser;
    }

    Pattern parsePattern() {
        SourceLocation loc = parser.location();

        if (parser.match(UNDERSCORE)) {
            return new WildcardPattern(loc);
        }

        if (parser.match(LPAREN)) {
            List<Pattern> elements = new ArrayList<Pattern>();
            while (!parser.check(RPAREN)) {
                elements.add(parsePattern());
                if (!parser.match(COMMA)) break;
            }
            parser.expect(RPAREN, "Expected ')' after tuple pattern");
            return new TuplePattern(loc, elements);
        }

        boolean mutable = parser.match(KW_MUT);
        String name = parser.expectIdentifier("Expected pattern");
        return new IdentPattern(loc, name, mutable);
    }
}
