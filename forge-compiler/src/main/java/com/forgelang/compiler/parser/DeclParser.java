package com.forgelang.compiler.parser;

import com.forgelang.compiler.ast.*;
import com.forgelang.compiler.ast.decl.*;
import com.forgelang.compiler.ast.expr.Expression;
import com.forgelang.compiler.ast.pattern.Pattern;
import com.forgelang.compiler.ast.stmt.Block;
import com.forgelang.compiler.ast.type.PathType;
import com.forgelang.compiler.ast.type.TypeRef;
import com.forgelang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.forgelang.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    Item parseItem() {
        SourceLocation loc = parser.location();

        // 解析属性和可见性
        List<Attribute> attributes = parseAttributes();
        Visibility visibility = parseVisibility();

        if (parser.check(KW_MOD)) {
            return parseModuleDecl(loc, attributes, visibility);
        } else if (parser.check(KW_STRUCT)) {
            return parseStructDecl(loc, attributes, visibility);
        } else if (parser.check(KW_IMPL)) {
            if (visibility != Visibility.PRIVATE) {
                throw new ParseException("Visibility qualifiers are not permitted on impl blocks", parser.current);
            }
            return parseImplBlock(loc, attributes);
        } else if (parser.checkAny(KW_FN, KW_UNSAFE)) {
            return parseFnDecl(loc, attributes, visibility);
        } else if (parser.check(KW_USE)) {
            return parseUseDecl(loc, attributes, visibility);
        } else if (parser.checkAny(KW_CONST, KW_STATIC)) {
            return parseStaticDecl(loc, attributes, visibility);
        } else if (parser.checkAny(KW_TRAIT, KW_ENUM, KW_TYPE)) {
            throw new ParseException("Unsupported item '" + parser.current.getLexeme() + "'", parser.current);
        } else {
            throw new ParseException("Expected item", parser.current);
        }
    }

    // ============ 属性与可见性 ============

    List<Attribute> parseAttributes() {
        List<Attribute> attributes = new ArrayList<Attribute>();
        while (parser.check(HASH)) {
            attributes.add(parseAttribute());
        }
        return attributes;
    }

    /**
     * {@code #[path]} 或 {@code #[path(任意平衡 token)]}，参数保存为原文
     */
    private Attribute parseAttribute() {
        SourceLocation loc = parser.location();
        parser.expect(HASH, "Expected '#'");
        parser.expect(LBRACKET, "Expected '[' after '#'");
        Path path = parser.parsePath(false);

        String arguments = null;
        if (parser.check(LPAREN)) {
            Token open = parser.advance();
            int depth = 1;
            Token close = open;
            while (depth > 0) {
                if (parser.isAtEnd()) {
                    throw new ParseException("Unterminated attribute arguments", parser.current, "RPAREN");
                }
                if (parser.checkAny(LPAREN, LBRACKET, LBRACE)) {
                    depth++;
                } else if (parser.checkAny(RPAREN, RBRACKET, RBRACE)) {
                    depth--;
                }
                close = parser.advance();
            }
            arguments = parser.lexer.slice(open.getEndOffset(), close.getOffset()).trim();
        }

        parser.expect(RBRACKET, "Expected ']' after attribute");
        return new Attribute(loc, path, arguments);
    }

    Visibility parseVisibility() {
        if (!parser.match(KW_PUB)) {
            return Visibility.PRIVATE;
        }
        if (parser.check(LPAREN) && parser.checkAhead(KW_CRATE)) {
            parser.advance(); // consume '('
            parser.advance(); // consume 'crate'
            parser.expect(RPAREN, "Expected ')' after 'pub(crate'");
            return Visibility.CRATE;
        }
        return Visibility.PUBLIC;
    }

    // ============ 模块 ============

    private ModuleDecl parseModuleDecl(SourceLocation loc, List<Attribute> attributes, Visibility visibility) {
        parser.expect(KW_MOD, "Expected 'mod'");
        SourceLocation nameLoc = parser.location();
        String name = parser.expectIdentifier("Expected module name");
        if (parser.check(SEMICOLON)) {
            throw new ParseException("Out-of-line modules are not supported", parser.current);
        }
        parser.expect(LBRACE, "Expected '{' after module name");

        List<Item> items = new ArrayList<Item>();
        while (!parser.check(RBRACE)) {
            if (parser.isAtEnd()) {
                throw new ParseException("Unterminated module '" + name + "'", parser.current, "RBRACE");
            }
            items.add(parseItem());
        }
        parser.expect(RBRACE, "Expected '}' after module body");

        ModuleDecl module = new ModuleDecl(loc, attributes, visibility, name, items);
        module.setNameLocation(nameLoc);
        return module;
    }

    // ============ 结构体 ============

    private StructDecl parseStructDecl(SourceLocation loc, List<Attribute> attributes, Visibility visibility) {
        parser.expect(KW_STRUCT, "Expected 'struct'");
        SourceLocation nameLoc = parser.location();
        String name = parser.expectIdentifier("Expected struct name");

        StructDecl struct;
        if (parser.match(SEMICOLON)) {
            struct = new StructDecl(loc, attributes, visibility, name, Collections.<FieldDecl>emptyList(), true);
        } else {
            if (parser.check(LPAREN)) {
                throw new ParseException("Tuple structs are not supported", parser.current);
            }
            parser.expect(LBRACE, "Expected '{' or ';' after struct name");
            List<FieldDecl> fields = new ArrayList<FieldDecl>();
            while (!parser.check(RBRACE)) {
                fields.add(parseFieldDecl());
                if (!parser.match(COMMA)) break;
            }
            parser.expect(RBRACE, "Expected '}' after struct fields");
            struct = new StructDecl(loc, attributes, visibility, name, fields, false);
        }
        struct.setNameLocation(nameLoc);
        return struct;
    }

    private FieldDecl parseFieldDecl() {
        SourceLocation loc = parser.location();
        Visibility visibility = parseVisibility();
        String name = parser.expectIdentifier("Expected field name");
        parser.expect(COLON, "Expected ':' after field name");
        TypeRef type = parser.parseType();
        return new FieldDecl(loc, visibility, name, type);
    }

    // ============ impl 块 ============

    private ImplBlock parseImplBlock(SourceLocation loc, List<Attribute> attributes) {
        parser.expect(KW_IMPL, "Expected 'impl'");
        SourceLocation typeLoc = parser.location();
        TypeRef first = parser.parseType();

        Path capability = null;
        TypeRef selfType = first;
        if (parser.match(KW_FOR)) {
            if (!(first instanceof PathType)) {
                throw new ParseException("Expected capability path before 'for'", parser.previous);
            }
            capability = ((PathType) first).getPath();
            typeLoc = parser.location();
            selfType = parser.parseType();
        }
        if (!(selfType instanceof PathType)) {
            throw new ParseException("Expected type path in impl header", parser.previous);
        }
        String typeName = ((PathType) selfType).getPath().getLastSegment().getName();

        parser.expect(LBRACE, "Expected '{' after impl header");
        List<FnDecl> methods = new ArrayList<FnDecl>();
        while (!parser.check(RBRACE)) {
            if (parser.isAtEnd()) {
                throw new ParseException("Unterminated impl block", parser.current, "RBRACE");
            }
            SourceLocation methodLoc = parser.location();
            List<Attribute> methodAttributes = parseAttributes();
            Visibility visibility = parseVisibility();
            if (!parser.checkAny(KW_FN, KW_UNSAFE)) {
                throw new ParseException("Only functions are supported inside impl blocks", parser.current, "KW_FN");
            }
            methods.add(parseFnDecl(methodLoc, methodAttributes, visibility));
        }
        parser.expect(RBRACE, "Expected '}' after impl body");

        ImplBlock block = new ImplBlock(loc, attributes, typeName, capability, selfType, methods);
        block.setNameLocation(typeLoc);
        return block;
    }

    // ============ 函数 ============

    FnDecl parseFnDecl(SourceLocation loc, List<Attribute> attributes, Visibility visibility) {
        boolean isUnsafe = parser.match(KW_UNSAFE);
        parser.expect(KW_FN, "Expected 'fn'");
        SourceLocation nameLoc = parser.location();
        String name = parser.expectIdentifier("Expected function name");
        if (parser.check(LT)) {
            throw new ParseException("Generic functions are not supported", parser.current);
        }

        parser.expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = new ArrayList<Parameter>();
        while (!parser.check(RPAREN)) {
            params.add(parseParameter(params.isEmpty()));
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RPAREN, "Expected ')' after parameters");

        TypeRef returnType = null;
        if (parser.match(ARROW)) {
            returnType = parser.parseType();
        }

        if (parser.check(SEMICOLON)) {
            throw new ParseException("Function '" + name + "' has no body", parser.current, "LBRACE");
        }
        Block body = parser.parseBlock();

        FnDecl fn = new FnDecl(loc, attributes, visibility, isUnsafe, name, params, returnType, body);
        fn.setNameLocation(nameLoc);
        return fn;
    }

    private Parameter parseParameter(boolean first) {
        SourceLocation loc = parser.location();

        // 接收者：self / mut self / &self / &mut self
        if (parser.check(KW_SELF_VALUE)) {
            requireFirst(first);
            parser.advance();
            return Parameter.receiver(loc, Parameter.ReceiverKind.VALUE);
        }
        if (parser.check(KW_MUT) && parser.checkAhead(KW_SELF_VALUE)) {
            requireFirst(first);
            parser.advance();
            parser.advance();
            return Parameter.receiver(loc, Parameter.ReceiverKind.MUT_VALUE);
        }
        if (parser.check(AMP) && (parser.checkAhead(KW_SELF_VALUE) || parser.checkAhead(KW_MUT))) {
            requireFirst(first);
            parser.advance(); // consume '&'
            boolean mutable = parser.match(KW_MUT);
            parser.expect(KW_SELF_VALUE, "Expected 'self' after '&" + (mutable ? "mut" : "") + "'");
            return Parameter.receiver(loc, mutable ? Parameter.ReceiverKind.REF_MUT : Parameter.ReceiverKind.REF);
        }

        Pattern pattern = parser.parsePattern();
        parser.expect(COLON, "Expected ':' after parameter pattern");
        TypeRef type = parser.parseType();
        return Parameter.typed(loc, pattern, type);
    }

    private void requireFirst(boolean first) {
        if (!first) {
            throw new ParseException("'self' must be the first parameter", parser.current);
        }
    }

    // ============ use ============

    private UseDecl parseUseDecl(SourceLocation loc, List<Attribute> attributes, Visibility visibility) {
        parser.expect(KW_USE, "Expected 'use'");
        Path path = parser.parsePath(false);

        UseDecl.UseKind kind = UseDecl.UseKind.SINGLE;
        List<String> members = Collections.emptyList();
        String alias = null;

        if (parser.match(PATH_SEP)) {
            if (parser.match(STAR)) {
                kind = UseDecl.UseKind.GLOB;
            } else {
                parser.expect(LBRACE, "Expected '{' or '*' after '::'");
                kind = UseDecl.UseKind.GROUP;
                members = new ArrayList<String>();
                while (!parser.check(RBRACE)) {
                    if (!parser.checkAny(IDENTIFIER, KW_SELF_VALUE)) {
                        throw new ParseException("Expected import name", parser.current, "IDENTIFIER");
                    }
                    members.add(parser.advance().getLexeme());
                    if (!parser.match(COMMA)) break;
                }
                parser.expect(RBRACE, "Expected '}' after import group");
            }
        } else if (parser.match(KW_AS)) {
            alias = parser.expectIdentifier("Expected alias after 'as'");
        }

        parser.expect(SEMICOLON, "Expected ';' after use declaration");
        return new UseDecl(loc, attributes, visibility, path, kind, members, alias);
    }

    // ============ const / static ============

    private StaticDecl parseStaticDecl(SourceLocation loc, List<Attribute> attributes, Visibility visibility) {
        boolean isConst = parser.match(KW_CONST);
        if (!isConst) {
            parser.expect(KW_STATIC, "Expected 'static'");
        }
        boolean isMutable = !isConst && parser.match(KW_MUT);
        SourceLocation nameLoc = parser.location();
        String name = parser.expectIdentifier("Expected name");
        parser.expect(COLON, "Expected ':' after name");
        TypeRef type = parser.parseType();
        parser.expect(ASSIGN, "Expected '=' after type");
        Expression value = parser.parseExpression();
        parser.expect(SEMICOLON, "Expected ';' after initializer");

        StaticDecl decl = new StaticDecl(loc, attributes, visibility, isConst, isMutable, name, type, value);
        decl.setNameLocation(nameLoc);
        return decl;
    }
}
