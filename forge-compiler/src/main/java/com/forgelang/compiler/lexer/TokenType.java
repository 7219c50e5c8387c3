package com.forgelang.compiler.lexer;

/**
 * Forge 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    FLOAT_LITERAL,
    CHAR_LITERAL,
    STRING_LITERAL,

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 项 ===
    KW_MOD, KW_STRUCT, KW_IMPL, KW_FN, KW_USE,
    KW_CONST, KW_STATIC, KW_TRAIT, KW_ENUM, KW_TYPE,

    // === 关键词 - 修饰符 ===
    KW_PUB, KW_CRATE, KW_MUT, KW_UNSAFE, KW_MOVE,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELSE, KW_WHILE, KW_FOR, KW_IN, KW_LOOP,
    KW_MATCH, KW_RETURN, KW_BREAK, KW_CONTINUE, KW_LET,

    // === 关键词 - 其他 ===
    KW_AS, KW_TRUE, KW_FALSE, KW_WHERE,
    KW_SELF_VALUE,      // self
    KW_SELF_TYPE,       // Self
    KW_SUPER,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    SLASH,          // /
    PERCENT,        // %

    // === 操作符 - 位运算 ===
    AMP,            // &
    PIPE,           // |
    CARET,          // ^
    SHL,            // <<

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >   （>> 由解析器按相邻两个 GT 识别）
    LE,             // <=
    GE,             // >=

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 操作符 - 赋值 ===
    ASSIGN,         // =
    PLUS_ASSIGN,    // +=
    MINUS_ASSIGN,   // -=
    STAR_ASSIGN,    // *=
    SLASH_ASSIGN,   // /=
    PERCENT_ASSIGN, // %=

    // === 分隔符 ===
    LPAREN, RPAREN,         // ( )
    LBRACE, RBRACE,         // { }
    LBRACKET, RBRACKET,     // [ ]
    COMMA,                  // ,
    SEMICOLON,              // ;
    COLON,                  // :
    PATH_SEP,               // ::
    DOT,                    // .
    DOT_DOT,                // ..
    DOT_DOT_EQ,             // ..=
    ARROW,                  // ->
    FAT_ARROW,              // =>
    HASH,                   // #
    QUESTION,               // ?
    UNDERSCORE,             // _

    // === 特殊 ===
    EOF,
    ERROR;

    /** 是否为关键词 */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }
}
