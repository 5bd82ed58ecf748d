package com.ourolang.compiler.lexer;

/**
 * OuroLang 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,            // 十进制 / 0x / 0b / 0o
    FLOAT_LITERAL,          // 1.5, 1e3, 1.5e-2
    CHAR_LITERAL,
    STRING_LITERAL,         // "..." 与 """..."""

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 声明 ===
    KW_CLASS, KW_STRUCT, KW_ENUM, KW_INTERFACE,
    KW_VAR, KW_CONST, KW_FUNC, KW_INIT,
    KW_EXTENSION, KW_TYPEALIAS, KW_PROTOCOL,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELSE, KW_SWITCH, KW_CASE, KW_DEFAULT,
    KW_FOR, KW_IN, KW_WHILE, KW_DO,
    KW_BREAK, KW_CONTINUE, KW_RETURN,
    KW_THROW, KW_THROWS, KW_RETHROWS,
    KW_TRY, KW_CATCH, KW_FINALLY,
    KW_YIELD, KW_DEFER,

    // === 关键词 - 字面量 ===
    KW_TRUE, KW_FALSE, KW_NULL,

    // === 关键词 - 修饰符 ===
    KW_PUBLIC, KW_PRIVATE, KW_PROTECTED, KW_INTERNAL, KW_FILEPRIVATE,
    KW_STATIC, KW_FINAL, KW_ABSTRACT, KW_SEALED,
    KW_OVERRIDE, KW_LAZY, KW_ASYNC, KW_AWAIT,

    // === 关键词 - 类型 ===
    KW_IS, KW_AS, KW_EXTENDS, KW_IMPLEMENTS,
    KW_SUPER, KW_THIS,

    // === 关键词 - 模块 ===
    KW_IMPORT, KW_PACKAGE, KW_MODULE,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %
    POWER,          // **

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=
    SPACESHIP,      // <=>

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 操作符 - 位运算 ===
    BIT_AND,        // &
    BIT_OR,         // |
    BIT_XOR,        // ^
    BIT_NOT,        // ~
    SHL,            // <<
    SHR,            // >>
    USHR,           // >>>

    // === 操作符 - 赋值 ===
    ASSIGN,                 // =
    PLUS_ASSIGN,            // +=
    MINUS_ASSIGN,           // -=
    MUL_ASSIGN,             // *=
    DIV_ASSIGN,             // /=
    MOD_ASSIGN,             // %=
    POWER_ASSIGN,           // **=
    BIT_AND_ASSIGN,         // &=
    BIT_OR_ASSIGN,          // |=
    BIT_XOR_ASSIGN,         // ^=
    SHL_ASSIGN,             // <<=
    SHR_ASSIGN,             // >>=
    USHR_ASSIGN,            // >>>=
    NULL_COALESCE_ASSIGN,   // ??=

    // === 操作符 - 空值 / 条件 ===
    QUESTION,           // ?
    NULL_COALESCE,      // ??

    // === 操作符 - 范围 ===
    RANGE,              // ..
    ELLIPSIS,           // ...

    // === 操作符 - 特殊 ===
    ARROW,          // ->
    DOUBLE_ARROW,   // =>
    DOUBLE_COLON,   // ::

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    DOT,            // .
    COLON,          // :
    SEMICOLON,      // ;

    // === 特殊 ===
    EOF;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为修饰符关键词
     */
    public boolean isModifier() {
        switch (this) {
            case KW_PUBLIC:
            case KW_PRIVATE:
            case KW_PROTECTED:
            case KW_INTERNAL:
            case KW_FILEPRIVATE:
            case KW_STATIC:
            case KW_FINAL:
            case KW_ABSTRACT:
            case KW_SEALED:
            case KW_OVERRIDE:
            case KW_LAZY:
            case KW_ASYNC:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为赋值操作符
     */
    public boolean isAssignmentOp() {
        switch (this) {
            case ASSIGN:
            case PLUS_ASSIGN:
            case MINUS_ASSIGN:
            case MUL_ASSIGN:
            case DIV_ASSIGN:
            case MOD_ASSIGN:
            case POWER_ASSIGN:
            case BIT_AND_ASSIGN:
            case BIT_OR_ASSIGN:
            case BIT_XOR_ASSIGN:
            case SHL_ASSIGN:
            case SHR_ASSIGN:
            case USHR_ASSIGN:
            case NULL_COALESCE_ASSIGN:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为比较操作符
     */
    public boolean isComparisonOp() {
        switch (this) {
            case LT:
            case GT:
            case LE:
            case GE:
                return true;
            default:
                return false;
        }
    }
}
