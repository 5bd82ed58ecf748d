package com.ourolang.lsp;

/**
 * LSP 协议常量定义。
 *
 * @see <a href="https://microsoft.github.io/language-server-protocol/specifications/lsp/3.17/specification/">LSP 3.17 Spec</a>
 */
public final class LspConstants {

    private LspConstants() {}

    /** 诊断来源标识 */
    public static final String SOURCE = "ouro";

    // ==================== DiagnosticSeverity ====================

    public static final int SEVERITY_ERROR = 1;
    public static final int SEVERITY_WARNING = 2;
    public static final int SEVERITY_INFORMATION = 3;
    public static final int SEVERITY_HINT = 4;

    // ==================== SymbolKind ====================

    public static final int SYMBOL_CLASS = 5;
    public static final int SYMBOL_METHOD = 6;
    public static final int SYMBOL_PROPERTY = 7;
    public static final int SYMBOL_CONSTRUCTOR = 9;
    public static final int SYMBOL_ENUM = 10;
    public static final int SYMBOL_INTERFACE = 11;
    public static final int SYMBOL_FUNCTION = 12;
    public static final int SYMBOL_VARIABLE = 13;
    public static final int SYMBOL_CONSTANT = 14;
    public static final int SYMBOL_ENUM_MEMBER = 22;
    public static final int SYMBOL_STRUCT = 23;
}
