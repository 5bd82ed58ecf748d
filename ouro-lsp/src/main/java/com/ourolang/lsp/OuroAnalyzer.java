package com.ourolang.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.decl.*;
import com.ourolang.compiler.compiler.CompilationResult;
import com.ourolang.compiler.compiler.CompilerOptions;
import com.ourolang.compiler.compiler.Diagnostic;
import com.ourolang.compiler.compiler.OuroCompiler;
import com.ourolang.compiler.formatter.FormatConfig;
import com.ourolang.compiler.formatter.OuroFormatter;
import com.ourolang.compiler.lexer.Lexer;
import com.ourolang.compiler.lexer.LexerException;
import com.ourolang.compiler.parser.ParseException;
import com.ourolang.compiler.parser.ParseResult;
import com.ourolang.compiler.parser.Parser;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.ourolang.lsp.LspConstants.*;

/**
 * OuroLang 代码分析器
 *
 * <p>把编译器的诊断、声明结构和格式化结果转换为 LSP 形状的 JSON。
 * 行列一律转换为 0 起始。</p>
 */
public class OuroAnalyzer {
    private static final Logger LOG = Logger.getLogger(OuroAnalyzer.class.getName());

    private final OuroCompiler compiler = new OuroCompiler();
    private final FormatConfig formatConfig;

    public OuroAnalyzer() {
        this(new FormatConfig());
    }

    public OuroAnalyzer(FormatConfig formatConfig) {
        this.formatConfig = formatConfig;
    }

    // ============ 核心 LSP 方法 ============

    /**
     * 分析文档，返回诊断信息。使用容错解析，一次报告多个语法错误。
     */
    public JsonArray analyze(String uri, String content) {
        JsonArray diagnostics = new JsonArray();
        if (content == null) return diagnostics;

        CompilerOptions options = new CompilerOptions()
                .setFileName(getFileName(uri))
                .setTolerantParsing(true)
                .setOptimize(false);
        CompilationResult result;
        try {
            result = compiler.compile(content, options);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "分析文档失败: " + uri, e);
            return diagnostics;
        }

        for (Diagnostic d : result.getDiagnostics()) {
            JsonObject diag = new JsonObject();
            int line = Math.max(0, d.getLine() - 1);
            int col = Math.max(0, d.getColumn() - 1);
            diag.add("range", createRange(line, col, line, col + d.getLength()));
            diag.addProperty("severity", toLspSeverity(d.getSeverity()));
            diag.addProperty("source", SOURCE);
            diag.addProperty("message", d.getMessage());
            diagnostics.add(diag);
        }
        return diagnostics;
    }

    /**
     * 文档大纲：顶层声明及其成员
     */
    public JsonArray documentSymbols(String uri, String content) {
        JsonArray symbols = new JsonArray();
        if (content == null) return symbols;

        List<Declaration> declarations;
        try {
            String fileName = getFileName(uri);
            ParseResult parsed = new Parser(new Lexer(content, fileName).scanTokens(), fileName).parseTolerant();
            declarations = parsed.getDeclarations();
        } catch (LexerException e) {
            LOG.log(Level.FINE, "无法为大纲做词法分析: " + uri, e);
            return symbols;
        }

        for (Declaration decl : declarations) {
            symbols.add(declarationSymbol(decl));
        }
        return symbols;
    }

    /**
     * 格式化文档
     *
     * @return 格式化后的文本；文本无法解析时返回 null
     */
    public String format(String content) {
        if (content == null) return null;
        List<Declaration> declarations;
        try {
            declarations = new Parser(new Lexer(content).scanTokens()).parse();
        } catch (LexerException | ParseException e) {
            LOG.log(Level.FINE, "文档无法解析，跳过格式化", e);
            return null;
        }
        return new OuroFormatter().format(declarations, formatConfig);
    }

    // ============ 符号转换辅助 ============

    private JsonObject declarationSymbol(Declaration decl) {
        JsonArray children = new JsonArray();
        int kind;
        if (decl instanceof TypeDecl) {
            TypeDecl type = (TypeDecl) decl;
            if (decl instanceof ClassDecl) {
                kind = SYMBOL_CLASS;
            } else if (decl instanceof StructDecl) {
                kind = SYMBOL_STRUCT;
            } else if (decl instanceof InterfaceDecl) {
                kind = SYMBOL_INTERFACE;
            } else {
                kind = SYMBOL_ENUM;
                for (EnumCase c : ((EnumDecl) decl).getCases()) {
                    children.add(documentSymbol(c.getName(), SYMBOL_ENUM_MEMBER, c.getLocation(),
                            new JsonArray()));
                }
            }
            for (VarDecl property : type.getProperties()) {
                children.add(documentSymbol(property.getName(),
                        property.isConstant() ? SYMBOL_CONSTANT : SYMBOL_PROPERTY,
                        nameLocation(property), new JsonArray()));
            }
            for (FunctionDecl method : type.getMethods()) {
                children.add(documentSymbol(method.getName(),
                        method.isConstructor() ? SYMBOL_CONSTRUCTOR : SYMBOL_METHOD,
                        nameLocation(method), new JsonArray()));
            }
        } else if (decl instanceof FunctionDecl) {
            kind = SYMBOL_FUNCTION;
        } else {
            kind = ((VarDecl) decl).isConstant() ? SYMBOL_CONSTANT : SYMBOL_VARIABLE;
        }
        return documentSymbol(decl.getName(), kind, nameLocation(decl), children);
    }

    private JsonObject documentSymbol(String name, int kind, SourceLocation loc, JsonArray children) {
        JsonObject docSym = new JsonObject();
        docSym.addProperty("name", name);
        docSym.addProperty("kind", kind);
        int line = Math.max(0, loc.getLine() - 1);
        int col = Math.max(0, loc.getColumn() - 1);
        int end = Math.max(col, loc.getEndColumn() - 1);
        docSym.add("range", createRange(line, col, line, end));
        docSym.add("selectionRange", createRange(line, col, line, end));
        docSym.add("children", children);
        return docSym;
    }

    /** 获取声明名称的精确位置（优先 nameLocation，回退到 location） */
    private static SourceLocation nameLocation(Declaration decl) {
        return decl.getNameLocation() != null ? decl.getNameLocation() : decl.getLocation();
    }

    private static int toLspSeverity(Diagnostic.Severity severity) {
        switch (severity) {
            case WARNING: return SEVERITY_WARNING;
            case INFO: return SEVERITY_INFORMATION;
            case HINT: return SEVERITY_HINT;
            default: return SEVERITY_ERROR;
        }
    }

    /**
     * 从 URI 提取文件名：file:///path/to/main.ouro -> main.ouro
     */
    public static String getFileName(String uri) {
        int lastSlash = uri.lastIndexOf('/');
        return lastSlash >= 0 ? uri.substring(lastSlash + 1) : uri;
    }

    // ============ JSON 工具 ============

    private static JsonObject createRange(int startLine, int startChar, int endLine, int endChar) {
        JsonObject range = new JsonObject();
        JsonObject start = new JsonObject();
        start.addProperty("line", startLine);
        start.addProperty("character", startChar);
        range.add("start", start);
        JsonObject end = new JsonObject();
        end.addProperty("line", endLine);
        end.addProperty("character", endChar);
        range.add("end", end);
        return range;
    }
}
