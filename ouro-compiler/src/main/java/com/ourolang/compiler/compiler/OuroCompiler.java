package com.ourolang.compiler.compiler;

import com.ourolang.compiler.analysis.AnalysisResult;
import com.ourolang.compiler.analysis.SemanticAnalyzer;
import com.ourolang.compiler.analysis.SymbolError;
import com.ourolang.compiler.analysis.TypeChecker;
import com.ourolang.compiler.ast.decl.Declaration;
import com.ourolang.compiler.lexer.Lexer;
import com.ourolang.compiler.lexer.LexerException;
import com.ourolang.compiler.lexer.Token;
import com.ourolang.compiler.optimizer.Optimizer;
import com.ourolang.compiler.optimizer.PassPipeline;
import com.ourolang.compiler.parser.ParseError;
import com.ourolang.compiler.parser.ParseException;
import com.ourolang.compiler.parser.ParseResult;
import com.ourolang.compiler.parser.Parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 单个编译单元的同步编译驱动
 *
 * <p>词法分析 → 语法分析 → 语义分析与类型检查 → 优化（启用且无错误时）。
 * 每个阶段之间检查 {@link CancellationToken}，取消时抛出
 * {@link CancellationException}，不返回部分结果。</p>
 *
 * <p>实例无状态，每次调用都新建各阶段对象，可被多个线程共享。</p>
 */
public class OuroCompiler {
    private static final Logger LOG = Logger.getLogger(OuroCompiler.class.getName());

    private final Optimizer optimizer;

    public OuroCompiler() {
        this(PassPipeline.createDefault());
    }

    public OuroCompiler(Optimizer optimizer) {
        this.optimizer = optimizer;
    }

    public CompilationResult compile(String source, CompilerOptions options) {
        return compile(source, options, CancellationToken.NONE);
    }

    public CompilationResult compile(String source, CompilerOptions options, CancellationToken token) {
        String fileName = options.getFileName();
        long start = System.nanoTime();
        List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

        // 词法分析
        token.throwIfCancelled("lexing");
        List<Token> tokens;
        try {
            tokens = new Lexer(source, fileName).scanTokens();
        } catch (LexerException e) {
            diagnostics.add(Diagnostic.of(e));
            return finish(fileName, Collections.<Declaration>emptyList(), diagnostics, null, start);
        }

        // 语法分析
        token.throwIfCancelled("parsing");
        Parser parser = new Parser(tokens, fileName, options.getMaxNestingDepth());
        List<Declaration> declarations;
        if (options.isTolerantParsing()) {
            ParseResult parsed = parser.parseTolerant();
            for (ParseError error : parsed.getErrors()) {
                diagnostics.add(Diagnostic.of(error));
            }
            declarations = parsed.getDeclarations();
        } else {
            try {
                declarations = parser.parse();
            } catch (ParseException e) {
                diagnostics.add(Diagnostic.of(e));
                return finish(fileName, Collections.<Declaration>emptyList(), diagnostics, null, start);
            }
        }

        // 语义分析 + 类型检查
        token.throwIfCancelled("semantic analysis");
        AnalysisResult analysis = new SemanticAnalyzer().analyze(declarations);
        List<SymbolError> errors = new TypeChecker().check(analysis);
        for (SymbolError error : errors) {
            diagnostics.add(Diagnostic.of(error));
        }

        // 优化
        if (options.isOptimize() && !hasErrors(diagnostics)) {
            token.throwIfCancelled("optimization");
            declarations = optimizer.optimize(declarations);
        }

        token.throwIfCancelled("completion");
        return finish(fileName, declarations, diagnostics, analysis, start);
    }

    private static CompilationResult finish(String fileName, List<Declaration> declarations,
                                            List<Diagnostic> diagnostics, AnalysisResult analysis,
                                            long startNanos) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("%s compiled in %.2f ms, %d diagnostic(s)",
                    fileName, (System.nanoTime() - startNanos) / 1_000_000.0, diagnostics.size()));
        }
        return new CompilationResult(fileName, declarations, diagnostics,
                analysis != null ? analysis.getSymbolTable() : null);
    }

    private static boolean hasErrors(List<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            if (d.isError()) return true;
        }
        return false;
    }
}
