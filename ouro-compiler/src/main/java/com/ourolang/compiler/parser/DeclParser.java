package com.ourolang.compiler.parser;

import com.ourolang.compiler.ast.Modifier;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.decl.*;
import com.ourolang.compiler.ast.expr.Expression;
import com.ourolang.compiler.ast.stmt.Block;
import com.ourolang.compiler.ast.type.TypeParameter;
import com.ourolang.compiler.ast.type.TypeRef;
import com.ourolang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.ourolang.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析顶层声明
     */
    Declaration parseDeclaration() {
        List<Modifier> modifiers = parseModifiers();

        if (parser.check(KW_CLASS)) {
            return parseClassDecl(modifiers);
        } else if (parser.check(KW_STRUCT)) {
            return parseStructDecl(modifiers);
        } else if (parser.check(KW_ENUM)) {
            return parseEnumDecl(modifiers);
        } else if (parser.check(KW_INTERFACE)) {
            return parseInterfaceDecl(modifiers);
        } else if (parser.check(KW_FUNC)) {
            return parseFunctionDecl(modifiers);
        } else if (parser.checkAny(KW_VAR, KW_CONST)) {
            return parseVarDecl(modifiers);
        }
        throw new ParseException("Expected declaration", parser.current);
    }

    // ============ 修饰符 ============

    List<Modifier> parseModifiers() {
        List<Modifier> modifiers = new ArrayList<Modifier>();

        while (parser.current.getType().isModifier()) {
            Token token = parser.advance();
            Modifier mod = toModifier(token);

            if (modifiers.contains(mod)) {
                throw invalidModifier("Duplicate modifier '" + mod.toSourceString() + "'", token);
            }
            if (mod.isVisibility()) {
                for (Modifier m : modifiers) {
                    if (m.isVisibility()) {
                        throw invalidModifier("Conflicting visibility modifiers '"
                                + m.toSourceString() + "' and '" + mod.toSourceString() + "'", token);
                    }
                }
            }
            if ((mod == Modifier.ABSTRACT && modifiers.contains(Modifier.FINAL))
                    || (mod == Modifier.FINAL && modifiers.contains(Modifier.ABSTRACT))) {
                throw invalidModifier("'abstract' and 'final' modifiers are incompatible", token);
            }
            if ((mod == Modifier.SEALED && modifiers.contains(Modifier.FINAL))
                    || (mod == Modifier.FINAL && modifiers.contains(Modifier.SEALED))) {
                throw invalidModifier("'sealed' and 'final' modifiers are incompatible", token);
            }
            modifiers.add(mod);
        }

        return modifiers;
    }

    private static Modifier toModifier(Token token) {
        switch (token.getType()) {
            case KW_PUBLIC: return Modifier.PUBLIC;
            case KW_PRIVATE: return Modifier.PRIVATE;
            case KW_PROTECTED: return Modifier.PROTECTED;
            case KW_INTERNAL: return Modifier.INTERNAL;
            case KW_FILEPRIVATE: return Modifier.FILEPRIVATE;
            case KW_STATIC: return Modifier.STATIC;
            case KW_FINAL: return Modifier.FINAL;
            case KW_ABSTRACT: return Modifier.ABSTRACT;
            case KW_SEALED: return Modifier.SEALED;
            case KW_OVERRIDE: return Modifier.OVERRIDE;
            case KW_LAZY: return Modifier.LAZY;
            case KW_ASYNC: return Modifier.ASYNC;
            default: throw new ParseException("Expected modifier", token);
        }
    }

    private static ParseException invalidModifier(String message, Token token) {
        return new ParseException(ParseException.Kind.INVALID_MODIFIER, message, token, null);
    }

    // ============ 类声明 ============

    private ClassDecl parseClassDecl(List<Modifier> modifiers) {
        SourceLocation loc = parser.location();
        parser.expect(KW_CLASS, "Expected 'class'");
        String name = parser.expect(IDENTIFIER, "Expected class name").getLexeme();
        SourceLocation nameLoc = parser.previousLocation();
        List<TypeParameter> typeParams = parser.typeParser.parseTypeParamsOpt();

        // 第一个名字先记为父类，是否为接口由语义分析判断
        TypeRef superclass = null;
        List<TypeRef> interfaces = new ArrayList<TypeRef>();
        if (parser.match(COLON)) {
            List<TypeRef> superTypes = parser.typeParser.parseTypeList();
            superclass = superTypes.get(0);
            interfaces.addAll(superTypes.subList(1, superTypes.size()));
        }

        // sealed class A permits B, C
        List<String> permits = new ArrayList<String>();
        if (parser.checkContextual("permits")) {
            parser.advance();
            do {
                permits.add(parser.expect(IDENTIFIER, "Expected permitted subclass name").getLexeme());
            } while (parser.match(COMMA));
        }

        List<VarDecl> properties = new ArrayList<VarDecl>();
        List<FunctionDecl> methods = new ArrayList<FunctionDecl>();
        parser.expect(LBRACE, "Expected '{' after class header");
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            parseMember(properties, methods);
        }
        parser.expect(RBRACE, "Expected '}' after class body");

        ClassDecl decl = new ClassDecl(loc, modifiers, name, typeParams, superclass, interfaces,
                permits, properties, methods);
        decl.setNameLocation(nameLoc);
        return decl;
    }

    // ============ 结构体声明 ============

    private StructDecl parseStructDecl(List<Modifier> modifiers) {
        SourceLocation loc = parser.location();
        parser.expect(KW_STRUCT, "Expected 'struct'");
        String name = parser.expect(IDENTIFIER, "Expected struct name").getLexeme();
        SourceLocation nameLoc = parser.previousLocation();
        List<TypeParameter> typeParams = parser.typeParser.parseTypeParamsOpt();

        List<TypeRef> interfaces = Collections.emptyList();
        if (parser.match(COLON)) {
            interfaces = parser.typeParser.parseTypeList();
        }

        List<VarDecl> properties = new ArrayList<VarDecl>();
        List<FunctionDecl> methods = new ArrayList<FunctionDecl>();
        parser.expect(LBRACE, "Expected '{' after struct header");
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            parseMember(properties, methods);
        }
        parser.expect(RBRACE, "Expected '}' after struct body");

        StructDecl decl = new StructDecl(loc, modifiers, name, typeParams, interfaces, properties, methods);
        decl.setNameLocation(nameLoc);
        return decl;
    }

    /**
     * 类 / 结构体成员：属性、方法或构造器
     */
    private void parseMember(List<VarDecl> properties, List<FunctionDecl> methods) {
        List<Modifier> modifiers = parseModifiers();
        if (parser.check(KW_FUNC)) {
            methods.add(parseFunctionDecl(modifiers));
        } else if (parser.check(KW_INIT)) {
            methods.add(parseInitDecl(modifiers));
        } else if (parser.checkAny(KW_VAR, KW_CONST)) {
            properties.add(parseVarDecl(modifiers));
        } else {
            throw new ParseException("Expected member declaration", parser.current);
        }
    }

    // ============ 枚举声明 ============

    private EnumDecl parseEnumDecl(List<Modifier> modifiers) {
        SourceLocation loc = parser.location();
        parser.expect(KW_ENUM, "Expected 'enum'");
        String name = parser.expect(IDENTIFIER, "Expected enum name").getLexeme();
        SourceLocation nameLoc = parser.previousLocation();

        TypeRef rawType = null;
        if (parser.match(COLON)) {
            rawType = parser.typeParser.parseType();
        }

        List<EnumCase> cases = new ArrayList<EnumCase>();
        List<FunctionDecl> methods = new ArrayList<FunctionDecl>();
        parser.expect(LBRACE, "Expected '{' after enum header");
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            if (parser.check(IDENTIFIER) || parser.check(KW_CASE)) {
                cases.add(parseEnumCase());
                continue;
            }
            List<Modifier> memberModifiers = parseModifiers();
            if (parser.check(KW_FUNC)) {
                methods.add(parseFunctionDecl(memberModifiers));
            } else if (parser.check(KW_INIT)) {
                methods.add(parseInitDecl(memberModifiers));
            } else {
                throw new ParseException("Expected enum case or method", parser.current);
            }
        }
        parser.expect(RBRACE, "Expected '}' after enum body");

        EnumDecl decl = new EnumDecl(loc, modifiers, name, rawType, cases, methods);
        decl.setNameLocation(nameLoc);
        return decl;
    }

    private EnumCase parseEnumCase() {
        parser.match(KW_CASE);
        SourceLocation loc = parser.location();
        String name = parser.expect(IDENTIFIER, "Expected enum case name").getLexeme();

        Expression rawValue = null;
        if (parser.match(ASSIGN)) {
            rawValue = parser.exprParser.parseExpression();
        }

        // 最后一个 case 之后可以直接是 '}'
        if (!parser.matchAny(SEMICOLON, COMMA) && !parser.check(RBRACE)) {
            throw new ParseException("Expected ';' or ',' after enum case", parser.current, "SEMICOLON");
        }
        return new EnumCase(loc, name, rawValue);
    }

    // ============ 接口声明 ============

    private InterfaceDecl parseInterfaceDecl(List<Modifier> modifiers) {
        SourceLocation loc = parser.location();
        parser.expect(KW_INTERFACE, "Expected 'interface'");
        String name = parser.expect(IDENTIFIER, "Expected interface name").getLexeme();
        SourceLocation nameLoc = parser.previousLocation();
        List<TypeParameter> typeParams = parser.typeParser.parseTypeParamsOpt();

        List<TypeRef> extended = Collections.emptyList();
        if (parser.match(COLON)) {
            extended = parser.typeParser.parseTypeList();
        }

        List<FunctionDecl> methods = new ArrayList<FunctionDecl>();
        parser.expect(LBRACE, "Expected '{' after interface header");
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            List<Modifier> memberModifiers = parseModifiers();
            if (!parser.check(KW_FUNC)) {
                throw new ParseException("Interfaces may only declare methods", parser.current);
            }
            methods.add(parseFunctionDecl(memberModifiers));
        }
        parser.expect(RBRACE, "Expected '}' after interface body");

        InterfaceDecl decl = new InterfaceDecl(loc, modifiers, name, typeParams, extended, methods);
        decl.setNameLocation(nameLoc);
        return decl;
    }

    // ============ 函数声明 ============

    FunctionDecl parseFunctionDecl(List<Modifier> modifiers) {
        SourceLocation loc = parser.location();
        parser.expect(KW_FUNC, "Expected 'func'");
        String name = parser.expect(IDENTIFIER, "Expected function name").getLexeme();
        SourceLocation nameLoc = parser.previousLocation();
        List<TypeParameter> typeParams = parser.typeParser.parseTypeParamsOpt();

        List<Parameter> params = parseParameters();

        TypeRef returnType = null;
        if (parser.match(ARROW)) {
            returnType = parser.typeParser.parseType();
        }

        // 无函数体：接口方法或抽象方法
        Block body = null;
        if (!parser.match(SEMICOLON)) {
            body = parser.stmtParser.parseBlock();
        }

        FunctionDecl decl = new FunctionDecl(loc, modifiers, name, typeParams, params, returnType, body);
        decl.setNameLocation(nameLoc);
        return decl;
    }

    private FunctionDecl parseInitDecl(List<Modifier> modifiers) {
        SourceLocation loc = parser.location();
        parser.expect(KW_INIT, "Expected 'init'");
        List<Parameter> params = parseParameters();
        Block body = parser.stmtParser.parseBlock();

        FunctionDecl decl = new FunctionDecl(loc, modifiers, FunctionDecl.CONSTRUCTOR_NAME,
                Collections.<TypeParameter>emptyList(), params, null, body);
        decl.setNameLocation(loc);
        return decl;
    }

    private List<Parameter> parseParameters() {
        parser.expect(LPAREN, "Expected '(' before parameters");
        List<Parameter> params = new ArrayList<Parameter>();
        if (!parser.check(RPAREN)) {
            do {
                SourceLocation loc = parser.location();
                String name = parser.expect(IDENTIFIER, "Expected parameter name").getLexeme();
                parser.expect(COLON, "Expected ':' after parameter name");
                TypeRef type = parser.typeParser.parseType();
                Expression defaultValue = null;
                if (parser.match(ASSIGN)) {
                    defaultValue = parser.exprParser.parseExpression();
                }
                params.add(new Parameter(loc, name, type, defaultValue));
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after parameters");
        return params;
    }

    // ============ 变量声明 ============

    VarDecl parseVarDecl(List<Modifier> modifiers) {
        SourceLocation loc = parser.location();
        boolean constant = parser.check(KW_CONST);
        if (!parser.matchAny(KW_VAR, KW_CONST)) {
            throw new ParseException("Expected 'var' or 'const'", parser.current, "KW_VAR");
        }
        String name = parser.expect(IDENTIFIER, "Expected variable name").getLexeme();
        SourceLocation nameLoc = parser.previousLocation();

        TypeRef typeAnnotation = null;
        if (parser.match(COLON)) {
            typeAnnotation = parser.typeParser.parseType();
        }

        Expression initializer = null;
        if (parser.match(ASSIGN)) {
            initializer = parser.exprParser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expected ';' after variable declaration");

        VarDecl decl = new VarDecl(loc, modifiers, name, constant, typeAnnotation, initializer);
        decl.setNameLocation(nameLoc);
        return decl;
    }
}
