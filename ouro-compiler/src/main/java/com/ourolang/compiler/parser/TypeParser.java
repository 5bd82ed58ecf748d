package com.ourolang.compiler.parser;

import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.type.ArrayType;
import com.ourolang.compiler.ast.type.GenericType;
import com.ourolang.compiler.ast.type.SimpleType;
import com.ourolang.compiler.ast.type.TypeParameter;
import com.ourolang.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.ourolang.compiler.lexer.TokenType.*;

/**
 * 类型解析辅助类
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 可选的类型参数列表 {@code <T, U>}，不存在时返回空列表
     */
    List<TypeParameter> parseTypeParamsOpt() {
        if (!parser.check(LT)) {
            return Collections.emptyList();
        }
        parser.advance();
        List<TypeParameter> params = new ArrayList<TypeParameter>();
        do {
            SourceLocation loc = parser.location();
            String name = parser.expect(IDENTIFIER, "Expected type parameter name").getLexeme();
            params.add(new TypeParameter(loc, name));
        } while (parser.match(COMMA));
        parser.expectCloseAngle("Expected '>' after type parameters");
        return params;
    }

    /**
     * 逗号分隔的类型列表（继承子句）
     */
    List<TypeRef> parseTypeList() {
        List<TypeRef> types = new ArrayList<TypeRef>();
        do {
            types.add(parseType());
        } while (parser.match(COMMA));
        return types;
    }

    TypeRef parseType() {
        SourceLocation loc = parser.location();

        // 数组类型: [T]
        if (parser.match(LBRACKET)) {
            TypeRef element = parseType();
            parser.expect(RBRACKET, "Expected ']' after array element type");
            return new ArrayType(loc, element);
        }

        String name = parser.expect(IDENTIFIER, "Expected type name").getLexeme();

        // 泛型参数
        if (parser.match(LT)) {
            List<TypeRef> typeArgs = new ArrayList<TypeRef>();
            do {
                typeArgs.add(parseType());
            } while (parser.match(COMMA));
            parser.expectCloseAngle("Expected '>' after generic type arguments");
            return new GenericType(loc, name, typeArgs);
        }

        return new SimpleType(loc, name);
    }
}
