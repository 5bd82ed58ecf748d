package com.ourolang.compiler.ast.decl;

import com.ourolang.compiler.ast.AstVisitor;
import com.ourolang.compiler.ast.Modifier;
import com.ourolang.compiler.ast.SourceLocation;
import com.ourolang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 枚举声明
 */
public class EnumDecl extends TypeDecl {
    private final TypeRef rawType;  // 可选，enum E: Int
    private final List<EnumCase> cases;

    public EnumDecl(SourceLocation location, List<Modifier> modifiers, String name,
                    TypeRef rawType, List<EnumCase> cases, List<FunctionDecl> methods) {
        super(location, modifiers, name, null, null, null, methods);
        this.rawType = rawType;
        this.cases = cases != null ? cases : Collections.<EnumCase>emptyList();
    }

    public TypeRef getRawType() {
        return rawType;
    }

    public List<EnumCase> getCases() {
        return cases;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumDecl(this, context);
    }
}
