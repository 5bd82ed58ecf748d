package com.ourolang.compiler.analysis.types;

import com.ourolang.compiler.analysis.SymbolError;
import com.ourolang.compiler.analysis.SymbolTable;
import com.ourolang.compiler.ast.type.ArrayType;
import com.ourolang.compiler.ast.type.GenericType;
import com.ourolang.compiler.ast.type.SimpleType;
import com.ourolang.compiler.ast.type.TypeRef;
import com.ourolang.compiler.ast.type.TypeRefVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 类型解析器：将 AST TypeRef / 类型名解析为 {@link TypeDefinition}。
 *
 * <p>按名字查找时先走符号表的作用域链（用户类型、泛型参数、原始类型），
 * 再查原始类型别名（bool、long 等）。</p>
 */
public final class TypeResolver {

    private final SymbolTable symbolTable;

    public TypeResolver(SymbolTable symbolTable) {
        this.symbolTable = symbolTable;
    }

    /**
     * 按名字解析类型，找不到返回 null
     */
    public TypeDefinition resolve(String name) {
        TypeDefinition found = symbolTable.resolveType(name);
        if (found != null) {
            return found;
        }
        return PrimitiveTypes.fromName(name);
    }

    /**
     * 解析类型引用；失败时把错误追加到 errors 并返回 {@link PrimitiveTypes#ERROR}
     */
    public TypeDefinition resolve(TypeRef ref, List<SymbolError> errors) {
        return ref.accept(new Visitor(errors));
    }

    /**
     * 解析类型引用，失败返回 null（不报告错误）
     */
    public TypeDefinition resolveOrNull(TypeRef ref) {
        List<SymbolError> errors = new ArrayList<SymbolError>();
        TypeDefinition result = resolve(ref, errors);
        return errors.isEmpty() ? result : null;
    }

    private final class Visitor implements TypeRefVisitor<TypeDefinition> {
        private final List<SymbolError> errors;

        Visitor(List<SymbolError> errors) {
            this.errors = errors;
        }

        @Override
        public TypeDefinition visitSimple(SimpleType type) {
            TypeDefinition found = resolve(type.getName());
            if (found == null && "Array".equals(type.getName())) {
                found = PrimitiveTypes.ARRAY;
            }
            if (found == null) {
                errors.add(SymbolError.undefinedType(type.getName(), type.getLocation()));
                return PrimitiveTypes.ERROR;
            }
            // 裸 Array 没有元素类型
            if (found == PrimitiveTypes.ARRAY) {
                errors.add(arityError(found, 0, type));
                return PrimitiveTypes.ERROR;
            }
            return found;
        }

        @Override
        public TypeDefinition visitArray(ArrayType type) {
            TypeDefinition element = type.getElementType().accept(this);
            return element.isError() ? element : TypeDefinition.arrayOf(element);
        }

        @Override
        public TypeDefinition visitGeneric(GenericType type) {
            TypeDefinition base = "Array".equals(type.getName()) ? PrimitiveTypes.ARRAY : resolve(type.getName());
            if (base == null) {
                errors.add(SymbolError.undefinedType(type.getName(), type.getLocation()));
                return PrimitiveTypes.ERROR;
            }

            List<TypeDefinition> args = new ArrayList<TypeDefinition>();
            boolean failed = false;
            for (TypeRef arg : type.getTypeArgs()) {
                TypeDefinition resolved = arg.accept(this);
                failed |= resolved.isError();
                args.add(resolved);
            }

            int expected = base.getTypeParameters().size();
            if (expected != args.size()) {
                errors.add(arityError(base, args.size(), type));
                return PrimitiveTypes.ERROR;
            }
            return failed ? PrimitiveTypes.ERROR : base.instantiate(args);
        }

        private SymbolError arityError(TypeDefinition base, int given, TypeRef ref) {
            return SymbolError.invalidOperation("Type '" + base.getName() + "' expects "
                    + base.getTypeParameters().size() + " type argument(s) but got " + given, ref.getLocation());
        }
    }
}
