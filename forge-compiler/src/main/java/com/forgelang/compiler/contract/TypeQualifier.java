package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.AstVisitor;
import com.forgelang.compiler.ast.Path;
import com.forgelang.compiler.ast.PathSegment;
import com.forgelang.compiler.ast.type.ArrayType;
import com.forgelang.compiler.ast.type.PathType;
import com.forgelang.compiler.ast.type.RefType;
import com.forgelang.compiler.ast.type.TupleType;
import com.forgelang.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 复制方法签名中的类型，使其能在模块之外使用
 *
 * <p>{@code Self} 变为 {@code module::Type}，模块内声明的类型加模块前缀，
 * {@code self::X} 变为 {@code module::X}，{@code super::X} 去掉前缀。原类型不被修改；
 * 数组长度表达式不复制，与原节点共享。</p>
 */
class TypeQualifier implements AstVisitor<TypeRef, Void> {

    private final StateHandle handle;
    private final Set<String> moduleTypes;

    TypeQualifier(StateHandle handle, Set<String> moduleTypes) {
        this.handle = handle;
        this.moduleTypes = moduleTypes;
    }

    TypeRef qualify(TypeRef type) {
        return type == null ? null : type.accept(this, null);
    }

    @Override
    public TypeRef visitPathType(PathType node, Void ctx) {
        return new PathType(node.getLocation(), qualifyPath(node.getPath()));
    }

    @Override
    public TypeRef visitRefType(RefType node, Void ctx) {
        return new RefType(node.getLocation(), node.isMutable(), qualify(node.getTarget()));
    }

    @Override
    public TypeRef visitTupleType(TupleType node, Void ctx) {
        return new TupleType(node.getLocation(), qualifyAll(node.getElements()));
    }

    @Override
    public TypeRef visitArrayType(ArrayType node, Void ctx) {
        return new ArrayType(node.getLocation(), qualify(node.getElementType()), node.getLength());
    }

    private List<TypeRef> qualifyAll(List<TypeRef> types) {
        List<TypeRef> result = new ArrayList<TypeRef>(types.size());
        for (TypeRef type : types) {
            result.add(qualify(type));
        }
        return result;
    }

    private Path qualifyPath(Path path) {
        List<PathSegment> source = path.getSegments();
        List<PathSegment> segments = new ArrayList<PathSegment>(source.size() + 1);

        String head = source.get(0).getName();
        int start = 0;
        if ("self".equals(head)) {
            segments.add(new PathSegment(handle.getModuleName()));
            start = 1;
        } else if ("super".equals(head)) {
            start = 1;
        } else if (Path.SELF_TYPE.equals(head) || moduleTypes.contains(head)) {
            segments.add(new PathSegment(handle.getModuleName()));
        }

        for (int i = start; i < source.size(); i++) {
            PathSegment segment = source.get(i);
            String name = Path.SELF_TYPE.equals(segment.getName()) ? handle.getTypeName() : segment.getName();
            segments.add(new PathSegment(name, qualifyAll(segment.getGenericArgs()), segment.isTurbofish()));
        }
        return new Path(path.getLocation(), segments);
    }
}
