package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.Path;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.decl.FnDecl;
import com.forgelang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 一个导出包装函数及其元数据
 */
public final class WrapperFunction {

    /**
     * 调用分派方式
     */
    public enum DispatchKind {
        /** {@code module::STATE.method(..)} */
        STATE,
        /** {@code module::Tag::method(&mut module::STATE, ..)} */
        CAPABILITY,
        /** {@code module::Type::method(..)} */
        STATIC
    }

    /**
     * 解码后的参数绑定
     */
    public static final class ArgumentBinding {
        private final String name;
        private final TypeRef type;
        private final boolean synthesized;

        ArgumentBinding(String name, TypeRef type, boolean synthesized) {
            this.name = name;
            this.type = type;
            this.synthesized = synthesized;
        }

        public String getName() {
            return name;
        }

        public TypeRef getType() {
            return type;
        }

        /** 名称是否由位置生成（原模式无法命名） */
        public boolean isSynthesized() {
            return synthesized;
        }
    }

    private final String exportName;
    private final String methodName;
    private final DispatchKind dispatch;
    private final Path capability;
    private final List<ArgumentBinding> arguments;
    private final TypeRef returnType;
    private final FnDecl declaration;
    private final SourceLocation sourceLocation;

    WrapperFunction(String exportName, String methodName, DispatchKind dispatch, Path capability,
                    List<ArgumentBinding> arguments, TypeRef returnType, FnDecl declaration,
                    SourceLocation sourceLocation) {
        this.exportName = exportName;
        this.methodName = methodName;
        this.dispatch = dispatch;
        this.capability = capability;
        this.arguments = Collections.unmodifiableList(arguments);
        this.returnType = returnType;
        this.declaration = declaration;
        this.sourceLocation = sourceLocation;
    }

    public String getExportName() {
        return exportName;
    }

    public String getMethodName() {
        return methodName;
    }

    public DispatchKind getDispatch() {
        return dispatch;
    }

    /** 仅 CAPABILITY 分派有值 */
    public Path getCapability() {
        return capability;
    }

    public List<ArgumentBinding> getArguments() {
        return arguments;
    }

    /** 方法声明的返回类型，无返回值时为 null */
    public TypeRef getReturnType() {
        return returnType;
    }

    public FnDecl getDeclaration() {
        return declaration;
    }

    public SourceLocation getSourceLocation() {
        return sourceLocation;
    }
}
