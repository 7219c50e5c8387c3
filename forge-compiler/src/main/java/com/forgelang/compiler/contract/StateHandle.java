package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.Path;
import com.forgelang.compiler.ast.PathSegment;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.decl.StaticDecl;

import java.util.ArrayList;
import java.util.List;

/**
 * 单例状态的访问句柄
 *
 * <p>包装函数生成在模块之外，所有对状态和合约类型的引用都经由此句柄构造，
 * 以模块名限定：{@code module::STATE}、{@code module::Type::method}。</p>
 */
public final class StateHandle {
    private final String moduleName;
    private final String stateName;
    private final String typeName;
    private final StaticDecl declaration;

    StateHandle(String moduleName, String stateName, String typeName, StaticDecl declaration) {
        this.moduleName = moduleName;
        this.stateName = stateName;
        this.typeName = typeName;
        this.declaration = declaration;
    }

    public String getModuleName() {
        return moduleName;
    }

    public String getStateName() {
        return stateName;
    }

    public String getTypeName() {
        return typeName;
    }

    public StaticDecl getDeclaration() {
        return declaration;
    }

    /** {@code module::STATE} */
    public Path statePath() {
        return Path.of(SourceLocation.UNKNOWN, moduleName, stateName);
    }

    /** {@code module::Type::member} */
    public Path typeMemberPath(String member) {
        return Path.of(SourceLocation.UNKNOWN, moduleName, typeName, member);
    }

    /**
     * 能力标签成员路径。单段标签按模块内声明处理并加模块前缀，多段路径原样使用。
     */
    public Path capabilityMemberPath(Path capability, String member) {
        List<PathSegment> segments = new ArrayList<PathSegment>();
        if (capability.getSegments().size() == 1) {
            segments.add(new PathSegment(moduleName));
        }
        for (PathSegment segment : capability.getSegments()) {
            segments.add(new PathSegment(segment.getName(), segment.getGenericArgs(), true));
        }
        segments.add(new PathSegment(member));
        return new Path(SourceLocation.UNKNOWN, segments);
    }

    @Override
    public String toString() {
        return moduleName + "::" + stateName + ": " + typeName;
    }
}
