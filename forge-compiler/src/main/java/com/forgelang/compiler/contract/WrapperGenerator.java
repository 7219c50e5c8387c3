package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.Path;
import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.Visibility;
import com.forgelang.compiler.ast.decl.*;
import com.forgelang.compiler.ast.expr.*;
import com.forgelang.compiler.ast.pattern.IdentPattern;
import com.forgelang.compiler.ast.pattern.Pattern;
import com.forgelang.compiler.ast.stmt.Block;
import com.forgelang.compiler.ast.stmt.ExpressionStmt;
import com.forgelang.compiler.ast.stmt.Statement;
import com.forgelang.compiler.ast.type.PathType;
import com.forgelang.compiler.ast.type.TupleType;
import com.forgelang.compiler.ast.type.TypeRef;
import com.forgelang.compiler.ast.pattern.TuplePattern;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 导出包装函数生成器
 *
 * <p>为每个公开的非 {@code new} 方法生成：</p>
 * <pre>
 * #[no_mangle]
 * pub unsafe fn increment(arg_len: u32) -&gt; u32 {
 *     abi::wrap_call(arg_len, |(n): (i32)| counter::STATE.increment(n))
 * }
 * </pre>
 * <p>包装函数本身不做任何编解码，参数解码、调用结果编码都交给桥接函数。</p>
 */
public class WrapperGenerator {

    private static final Logger LOG = Logger.getLogger(WrapperGenerator.class.getName());

    private static final SourceLocation GENERATED = SourceLocation.UNKNOWN;

    private final ExpansionOptions options;

    public WrapperGenerator(ExpansionOptions options) {
        this.options = options;
    }

    /**
     * 按块、再按方法的出现顺序生成包装函数
     *
     * @param blocks   已移除 new 的行为块
     * @param handle   单例状态句柄
     * @param warnings 收集无名参数、导出名冲突等警告
     */
    public List<WrapperFunction> generate(List<ImplBlock> blocks, StateHandle handle,
                                          Set<String> moduleTypes, List<ContractDiagnostic> warnings) {
        TypeQualifier qualifier = new TypeQualifier(handle, moduleTypes);
        List<WrapperFunction> wrappers = new ArrayList<WrapperFunction>();
        Map<String, FnDecl> exported = new LinkedHashMap<String, FnDecl>();

        for (ImplBlock block : blocks) {
            for (FnDecl method : block.getMethods()) {
                if (!method.isPublic() || ContractParser.CONSTRUCTOR_NAME.equals(method.getName())) {
                    continue;
                }

                FnDecl previous = exported.get(method.getName());
                if (previous != null) {
                    warnings.add(ContractDiagnostic.warning(DiagnosticKind.DUPLICATE_EXPORT,
                            "Exported symbol '" + method.getName() + "' is already generated for the method at "
                                    + previous.getNameLocation() + ".",
                            method.getNameLocation()));
                } else {
                    exported.put(method.getName(), method);
                }

                wrappers.add(generateWrapper(block, method, handle, qualifier, warnings));
            }
        }

        LOG.fine("Generated " + wrappers.size() + " export wrapper(s) for module '" + handle.getModuleName() + "'");
        return wrappers;
    }

    /**
     * 不限定模块内声明的类型，签名中只有 Self 被替换为 {@code module::Type}
     */
    public List<WrapperFunction> generate(List<ImplBlock> blocks, StateHandle handle,
                                          List<ContractDiagnostic> warnings) {
        return generate(blocks, handle, new HashSet<String>(), warnings);
    }

    private WrapperFunction generateWrapper(ImplBlock block, FnDecl method, StateHandle handle,
                                            TypeQualifier qualifier, List<ContractDiagnostic> warnings) {
        // 参数绑定：跳过接收者，无法命名的模式按位置命名为 arg{i}，与已有参数名冲突时追加 _1、_2…
        List<WrapperFunction.ArgumentBinding> bindings = new ArrayList<WrapperFunction.ArgumentBinding>();
        List<Parameter> params = method.getParams();
        Set<String> usedNames = new HashSet<String>();
        for (Parameter param : params) {
            if (!param.isReceiver() && param.getName() != null) {
                usedNames.add(param.getName());
            }
        }
        for (int i = 0; i < params.size(); i++) {
            Parameter param = params.get(i);
            if (param.isReceiver()) {
                continue;
            }
            String name = param.getName();
            boolean synthesized = name == null;
            if (synthesized) {
                name = freshName("arg" + i, usedNames);
                warnings.add(ContractDiagnostic.warning(DiagnosticKind.UNNAMED_PARAMETER,
                        "Parameter " + i + " of '" + method.getName() + "' has no simple name; it is bound as '"
                                + name + "' in the export wrapper.",
                        param.getLocation()));
            }
            bindings.add(new WrapperFunction.ArgumentBinding(name, qualifier.qualify(param.getType()), synthesized));
        }

        WrapperFunction.DispatchKind dispatch;
        Expression call;
        Parameter receiver = method.getReceiver();
        if (receiver == null) {
            dispatch = WrapperFunction.DispatchKind.STATIC;
            call = new CallExpr(GENERATED, new PathExpr(GENERATED, handle.typeMemberPath(method.getName())),
                    argumentExpressions(bindings));
        } else if (block.hasCapability()) {
            dispatch = WrapperFunction.DispatchKind.CAPABILITY;
            List<Expression> args = new ArrayList<Expression>();
            args.add(receiverArgument(receiver.getReceiverKind(), handle));
            args.addAll(argumentExpressions(bindings));
            call = new CallExpr(GENERATED,
                    new PathExpr(GENERATED, handle.capabilityMemberPath(block.getCapability(), method.getName())),
                    args);
        } else {
            dispatch = WrapperFunction.DispatchKind.STATE;
            call = new MethodCallExpr(GENERATED, new PathExpr(GENERATED, handle.statePath()), method.getName(),
                    new ArrayList<TypeRef>(), argumentExpressions(bindings));
        }

        FnDecl declaration = buildDeclaration(method, bindings, call);
        return new WrapperFunction(method.getName(), method.getName(), dispatch,
                block.hasCapability() ? block.getCapability() : null,
                bindings, qualifier.qualify(method.getReturnType()), declaration, method.getNameLocation());
    }

    private static String freshName(String base, Set<String> usedNames) {
        String name = base;
        for (int suffix = 1; usedNames.contains(name); suffix++) {
            name = base + "_" + suffix;
        }
        usedNames.add(name);
        return name;
    }

    /**
     * {@code &mut module::STATE}、{@code &module::STATE} 或按值传递
     */
    private Expression receiverArgument(Parameter.ReceiverKind kind, StateHandle handle) {
        Expression state = new PathExpr(GENERATED, handle.statePath());
        switch (kind) {
            case REF_MUT:
                return new UnaryExpr(GENERATED, UnaryExpr.UnaryOp.REF_MUT, state);
            case REF:
                return new UnaryExpr(GENERATED, UnaryExpr.UnaryOp.REF, state);
            default:
                return state;
        }
    }

    private List<Expression> argumentExpressions(List<WrapperFunction.ArgumentBinding> bindings) {
        List<Expression> args = new ArrayList<Expression>(bindings.size());
        for (WrapperFunction.ArgumentBinding binding : bindings) {
            args.add(PathExpr.of(GENERATED, binding.getName()));
        }
        return args;
    }

    private FnDecl buildDeclaration(FnDecl method, List<WrapperFunction.ArgumentBinding> bindings, Expression call) {
        // |(a, b): (A, B)| call
        List<Pattern> patterns = new ArrayList<Pattern>(bindings.size());
        List<TypeRef> types = new ArrayList<TypeRef>(bindings.size());
        for (WrapperFunction.ArgumentBinding binding : bindings) {
            patterns.add(new IdentPattern(GENERATED, binding.getName(), false));
            types.add(binding.getType());
        }
        List<ClosureExpr.ClosureParam> closureParams = new ArrayList<ClosureExpr.ClosureParam>();
        closureParams.add(new ClosureExpr.ClosureParam(GENERATED,
                new TuplePattern(GENERATED, patterns), new TupleType(GENERATED, types)));
        ClosureExpr closure = new ClosureExpr(GENERATED, false, closureParams, null, call);

        // abi::wrap_call(arg_len, closure)
        String sizeParameter = options.getSizeParameter();
        List<Expression> bridgeArgs = new ArrayList<Expression>();
        bridgeArgs.add(PathExpr.of(GENERATED, sizeParameter));
        bridgeArgs.add(closure);
        Expression bridgeCall = new CallExpr(GENERATED,
                new PathExpr(GENERATED, Path.of(GENERATED, options.getBridgeFunctionSegments())), bridgeArgs);

        List<Statement> statements = new ArrayList<Statement>();
        statements.add(new ExpressionStmt(GENERATED, bridgeCall, false));

        List<Attribute> attributes = new ArrayList<Attribute>();
        attributes.add(new Attribute(GENERATED, Path.of(GENERATED, options.getExportAttribute()), null));

        List<Parameter> params = new ArrayList<Parameter>();
        params.add(Parameter.typed(GENERATED, new IdentPattern(GENERATED, sizeParameter, false),
                PathType.of(GENERATED, options.getSizeType())));

        FnDecl declaration = new FnDecl(method.getLocation(), attributes, Visibility.PUBLIC, true,
                method.getName(), params, PathType.of(GENERATED, options.getSizeType()),
                new Block(GENERATED, statements));
        declaration.setNameLocation(method.getNameLocation());
        return declaration;
    }
}
