package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.Visibility;
import com.forgelang.compiler.ast.decl.Attribute;
import com.forgelang.compiler.ast.decl.ModuleDecl;
import com.forgelang.compiler.ast.decl.StaticDecl;
import com.forgelang.compiler.ast.expr.Expression;
import com.forgelang.compiler.ast.type.PathType;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 单例状态合成器
 *
 * <p>将构造表达式中的 {@code Self} 替换为类型名后，生成
 * {@code pub(crate) static mut STATE: T = expr;} 并追加到模块末尾。</p>
 */
public class StateSynthesizer {

    private static final Logger LOG = Logger.getLogger(StateSynthesizer.class.getName());

    static final String MISSING_CONSTRUCTOR_MESSAGE =
            "The struct must implement a `new` function for initializing the contract state.";
    static final String CONSTRUCTOR_NOT_EXPRESSION_MESSAGE =
            "The first statement of `new` must be an expression that constructs the contract state.";

    private final ExpansionOptions options;

    public StateSynthesizer(ExpansionOptions options) {
        this.options = options;
    }

    /**
     * @throws StateException 没有 new（或 new 为空），或 new 的首条语句不是表达式
     */
    public StateHandle synthesize(ContractComponents components) {
        ModuleDecl module = components.getModule();
        String typeName = components.getTypeName();

        Expression constructor = components.getConstructor();
        if (constructor == null) {
            // 空的 new 与缺少 new 同样处理
            if (components.hasConstructorMethod()
                    && !components.getConstructorMethod().getBody().isEmpty()) {
                throw new StateException(DiagnosticKind.MISSING_CONSTRUCTOR, CONSTRUCTOR_NOT_EXPRESSION_MESSAGE,
                        components.getConstructorMethod().getNameLocation());
            }
            throw new StateException(DiagnosticKind.MISSING_CONSTRUCTOR, MISSING_CONSTRUCTOR_MESSAGE,
                    module.getNameLocation());
        }

        SelfReferenceRewriter rewriter = new SelfReferenceRewriter(typeName);
        int replaced = rewriter.rewrite(constructor);
        List<SourceLocation> residuals = SelfReferenceRewriter.findResiduals(constructor);
        if (!residuals.isEmpty()) {
            throw new IllegalStateException("Self reference survived rewriting at " + residuals);
        }

        StaticDecl state = new StaticDecl(SourceLocation.UNKNOWN, new ArrayList<Attribute>(), Visibility.CRATE,
                false, true, options.getStateName(), PathType.of(SourceLocation.UNKNOWN, typeName), constructor);
        module.getItems().add(state);

        LOG.fine("Synthesized state " + options.getStateName() + ": " + typeName
                + " (" + replaced + " Self reference(s) rewritten)");
        return new StateHandle(module.getName(), options.getStateName(), typeName, state);
    }
}
