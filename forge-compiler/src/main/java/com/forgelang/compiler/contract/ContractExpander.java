package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.decl.Attribute;
import com.forgelang.compiler.ast.decl.ImplBlock;
import com.forgelang.compiler.ast.decl.Item;
import com.forgelang.compiler.ast.decl.ModuleDecl;
import com.forgelang.compiler.ast.decl.SourceFile;
import com.forgelang.compiler.ast.decl.StructDecl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 合约展开流水线：模块解析 → 状态合成 → 包装函数生成
 *
 * <p>状态声明追加在模块内部，包装函数紧跟在模块之后输出到文件顶层；触发属性被消费。
 * 任一模块出现终止性错误时整个文件失败，不产生输出。输入树会被就地修改，
 * 失败后调用方应丢弃它。</p>
 */
public class ContractExpander {

    private static final Logger LOG = Logger.getLogger(ContractExpander.class.getName());

    private final ExpansionOptions options;

    public ContractExpander(ExpansionOptions options) {
        this.options = options;
    }

    public ContractExpander() {
        this(new ExpansionOptions());
    }

    public ExpansionOptions getOptions() {
        return options;
    }

    /**
     * 展开文件中所有带触发属性的顶层模块，其余项原样保留
     */
    public ExpansionResult expand(SourceFile file) {
        List<ContractDiagnostic> warnings = new ArrayList<ContractDiagnostic>();
        List<ExpandedContract> contracts = new ArrayList<ExpandedContract>();
        List<Item> items = new ArrayList<Item>();

        try {
            for (Item item : file.getItems()) {
                items.add(item);
                if (item instanceof ModuleDecl && isContract(item)) {
                    ExpandedContract contract = expandModule((ModuleDecl) item, warnings);
                    contracts.add(contract);
                    for (WrapperFunction wrapper : contract.getWrappers()) {
                        items.add(wrapper.getDeclaration());
                    }
                } else if (item instanceof ImplBlock && isContract(item)) {
                    LOG.fine("Skipping impl-level '" + options.getTriggerAttribute() + "' attribute at "
                            + item.getLocation() + "; only modules are expanded");
                }
            }
        } catch (ContractException e) {
            return fail(file, e, warnings);
        }

        if (contracts.isEmpty()) {
            warnings.add(ContractDiagnostic.warning(DiagnosticKind.NO_CONTRACT_MODULE,
                    "No module carries the #[" + options.getTriggerAttribute() + "] attribute; nothing to expand.",
                    new SourceLocation(file.getFileName(), 1, 1, 0, 0)));
        }

        SourceFile output = new SourceFile(file.getLocation(), file.getFileName(), items);
        return finish(output, contracts, warnings);
    }

    /**
     * 将单个模块作为合约展开（不检查触发属性），输出为模块加其包装函数
     */
    public ExpansionResult expand(ModuleDecl module) {
        List<ContractDiagnostic> warnings = new ArrayList<ContractDiagnostic>();
        SourceLocation location = module.getLocation();
        SourceFile input = new SourceFile(location, location.getFile(), Collections.<Item>singletonList(module));
        ExpandedContract contract;
        try {
            contract = expandModule(module, warnings);
        } catch (ContractException e) {
            return fail(input, e, warnings);
        }

        List<Item> items = new ArrayList<Item>();
        items.add(module);
        for (WrapperFunction wrapper : contract.getWrappers()) {
            items.add(wrapper.getDeclaration());
        }
        SourceFile output = new SourceFile(location, location.getFile(), items);
        return finish(output, Collections.singletonList(contract), warnings);
    }

    private ExpandedContract expandModule(ModuleDecl module, List<ContractDiagnostic> warnings) {
        LOG.fine("Expanding contract module '" + module.getName() + "' at " + module.getLocation());

        ContractComponents components = new ContractParser().parse(module);
        warnings.addAll(components.getWarnings());

        StateHandle state = new StateSynthesizer(options).synthesize(components);

        Set<String> moduleTypes = new HashSet<String>();
        for (Item item : module.getItems()) {
            if (item instanceof StructDecl) {
                moduleTypes.add(item.getName());
            }
        }
        List<WrapperFunction> wrappers = new WrapperGenerator(options)
                .generate(components.getBlocks(), state, moduleTypes, warnings);

        consumeTrigger(module);
        return new ExpandedContract(module, state, wrappers);
    }

    private boolean isContract(Item item) {
        return item.hasAttribute(options.getTriggerAttribute());
    }

    private void consumeTrigger(ModuleDecl module) {
        List<Attribute> attributes = module.getAttributes();
        for (int i = attributes.size() - 1; i >= 0; i--) {
            if (attributes.get(i).hasSimpleName(options.getTriggerAttribute())) {
                attributes.remove(i);
            }
        }
    }

    private ExpansionResult finish(SourceFile output, List<ExpandedContract> contracts,
                                   List<ContractDiagnostic> warnings) {
        if (options.isStrict() && !warnings.isEmpty()) {
            List<ContractDiagnostic> errors = new ArrayList<ContractDiagnostic>();
            for (ContractDiagnostic warning : warnings) {
                errors.add(warning.promote());
            }
            LOG.fine("Strict mode: " + errors.size() + " warning(s) promoted to errors in " + output.getFileName());
            return ExpansionResult.failure(errors);
        }
        LOG.fine("Expanded " + contracts.size() + " contract module(s) in " + output.getFileName()
                + " with " + warnings.size() + " warning(s)");
        return ExpansionResult.success(output, contracts, warnings);
    }

    private ExpansionResult fail(SourceFile file, ContractException e, List<ContractDiagnostic> warnings) {
        LOG.log(Level.FINE, "Expansion of " + file.getFileName() + " failed", e);
        List<ContractDiagnostic> diagnostics = new ArrayList<ContractDiagnostic>();
        diagnostics.add(e.getDiagnostic());
        diagnostics.addAll(warnings);
        return ExpansionResult.failure(diagnostics);
    }
}
