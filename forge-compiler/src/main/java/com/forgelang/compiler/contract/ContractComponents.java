package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.decl.FnDecl;
import com.forgelang.compiler.ast.decl.ImplBlock;
import com.forgelang.compiler.ast.decl.ModuleDecl;
import com.forgelang.compiler.ast.decl.StructDecl;
import com.forgelang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * 合约模块解析结果：公开类型、行为块（已移除 new）以及构造表达式
 */
public final class ContractComponents {
    private final ModuleDecl module;
    private final StructDecl publicType;
    private final List<ImplBlock> blocks;
    private final FnDecl constructorMethod;     // 第一个 new，可能为 null
    private final Expression constructor;       // 其首条表达式语句，可能为 null
    private final List<ContractDiagnostic> warnings;

    ContractComponents(ModuleDecl module, StructDecl publicType, List<ImplBlock> blocks,
                       FnDecl constructorMethod, Expression constructor,
                       List<ContractDiagnostic> warnings) {
        this.module = module;
        this.publicType = publicType;
        this.blocks = Collections.unmodifiableList(blocks);
        this.constructorMethod = constructorMethod;
        this.constructor = constructor;
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public ModuleDecl getModule() {
        return module;
    }

    public String getTypeName() {
        return publicType.getName();
    }

    public List<ImplBlock> getBlocks() {
        return blocks;
    }

    public FnDecl getConstructorMethod() {
        return constructorMethod;
    }

    public boolean hasConstructorMethod() {
        return constructorMethod != null;
    }

    public Expression getConstructor() {
        return constructor;
    }

    public List<ContractDiagnostic> getWarnings() {
        return warnings;
    }
}
