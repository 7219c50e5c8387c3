package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.decl.ModuleDecl;

import java.util.Collections;
import java.util.List;

/**
 * 单个合约模块的展开结果
 */
public final class ExpandedContract {
    private final ModuleDecl module;
    private final StateHandle state;
    private final List<WrapperFunction> wrappers;

    ExpandedContract(ModuleDecl module, StateHandle state, List<WrapperFunction> wrappers) {
        this.module = module;
        this.state = state;
        this.wrappers = Collections.unmodifiableList(wrappers);
    }

    public ModuleDecl getModule() {
        return module;
    }

    public String getModuleName() {
        return module.getName();
    }

    public String getTypeName() {
        return state.getTypeName();
    }

    public StateHandle getState() {
        return state;
    }

    public List<WrapperFunction> getWrappers() {
        return wrappers;
    }
}
