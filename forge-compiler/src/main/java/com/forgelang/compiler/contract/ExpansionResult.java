package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.decl.SourceFile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 展开结果：成功时包含输出树和警告，失败时只有诊断，没有任何部分输出
 */
public final class ExpansionResult {
    private final SourceFile output;
    private final List<ExpandedContract> contracts;
    private final List<ContractDiagnostic> diagnostics;

    private ExpansionResult(SourceFile output, List<ExpandedContract> contracts,
                            List<ContractDiagnostic> diagnostics) {
        this.output = output;
        this.contracts = Collections.unmodifiableList(contracts);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public static ExpansionResult success(SourceFile output, List<ExpandedContract> contracts,
                                          List<ContractDiagnostic> warnings) {
        return new ExpansionResult(output, contracts, warnings);
    }

    public static ExpansionResult failure(List<ContractDiagnostic> diagnostics) {
        return new ExpansionResult(null, Collections.<ExpandedContract>emptyList(), diagnostics);
    }

    public static ExpansionResult failure(ContractDiagnostic error) {
        return failure(Collections.singletonList(error));
    }

    public boolean isSuccess() {
        return output != null;
    }

    /**
     * @throws IllegalStateException 展开失败时
     */
    public SourceFile getOutput() {
        if (output == null) {
            throw new IllegalStateException("Expansion failed: " + getErrors());
        }
        return output;
    }

    public List<ExpandedContract> getContracts() {
        return contracts;
    }

    public List<ContractDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<ContractDiagnostic> getErrors() {
        return filter(ContractDiagnostic.Severity.ERROR);
    }

    public List<ContractDiagnostic> getWarnings() {
        return filter(ContractDiagnostic.Severity.WARNING);
    }

    public boolean hasDiagnostic(DiagnosticKind kind) {
        for (ContractDiagnostic d : diagnostics) {
            if (d.getKind() == kind) return true;
        }
        return false;
    }

    private List<ContractDiagnostic> filter(ContractDiagnostic.Severity severity) {
        List<ContractDiagnostic> result = new ArrayList<ContractDiagnostic>();
        for (ContractDiagnostic d : diagnostics) {
            if (d.getSeverity() == severity) {
                result.add(d);
            }
        }
        return result;
    }
}
