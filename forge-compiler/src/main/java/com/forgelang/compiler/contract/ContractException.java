package com.forgelang.compiler.contract;

/**
 * 合约展开的终止性错误，携带一条错误级别的诊断
 */
public class ContractException extends RuntimeException {

    private final ContractDiagnostic diagnostic;

    public ContractException(ContractDiagnostic diagnostic) {
        super(diagnostic.format());
        this.diagnostic = diagnostic;
    }

    public ContractDiagnostic getDiagnostic() {
        return diagnostic;
    }

    public DiagnosticKind getKind() {
        return diagnostic.getKind();
    }
}
