package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.SourceLocation;

/**
 * 状态合成错误：没有可用的构造表达式
 */
public class StateException extends ContractException {

    public StateException(DiagnosticKind kind, String message, SourceLocation location) {
        super(ContractDiagnostic.error(kind, message, location));
    }
}
