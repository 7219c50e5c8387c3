package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.SourceLocation;

/**
 * 模块结构错误：缺少或存在多个公开类型
 */
public class StructuralException extends ContractException {

    public StructuralException(DiagnosticKind kind, String message, SourceLocation location) {
        super(ContractDiagnostic.error(kind, message, location));
    }
}
