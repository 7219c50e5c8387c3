package com.forgelang.compiler.contract;

/**
 * 诊断种类
 */
public enum DiagnosticKind {
    // 终止性错误
    MISSING_PUBLIC_TYPE("MissingPublicType"),
    MULTIPLE_PUBLIC_TYPES("MultiplePublicTypes"),
    MISSING_CONSTRUCTOR("MissingConstructor"),
    PARSE_ERROR("ParseError"),

    // 警告（严格模式下提升为错误）
    DUPLICATE_CONSTRUCTOR("DuplicateConstructor"),
    CONSTRUCTOR_STATEMENTS_IGNORED("ConstructorStatementsIgnored"),
    UNNAMED_PARAMETER("UnnamedParameter"),
    DUPLICATE_EXPORT("DuplicateExport"),
    NO_CONTRACT_MODULE("NoContractModule");

    private final String displayName;

    DiagnosticKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
