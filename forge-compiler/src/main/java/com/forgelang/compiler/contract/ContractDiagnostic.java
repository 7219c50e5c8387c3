package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.SourceLocation;

/**
 * 展开过程产生的一条诊断
 */
public final class ContractDiagnostic {

    public enum Severity {
        ERROR,
        WARNING
    }

    private final Severity severity;
    private final DiagnosticKind kind;
    private final String message;
    private final SourceLocation location;

    public ContractDiagnostic(Severity severity, DiagnosticKind kind, String message, SourceLocation location) {
        this.severity = severity;
        this.kind = kind;
        this.message = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public static ContractDiagnostic error(DiagnosticKind kind, String message, SourceLocation location) {
        return new ContractDiagnostic(Severity.ERROR, kind, message, location);
    }

    public static ContractDiagnostic warning(DiagnosticKind kind, String message, SourceLocation location) {
        return new ContractDiagnostic(Severity.WARNING, kind, message, location);
    }

    public Severity getSeverity() {
        return severity;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * 严格模式：同一诊断以错误级别重新发出
     */
    public ContractDiagnostic promote() {
        if (severity == Severity.ERROR) return this;
        return new ContractDiagnostic(Severity.ERROR, kind, message, location);
    }

    /**
     * {@code file:line:column: error[Kind]: message}
     */
    public String format() {
        return location + ": " + severity.name().toLowerCase() + "[" + kind.getDisplayName() + "]: " + message;
    }

    @Override
    public String toString() {
        return format();
    }
}
