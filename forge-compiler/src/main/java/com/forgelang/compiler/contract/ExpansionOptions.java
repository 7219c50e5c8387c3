package com.forgelang.compiler.contract;

/**
 * 合约展开配置
 */
public class ExpansionOptions {
    private String triggerAttribute = "contract";
    private String stateName = "STATE";
    private String bridgeFunction = "abi::wrap_call";
    private String exportAttribute = "no_mangle";
    private String sizeType = "u32";
    private String sizeParameter = "arg_len";
    private boolean strict = false;

    public ExpansionOptions() {
    }

    /** 触发展开的模块属性，按最后一段名称匹配 */
    public String getTriggerAttribute() {
        return triggerAttribute;
    }

    public void setTriggerAttribute(String triggerAttribute) {
        this.triggerAttribute = requireIdentifier("triggerAttribute", triggerAttribute);
    }

    /** 单例状态的符号名 */
    public String getStateName() {
        return stateName;
    }

    public void setStateName(String stateName) {
        this.stateName = requireIdentifier("stateName", stateName);
    }

    /** 运行时桥接函数路径，如 {@code abi::wrap_call} */
    public String getBridgeFunction() {
        return bridgeFunction;
    }

    public void setBridgeFunction(String bridgeFunction) {
        if (bridgeFunction == null) {
            throw new IllegalArgumentException("bridgeFunction must not be null");
        }
        for (String segment : bridgeFunction.split("::", -1)) {
            requireIdentifier("bridgeFunction", segment);
        }
        this.bridgeFunction = bridgeFunction;
    }

    public String[] getBridgeFunctionSegments() {
        return bridgeFunction.split("::");
    }

    public String getExportAttribute() {
        return exportAttribute;
    }

    public void setExportAttribute(String exportAttribute) {
        this.exportAttribute = requireIdentifier("exportAttribute", exportAttribute);
    }

    /** 包装函数入参与返回值的尺寸类型 */
    public String getSizeType() {
        return sizeType;
    }

    public void setSizeType(String sizeType) {
        this.sizeType = requireIdentifier("sizeType", sizeType);
    }

    public String getSizeParameter() {
        return sizeParameter;
    }

    public void setSizeParameter(String sizeParameter) {
        this.sizeParameter = requireIdentifier("sizeParameter", sizeParameter);
    }

    /** 严格模式下任何警告都使展开失败 */
    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    private static String requireIdentifier(String option, String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(option + " must not be empty");
        }
        char first = value.charAt(0);
        if (!(Character.isLetter(first) || first == '_')) {
            throw new IllegalArgumentException(option + " is not a valid identifier: " + value);
        }
        for (int i = 1; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_')) {
                throw new IllegalArgumentException(option + " is not a valid identifier: " + value);
            }
        }
        return value;
    }
}
