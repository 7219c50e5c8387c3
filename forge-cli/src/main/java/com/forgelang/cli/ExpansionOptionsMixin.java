package com.forgelang.cli;

import com.forgelang.compiler.contract.ExpansionOptions;
import picocli.CommandLine.Option;

/**
 * expand / check 共用的展开选项
 */
public class ExpansionOptionsMixin {

    @Option(names = "--strict", description = "严格模式：警告升级为错误")
    boolean strict;

    @Option(names = "--state-name", description = "单例状态符号名（默认 STATE）")
    String stateName;

    @Option(names = "--bridge", description = "运行时桥接函数路径（默认 abi::wrap_call）")
    String bridge;

    @Option(names = "--attribute", description = "触发展开的模块属性（默认 contract）")
    String attribute;

    /**
     * @throws IllegalArgumentException 选项值不是合法标识符
     */
    ExpansionOptions toOptions() {
        ExpansionOptions options = new ExpansionOptions();
        options.setStrict(strict);
        if (stateName != null) {
            options.setStateName(stateName);
        }
        if (bridge != null) {
            options.setBridgeFunction(bridge);
        }
        if (attribute != null) {
            options.setTriggerAttribute(attribute);
        }
        return options;
    }
}
