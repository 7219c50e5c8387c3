package com.forgelang.compiler.contract;

import com.forgelang.compiler.printer.SourcePrinter;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * 导出清单：描述每个包装函数的符号、分派方式和参数类型，供宿主侧使用
 *
 * <pre>
 * {"module": "counter", "stateType": "Counter", "exports": [
 *   {"symbol": "increment", "method": "increment", "dispatch": "state", "capability": null,
 *    "arguments": [{"name": "n", "type": "i32"}], "returnType": null}]}
 * </pre>
 * 文件中有多个合约模块时输出上述对象的数组。
 */
public final class ExportManifest {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private ExportManifest() {}

    public static JsonObject describe(ExpandedContract contract) {
        SourcePrinter printer = new SourcePrinter();

        JsonObject root = new JsonObject();
        root.addProperty("module", contract.getModuleName());
        root.addProperty("stateType", contract.getTypeName());

        JsonArray exports = new JsonArray();
        for (WrapperFunction wrapper : contract.getWrappers()) {
            JsonObject export = new JsonObject();
            export.addProperty("symbol", wrapper.getExportName());
            export.addProperty("method", wrapper.getMethodName());
            export.addProperty("dispatch", wrapper.getDispatch().name().toLowerCase());
            if (wrapper.getCapability() != null) {
                export.addProperty("capability", printer.render(wrapper.getCapability()));
            } else {
                export.add("capability", JsonNull.INSTANCE);
            }

            JsonArray arguments = new JsonArray();
            for (WrapperFunction.ArgumentBinding binding : wrapper.getArguments()) {
                JsonObject argument = new JsonObject();
                argument.addProperty("name", binding.getName());
                argument.addProperty("type", printer.render(binding.getType()));
                arguments.add(argument);
            }
            export.add("arguments", arguments);

            if (wrapper.getReturnType() != null) {
                export.addProperty("returnType", printer.render(wrapper.getReturnType()));
            } else {
                export.add("returnType", JsonNull.INSTANCE);
            }
            exports.add(export);
        }
        root.add("exports", exports);
        return root;
    }

    public static JsonElement describe(List<ExpandedContract> contracts) {
        if (contracts.size() == 1) {
            return describe(contracts.get(0));
        }
        JsonArray array = new JsonArray();
        for (ExpandedContract contract : contracts) {
            array.add(describe(contract));
        }
        return array;
    }

    /**
     * @throws IllegalStateException 展开失败时
     */
    public static String toJson(ExpansionResult result) {
        if (!result.isSuccess()) {
            throw new IllegalStateException("Cannot build a manifest for a failed expansion");
        }
        return GSON.toJson(describe(result.getContracts()));
    }
}
